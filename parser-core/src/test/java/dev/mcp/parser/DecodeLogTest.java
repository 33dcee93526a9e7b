package dev.mcp.parser;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.*;

class DecodeLogTest {

    @Test
    void shortPayload_isUnchanged() {
        assertEquals("{}", DecodeLog.truncate("{}", 200));
    }

    @Test
    void longPayload_isCut() {
        assertEquals("abc...", DecodeLog.truncate("abcdef", 3));
    }

    @Test
    void nullPayload_staysNull() {
        assertNull(DecodeLog.truncate(null, 10));
    }

    @Test
    void codecRejectsNegativeLimit() {
        assertThrows(IllegalArgumentException.class, () -> new JsonRpcCodec(JsonRpcCodec.defaultMapper(), -1));
    }

    @Test
    void acceptedLine_truncatesMethodAndId() throws Exception {
        Logger logger = (Logger) LoggerFactory.getLogger("JSONRPC");
        Level previous = logger.getLevel();
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        logger.setLevel(Level.TRACE);
        try {
            String longMethod = "m".repeat(50);
            String longId = "i".repeat(50);
            new JsonRpcCodec(JsonRpcCodec.defaultMapper(), 10).decodeRequest(
                "{\"jsonrpc\":\"2.0\",\"id\":\"" + longId + "\",\"method\":\"" + longMethod + "\"}");

            String line = appender.list.get(0).getFormattedMessage();
            assertTrue(line.contains("method=" + "m".repeat(10) + "..."));
            assertFalse(line.contains("m".repeat(11)));
            assertFalse(line.contains("i".repeat(11)));
        } finally {
            logger.detachAppender(appender);
            logger.setLevel(previous);
        }
    }
}
