package dev.mcp.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs decode outcomes in one format for every decoder. Payloads are untrusted and truncated.
 */
final class DecodeLog {

    private static final Logger LOGGER = LoggerFactory.getLogger("JSONRPC");

    private DecodeLog() {
    }

    static void accepted(String type, String method, Object id, int limit) {
        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("OK type={} method={} id={}",
                type,
                truncate(method, limit),
                truncate(String.valueOf(id), limit));
        }
    }

    static void rejected(String type, DecodeError error, String input, int limit) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("REJECT type={} kind={} field={} json={}",
                type,
                error.kind(),
                error.field(),
                truncate(input, limit));
        }
    }

    static String truncate(String value, int max) {
        if (value == null) {
            return null;
        }
        if (value.length() <= max) {
            return value;
        }
        return value.substring(0, max) + "...";
    }
}
