package dev.mcp.parser.bridge;

import dev.mcp.parser.DecodeError;
import dev.mcp.parser.FastRejectFilter;
import dev.mcp.parser.JsonRpcCodec;
import dev.mcp.parser.JsonRpcDecodeException;
import dev.mcp.parser.model.JsonRpcErrorResponse;
import dev.mcp.parser.model.JsonRpcRequest;
import dev.mcp.parser.model.JsonRpcResponse;
import dev.mcp.parser.model.RequestId;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class McpParserTest {

    private final JsonRpcCodec codec = new JsonRpcCodec();
    private final McpParser parser = new McpParser(codec, new FastRejectFilter(codec));

    @Test
    void parseRequest_returnsValidatedRequest() {
        JsonRpcRequest request = parser.parseRequest("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tools/list\"}");
        assertEquals("tools/list", request.method());
        assertEquals(RequestId.of(1L), request.id());
    }

    @Test
    void parseRequest_failureIsUnchecked() {
        JsonRpcParseException e = assertThrows(JsonRpcParseException.class,
            () -> parser.parseRequest("{\"invalid\": \"json-rpc\"}"));
        assertEquals("Missing required field: jsonrpc", e.getMessage());
        assertEquals(DecodeError.Kind.MISSING_FIELD, e.getError().kind());
        assertInstanceOf(JsonRpcDecodeException.class, e.getCause());
    }

    @Test
    void parseRequest_missingMethodMessage() {
        JsonRpcParseException e = assertThrows(JsonRpcParseException.class,
            () -> parser.parseRequest("{\"jsonrpc\":\"2.0\",\"id\":1}"));
        assertEquals("Missing required field: method", e.getMessage());
    }

    @Test
    void parseResponse_defaultsMissingId() {
        JsonRpcResponse response = parser.parseResponse("{\"jsonrpc\":\"2.0\",\"result\":{}}");
        assertSame(RequestId.nullId(), response.id());
    }

    @Test
    void parseErrorResponse() {
        JsonRpcErrorResponse response = parser.parseErrorResponse(
            "{\"jsonrpc\":\"2.0\",\"id\":3,\"error\":{\"code\":-32603,\"message\":\"Internal error\"}}");
        assertEquals(-32603, response.error().code());
    }

    @Test
    void parseErrorResponse_failure() {
        JsonRpcParseException e = assertThrows(JsonRpcParseException.class,
            () -> parser.parseErrorResponse("{\"jsonrpc\":\"2.0\",\"id\":3,\"result\":1}"));
        assertEquals("Missing required field: error", e.getMessage());
    }

    @Test
    void parseRequestsBatch_reportsFirstFailure() {
        List<String> inputs = List.of(
            "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"a\"}",
            "{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"b\",\"params\":[]}",
            "{\"jsonrpc\":\"2.0\",\"method\":\"c\"}");
        JsonRpcParseException e = assertThrows(JsonRpcParseException.class, () -> parser.parseRequestsBatch(inputs));
        assertEquals("Invalid field type for 'params': expected object or null", e.getMessage());
    }

    @Test
    void parseRequestsBatch_success() {
        List<JsonRpcRequest> requests = parser.parseRequestsBatch(List.of(
            "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"a\"}",
            "{\"jsonrpc\":\"2.0\",\"id\":\"2\",\"method\":\"b\"}"));
        assertEquals(List.of("a", "b"), requests.stream().map(JsonRpcRequest::method).toList());
    }

    @Test
    void isValid_delegatesToFilter() {
        assertTrue(parser.isValid("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tools/list\"}"));
        assertFalse(parser.isValid("not json"));
    }

    @Test
    void toJson_reencodes() {
        JsonRpcRequest request = parser.parseRequest(
            "{\"jsonrpc\":\"2.0\",\"id\":\"abc\",\"method\":\"tools/call\",\"params\":{\"name\":\"get_posts\"}}");
        assertEquals(request, parser.parseRequest(parser.toJson(request)));
    }

    @Test
    void rejectionFor_validRequest_isEmpty() {
        assertEquals(Optional.empty(), parser.rejectionFor("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"m\"}"));
    }

    @Test
    void rejectionFor_garbage_isParseError() {
        JsonRpcErrorResponse rejection = parser.rejectionFor("{oops").orElseThrow();
        assertEquals(-32700, rejection.error().code());
        assertSame(RequestId.nullId(), rejection.id());
    }

    @Test
    void rejectionFor_nonObjectJson_isInvalidRequest() {
        for (String input : List.of("[]", "[1]", "42", "\"text\"")) {
            JsonRpcErrorResponse rejection = parser.rejectionFor(input).orElseThrow();
            assertEquals(-32600, rejection.error().code(), input);
        }
    }
}
