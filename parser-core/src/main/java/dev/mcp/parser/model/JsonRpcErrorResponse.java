package dev.mcp.parser.model;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;

/**
 * JSON-RPC error response.
 */
public record JsonRpcErrorResponse(
    String protocolVersion,
    RequestId id,
    ErrorData error
) implements JsonRpcMessage {

    public JsonRpcErrorResponse {
        Objects.requireNonNull(protocolVersion, "protocolVersion");
        if (!JsonRpcFields.VERSION.equals(protocolVersion)) {
            throw new IllegalArgumentException("protocolVersion must be " + JsonRpcFields.VERSION + ": " + protocolVersion);
        }
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(error, "error");
    }

    public static JsonRpcErrorResponse of(RequestId id, ErrorData error) {
        return new JsonRpcErrorResponse(JsonRpcFields.VERSION, id, error);
    }

    @Override
    public ObjectNode toJsonNode() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put(JsonRpcFields.JSONRPC, protocolVersion);
        node.set(JsonRpcFields.ID, id.toJsonNode());
        node.set(JsonRpcFields.ERROR, error.toJsonNode());
        return node;
    }
}
