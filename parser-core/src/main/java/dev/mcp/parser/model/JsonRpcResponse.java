package dev.mcp.parser.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;

/**
 * Successful JSON-RPC response. {@code result} may be any JSON value, JSON null included. The
 * accessor returns a copy.
 */
public record JsonRpcResponse(
    String protocolVersion,
    RequestId id,
    JsonNode result
) implements JsonRpcMessage {

    public JsonRpcResponse {
        Objects.requireNonNull(protocolVersion, "protocolVersion");
        if (!JsonRpcFields.VERSION.equals(protocolVersion)) {
            throw new IllegalArgumentException("protocolVersion must be " + JsonRpcFields.VERSION + ": " + protocolVersion);
        }
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(result, "result");
    }

    public static JsonRpcResponse of(RequestId id, JsonNode result) {
        return new JsonRpcResponse(JsonRpcFields.VERSION, id, result);
    }

    @Override
    public JsonNode result() {
        return result.deepCopy();
    }

    @Override
    public ObjectNode toJsonNode() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put(JsonRpcFields.JSONRPC, protocolVersion);
        node.set(JsonRpcFields.ID, id.toJsonNode());
        node.set(JsonRpcFields.RESULT, result.deepCopy());
        return node;
    }
}
