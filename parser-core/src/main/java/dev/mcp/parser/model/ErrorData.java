package dev.mcp.parser.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;

/**
 * Error object carried by a JSON-RPC error response.
 * @param code error code, see {@link ErrorCode} for the reserved values
 * @param message short human-readable description
 * @param data optional structured detail, {@code null} when absent; the accessor returns a copy
 */
public record ErrorData(int code, String message, JsonNode data) {

    public ErrorData {
        Objects.requireNonNull(message, "message");
    }

    public static ErrorData of(ErrorCode code, String message, JsonNode data) {
        return new ErrorData(code.code(), message, data);
    }

    @Override
    public JsonNode data() {
        return data == null ? null : data.deepCopy();
    }

    public ObjectNode toJsonNode() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put(JsonRpcFields.CODE, code);
        node.put(JsonRpcFields.MESSAGE, message);
        if (data != null) {
            node.set(JsonRpcFields.DATA, data.deepCopy());
        }
        return node;
    }
}
