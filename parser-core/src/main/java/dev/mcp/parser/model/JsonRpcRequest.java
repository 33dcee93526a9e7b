package dev.mcp.parser.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * JSON-RPC request. {@code params} is {@code null} when the input had no params or an explicit
 * JSON null in that slot; otherwise it holds deep copies of the input members. The accessor
 * returns fresh copies, so changing them leaves the request untouched.
 */
public record JsonRpcRequest(
    String protocolVersion,
    RequestId id,
    String method,
    Map<String, JsonNode> params
) implements JsonRpcMessage {

    public JsonRpcRequest {
        Objects.requireNonNull(protocolVersion, "protocolVersion");
        if (!JsonRpcFields.VERSION.equals(protocolVersion)) {
            throw new IllegalArgumentException("protocolVersion must be " + JsonRpcFields.VERSION + ": " + protocolVersion);
        }
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(method, "method");
        if (params != null) {
            params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
        }
    }

    public static JsonRpcRequest of(RequestId id, String method, Map<String, JsonNode> params) {
        return new JsonRpcRequest(JsonRpcFields.VERSION, id, method, params);
    }

    @Override
    public Map<String, JsonNode> params() {
        if (params == null) {
            return null;
        }
        Map<String, JsonNode> copy = new LinkedHashMap<>();
        params.forEach((key, value) -> copy.put(key, value.deepCopy()));
        return Collections.unmodifiableMap(copy);
    }

    public boolean hasParams() {
        return params != null;
    }

    @Override
    public ObjectNode toJsonNode() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put(JsonRpcFields.JSONRPC, protocolVersion);
        node.set(JsonRpcFields.ID, id.toJsonNode());
        node.put(JsonRpcFields.METHOD, method);
        if (params != null) {
            ObjectNode paramsNode = node.putObject(JsonRpcFields.PARAMS);
            params.forEach((key, value) -> paramsNode.set(key, value.deepCopy()));
        }
        return node;
    }
}
