package dev.mcp.parser;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mcp.parser.model.ErrorData;
import dev.mcp.parser.model.JsonRpcErrorResponse;
import dev.mcp.parser.model.JsonRpcFields;
import dev.mcp.parser.model.JsonRpcMessage;
import dev.mcp.parser.model.JsonRpcRequest;
import dev.mcp.parser.model.JsonRpcResponse;
import dev.mcp.parser.model.RequestId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Decodes raw text into validated JSON-RPC 2.0 records and encodes records back to JSON.
 *
 * <p>Every decoder checks its rules in a fixed order and throws on the first one violated, so a
 * given input always produces the same diagnostic. Instances hold no mutable state and can be
 * shared between threads.
 */
public final class JsonRpcCodec {

    public static final int DEFAULT_LOG_PAYLOAD_LIMIT = 200;

    private static final String PARAMS_EXPECTED = "object or null";
    private static final String ERROR_EXPECTED = "object";
    private static final String CODE_EXPECTED = "32-bit integer";

    private final ObjectMapper mapper;
    private final int logPayloadLimit;

    public JsonRpcCodec() {
        this(defaultMapper(), DEFAULT_LOG_PAYLOAD_LIMIT);
    }

    public JsonRpcCodec(ObjectMapper mapper, int logPayloadLimit) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        if (logPayloadLimit < 0) {
            throw new IllegalArgumentException("logPayloadLimit must not be negative: " + logPayloadLimit);
        }
        this.logPayloadLimit = logPayloadLimit;
    }

    /**
     * Mapper used when none is supplied: strict standard JSON, nothing allowed after the
     * top-level value.
     */
    public static ObjectMapper defaultMapper() {
        return new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public JsonRpcRequest decodeRequest(String input) throws JsonRpcDecodeException {
        Objects.requireNonNull(input, "input");
        try {
            ObjectNode message = readEnvelope(input);

            JsonNode idNode = message.get(JsonRpcFields.ID);
            if (idNode == null) {
                throw failure(DecodeError.missingField(JsonRpcFields.ID));
            }
            RequestId id = RequestIdDecoder.decode(idNode);

            JsonNode methodNode = message.get(JsonRpcFields.METHOD);
            if (methodNode == null || !methodNode.isTextual()) {
                throw failure(DecodeError.missingField(JsonRpcFields.METHOD));
            }
            String method = methodNode.textValue();

            Map<String, JsonNode> params = null;
            JsonNode paramsNode = message.get(JsonRpcFields.PARAMS);
            if (paramsNode != null && !paramsNode.isNull()) {
                if (!paramsNode.isObject()) {
                    throw failure(DecodeError.invalidFieldType(JsonRpcFields.PARAMS, PARAMS_EXPECTED));
                }
                params = copyMembers(paramsNode);
            }

            DecodeLog.accepted("request", method, id, logPayloadLimit);
            return JsonRpcRequest.of(id, method, params);
        } catch (JsonRpcDecodeException e) {
            DecodeLog.rejected("request", e.error(), input, logPayloadLimit);
            throw e;
        }
    }

    public JsonRpcResponse decodeResponse(String input) throws JsonRpcDecodeException {
        Objects.requireNonNull(input, "input");
        try {
            ObjectNode message = readEnvelope(input);
            RequestId id = optionalId(message);

            JsonNode result = message.get(JsonRpcFields.RESULT);
            if (result == null) {
                throw failure(DecodeError.missingField(JsonRpcFields.RESULT));
            }

            DecodeLog.accepted("response", null, id, logPayloadLimit);
            return JsonRpcResponse.of(id, result.deepCopy());
        } catch (JsonRpcDecodeException e) {
            DecodeLog.rejected("response", e.error(), input, logPayloadLimit);
            throw e;
        }
    }

    public JsonRpcErrorResponse decodeErrorResponse(String input) throws JsonRpcDecodeException {
        Objects.requireNonNull(input, "input");
        try {
            ObjectNode message = readEnvelope(input);
            RequestId id = optionalId(message);

            JsonNode errorNode = message.get(JsonRpcFields.ERROR);
            if (errorNode == null) {
                throw failure(DecodeError.missingField(JsonRpcFields.ERROR));
            }
            if (!errorNode.isObject()) {
                throw failure(DecodeError.invalidFieldType(JsonRpcFields.ERROR, ERROR_EXPECTED));
            }

            JsonNode codeNode = errorNode.get(JsonRpcFields.CODE);
            if (codeNode == null) {
                throw failure(DecodeError.missingField(JsonRpcFields.CODE));
            }
            if (!codeNode.isIntegralNumber() || !codeNode.canConvertToInt()) {
                throw failure(DecodeError.invalidFieldType(JsonRpcFields.CODE, CODE_EXPECTED));
            }

            JsonNode messageNode = errorNode.get(JsonRpcFields.MESSAGE);
            if (messageNode == null || !messageNode.isTextual()) {
                throw failure(DecodeError.missingField(JsonRpcFields.MESSAGE));
            }

            JsonNode dataNode = errorNode.get(JsonRpcFields.DATA);
            JsonNode data = dataNode == null || dataNode.isNull() ? null : dataNode.deepCopy();

            DecodeLog.accepted("error", null, id, logPayloadLimit);
            return JsonRpcErrorResponse.of(id, new ErrorData(codeNode.intValue(), messageNode.textValue(), data));
        } catch (JsonRpcDecodeException e) {
            DecodeLog.rejected("error", e.error(), input, logPayloadLimit);
            throw e;
        }
    }

    /**
     * Decodes each input as a request, in order. Stops at the first input that fails and
     * rethrows its exception; inputs after it are not looked at.
     */
    public List<JsonRpcRequest> decodeRequests(List<String> inputs) throws JsonRpcDecodeException {
        Objects.requireNonNull(inputs, "inputs");
        List<JsonRpcRequest> requests = new ArrayList<>(inputs.size());
        for (String input : inputs) {
            requests.add(decodeRequest(input));
        }
        return Collections.unmodifiableList(requests);
    }

    public String encode(JsonRpcMessage message) {
        Objects.requireNonNull(message, "message");
        try {
            return mapper.writeValueAsString(message.toJsonNode());
        } catch (JsonProcessingException e) {
            // A tree built from JsonNodeFactory always serializes.
            throw new IllegalStateException("Unable to serialize " + message.getClass().getSimpleName(), e);
        }
    }

    /**
     * Reads the generic tree for a message without any JSON-RPC validation. Returns
     * {@code null} when the text is not valid JSON.
     */
    JsonNode readTreeOrNull(String input) {
        try {
            return mapper.readTree(input);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private ObjectNode readEnvelope(String input) throws JsonRpcDecodeException {
        JsonNode root;
        try {
            root = mapper.readTree(input);
        } catch (JsonProcessingException e) {
            throw new JsonRpcDecodeException(DecodeError.invalidJson(diagnostic(e)), e);
        }
        if (root == null || !root.isObject()) {
            throw failure(DecodeError.notAnObject());
        }
        ObjectNode message = (ObjectNode) root;

        JsonNode versionNode = message.get(JsonRpcFields.JSONRPC);
        if (versionNode == null || !versionNode.isTextual()) {
            throw failure(DecodeError.missingField(JsonRpcFields.JSONRPC));
        }
        String version = versionNode.textValue();
        if (!JsonRpcFields.VERSION.equals(version)) {
            throw failure(DecodeError.invalidVersion(version));
        }
        return message;
    }

    private static RequestId optionalId(ObjectNode message) throws JsonRpcDecodeException {
        JsonNode idNode = message.get(JsonRpcFields.ID);
        if (idNode == null) {
            return RequestId.nullId();
        }
        return RequestIdDecoder.decode(idNode);
    }

    private static Map<String, JsonNode> copyMembers(JsonNode object) {
        Map<String, JsonNode> members = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            members.put(field.getKey(), field.getValue().deepCopy());
        }
        return members;
    }

    private static String diagnostic(JsonProcessingException e) {
        JsonLocation location = e.getLocation();
        if (location == null) {
            return e.getOriginalMessage();
        }
        return e.getOriginalMessage() + " at line " + location.getLineNr() + " column " + location.getColumnNr();
    }

    private static JsonRpcDecodeException failure(DecodeError error) {
        return new JsonRpcDecodeException(error);
    }
}
