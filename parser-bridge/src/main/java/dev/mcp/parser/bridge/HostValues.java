package dev.mcp.parser.bridge;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

import dev.mcp.parser.model.ErrorData;
import dev.mcp.parser.model.JsonRpcErrorResponse;
import dev.mcp.parser.model.JsonRpcFields;
import dev.mcp.parser.model.JsonRpcMessage;
import dev.mcp.parser.model.JsonRpcRequest;
import dev.mcp.parser.model.JsonRpcResponse;
import dev.mcp.parser.model.RequestId;

/**
 * Projects decoded JSON-RPC records into plain Java values so host code can work with maps,
 * lists and boxed scalars instead of Jackson trees.
 */
public final class HostValues {

	private HostValues() {
	}

	/**
	 * Convert a JSON value to its native Java counterpart. Objects become insertion-ordered
	 * {@link LinkedHashMap}s, arrays become {@link List}s and numbers keep the width Jackson
	 * parsed them with ({@link Integer}, {@link Long}, {@link java.math.BigInteger},
	 * {@link Double} or {@link java.math.BigDecimal}).
	 * @param value the JSON value, may be {@code null}
	 * @return the native value, {@code null} for JSON null or a missing value
	 * @throws IllegalArgumentException when the tree holds a node that plain JSON text cannot
	 * produce, such as binary or POJO nodes
	 */
	public static Object toNative(JsonNode value) {
		if (value == null) {
			return null;
		}
		return switch (value.getNodeType()) {
			case NULL, MISSING -> null;
			case BOOLEAN -> value.booleanValue();
			case NUMBER -> value.numberValue();
			case STRING -> value.textValue();
			case ARRAY -> toList(value);
			case OBJECT -> toMap(value);
			default -> throw new IllegalArgumentException("Unsupported JSON node type: " + value.getNodeType());
		};
	}

	/**
	 * Convert an identifier to the value a host would compare it with.
	 * @param id decoded identifier
	 * @return a {@link String}, a {@link Long} or {@code null}
	 */
	public static Object toNative(RequestId id) {
		if (id instanceof RequestId.StringId stringId) {
			return stringId.value();
		}
		if (id instanceof RequestId.NumberId numberId) {
			return numberId.value();
		}
		return null;
	}

	/**
	 * Build a structured map view of a decoded message using the wire field names.
	 * @param message decoded request, response or error response
	 * @return ordered map with {@code jsonrpc}, {@code id} and the message-specific members
	 */
	public static Map<String, Object> toStructured(JsonRpcMessage message) {
		Map<String, Object> structured = new LinkedHashMap<>();
		structured.put(JsonRpcFields.JSONRPC, message.protocolVersion());
		structured.put(JsonRpcFields.ID, toNative(message.id()));
		if (message instanceof JsonRpcRequest request) {
			structured.put(JsonRpcFields.METHOD, request.method());
			structured.put(JsonRpcFields.PARAMS, request.hasParams() ? paramsToNative(request) : null);
		}
		else if (message instanceof JsonRpcResponse response) {
			structured.put(JsonRpcFields.RESULT, toNative(response.result()));
		}
		else if (message instanceof JsonRpcErrorResponse errorResponse) {
			structured.put(JsonRpcFields.ERROR, errorToNative(errorResponse.error()));
		}
		return structured;
	}

	/**
	 * Convert the params of a request, or return {@code null} when it has none.
	 * @param request decoded request
	 * @return native params map, or {@code null}
	 */
	public static Map<String, Object> paramsToNative(JsonRpcRequest request) {
		if (!request.hasParams()) {
			return null;
		}
		Map<String, Object> params = new LinkedHashMap<>();
		request.params().forEach((key, value) -> params.put(key, toNative(value)));
		return params;
	}

	private static Map<String, Object> errorToNative(ErrorData error) {
		Map<String, Object> structured = new LinkedHashMap<>();
		structured.put(JsonRpcFields.CODE, error.code());
		structured.put(JsonRpcFields.MESSAGE, error.message());
		if (error.data() != null) {
			structured.put(JsonRpcFields.DATA, toNative(error.data()));
		}
		return structured;
	}

	private static List<Object> toList(JsonNode array) {
		List<Object> list = new ArrayList<>(array.size());
		for (JsonNode element : array) {
			list.add(toNative(element));
		}
		return list;
	}

	private static Map<String, Object> toMap(JsonNode object) {
		Map<String, Object> map = new LinkedHashMap<>();
		Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
		while (fields.hasNext()) {
			Map.Entry<String, JsonNode> field = fields.next();
			map.put(field.getKey(), toNative(field.getValue()));
		}
		return map;
	}

}
