package dev.mcp.parser.bridge;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import dev.mcp.parser.DecodeError;
import dev.mcp.parser.model.ErrorCode;
import dev.mcp.parser.model.ErrorData;
import dev.mcp.parser.model.JsonRpcErrorResponse;
import dev.mcp.parser.model.JsonRpcFields;
import dev.mcp.parser.model.RequestId;

/**
 * Maps decode failures to the JSON-RPC error responses a gateway sends back to the caller.
 */
public final class ErrorResponses {

	private ErrorResponses() {
	}

	/**
	 * Build the error response for a message that could not be decoded. The identifier of an
	 * undecodable message cannot be trusted, so the response always carries a null id.
	 * @param error the decode failure
	 * @return error response with a standard code, the decode message and a {@code data} object
	 * naming the failure kind and, where known, the field
	 */
	public static JsonRpcErrorResponse fromDecodeError(DecodeError error) {
		ObjectNode data = JsonNodeFactory.instance.objectNode();
		data.put("kind", error.kind().name());
		if (error.field() != null) {
			data.put("field", error.field());
		}
		return JsonRpcErrorResponse.of(RequestId.nullId(), ErrorData.of(codeFor(error), error.message(), data));
	}

	/**
	 * Select the standard error code for a decode failure.
	 * @param error the decode failure
	 * @return {@link ErrorCode#PARSE_ERROR} for syntax failures, {@link ErrorCode#INVALID_PARAMS}
	 * for a malformed {@code params} member, {@link ErrorCode#INVALID_REQUEST} otherwise,
	 * including valid JSON whose top-level value is not an object
	 */
	public static ErrorCode codeFor(DecodeError error) {
		return switch (error.kind()) {
			case INVALID_JSON -> error.isNotAnObject() ? ErrorCode.INVALID_REQUEST : ErrorCode.PARSE_ERROR;
			case INVALID_FIELD_TYPE -> JsonRpcFields.PARAMS.equals(error.field()) ? ErrorCode.INVALID_PARAMS
					: ErrorCode.INVALID_REQUEST;
			case INVALID_VERSION, MISSING_FIELD, INVALID_IDENTIFIER -> ErrorCode.INVALID_REQUEST;
		};
	}

}
