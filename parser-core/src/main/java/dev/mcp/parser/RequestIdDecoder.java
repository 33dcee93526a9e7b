package dev.mcp.parser;

import com.fasterxml.jackson.databind.JsonNode;
import dev.mcp.parser.model.RequestId;

/**
 * Turns the JSON value of an {@code id} member into a {@link RequestId}.
 *
 * <p>Precedence: string, then integral number that fits a {@code long}, then null. Every other
 * value, including {@code 1.0} and integers beyond the 64-bit range, is rejected rather than
 * truncated.
 */
public final class RequestIdDecoder {

    private RequestIdDecoder() {
    }

    public static RequestId decode(JsonNode value) throws JsonRpcDecodeException {
        if (value.isTextual()) {
            return RequestId.of(value.textValue());
        }
        if (value.isNumber()) {
            if (value.isIntegralNumber() && value.canConvertToLong()) {
                return RequestId.of(value.longValue());
            }
            throw new JsonRpcDecodeException(DecodeError.invalidIdentifier());
        }
        if (value.isNull()) {
            return RequestId.nullId();
        }
        throw new JsonRpcDecodeException(DecodeError.invalidIdentifier());
    }
}
