package dev.mcp.parser.bridge;

import dev.mcp.parser.DecodeError;
import dev.mcp.parser.JsonRpcDecodeException;

/**
 * Unchecked form of {@link JsonRpcDecodeException} raised by {@link McpParser} so host code is
 * not forced to declare decode failures. The message names the failed rule, for example
 * {@code Missing required field: method}.
 */
public class JsonRpcParseException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final DecodeError error;

	/**
	 * Wrap a checked decode failure.
	 * @param cause the failure reported by the codec
	 */
	public JsonRpcParseException(JsonRpcDecodeException cause) {
		super(cause.getMessage(), cause);
		this.error = cause.error();
	}

	/**
	 * Obtain the structured reason for the failure.
	 * @return decode error describing the violated rule
	 */
	public DecodeError getError() {
		return this.error;
	}

}
