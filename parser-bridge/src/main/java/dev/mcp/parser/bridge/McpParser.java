package dev.mcp.parser.bridge;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lombok.RequiredArgsConstructor;

import dev.mcp.parser.FastRejectFilter;
import dev.mcp.parser.JsonRpcCodec;
import dev.mcp.parser.JsonRpcDecodeException;
import dev.mcp.parser.model.JsonRpcErrorResponse;
import dev.mcp.parser.model.JsonRpcMessage;
import dev.mcp.parser.model.JsonRpcRequest;
import dev.mcp.parser.model.JsonRpcResponse;

/**
 * Entry point a hosting gateway uses to validate MCP traffic. Wraps the core codec and the
 * fast-reject filter and reports decode failures as {@link JsonRpcParseException}.
 */
@RequiredArgsConstructor
public class McpParser {

	private static final Logger logger = LoggerFactory.getLogger(McpParser.class);

	private final JsonRpcCodec codec;

	private final FastRejectFilter filter;

	/**
	 * Decode and validate a request.
	 * @param input raw JSON text
	 * @return the validated request
	 * @throws JsonRpcParseException when any request rule is violated
	 */
	public JsonRpcRequest parseRequest(String input) {
		try {
			return this.codec.decodeRequest(input);
		}
		catch (JsonRpcDecodeException ex) {
			throw new JsonRpcParseException(ex);
		}
	}

	/**
	 * Decode and validate a success response.
	 * @param input raw JSON text
	 * @return the validated response, with a null id when the input had none
	 * @throws JsonRpcParseException when any response rule is violated
	 */
	public JsonRpcResponse parseResponse(String input) {
		try {
			return this.codec.decodeResponse(input);
		}
		catch (JsonRpcDecodeException ex) {
			throw new JsonRpcParseException(ex);
		}
	}

	/**
	 * Decode and validate an error response.
	 * @param input raw JSON text
	 * @return the validated error response
	 * @throws JsonRpcParseException when any error-response rule is violated
	 */
	public JsonRpcErrorResponse parseErrorResponse(String input) {
		try {
			return this.codec.decodeErrorResponse(input);
		}
		catch (JsonRpcDecodeException ex) {
			throw new JsonRpcParseException(ex);
		}
	}

	/**
	 * Decode several requests, all or nothing.
	 * @param inputs raw JSON texts in order
	 * @return the decoded requests in input order
	 * @throws JsonRpcParseException for the first input that fails
	 */
	public List<JsonRpcRequest> parseRequestsBatch(List<String> inputs) {
		try {
			return this.codec.decodeRequests(inputs);
		}
		catch (JsonRpcDecodeException ex) {
			throw new JsonRpcParseException(ex);
		}
	}

	/**
	 * Cheap plausibility check, see {@link FastRejectFilter}.
	 * @param input raw text
	 * @return {@code true} when the text looks like JSON-RPC 2.0
	 */
	public boolean isValid(String input) {
		return this.filter.isValid(input);
	}

	/**
	 * Re-serialize a decoded message for logging or forwarding.
	 * @param message decoded message
	 * @return canonical JSON text
	 */
	public String toJson(JsonRpcMessage message) {
		return this.codec.encode(message);
	}

	/**
	 * Determine the error response a gateway should return for an incoming request.
	 * @param input raw JSON text received from a client
	 * @return the error response when the text is not a valid request, empty otherwise
	 */
	public Optional<JsonRpcErrorResponse> rejectionFor(String input) {
		try {
			this.codec.decodeRequest(input);
			return Optional.empty();
		}
		catch (JsonRpcDecodeException ex) {
			JsonRpcErrorResponse rejection = ErrorResponses.fromDecodeError(ex.error());
			logger.debug("Rejecting request with code {}: {}", rejection.error().code(), ex.getMessage());
			return Optional.of(rejection);
		}
	}

}
