package dev.mcp.parser;

/**
 * Thrown when text cannot be decoded into a JSON-RPC message. The message is
 * {@link DecodeError#message()}.
 */
public class JsonRpcDecodeException extends Exception {

    private static final long serialVersionUID = 1L;

    private final DecodeError error;

    public JsonRpcDecodeException(DecodeError error) {
        super(error.message());
        this.error = error;
    }

    public JsonRpcDecodeException(DecodeError error, Throwable cause) {
        super(error.message(), cause);
        this.error = error;
    }

    public DecodeError error() {
        return error;
    }

    public DecodeError.Kind kind() {
        return error.kind();
    }
}
