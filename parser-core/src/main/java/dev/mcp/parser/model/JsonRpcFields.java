package dev.mcp.parser.model;

/**
 * Field names and literals of the JSON-RPC 2.0 wire format. Decoders, encoders and error payloads
 * all refer to these constants so a renamed field is a single-point change.
 */
public final class JsonRpcFields {

    public static final String VERSION = "2.0";

    public static final String JSONRPC = "jsonrpc";
    public static final String ID = "id";
    public static final String METHOD = "method";
    public static final String PARAMS = "params";
    public static final String RESULT = "result";
    public static final String ERROR = "error";

    public static final String CODE = "code";
    public static final String MESSAGE = "message";
    public static final String DATA = "data";

    private JsonRpcFields() {
    }
}
