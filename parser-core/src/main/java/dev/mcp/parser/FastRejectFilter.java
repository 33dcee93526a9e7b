package dev.mcp.parser;

import com.fasterxml.jackson.databind.JsonNode;
import dev.mcp.parser.model.JsonRpcFields;
import java.util.Objects;

/**
 * Cheap admission check in front of full decoding. Answers whether text is plausibly a JSON-RPC
 * 2.0 message and never throws on bad input.
 *
 * <p>Text that lacks the quoted literals {@code "jsonrpc"} and {@code "2.0"} is rejected
 * without parsing. The scan is not JSON-aware: those literals inside unrelated nested strings
 * pass it, and only the parse that follows tells such input apart. Passing this filter does not
 * mean the message will decode.
 */
public final class FastRejectFilter {

    private static final String VERSION_KEY_LITERAL = "\"" + JsonRpcFields.JSONRPC + "\"";
    private static final String VERSION_LITERAL = "\"" + JsonRpcFields.VERSION + "\"";

    private final JsonRpcCodec codec;

    public FastRejectFilter() {
        this(new JsonRpcCodec());
    }

    public FastRejectFilter(JsonRpcCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    public boolean isValid(String input) {
        if (input == null) {
            return false;
        }
        if (!input.contains(VERSION_KEY_LITERAL) || !input.contains(VERSION_LITERAL)) {
            return false;
        }
        JsonNode root = codec.readTreeOrNull(input);
        if (root == null) {
            return false;
        }
        JsonNode version = root.path(JsonRpcFields.JSONRPC);
        return version.isTextual() && JsonRpcFields.VERSION.equals(version.textValue());
    }
}
