package dev.mcp.parser.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.util.Objects;

/**
 * Correlation value echoed between a request and its response. A JSON-RPC identifier is a
 * string, a 64-bit integer or null; fractional and structured values never make it this far.
 */
public interface RequestId {

    static RequestId of(String value) {
        return new StringId(value);
    }

    static RequestId of(long value) {
        return new NumberId(value);
    }

    static RequestId nullId() {
        return NullId.INSTANCE;
    }

    JsonNode toJsonNode();

    record StringId(String value) implements RequestId {

        public StringId {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public JsonNode toJsonNode() {
            return JsonNodeFactory.instance.textNode(value);
        }
    }

    record NumberId(long value) implements RequestId {

        @Override
        public JsonNode toJsonNode() {
            return JsonNodeFactory.instance.numberNode(value);
        }
    }

    enum NullId implements RequestId {
        INSTANCE;

        @Override
        public JsonNode toJsonNode() {
            return JsonNodeFactory.instance.nullNode();
        }

        @Override
        public String toString() {
            return "NullId";
        }
    }
}
