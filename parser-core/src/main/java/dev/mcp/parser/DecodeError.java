package dev.mcp.parser;

import java.io.Serializable;
import java.util.Objects;

/**
 * Why a message failed to decode. The set of kinds is closed; only {@link Kind#INVALID_JSON}
 * carries free-form text, the wording of the underlying JSON parser.
 *
 * @param kind which structural rule failed
 * @param field the offending field for {@code MISSING_FIELD} and {@code INVALID_FIELD_TYPE},
 *     otherwise {@code null}
 * @param detail parser diagnostic for {@code INVALID_JSON}, the version found for
 *     {@code INVALID_VERSION}, the expected type for {@code INVALID_FIELD_TYPE}, otherwise
 *     {@code null}
 */
public record DecodeError(Kind kind, String field, String detail) implements Serializable {

    /**
     * Detail of an {@link Kind#INVALID_JSON} error for text that parses but is not an object.
     */
    public static final String NOT_AN_OBJECT = "expected object";

    public enum Kind {
        INVALID_JSON,
        INVALID_VERSION,
        MISSING_FIELD,
        INVALID_FIELD_TYPE,
        INVALID_IDENTIFIER
    }

    public DecodeError {
        Objects.requireNonNull(kind, "kind");
    }

    public static DecodeError invalidJson(String diagnostic) {
        return new DecodeError(Kind.INVALID_JSON, null, diagnostic);
    }

    public static DecodeError notAnObject() {
        return new DecodeError(Kind.INVALID_JSON, null, NOT_AN_OBJECT);
    }

    public static DecodeError invalidVersion(String found) {
        return new DecodeError(Kind.INVALID_VERSION, null, found);
    }

    public static DecodeError missingField(String field) {
        return new DecodeError(Kind.MISSING_FIELD, field, null);
    }

    public static DecodeError invalidFieldType(String field, String expected) {
        return new DecodeError(Kind.INVALID_FIELD_TYPE, field, expected);
    }

    public static DecodeError invalidIdentifier() {
        return new DecodeError(Kind.INVALID_IDENTIFIER, null, null);
    }

    /**
     * Whether the input was syntactically valid JSON whose top-level value is not an object.
     */
    public boolean isNotAnObject() {
        return kind == Kind.INVALID_JSON && NOT_AN_OBJECT.equals(detail);
    }

    public String message() {
        return switch (kind) {
            case INVALID_JSON -> "Invalid JSON: " + detail;
            case INVALID_VERSION -> "Invalid JSON-RPC version: expected '2.0', got '" + detail + "'";
            case MISSING_FIELD -> "Missing required field: " + field;
            case INVALID_FIELD_TYPE -> "Invalid field type for '" + field + "': expected " + detail;
            case INVALID_IDENTIFIER -> "Invalid request ID: must be string, number, or null";
        };
    }
}
