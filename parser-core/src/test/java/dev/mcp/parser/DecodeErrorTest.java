package dev.mcp.parser;

import dev.mcp.parser.model.JsonRpcFields;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DecodeErrorTest {

    @Test
    void missingField_namesTheField() {
        assertEquals("Missing required field: method", DecodeError.missingField(JsonRpcFields.METHOD).message());
    }

    @Test
    void invalidFieldType_namesFieldAndExpectation() {
        DecodeError error = DecodeError.invalidFieldType(JsonRpcFields.PARAMS, "object or null");
        assertEquals("Invalid field type for 'params': expected object or null", error.message());
        assertEquals(JsonRpcFields.PARAMS, error.field());
    }

    @Test
    void invalidVersion_quotesTheVersionFound() {
        assertEquals("Invalid JSON-RPC version: expected '2.0', got '1.0'", DecodeError.invalidVersion("1.0").message());
    }

    @Test
    void invalidJson_prefixesDiagnostic() {
        assertEquals("Invalid JSON: expected object", DecodeError.invalidJson("expected object").message());
    }

    @Test
    void exception_carriesErrorAndMessage() {
        DecodeError error = DecodeError.missingField(JsonRpcFields.ID);
        JsonRpcDecodeException e = new JsonRpcDecodeException(error);
        assertSame(error, e.error());
        assertEquals(DecodeError.Kind.MISSING_FIELD, e.kind());
        assertEquals("Missing required field: id", e.getMessage());
    }

    @Test
    void kindIsRequired() {
        assertThrows(NullPointerException.class, () -> new DecodeError(null, null, null));
    }

    @Test
    void notAnObject_isInvalidJsonWithFixedDetail() {
        DecodeError error = DecodeError.notAnObject();
        assertEquals(DecodeError.Kind.INVALID_JSON, error.kind());
        assertEquals("Invalid JSON: expected object", error.message());
        assertTrue(error.isNotAnObject());
        assertFalse(DecodeError.invalidJson("Unexpected character").isNotAnObject());
    }

    @Test
    void exception_survivesSerialization() throws Exception {
        JsonRpcDecodeException original = new JsonRpcDecodeException(DecodeError.invalidVersion("1.0"));
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
            out.writeObject(original);
        }
        try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(bytes.toByteArray()))) {
            JsonRpcDecodeException copy = (JsonRpcDecodeException) in.readObject();
            assertEquals(original.error(), copy.error());
            assertEquals(original.getMessage(), copy.getMessage());
        }
    }
}
