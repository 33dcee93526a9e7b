package dev.mcp.parser.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A decoded, validated JSON-RPC 2.0 message.
 */
public interface JsonRpcMessage {

    String protocolVersion();

    RequestId id();

    /**
     * Canonical JSON form of this message. Field order and whitespace are not those of the
     * original input, but decoding the result yields an equal message.
     */
    ObjectNode toJsonNode();
}
