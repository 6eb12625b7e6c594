package com.ashby.mcp;

/**
 * A session was used out of order: a call before the handshake, or a second handshake.
 */
public class ProtocolUsageException extends IllegalStateException {

    public ProtocolUsageException(String message) {
        super(message);
    }
}
