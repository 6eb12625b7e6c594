package com.ashby.mcp;

/**
 * Base class for protocol-level failures of a JSON-RPC call.
 */
public class RpcException extends RuntimeException {

    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
