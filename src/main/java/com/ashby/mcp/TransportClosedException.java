package com.ashby.mcp;

public class TransportClosedException extends RpcException {

    public TransportClosedException(String message) {
        super(message);
    }

    public TransportClosedException(String message, Throwable cause) {
        super(message, cause);
    }
}
