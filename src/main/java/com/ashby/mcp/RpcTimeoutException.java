package com.ashby.mcp;

import java.time.Duration;

public class RpcTimeoutException extends RpcException {

    private final String method;
    private final Duration timeout;

    public RpcTimeoutException(String method, Duration timeout) {
        super("Request '" + method + "' timed out after " + timeout.toMillis() + "ms");
        this.method = method;
        this.timeout = timeout;
    }

    public String getMethod() {
        return method;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
