package com.ashby.mcp;

/**
 * The plugin process answered with a JSON-RPC error object. Code, message and data are
 * passed through verbatim to the caller.
 */
public class RemoteErrorException extends RpcException {

    private final int code;
    private final String remoteMessage;
    private final Object data;

    public RemoteErrorException(int code, String remoteMessage, Object data) {
        super("Remote error " + code + ": " + remoteMessage);
        this.code = code;
        this.remoteMessage = remoteMessage;
        this.data = data;
    }

    public int getCode() {
        return code;
    }

    public String getRemoteMessage() {
        return remoteMessage;
    }

    public Object getData() {
        return data;
    }
}
