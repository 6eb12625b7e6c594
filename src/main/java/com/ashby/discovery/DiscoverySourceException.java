package com.ashby.discovery;

public class DiscoverySourceException extends RuntimeException {

    public DiscoverySourceException(String message) {
        super(message);
    }

    public DiscoverySourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
