package com.ashby.router;

public class UnknownCapabilityException extends RuntimeException {

    private final String capability;

    public UnknownCapabilityException(String capability) {
        super("No route for capability: " + capability);
        this.capability = capability;
    }

    public String getCapability() {
        return capability;
    }
}
