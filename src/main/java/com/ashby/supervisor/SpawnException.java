package com.ashby.supervisor;

public class SpawnException extends RuntimeException {

    public enum Reason { NOT_FOUND, SPAWN_FAILED }

    private final Reason reason;

    public SpawnException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public SpawnException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
