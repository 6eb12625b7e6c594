package com.ashby.router;

/**
 * The process behind a route is gone. Its routes have been removed.
 */
public class ProcessUnavailableException extends RuntimeException {

    private final String processId;

    public ProcessUnavailableException(String processId, String message) {
        super(message);
        this.processId = processId;
    }

    public ProcessUnavailableException(String processId, String message, Throwable cause) {
        super(message, cause);
        this.processId = processId;
    }

    public String getProcessId() {
        return processId;
    }
}
