package com.ashby.supervisor;

import com.ashby.mcp.TransportClosedException;

/**
 * Data was sent to a process that is not (or no longer) running.
 * From the protocol's point of view the transport is closed.
 */
public class ProcessNotRunningException extends TransportClosedException {

    private final String processId;

    public ProcessNotRunningException(String processId, String message) {
        super(message);
        this.processId = processId;
    }

    public String getProcessId() {
        return processId;
    }
}
