package com.ashby.core.model;

public enum ProcessStatus {
    STARTING,
    RUNNING,
    CRASHED,
    STOPPED;

    public boolean isTerminal() {
        return this == CRASHED || this == STOPPED;
    }
}
