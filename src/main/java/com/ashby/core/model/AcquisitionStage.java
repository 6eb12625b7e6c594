package com.ashby.core.model;

/**
 * Stages of the per-capability acquisition state machine.
 * {@link #REGISTERED} and {@link #FAILED} are terminal.
 */
public enum AcquisitionStage {
    DETECTED,
    DISCOVERING,
    INSTALLING,
    SPAWNING,
    HANDSHAKING,
    REGISTERED,
    FAILED;

    public boolean isTerminal() {
        return this == REGISTERED || this == FAILED;
    }
}
