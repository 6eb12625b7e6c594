package com.ashby.core.model;

import java.time.Instant;

/**
 * Point-in-time view of a capability's acquisition state machine, as reported by status queries.
 *
 * @param capability  the capability being acquired
 * @param stage       current stage, or the terminal stage
 * @param failure     failure details when {@code stage} is FAILED, otherwise null
 * @param attempt     1-based attempt counter for this capability
 * @param packageName selected package once discovery finished, otherwise null
 * @param processId   supervisor id once spawned, otherwise null
 * @param toolName    routed tool once registered, otherwise null
 * @param startedAt   when the current attempt started
 * @param updatedAt   last stage transition
 * @param nextRetryAt earliest time the monitor will retry on its own, null if it will not
 */
public record AcquisitionSnapshot(
    String capability,
    AcquisitionStage stage,
    AcquisitionFailure failure,
    int attempt,
    String packageName,
    String processId,
    String toolName,
    Instant startedAt,
    Instant updatedAt,
    Instant nextRetryAt
) {
    public static AcquisitionSnapshot detected(String capability, int attempt) {
        Instant now = Instant.now();
        return new AcquisitionSnapshot(capability, AcquisitionStage.DETECTED, null, attempt,
                null, null, null, now, now, null);
    }

    public boolean inFlight() {
        return !stage.isTerminal();
    }

    public AcquisitionSnapshot withStage(AcquisitionStage next) {
        return new AcquisitionSnapshot(capability, next, failure, attempt, packageName, processId,
                toolName, startedAt, Instant.now(), nextRetryAt);
    }

    public AcquisitionSnapshot withPackage(String pkg) {
        return new AcquisitionSnapshot(capability, stage, failure, attempt, pkg, processId,
                toolName, startedAt, Instant.now(), nextRetryAt);
    }

    public AcquisitionSnapshot withProcess(String id) {
        return new AcquisitionSnapshot(capability, stage, failure, attempt, packageName, id,
                toolName, startedAt, Instant.now(), nextRetryAt);
    }

    public AcquisitionSnapshot registered(String tool) {
        return new AcquisitionSnapshot(capability, AcquisitionStage.REGISTERED, null, attempt, packageName,
                processId, tool, startedAt, Instant.now(), null);
    }

    public AcquisitionSnapshot failed(FailureKind kind, String detail) {
        return new AcquisitionSnapshot(capability, AcquisitionStage.FAILED,
                new AcquisitionFailure(stage, kind, detail), attempt, packageName, processId,
                toolName, startedAt, Instant.now(), nextRetryAt);
    }

    public AcquisitionSnapshot withNextRetryAt(Instant at) {
        return new AcquisitionSnapshot(capability, stage, failure, attempt, packageName, processId,
                toolName, startedAt, updatedAt, at);
    }
}
