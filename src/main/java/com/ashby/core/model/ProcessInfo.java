package com.ashby.core.model;

import java.time.Instant;

/**
 * Read-only view of a supervised process. The OS handle never leaves the supervisor.
 *
 * @param id              stable supervisor id (e.g. "proc-3")
 * @param packageName     package the process was launched from
 * @param status          current lifecycle status
 * @param startedAt       spawn time
 * @param statusChangedAt time of the last status transition
 * @param exitCode        OS exit code once terminal, otherwise null
 */
public record ProcessInfo(
    String id,
    String packageName,
    ProcessStatus status,
    Instant startedAt,
    Instant statusChangedAt,
    Integer exitCode
) {}
