package com.ashby.core.model;

import java.time.Instant;

/**
 * Live association of a capability with the process and tool that serve it.
 */
public record CapabilityRoute(
    String capabilityName,
    String processId,
    String toolName,
    Instant registeredAt
) {}
