package com.ashby.core.model;

import java.time.Instant;
import java.util.Set;

/**
 * A shortfall between the capabilities the control system needs and those it can currently perform.
 * <p>
 * Gaps are never mutated; a newer observation simply supersedes an older one.
 *
 * @param requiredCapabilities capability names that are missing
 * @param severity             urgency of the gap
 * @param source               who observed it (e.g. "monitor", "api", "cli")
 * @param observedAt           when it was observed
 */
public record VarietyGap(
    Set<String> requiredCapabilities,
    Severity severity,
    String source,
    Instant observedAt
) {
    public VarietyGap {
        requiredCapabilities = Set.copyOf(requiredCapabilities);
        severity = severity != null ? severity : Severity.NORMAL;
        source = source != null ? source : "unknown";
        observedAt = observedAt != null ? observedAt : Instant.now();
    }

    public static VarietyGap of(Set<String> capabilities, Severity severity, String source) {
        return new VarietyGap(capabilities, severity, source, Instant.now());
    }
}
