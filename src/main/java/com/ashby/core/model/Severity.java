package com.ashby.core.model;

/**
 * How urgently a variety gap should be closed.
 */
public enum Severity {
    LOW,
    NORMAL,
    HIGH,
    CRITICAL;

    /**
     * Lenient parse used by the REST and CLI front-ends. Unknown or blank values map to {@link #NORMAL}.
     */
    public static Severity parse(String value) {
        if (value == null || value.isBlank()) {
            return NORMAL;
        }
        try {
            return Severity.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return NORMAL;
        }
    }
}
