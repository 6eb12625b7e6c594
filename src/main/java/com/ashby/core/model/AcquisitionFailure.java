package com.ashby.core.model;

/**
 * Terminal failure of an acquisition attempt.
 *
 * @param stage  stage the attempt was in when it failed
 * @param kind   failure category
 * @param detail human-readable reason (exit detail, exception message, ...)
 */
public record AcquisitionFailure(AcquisitionStage stage, FailureKind kind, String detail) {}
