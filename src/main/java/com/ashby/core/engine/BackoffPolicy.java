package com.ashby.core.engine;

import java.time.Duration;
import java.time.Instant;

/**
 * Bounded exponential backoff: the n-th consecutive failure waits {@code initial * 2^(n-1)},
 * capped at {@code max}. After {@code maxAutoAttempts} failures there is no automatic retry.
 */
public class BackoffPolicy {

    private final Duration initial;
    private final Duration max;
    private final int maxAutoAttempts;

    public BackoffPolicy(Duration initial, Duration max, int maxAutoAttempts) {
        this.initial = initial;
        this.max = max;
        this.maxAutoAttempts = maxAutoAttempts;
    }

    public static BackoffPolicy from(MonitorProperties.Backoff backoff) {
        return new BackoffPolicy(backoff.getInitial(), backoff.getMax(), backoff.getMaxAutoAttempts());
    }

    public Duration delayAfter(int failures) {
        if (failures <= 0) {
            return Duration.ZERO;
        }
        // 2^30 already exceeds any sane cap
        int exponent = Math.min(failures - 1, 30);
        Duration delay;
        try {
            delay = initial.multipliedBy(1L << exponent);
        } catch (ArithmeticException e) {
            return max;
        }
        return delay.compareTo(max) > 0 ? max : delay;
    }

    public boolean allowsAutoRetry(int failures) {
        return failures < maxAutoAttempts;
    }

    /**
     * @return when the next automatic attempt may start, or null if there will be none
     */
    public Instant nextRetryAt(Instant failedAt, int failures) {
        if (!allowsAutoRetry(failures)) {
            return null;
        }
        return failedAt.plus(delayAfter(failures));
    }
}
