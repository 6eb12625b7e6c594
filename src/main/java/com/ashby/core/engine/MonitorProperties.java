package com.ashby.core.engine;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Acquisition loop configuration bound from {@code ashby.monitor.*}.
 */
@Component
@ConfigurationProperties(prefix = "ashby.monitor")
public class MonitorProperties {

    /** Whether the periodic tick runs. Injection works either way. */
    private boolean enabled = true;

    private Duration interval = Duration.ofSeconds(30);

    /** Overall deadline for one acquisition attempt, all stages included. */
    private Duration attemptTimeout = Duration.ofMinutes(3);

    /** Attempts that may run at the same time. */
    private int workers = 4;

    /** Capabilities the control system must always have; missing ones become computed gaps. */
    private List<String> requiredCapabilities = new ArrayList<>();

    private Backoff backoff = new Backoff();

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public Duration getInterval() { return interval; }
    public void setInterval(Duration interval) { this.interval = interval; }
    public Duration getAttemptTimeout() { return attemptTimeout; }
    public void setAttemptTimeout(Duration attemptTimeout) { this.attemptTimeout = attemptTimeout; }
    public int getWorkers() { return workers; }
    public void setWorkers(int workers) { this.workers = workers; }
    public List<String> getRequiredCapabilities() { return requiredCapabilities; }
    public void setRequiredCapabilities(List<String> requiredCapabilities) { this.requiredCapabilities = requiredCapabilities; }
    public Backoff getBackoff() { return backoff; }
    public void setBackoff(Backoff backoff) { this.backoff = backoff; }

    /** Retry policy for capabilities whose last attempt failed. */
    public static class Backoff {
        private Duration initial = Duration.ofSeconds(30);
        private Duration max = Duration.ofMinutes(10);
        /** Consecutive failures after which ticks stop retrying; injection still works. */
        private int maxAutoAttempts = 5;

        public Duration getInitial() { return initial; }
        public void setInitial(Duration initial) { this.initial = initial; }
        public Duration getMax() { return max; }
        public void setMax(Duration max) { this.max = max; }
        public int getMaxAutoAttempts() { return maxAutoAttempts; }
        public void setMaxAutoAttempts(int maxAutoAttempts) { this.maxAutoAttempts = maxAutoAttempts; }
    }
}
