package com.ashby.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for capability acquisition, supervision and routing.
 */
@Service
public class AshbyMetrics {

    private final MeterRegistry registry;

    public AshbyMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordAcquisition(String outcome, String stage, long ms) {
        Timer.builder("ashby.acquisition.duration")
                .tag("outcome", outcome)
                .tag("stage", stage)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordGapAccepted(String source, int capabilityCount) {
        Counter.builder("ashby.gaps.accepted")
                .tag("source", source)
                .register(registry)
                .increment(capabilityCount);
    }

    /**
     * Records a gap that was folded into an attempt already in flight.
     */
    public void recordCoalesced() {
        Counter.builder("ashby.acquisition.coalesced")
                .description("Gap capabilities folded into an in-flight attempt")
                .register(registry)
                .increment();
    }

    public void recordRpcCall(String method, String outcome) {
        Counter.builder("ashby.rpc.calls")
                .tag("method", method)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordProcessExit(String status) {
        Counter.builder("ashby.process.exits")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordInvocation(String capability, String outcome) {
        Counter.builder("ashby.capability.invocations")
                .tag("capability", capability)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }
}
