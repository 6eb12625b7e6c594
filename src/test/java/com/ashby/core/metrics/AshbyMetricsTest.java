package com.ashby.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AshbyMetricsTest {

    private SimpleMeterRegistry registry;
    private AshbyMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new AshbyMetrics(registry);
    }

    @Test
    @DisplayName("recordAcquisition creates a timer tagged with outcome and stage")
    void recordAcquisition() {
        metrics.recordAcquisition("failed", "INSTALLING", 1200);
        var timer = registry.find("ashby.acquisition.duration")
                .tag("outcome", "failed").tag("stage", "INSTALLING").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
    }

    @Test
    @DisplayName("recordGapAccepted counts capabilities per source")
    void recordGapAccepted() {
        metrics.recordGapAccepted("api", 3);
        metrics.recordGapAccepted("api", 1);
        assertEquals(4.0, registry.find("ashby.gaps.accepted").tag("source", "api").counter().count());
    }

    @Test
    @DisplayName("recordRpcCall separates outcomes")
    void recordRpcCall() {
        metrics.recordRpcCall("tools/call", "ok");
        metrics.recordRpcCall("tools/call", "timeout");
        metrics.recordRpcCall("tools/call", "ok");

        assertEquals(2.0, registry.find("ashby.rpc.calls").tag("outcome", "ok").counter().count());
        assertEquals(1.0, registry.find("ashby.rpc.calls").tag("outcome", "timeout").counter().count());
    }

    @Test
    @DisplayName("recordProcessExit counts by status")
    void recordProcessExit() {
        metrics.recordProcessExit("crashed");
        assertEquals(1.0, registry.find("ashby.process.exits").tag("status", "crashed").counter().count());
        assertNull(registry.find("ashby.process.exits").tag("status", "stopped").counter());
    }
}
