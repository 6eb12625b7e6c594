package com.ashby.core.health;

import com.ashby.core.engine.VarietyMonitor;
import com.ashby.core.model.ProcessInfo;
import com.ashby.core.model.ProcessStatus;
import com.ashby.discovery.DiscoveryService;
import com.ashby.installer.InstallerProperties;
import com.ashby.router.CapabilityRouter;
import com.ashby.supervisor.ProcessSupervisor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthCheckServiceTest {

    @TempDir
    Path tmp;

    private ProcessSupervisor supervisor;
    private CapabilityRouter router;
    private VarietyMonitor monitor;
    private DiscoveryService discovery;
    private InstallerProperties installerProperties;
    private HealthCheckService service;

    @BeforeEach
    void setUp() {
        supervisor = mock(ProcessSupervisor.class);
        router = mock(CapabilityRouter.class);
        monitor = mock(VarietyMonitor.class);
        discovery = mock(DiscoveryService.class);
        installerProperties = new InstallerProperties();
        installerProperties.setInstallRoot(tmp.resolve("plugins"));

        when(discovery.sourceNames()).thenReturn(List.of("curated", "npm-registry"));
        when(router.listCapabilities()).thenReturn(List.of("memory"));
        service = new HealthCheckService(supervisor, router, monitor, discovery, installerProperties);
    }

    private HealthStatus component(String name) {
        return service.checkAll().stream()
                .filter(s -> name.equals(s.component()))
                .findFirst()
                .orElseThrow();
    }

    @Test
    @DisplayName("checkAll returns monitor, supervisor, router, discovery, installRoot")
    void checkAllReturnsAllComponents() {
        var components = service.checkAll().stream().map(HealthStatus::component).toList();
        assertEquals(List.of("monitor", "supervisor", "router", "discovery", "installRoot"), components);
    }

    @Test
    @DisplayName("Monitor not ticking -> DEGRADED")
    void monitorDegraded() {
        when(monitor.isTicking()).thenReturn(false);
        when(monitor.inFlightCount()).thenReturn(2);

        HealthStatus status = component("monitor");
        assertEquals(HealthStatus.Status.DEGRADED, status.status());
        assertEquals("2", status.metadata().get("inFlight"));
    }

    @Test
    @DisplayName("Monitor ticking -> UP")
    void monitorUp() {
        when(monitor.isTicking()).thenReturn(true);
        assertEquals(HealthStatus.Status.UP, component("monitor").status());
    }

    @Test
    @DisplayName("Supervisor reports running processes and recent crashes")
    void supervisorCounts() {
        Instant now = Instant.now();
        when(supervisor.listRunningProcesses()).thenReturn(List.of(
                new ProcessInfo("proc-1", "pkg", ProcessStatus.RUNNING, now, now, null)));
        when(supervisor.recentExits()).thenReturn(List.of(
                new ProcessInfo("proc-2", "pkg", ProcessStatus.CRASHED, now, now, 1),
                new ProcessInfo("proc-3", "pkg", ProcessStatus.STOPPED, now, now, 143)));

        HealthStatus status = component("supervisor");
        assertEquals(HealthStatus.Status.UP, status.status());
        assertEquals("1", status.metadata().get("running"));
        assertEquals("1", status.metadata().get("recentCrashes"));
    }

    @Test
    @DisplayName("No discovery source -> discovery DOWN")
    void discoveryDown() {
        when(discovery.sourceNames()).thenReturn(List.of());
        assertEquals(HealthStatus.Status.DOWN, component("discovery").status());
    }

    @Test
    @DisplayName("Install root is created and reported UP")
    void installRootUp() {
        HealthStatus status = component("installRoot");
        assertEquals(HealthStatus.Status.UP, status.status());
        assertTrue(tmp.resolve("plugins").toFile().isDirectory());
    }

    @Test
    @DisplayName("Install root under a regular file -> DOWN")
    void installRootDown() throws Exception {
        Path file = java.nio.file.Files.writeString(tmp.resolve("not-a-dir"), "x");
        installerProperties.setInstallRoot(file.resolve("plugins"));

        assertEquals(HealthStatus.Status.DOWN, component("installRoot").status());
    }
}
