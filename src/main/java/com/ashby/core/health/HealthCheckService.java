package com.ashby.core.health;

import com.ashby.core.engine.VarietyMonitor;
import com.ashby.core.model.ProcessStatus;
import com.ashby.discovery.DiscoveryService;
import com.ashby.installer.InstallerProperties;
import com.ashby.router.CapabilityRouter;
import com.ashby.supervisor.ProcessSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final ProcessSupervisor supervisor;
    private final CapabilityRouter router;
    private final VarietyMonitor monitor;
    private final DiscoveryService discovery;
    private final InstallerProperties installerProperties;

    public HealthCheckService(ProcessSupervisor supervisor, CapabilityRouter router, VarietyMonitor monitor,
                              DiscoveryService discovery, InstallerProperties installerProperties) {
        this.supervisor = supervisor;
        this.router = router;
        this.monitor = monitor;
        this.discovery = discovery;
        this.installerProperties = installerProperties;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkMonitor());
        results.add(checkSupervisor());
        results.add(checkRouter());
        results.add(checkDiscovery());
        results.add(checkInstallRoot());
        return results;
    }

    private HealthStatus checkMonitor() {
        Map<String, String> meta = Map.of("inFlight", String.valueOf(monitor.inFlightCount()));
        if (monitor.isTicking()) {
            return new HealthStatus("monitor", HealthStatus.Status.UP, "Monitor ticking", meta);
        }
        return new HealthStatus("monitor", HealthStatus.Status.DEGRADED,
                "Tick disabled, injection only", meta);
    }

    private HealthStatus checkSupervisor() {
        int running = supervisor.listRunningProcesses().size();
        long crashed = supervisor.recentExits().stream()
                .filter(p -> p.status() == ProcessStatus.CRASHED)
                .count();
        return new HealthStatus("supervisor", HealthStatus.Status.UP,
                running + " process(es) running",
                Map.of("running", String.valueOf(running), "recentCrashes", String.valueOf(crashed)));
    }

    private HealthStatus checkRouter() {
        int routes = router.listCapabilities().size();
        return new HealthStatus("router", HealthStatus.Status.UP, routes + " capability route(s)",
                Map.of("capabilities", String.valueOf(routes)));
    }

    private HealthStatus checkDiscovery() {
        List<String> sources = discovery.sourceNames();
        if (sources.isEmpty()) {
            return new HealthStatus("discovery", HealthStatus.Status.DOWN,
                    "No discovery source enabled", Map.of());
        }
        return new HealthStatus("discovery", HealthStatus.Status.UP,
                "Sources: " + String.join(", ", sources), Map.of());
    }

    private HealthStatus checkInstallRoot() {
        Path root = installerProperties.getInstallRoot();
        try {
            Files.createDirectories(root);
            if (Files.isWritable(root)) {
                return new HealthStatus("installRoot", HealthStatus.Status.UP,
                        "Writable: " + root, Map.of());
            }
            return new HealthStatus("installRoot", HealthStatus.Status.DOWN,
                    "Not writable: " + root, Map.of());
        } catch (IOException e) {
            log.warn("Install root check failed: {}", e.getMessage());
            return new HealthStatus("installRoot", HealthStatus.Status.DOWN,
                    "Install root error: " + e.getMessage(), Map.of());
        }
    }
}
