package com.ashby.core.engine;

import com.ashby.core.events.AshbyEvent;
import com.ashby.core.events.EventBus;
import com.ashby.core.events.EventTypes;
import com.ashby.core.logging.MdcContext;
import com.ashby.core.model.AcquisitionStage;
import com.ashby.core.model.CandidateServer;
import com.ashby.core.model.CapabilityRoute;
import com.ashby.core.model.FailureKind;
import com.ashby.core.model.InstalledPackage;
import com.ashby.core.model.ProcessInfo;
import com.ashby.discovery.DiscoveryService;
import com.ashby.installer.ExecutableResolver;
import com.ashby.installer.InstallFailedException;
import com.ashby.installer.Installer;
import com.ashby.installer.LaunchSpec;
import com.ashby.mcp.HandshakeResult;
import com.ashby.mcp.ProtocolClient;
import com.ashby.mcp.RpcException;
import com.ashby.mcp.ProtocolUsageException;
import com.ashby.mcp.ToolDescriptor;
import com.ashby.router.CapabilityRouter;
import com.ashby.router.ProcessUnavailableException;
import com.ashby.supervisor.ProcessSupervisor;
import com.ashby.supervisor.SpawnException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Drives one {@link AcquisitionAttempt} through
 * DISCOVERING → INSTALLING → SPAWNING → HANDSHAKING → REGISTERED.
 * <p>
 * Every stage failure ends the attempt as FAILED with its kind; nothing is simulated in place of a
 * missing capability. The attempt deadline is checked between stages and bounds each protocol
 * call. A process spawned by an attempt that did not register is stopped.
 */
@Service
public class AcquisitionEngine {

    private static final Logger log = LoggerFactory.getLogger(AcquisitionEngine.class);

    private final DiscoveryService discovery;
    private final Installer installer;
    private final ExecutableResolver resolver;
    private final ProcessSupervisor supervisor;
    private final ProtocolClient protocolClient;
    private final CapabilityRouter router;
    private final ToolSelector toolSelector;
    private final EventBus eventBus;

    public AcquisitionEngine(DiscoveryService discovery, Installer installer, ExecutableResolver resolver,
                             ProcessSupervisor supervisor, ProtocolClient protocolClient,
                             CapabilityRouter router, ToolSelector toolSelector, EventBus eventBus) {
        this.discovery = discovery;
        this.installer = installer;
        this.resolver = resolver;
        this.supervisor = supervisor;
        this.protocolClient = protocolClient;
        this.router = router;
        this.toolSelector = toolSelector;
        this.eventBus = eventBus;
    }

    /**
     * Runs the attempt to a terminal state on the calling thread.
     * Returns early, without side effects beyond cleanup, once the attempt was finished elsewhere.
     */
    public void run(AcquisitionAttempt attempt) {
        String capability = attempt.capability();
        MdcContext.setCapability(capability);
        try {
            execute(attempt);
        } catch (RuntimeException e) {
            log.error("Acquisition of {} aborted: {}", capability, e.getMessage(), e);
            if (attempt.fail(currentKind(attempt), "Unexpected error: " + e.getMessage())) {
                String processId = attempt.snapshot().processId();
                if (processId != null && router.route(capability).isEmpty()
                        && router.routes().stream().noneMatch(r -> r.processId().equals(processId))) {
                    abandon(processId);
                }
            }
        } finally {
            MdcContext.clear();
        }
    }

    private void execute(AcquisitionAttempt attempt) {
        String capability = attempt.capability();

        // DISCOVERING
        if (!stage(attempt, AcquisitionStage.DISCOVERING)) {
            return;
        }
        List<CandidateServer> candidates = discovery.discover(capability);
        if (candidates.isEmpty()) {
            attempt.fail(FailureKind.DISCOVERY_EMPTY, "No candidate found for " + capability);
            return;
        }
        CandidateServer candidate = candidates.get(0);
        log.info("Selected {} (score {}, {}) for {}", candidate.packageName(),
                candidate.score(), candidate.sourceOrigin(), capability);
        if (!attempt.advance(s -> s.withPackage(candidate.packageName()))) {
            return;
        }

        Optional<String> shared = runningProcessFor(candidate.packageName());
        if (shared.isPresent()) {
            log.info("{} already runs as {}, reusing it for {}", candidate.packageName(), shared.get(), capability);
            if (!attempt.advance(s -> s.withProcess(shared.get()))) {
                return;
            }
            // the process belongs to another capability: never stop it from here
            handshakeAndRegister(attempt, shared.get(), false);
            return;
        }

        // INSTALLING
        if (!stage(attempt, AcquisitionStage.INSTALLING)) {
            return;
        }
        InstalledPackage installed;
        try {
            installed = installer.install(candidate);
        } catch (InstallFailedException e) {
            attempt.fail(FailureKind.INSTALL_FAILED, e.getMessage());
            return;
        }

        // SPAWNING
        if (!stage(attempt, AcquisitionStage.SPAWNING)) {
            return;
        }
        Optional<LaunchSpec> launch = resolver.resolve(installed);
        if (launch.isEmpty()) {
            attempt.fail(FailureKind.SPAWN_FAILED, "No executable entry point in " + installed.packageDir());
            return;
        }
        ProcessInfo process;
        try {
            LaunchSpec spec = launch.get();
            process = supervisor.spawn(spec.executable(), spec.args(), spec.workingDir(), candidate.packageName());
        } catch (SpawnException e) {
            attempt.fail(FailureKind.SPAWN_FAILED, e.getReason() + ": " + e.getMessage());
            return;
        }
        String processId = process.id();
        MdcContext.setProcess(processId);
        if (!attempt.advance(s -> s.withProcess(processId))) {
            abandon(processId);
            return;
        }

        handshakeAndRegister(attempt, processId, true);
    }

    private void handshakeAndRegister(AcquisitionAttempt attempt, String processId, boolean owned) {
        String capability = attempt.capability();

        // HANDSHAKING
        if (!stage(attempt, AcquisitionStage.HANDSHAKING)) {
            if (owned) {
                abandon(processId);
            }
            return;
        }
        List<ToolDescriptor> tools;
        try {
            if (owned) {
                protocolClient.open(supervisor.transport(processId));
                HandshakeResult handshake = protocolClient.initialize(processId, bounded(attempt,
                        protocolClient.handshakeTimeout()));
                log.info("Handshake with {} ({} {}) on protocol {}", processId,
                        handshake.serverName(), handshake.serverVersion(), handshake.protocolVersion());
            }
            tools = protocolClient.listTools(processId, bounded(attempt, protocolClient.defaultTimeout()));
        } catch (RpcException | ProtocolUsageException e) {
            if (owned) {
                abandon(processId);
            }
            attempt.fail(FailureKind.HANDSHAKE_FAILED, e.getMessage());
            return;
        }

        Optional<String> tool = toolSelector.select(capability, tools);
        if (tool.isEmpty()) {
            if (owned) {
                abandon(processId);
            }
            attempt.fail(FailureKind.HANDSHAKE_FAILED, "Server " + processId + " advertises no tools");
            return;
        }

        // REGISTERED
        boolean registered;
        try {
            registered = attempt.complete(
                    () -> router.register(capability, processId, tool.get()),
                    s -> s.registered(tool.get()));
        } catch (ProcessUnavailableException e) {
            attempt.fail(FailureKind.PROCESS_CRASHED, e.getMessage());
            return;
        }
        if (!registered) {
            if (owned) {
                abandon(processId);
            }
            return;
        }
        log.info("Capability {} acquired: {} tool {}", capability, processId, tool.get());
    }

    private boolean stage(AcquisitionAttempt attempt, AcquisitionStage stage) {
        if (Thread.currentThread().isInterrupted() || Instant.now().isAfter(attempt.deadline())) {
            attempt.fail(FailureKind.TIMEOUT, "Attempt deadline passed before " + stage);
            return false;
        }
        if (!attempt.enter(stage)) {
            return false;
        }
        MdcContext.setStage(attempt.capability(), stage.name());
        log.debug("{} → {}", attempt.capability(), stage);
        eventBus.publish(AshbyEvent.of(EventTypes.ACQUISITION_STAGE, attempt.capability(),
                attempt.snapshot().processId(), Map.of("stage", stage.name(), "attempt", attempt.number())));
        return true;
    }

    /** The smaller of {@code timeout} and the time left until the attempt deadline. */
    private static Duration bounded(AcquisitionAttempt attempt, Duration timeout) {
        Duration left = Duration.between(Instant.now(), attempt.deadline());
        if (left.isNegative() || left.isZero()) {
            return Duration.ofMillis(1);
        }
        return left.compareTo(timeout) < 0 ? left : timeout;
    }

    private Optional<String> runningProcessFor(String packageName) {
        return router.routes().stream()
                .map(CapabilityRoute::processId)
                .distinct()
                .filter(supervisor::isRunning)
                .filter(id -> supervisor.get(id).map(p -> packageName.equals(p.packageName())).orElse(false))
                .findFirst();
    }

    private void abandon(String processId) {
        log.info("Stopping {} left behind by an unfinished acquisition", processId);
        try {
            supervisor.stop(processId);
        } catch (RuntimeException e) {
            log.warn("Failed to stop {}: {}", processId, e.getMessage());
        }
    }

    private static FailureKind currentKind(AcquisitionAttempt attempt) {
        return switch (attempt.snapshot().stage()) {
            case INSTALLING -> FailureKind.INSTALL_FAILED;
            case SPAWNING -> FailureKind.SPAWN_FAILED;
            case DISCOVERING, DETECTED -> FailureKind.DISCOVERY_EMPTY;
            default -> FailureKind.HANDSHAKE_FAILED;
        };
    }
}
