package com.ashby.supervisor;

import com.ashby.core.events.AshbyEvent;
import com.ashby.core.events.EventBus;
import com.ashby.core.events.EventTypes;
import com.ashby.core.logging.MdcContext;
import com.ashby.core.metrics.AshbyMetrics;
import com.ashby.core.model.ProcessInfo;
import com.ashby.core.model.ProcessStatus;
import com.ashby.mcp.Transport;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns every plugin subprocess: spawning, writing to stdin, stopping and exit monitoring.
 * <p>
 * Each process gets one exit watcher ({@link Process#onExit()}) and one stderr drainer thread.
 * Both run independently of protocol traffic, so a crash is noticed even while no request is
 * outstanding. Other components refer to processes only by id and see {@link ProcessInfo} snapshots.
 */
@Service
public class ProcessSupervisor {

    private static final Logger log = LoggerFactory.getLogger(ProcessSupervisor.class);
    private static final int EVENT_STDERR_LINES = 10;

    private final ProcessLauncher launcher;
    private final SupervisorProperties properties;
    private final EventBus eventBus;
    private final AshbyMetrics metrics;

    private final Map<String, ManagedProcess> processes = new ConcurrentHashMap<>();
    private final Deque<ProcessInfo> recentExits = new ArrayDeque<>();
    /** Exited processes still listed in {@link #recentExits}, kept for their stderr tail. Guarded by recentExits. */
    private final Map<String, ManagedProcess> exited = new LinkedHashMap<>();
    private final AtomicLong nextId = new AtomicLong(1);

    public ProcessSupervisor(ProcessLauncher launcher, SupervisorProperties properties,
                             EventBus eventBus, AshbyMetrics metrics) {
        this.launcher = launcher;
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public ProcessInfo spawn(String executable, List<String> args, Path workingDir) {
        return spawn(executable, args, workingDir, executable);
    }

    /**
     * Starts {@code executable} with {@code args} in {@code workingDir}.
     *
     * @return the process snapshot, {@code RUNNING} once it survived the startup grace period
     * @throws SpawnException {@code NOT_FOUND} when the executable does not exist,
     *                        {@code SPAWN_FAILED} when the OS refused or the process died during startup
     */
    public ProcessInfo spawn(String executable, List<String> args, Path workingDir, String packageName) {
        if (executable == null || executable.isBlank()) {
            throw new SpawnException(SpawnException.Reason.NOT_FOUND, "No executable given");
        }
        if (workingDir == null || !Files.isDirectory(workingDir)) {
            throw new SpawnException(SpawnException.Reason.SPAWN_FAILED,
                    "Working directory does not exist: " + workingDir);
        }
        // the child resolves a relative path after changing into workingDir
        if (executable.contains("/") && !Files.isRegularFile(workingDir.resolve(executable))) {
            throw new SpawnException(SpawnException.Reason.NOT_FOUND, "Executable not found: " + executable);
        }

        List<String> command = new ArrayList<>();
        command.add(executable);
        if (args != null) {
            command.addAll(args);
        }

        String id = "proc-" + nextId.getAndIncrement();
        Process process;
        try {
            process = launcher.launch(command, workingDir);
        } catch (IOException e) {
            throw classifyLaunchFailure(executable, e);
        }

        var managed = new ManagedProcess(id, packageName, process, properties.getStderrTailLines());
        managed.setTransport(new ProcessTransport(managed, this));
        processes.put(id, managed);

        MdcContext.setProcess(id);
        try {
            log.info("Spawned {} for {} (pid {})", id, packageName, pidOf(process));
            startStderrDrainer(managed);
            process.onExit().whenComplete((p, error) -> handleExit(managed));

            awaitStartup(managed);
            if (!managed.markRunning()) {
                throw startupFailure(managed);
            }
            eventBus.publish(AshbyEvent.of(EventTypes.PROCESS_STARTED, id, id,
                    Map.of("packageName", packageName, "command", String.join(" ", command))));
            return managed.toInfo();
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Writes raw bytes to the process's stdin.
     *
     * @throws ProcessNotRunningException if the process is unknown, exited, or the pipe is broken
     */
    public void send(String id, byte[] bytes) {
        ManagedProcess managed = processes.get(id);
        if (managed == null || !managed.isRunning()) {
            throw new ProcessNotRunningException(id, "Process " + id + " is not running");
        }
        try {
            OutputStream stdin = managed.process().getOutputStream();
            synchronized (stdin) {
                stdin.write(bytes);
                stdin.flush();
            }
        } catch (IOException e) {
            throw new ProcessNotRunningException(id, "Write to " + id + " failed: " + e.getMessage());
        }
    }

    /**
     * Stops a process: polite destroy, then forcible destroy after the stop timeout.
     * Unknown or already exited ids are a no-op.
     */
    public void stop(String id) {
        ManagedProcess managed = processes.get(id);
        if (managed == null) {
            log.debug("Stop requested for {} which is not running", id);
            return;
        }
        managed.requestStop();
        Process process = managed.process();
        log.info("Stopping {} ({})", id, managed.packageName());
        process.destroy();
        if (!awaitExit(process, properties.getStopTimeout().toMillis())) {
            log.warn("{} did not exit within {}, killing", id, properties.getStopTimeout());
            process.destroyForcibly();
            awaitExit(process, properties.getStopTimeout().toMillis());
        }
        handleExit(managed);
    }

    @PreDestroy
    public void stopAll() {
        for (String id : List.copyOf(processes.keySet())) {
            try {
                stop(id);
            } catch (RuntimeException e) {
                log.warn("Failed to stop {}: {}", id, e.getMessage());
            }
        }
    }

    /**
     * The protocol transport over the process's stdin/stdout.
     *
     * @throws ProcessNotRunningException if the process is not registered
     */
    public Transport transport(String id) {
        ManagedProcess managed = processes.get(id);
        if (managed == null) {
            throw new ProcessNotRunningException(id, "Process " + id + " is not running");
        }
        return managed.transport();
    }

    public boolean isRunning(String id) {
        ManagedProcess managed = id != null ? processes.get(id) : null;
        return managed != null && managed.isRunning();
    }

    public Optional<ProcessInfo> get(String id) {
        ManagedProcess managed = processes.get(id);
        if (managed != null) {
            return Optional.of(managed.toInfo());
        }
        synchronized (recentExits) {
            return recentExits.stream().filter(p -> p.id().equals(id)).findFirst();
        }
    }

    public List<ProcessInfo> listRunningProcesses() {
        return processes.values().stream()
                .map(ManagedProcess::toInfo)
                .filter(p -> !p.status().isTerminal())
                .toList();
    }

    /** Most recent exits first. */
    public List<ProcessInfo> recentExits() {
        synchronized (recentExits) {
            return List.copyOf(recentExits);
        }
    }

    /** Last stderr lines of a running or recently exited process. */
    public List<String> stderrTail(String id) {
        ManagedProcess managed = processes.get(id);
        if (managed == null) {
            synchronized (recentExits) {
                managed = exited.get(id);
            }
        }
        return managed != null ? managed.stderrTail() : List.of();
    }

    private void awaitStartup(ManagedProcess managed) {
        long graceMs = properties.getStartupGrace().toMillis();
        if (graceMs <= 0) {
            return;
        }
        if (awaitExit(managed.process(), graceMs)) {
            handleExit(managed);
        }
    }

    private SpawnException startupFailure(ManagedProcess managed) {
        ProcessInfo info = managed.toInfo();
        List<String> tail = managed.stderrTail();
        String detail = "Process exited during startup with code " + info.exitCode()
                + (tail.isEmpty() ? "" : ": " + String.join(" | ", lastLines(tail, 3)));
        return new SpawnException(SpawnException.Reason.SPAWN_FAILED, detail);
    }

    private SpawnException classifyLaunchFailure(String executable, IOException e) {
        String message = String.valueOf(e.getMessage());
        if (message.contains("error=2") || message.contains("No such file")) {
            return new SpawnException(SpawnException.Reason.NOT_FOUND,
                    "Executable not found: " + executable, e);
        }
        return new SpawnException(SpawnException.Reason.SPAWN_FAILED,
                "Failed to start " + executable + ": " + message, e);
    }

    /**
     * Records the exit of a process exactly once and announces it. Called from the exit
     * watcher and from {@link #stop}, whichever gets there first.
     */
    private void handleExit(ManagedProcess managed) {
        Process process = managed.process();
        if (process.isAlive()) {
            return;
        }
        if (!managed.markExited(process.exitValue())) {
            return;
        }
        processes.remove(managed.id(), managed);
        ProcessInfo info = managed.toInfo();
        synchronized (recentExits) {
            recentExits.addFirst(info);
            exited.put(managed.id(), managed);
            while (recentExits.size() > properties.getRecentExitsLimit()) {
                exited.remove(recentExits.removeLast().id());
            }
        }
        ProcessTransport transport = managed.transport();
        if (transport != null) {
            transport.close();
        }

        boolean crashed = info.status() == ProcessStatus.CRASHED;
        MdcContext.setProcess(managed.id());
        try {
            if (crashed) {
                log.warn("{} ({}) crashed with exit code {}", managed.id(), managed.packageName(), info.exitCode());
            } else {
                log.info("{} ({}) stopped with exit code {}", managed.id(), managed.packageName(), info.exitCode());
            }
        } finally {
            MdcContext.clear();
        }
        metrics.recordProcessExit(info.status().name().toLowerCase());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("packageName", managed.packageName());
        payload.put("exitCode", info.exitCode());
        payload.put("stderrTail", lastLines(managed.stderrTail(), EVENT_STDERR_LINES));
        eventBus.publish(AshbyEvent.of(crashed ? EventTypes.PROCESS_CRASHED : EventTypes.PROCESS_STOPPED,
                managed.id(), managed.id(), payload));
    }

    private void startStderrDrainer(ManagedProcess managed) {
        Thread drainer = new Thread(() -> {
            MdcContext.setProcess(managed.id());
            try (var reader = new BufferedReader(
                    new InputStreamReader(managed.process().getErrorStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    managed.appendStderr(line);
                    log.debug("[{} stderr] {}", managed.id(), line);
                }
            } catch (IOException e) {
                log.debug("stderr of {} closed: {}", managed.id(), e.getMessage());
            } finally {
                MdcContext.clear();
            }
        }, "stderr-" + managed.id());
        drainer.setDaemon(true);
        drainer.start();
    }

    private static boolean awaitExit(Process process, long millis) {
        try {
            process.onExit().get(millis, TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            return !process.isAlive();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return !process.isAlive();
        }
    }

    private static List<String> lastLines(List<String> lines, int n) {
        return lines.size() <= n ? lines : lines.subList(lines.size() - n, lines.size());
    }

    private static String pidOf(Process process) {
        try {
            return String.valueOf(process.pid());
        } catch (UnsupportedOperationException e) {
            return "n/a";
        }
    }
}
