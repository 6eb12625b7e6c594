package com.ashby.supervisor;

import com.ashby.core.model.ProcessInfo;
import com.ashby.core.model.ProcessStatus;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Supervisor-private handle for one subprocess. Never handed out; callers get {@link ProcessInfo}.
 */
class ManagedProcess {

    private final String id;
    private final String packageName;
    private final Process process;
    private final Instant startedAt;
    private final int stderrLimit;
    private final Deque<String> stderrTail = new ArrayDeque<>();

    private ProcessStatus status = ProcessStatus.STARTING;
    private Instant statusChangedAt;
    private Integer exitCode;
    private boolean stopRequested;
    private ProcessTransport transport;

    ManagedProcess(String id, String packageName, Process process, int stderrLimit) {
        this.id = id;
        this.packageName = packageName;
        this.process = process;
        this.stderrLimit = stderrLimit;
        this.startedAt = Instant.now();
        this.statusChangedAt = startedAt;
    }

    String id() { return id; }
    String packageName() { return packageName; }
    Process process() { return process; }

    synchronized ProcessStatus status() {
        return status;
    }

    synchronized boolean isRunning() {
        return status == ProcessStatus.RUNNING;
    }

    synchronized boolean markRunning() {
        if (status != ProcessStatus.STARTING) {
            return false;
        }
        status = ProcessStatus.RUNNING;
        statusChangedAt = Instant.now();
        return true;
    }

    /**
     * Records the exit. Returns false if the exit was already recorded.
     */
    synchronized boolean markExited(int code) {
        if (status.isTerminal()) {
            return false;
        }
        status = stopRequested ? ProcessStatus.STOPPED : ProcessStatus.CRASHED;
        exitCode = code;
        statusChangedAt = Instant.now();
        return true;
    }

    synchronized void requestStop() {
        stopRequested = true;
    }

    synchronized void setTransport(ProcessTransport transport) {
        this.transport = transport;
    }

    synchronized ProcessTransport transport() {
        return transport;
    }

    void appendStderr(String line) {
        synchronized (stderrTail) {
            if (stderrTail.size() >= stderrLimit) {
                stderrTail.removeFirst();
            }
            stderrTail.addLast(line);
        }
    }

    List<String> stderrTail() {
        synchronized (stderrTail) {
            return List.copyOf(stderrTail);
        }
    }

    synchronized ProcessInfo toInfo() {
        return new ProcessInfo(id, packageName, status, startedAt, statusChangedAt, exitCode);
    }
}
