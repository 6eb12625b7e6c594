package com.ashby.core.engine;

import com.ashby.core.model.AcquisitionSnapshot;
import com.ashby.core.model.AcquisitionStage;
import com.ashby.core.model.FailureKind;
import com.ashby.core.model.VarietyGap;

import java.time.Instant;
import java.util.concurrent.Future;
import java.util.function.UnaryOperator;

/**
 * One run of the acquisition state machine for one capability.
 * <p>
 * The worker running the stages and the deadline watchdog race to finish the attempt; whoever
 * finishes first wins and later updates are ignored. This is what keeps a timed-out attempt
 * from registering a route.
 */
public class AcquisitionAttempt {

    private final String capability;
    private final int number;
    private final VarietyGap gap;
    private final Instant deadline;

    private AcquisitionSnapshot snapshot;
    private boolean finished;
    private boolean reported;
    private Future<?> future;

    public AcquisitionAttempt(String capability, int number, VarietyGap gap, Instant deadline) {
        this.capability = capability;
        this.number = number;
        this.gap = gap;
        this.deadline = deadline;
        this.snapshot = AcquisitionSnapshot.detected(capability, number);
    }

    public String capability() { return capability; }
    public int number() { return number; }
    public VarietyGap gap() { return gap; }
    public Instant deadline() { return deadline; }

    public synchronized AcquisitionSnapshot snapshot() {
        return snapshot;
    }

    public synchronized boolean isFinished() {
        return finished;
    }

    /**
     * Applies a non-terminal update.
     *
     * @return false if the attempt already finished (the update was dropped)
     */
    public synchronized boolean advance(UnaryOperator<AcquisitionSnapshot> update) {
        if (finished) {
            return false;
        }
        snapshot = update.apply(snapshot);
        return true;
    }

    public boolean enter(AcquisitionStage stage) {
        return advance(s -> s.withStage(stage));
    }

    /**
     * Finishes the attempt with a terminal snapshot.
     *
     * @return false if someone else finished it first
     */
    public synchronized boolean finish(UnaryOperator<AcquisitionSnapshot> terminal) {
        if (finished) {
            return false;
        }
        snapshot = terminal.apply(snapshot);
        finished = true;
        return true;
    }

    /**
     * Runs {@code commit} and finishes the attempt atomically with respect to the watchdog.
     * If {@code commit} throws, the attempt stays unfinished.
     *
     * @return false if the attempt had already finished; {@code commit} did not run
     */
    public synchronized boolean complete(Runnable commit, UnaryOperator<AcquisitionSnapshot> terminal) {
        if (finished) {
            return false;
        }
        commit.run();
        snapshot = terminal.apply(snapshot);
        finished = true;
        return true;
    }

    public boolean fail(FailureKind kind, String detail) {
        return finish(s -> s.failed(kind, detail));
    }

    /**
     * Replaces the snapshot of an already finished attempt, for events after the fact
     * such as the process of a registered capability crashing.
     */
    synchronized void amend(UnaryOperator<AcquisitionSnapshot> update) {
        snapshot = update.apply(snapshot);
    }

    /** True exactly once, for the first caller after the attempt finished. */
    synchronized boolean claimReport() {
        if (!finished || reported) {
            return false;
        }
        reported = true;
        return true;
    }

    synchronized void setFuture(Future<?> future) {
        this.future = future;
    }

    synchronized void cancelWorker() {
        if (future != null) {
            future.cancel(true);
        }
    }
}
