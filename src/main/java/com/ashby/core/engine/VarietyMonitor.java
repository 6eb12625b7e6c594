package com.ashby.core.engine;

import com.ashby.core.events.AshbyEvent;
import com.ashby.core.events.EventBus;
import com.ashby.core.events.EventTypes;
import com.ashby.core.logging.MdcContext;
import com.ashby.core.metrics.AshbyMetrics;
import com.ashby.core.model.AcquisitionFailure;
import com.ashby.core.model.AcquisitionSnapshot;
import com.ashby.core.model.AcquisitionStage;
import com.ashby.core.model.FailureKind;
import com.ashby.core.model.Severity;
import com.ashby.core.model.VarietyGap;
import com.ashby.core.security.PackageNames;
import com.ashby.router.CapabilityRouter;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The acquisition loop. Gaps come from the periodic tick ({@link GapDetector}) or from
 * {@link #injectGap}; every capability that is not routed, not already being acquired and not
 * backing off gets an {@link AcquisitionAttempt} on the worker pool.
 * <p>
 * The tick only decides and submits, so a slow acquisition never delays the next tick. At most one
 * attempt per capability is in flight; further gaps naming it are coalesced into that attempt.
 * Each attempt has a watchdog that fails it with TIMEOUT at its deadline.
 */
@Service
public class VarietyMonitor {

    private static final Logger log = LoggerFactory.getLogger(VarietyMonitor.class);

    private final AcquisitionEngine engine;
    private final GapDetector gapDetector;
    private final CapabilityRouter router;
    private final MonitorProperties properties;
    private final EventBus eventBus;
    private final AshbyMetrics metrics;
    private final BackoffPolicy backoff;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService workers;

    /** Latest attempt per capability. Guarded by {@code this}. */
    private final Map<String, AcquisitionAttempt> attempts = new LinkedHashMap<>();
    /** Consecutive failures per capability. Guarded by {@code this}. */
    private final Map<String, Integer> failures = new HashMap<>();

    private ScheduledFuture<?> tickTask;

    @Autowired
    public VarietyMonitor(AcquisitionEngine engine, GapDetector gapDetector, CapabilityRouter router,
                          MonitorProperties properties, EventBus eventBus, AshbyMetrics metrics) {
        this(engine, gapDetector, router, properties, eventBus, metrics,
                Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread t = new Thread(r, "variety-monitor");
                    t.setDaemon(true);
                    return t;
                }),
                Executors.newFixedThreadPool(Math.max(1, properties.getWorkers()), workerThreads()));
    }

    VarietyMonitor(AcquisitionEngine engine, GapDetector gapDetector, CapabilityRouter router,
                   MonitorProperties properties, EventBus eventBus, AshbyMetrics metrics,
                   ScheduledExecutorService scheduler, ExecutorService workers) {
        this.engine = engine;
        this.gapDetector = gapDetector;
        this.router = router;
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.backoff = BackoffPolicy.from(properties.getBackoff());
        this.scheduler = scheduler;
        this.workers = workers;
    }

    @PostConstruct
    void init() {
        eventBus.subscribe(EventTypes.PROCESS_CRASHED, e -> onProcessLost(e.processId(), true));
        eventBus.subscribe(EventTypes.PROCESS_STOPPED, e -> onProcessLost(e.processId(), false));
        if (properties.isEnabled()) {
            start();
        } else {
            log.info("Variety monitor tick disabled; gaps are only taken by injection");
        }
    }

    public synchronized void start() {
        if (tickTask != null) {
            return;
        }
        long interval = properties.getInterval().toMillis();
        tickTask = scheduler.scheduleWithFixedDelay(this::safeTick, interval, interval, TimeUnit.MILLISECONDS);
        log.info("Variety monitor started: tick every {}, {} worker(s), attempt deadline {}",
                properties.getInterval(), properties.getWorkers(), properties.getAttemptTimeout());
    }

    public synchronized boolean isTicking() {
        return tickTask != null && !tickTask.isCancelled();
    }

    @PreDestroy
    public void shutdown() {
        synchronized (this) {
            if (tickTask != null) {
                tickTask.cancel(false);
                tickTask = null;
            }
        }
        scheduler.shutdownNow();
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Acquisition workers did not stop within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * One monitor cycle: compute the gap from the required capabilities and act on it.
     */
    public void tick() {
        gapDetector.detect().ifPresent(gap -> accept(gap, false));
    }

    /**
     * Out-of-band gap. Counts as an explicit retry, so backoff does not apply.
     *
     * @throws IllegalArgumentException if no capability is given or a name is invalid
     */
    public GapAcceptance injectGap(Collection<String> requiredCapabilities, Severity severity, String source) {
        if (requiredCapabilities == null || requiredCapabilities.isEmpty()) {
            throw new IllegalArgumentException("At least one capability is required");
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String raw : requiredCapabilities) {
            normalized.add(PackageNames.normalizeCapability(raw));
        }
        var gap = VarietyGap.of(normalized, severity, source);
        log.info("Gap injected by {} ({}): {}", gap.source(), gap.severity(), normalized);
        List<String> started = accept(gap, true);
        return new GapAcceptance(true, List.copyOf(normalized), started);
    }

    public synchronized Optional<AcquisitionSnapshot> getAcquisitionStatus(String capability) {
        AcquisitionAttempt attempt = attempts.get(capability);
        return attempt != null ? Optional.of(attempt.snapshot()) : Optional.empty();
    }

    public synchronized List<AcquisitionSnapshot> listAcquisitions() {
        return attempts.values().stream()
                .map(AcquisitionAttempt::snapshot)
                .sorted(Comparator.comparing(AcquisitionSnapshot::capability))
                .toList();
    }

    public synchronized int inFlightCount() {
        return (int) attempts.values().stream().filter(a -> !a.isFinished()).count();
    }

    private void safeTick() {
        try {
            tick();
        } catch (RuntimeException e) {
            log.error("Monitor tick failed: {}", e.getMessage(), e);
        }
    }

    private synchronized List<String> accept(VarietyGap gap, boolean explicit) {
        metrics.recordGapAccepted(gap.source(), gap.requiredCapabilities().size());
        eventBus.publish(AshbyEvent.of(EventTypes.GAP_ACCEPTED, String.join(",", gap.requiredCapabilities()),
                null, Map.of("severity", gap.severity().name(), "source", gap.source())));

        List<String> started = new ArrayList<>();
        Instant now = Instant.now();
        for (String capability : gap.requiredCapabilities()) {
            if (router.route(capability).isPresent()) {
                log.debug("{} is already available", capability);
                continue;
            }
            AcquisitionAttempt current = attempts.get(capability);
            if (current != null && !current.isFinished()) {
                log.info("{} already being acquired (attempt {}), coalescing", capability, current.number());
                metrics.recordCoalesced();
                continue;
            }
            if (!explicit && current != null && backingOff(capability, current.snapshot(), now)) {
                continue;
            }
            startAttempt(capability, gap, current != null ? current.number() + 1 : 1);
            started.add(capability);
        }
        return started;
    }

    private boolean backingOff(String capability, AcquisitionSnapshot last, Instant now) {
        if (last.stage() != AcquisitionStage.FAILED) {
            return false;
        }
        int failed = failures.getOrDefault(capability, 0);
        if (!backoff.allowsAutoRetry(failed)) {
            log.debug("{} failed {} time(s), no automatic retry", capability, failed);
            return true;
        }
        Instant next = last.nextRetryAt();
        if (next != null && now.isBefore(next)) {
            log.debug("{} backing off until {}", capability, next);
            return true;
        }
        return false;
    }

    private void startAttempt(String capability, VarietyGap gap, int number) {
        Duration timeout = properties.getAttemptTimeout();
        var attempt = new AcquisitionAttempt(capability, number, gap, Instant.now().plus(timeout));
        attempts.put(capability, attempt);
        log.info("Starting acquisition of {} (attempt {}, severity {})", capability, number, gap.severity());
        eventBus.publish(AshbyEvent.of(EventTypes.ACQUISITION_STARTED, capability, null,
                Map.of("attempt", number, "source", gap.source(), "severity", gap.severity().name())));

        attempt.setFuture(workers.submit(() -> {
            try {
                engine.run(attempt);
            } finally {
                report(attempt);
            }
        }));
        scheduler.schedule(() -> onDeadline(attempt), timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void onDeadline(AcquisitionAttempt attempt) {
        if (!attempt.fail(FailureKind.TIMEOUT, "Attempt exceeded deadline of " + properties.getAttemptTimeout())) {
            return;
        }
        MdcContext.setCapability(attempt.capability());
        try {
            log.warn("Acquisition of {} timed out in stage {}", attempt.capability(),
                    attempt.snapshot().failure().stage());
        } finally {
            MdcContext.clear();
        }
        attempt.cancelWorker();
        report(attempt);
    }

    /** Records the terminal outcome of an attempt once. */
    private synchronized void report(AcquisitionAttempt attempt) {
        if (!attempt.claimReport()) {
            return;
        }
        AcquisitionSnapshot snapshot = attempt.snapshot();
        String capability = snapshot.capability();
        long ms = Duration.between(snapshot.startedAt(), Instant.now()).toMillis();

        if (snapshot.stage() == AcquisitionStage.REGISTERED) {
            reportRegistered(snapshot);
            return;
        }

        AcquisitionFailure failure = snapshot.failure();
        int failed = failures.merge(capability, 1, Integer::sum);
        Instant next = backoff.nextRetryAt(Instant.now(), failed);
        attempt.amend(s -> s.withNextRetryAt(next));
        metrics.recordAcquisition("failed", failure.stage().name(), ms);
        log.warn("Acquisition of {} failed at {} ({}): {}; {}", capability, failure.stage(), failure.kind(),
                failure.detail(), next != null ? "next automatic retry at " + next : "no automatic retry");
        publishFailure(capability, snapshot.processId(), failure);
    }

    private void reportRegistered(AcquisitionSnapshot snapshot) {
        long ms = Duration.between(snapshot.startedAt(), Instant.now()).toMillis();
        failures.remove(snapshot.capability());
        metrics.recordAcquisition("registered", AcquisitionStage.REGISTERED.name(), ms);
        eventBus.publish(AshbyEvent.of(EventTypes.ACQUISITION_REGISTERED, snapshot.capability(), snapshot.processId(),
                Map.of("tool", snapshot.toolName(), "attempt", snapshot.attempt())));
    }

    /**
     * A registered capability lost its process: the capability is unavailable again.
     * Crashes count toward backoff; operator stops do not.
     */
    private synchronized void onProcessLost(String processId, boolean crashed) {
        if (processId == null) {
            return;
        }
        for (AcquisitionAttempt attempt : attempts.values()) {
            AcquisitionSnapshot snapshot = attempt.snapshot();
            if (snapshot.stage() != AcquisitionStage.REGISTERED || !processId.equals(snapshot.processId())) {
                continue;
            }
            if (attempt.claimReport()) {
                // lost before the worker reported the registration; the worker's report is now a no-op
                reportRegistered(snapshot);
            }
            String detail = "Process " + processId + (crashed ? " crashed" : " was stopped");
            attempt.amend(s -> s.failed(FailureKind.PROCESS_CRASHED, detail));
            if (crashed) {
                int failed = failures.merge(snapshot.capability(), 1, Integer::sum);
                Instant next = backoff.nextRetryAt(Instant.now(), failed);
                attempt.amend(s -> s.withNextRetryAt(next));
            }
            log.warn("Capability {} lost: {}", snapshot.capability(), detail);
            publishFailure(snapshot.capability(), processId, attempt.snapshot().failure());
        }
    }

    private void publishFailure(String capability, String processId, AcquisitionFailure failure) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("stage", failure.stage().name());
        payload.put("kind", failure.kind().name());
        payload.put("detail", failure.detail());
        eventBus.publish(AshbyEvent.of(EventTypes.ACQUISITION_FAILED, capability, processId, payload));
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "acquisition-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
