package com.releasewatch.service.runtime;

import com.releasewatch.core.bus.EventBus;
import com.releasewatch.core.events.AlertRaised;
import com.releasewatch.core.events.SweepCompleted;
import com.releasewatch.core.events.SweepStarted;
import com.releasewatch.core.model.WatchTarget;
import com.releasewatch.core.state.PersistenceException;
import com.releasewatch.watchers.api.FetchException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Sweeps every target on a fixed pool, either once or at a fixed rate. At most one sweep runs
 * at a time; a timer tick that finds a sweep in progress is skipped.
 */
public class PollScheduler {
    private static final Logger LOGGER = Logger.getLogger(PollScheduler.class.getName());

    private final List<WatchTarget> targets;
    private final ChangePipeline pipeline;
    private final EventBus eventBus;
    private final Clock clock;
    private final Duration interval;
    private final ScheduledExecutorService timerExecutor = Executors.newSingleThreadScheduledExecutor();
    private final ExecutorService pairExecutor;
    private final Map<String, ReentrantLock> pairLocks = new ConcurrentHashMap<>();
    private final AtomicReference<SchedulerState> state = new AtomicReference<>(SchedulerState.IDLE);
    private final AtomicBoolean stopping = new AtomicBoolean(false);

    public PollScheduler(
            List<WatchTarget> targets,
            ChangePipeline pipeline,
            EventBus eventBus,
            Clock clock,
            int parallelism,
            Duration interval
    ) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be positive");
        }
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        this.targets = List.copyOf(targets);
        this.pipeline = pipeline;
        this.eventBus = eventBus;
        this.clock = clock;
        this.interval = interval;
        this.pairExecutor = Executors.newFixedThreadPool(parallelism);
    }

    public void start() {
        timerExecutor.scheduleAtFixedRate(this::tick, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        LOGGER.info(() -> "Scheduled sweeps of " + targets.size() + " target(s) every " + interval);
    }

    /**
     * Runs one sweep on the calling thread and waits for every pair.
     *
     * @throws IllegalStateException when another sweep is in progress
     */
    public SweepReport runOnce() {
        return sweep().orElseThrow(() -> new IllegalStateException("A sweep is already in progress"));
    }

    public SchedulerState state() {
        return state.get();
    }

    public void shutdown() {
        stopping.set(true);
        timerExecutor.shutdown();
        pairExecutor.shutdown();
        try {
            if (!timerExecutor.awaitTermination(30, TimeUnit.SECONDS)) {
                LOGGER.warning("Sweep still running after shutdown timeout");
            }
            pairExecutor.awaitTermination(30, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    void tick() {
        try {
            if (sweep().isEmpty()) {
                LOGGER.info("Previous sweep still running, skipping this tick");
            }
        } catch (RuntimeException e) {
            // An exception escaping here would cancel every later tick.
            LOGGER.log(Level.SEVERE, "Sweep failed", e);
        }
    }

    private Optional<SweepReport> sweep() {
        if (!state.compareAndSet(SchedulerState.IDLE, SchedulerState.POLLING)) {
            return Optional.empty();
        }
        try {
            return Optional.of(runSweep());
        } finally {
            state.set(SchedulerState.IDLE);
        }
    }

    private SweepReport runSweep() {
        Instant startedAt = clock.instant();
        eventBus.publish(new SweepStarted(startedAt, targets.size()));
        redeliver();

        List<Future<PairOutcome>> futures = new ArrayList<>();
        for (WatchTarget target : targets) {
            if (stopping.get()) {
                break;
            }
            try {
                futures.add(pairExecutor.submit(() -> runPair(target)));
            } catch (RejectedExecutionException e) {
                LOGGER.info("Worker pool closed, not dispatching remaining targets");
                break;
            }
        }

        int attempted = 0;
        int succeeded = 0;
        int failed = 0;
        int events = 0;
        for (Future<PairOutcome> future : futures) {
            PairOutcome outcome = await(future);
            if (outcome == PairOutcome.SKIPPED) {
                continue;
            }
            attempted++;
            if (outcome.ok()) {
                succeeded++;
                events += outcome.eventsDetected();
            } else {
                failed++;
            }
        }

        long durationMillis = Duration.between(startedAt, clock.instant()).toMillis();
        SweepReport report = new SweepReport(startedAt, attempted, succeeded, failed, events, durationMillis);
        eventBus.publish(new SweepCompleted(clock.instant(), attempted, succeeded, failed, events, durationMillis));
        return report;
    }

    private void redeliver() {
        try {
            pipeline.redeliverPending();
        } catch (PersistenceException e) {
            LOGGER.log(Level.SEVERE, "Could not read pending events", e);
            eventBus.publish(new AlertRaised(clock.instant(), AlertRaised.OUTBOX, e.getMessage(), Map.of()));
        }
    }

    private PairOutcome runPair(WatchTarget target) {
        if (stopping.get()) {
            return PairOutcome.SKIPPED;
        }
        ReentrantLock lock = pairLocks.computeIfAbsent(target.entityKey(), ignored -> new ReentrantLock());
        lock.lock();
        try {
            return PairOutcome.succeeded(pipeline.process(target));
        } catch (FetchException e) {
            LOGGER.warning(() -> "Fetch failed for " + target.entityKey() + ": " + e.getMessage());
            pairFailed(target, AlertRaised.FETCH, "Fetch failed for " + target.entityKey() + ": " + e.getMessage());
            return PairOutcome.FAILED;
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Pair failed: " + target.entityKey(), e);
            pairFailed(target, AlertRaised.PAIR, "Pair failed for " + target.entityKey() + ": " + e.getMessage());
            return PairOutcome.FAILED;
        } finally {
            lock.unlock();
        }
    }

    private void pairFailed(WatchTarget target, String category, String message) {
        eventBus.publish(new AlertRaised(clock.instant(), category, message, Map.of("entityKey", target.entityKey())));
    }

    private PairOutcome await(Future<PairOutcome> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return PairOutcome.FAILED;
        } catch (ExecutionException e) {
            LOGGER.log(Level.WARNING, "Pair task failed", e.getCause());
            return PairOutcome.FAILED;
        }
    }

    private record PairOutcome(boolean ok, int eventsDetected) {
        static final PairOutcome FAILED = new PairOutcome(false, 0);
        static final PairOutcome SKIPPED = new PairOutcome(false, -1);

        static PairOutcome succeeded(PairResult result) {
            return new PairOutcome(true, result.eventsDetected());
        }
    }
}
