package com.alertsentinel.core.manager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs an evaluation task at a fixed rate with a single-flight guard.
 *
 * <p>
 * A ticker thread fires every {@code interval} and hands the task to a
 * worker thread. If the previous run is still in flight the tick is
 * skipped and counted rather than queued, so a slow evaluation never
 * builds up a backlog. Exceptions thrown by the task are logged and the
 * schedule keeps running.
 * </p>
 *
 * <p>
 * Both threads are daemon threads.
 * </p>
 *
 * @since 1.0.0
 */
public class EvaluationScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(EvaluationScheduler.class);

    private final Duration interval;
    private final Runnable task;
    private final AtomicBoolean inFlight = new AtomicBoolean(false);
    private final AtomicLong completedRuns = new AtomicLong();
    private final AtomicLong skippedTicks = new AtomicLong();

    private ScheduledExecutorService ticker;
    private ExecutorService worker;

    /**
     * @param interval time between ticks; must be positive
     * @param task     the evaluation to run on each tick
     */
    public EvaluationScheduler(Duration interval, Runnable task) {
        this.interval = Objects.requireNonNull(interval, "interval must not be null");
        this.task = Objects.requireNonNull(task, "task must not be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be > 0, got: " + interval);
        }
    }

    /**
     * Start ticking. The first tick fires after one interval. Calling
     * {@code start} on a running scheduler has no effect.
     */
    public synchronized void start() {
        if (ticker != null) {
            return;
        }
        ticker = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "alert-evaluation-ticker");
            t.setDaemon(true);
            return t;
        });
        worker = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "alert-evaluation-worker");
            t.setDaemon(true);
            return t;
        });
        long periodMs = interval.toMillis();
        ticker.scheduleAtFixedRate(this::tick, periodMs, periodMs, TimeUnit.MILLISECONDS);
        LOG.info("Auto-evaluation started (interval: {} ms)", periodMs);
    }

    /**
     * Stop ticking. A run already in flight is allowed to finish; this
     * method does not wait for it.
     */
    public synchronized void stop() {
        if (ticker == null) {
            return;
        }
        ticker.shutdownNow();
        worker.shutdown();
        ticker = null;
        worker = null;
        LOG.info("Auto-evaluation stopped after {} run(s), {} skipped tick(s)",
                completedRuns.get(), skippedTicks.get());
    }

    public synchronized boolean isRunning() {
        return ticker != null;
    }

    /** Number of task runs that have finished, successfully or not. */
    public long getCompletedRuns() {
        return completedRuns.get();
    }

    /** Number of ticks dropped because a run was still in flight. */
    public long getSkippedTicks() {
        return skippedTicks.get();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    void tick() {
        if (!inFlight.compareAndSet(false, true)) {
            long skipped = skippedTicks.incrementAndGet();
            LOG.warn("Previous evaluation still running, skipping tick (skipped so far: {})", skipped);
            return;
        }
        ExecutorService current;
        synchronized (this) {
            current = worker;
        }
        if (current == null) {
            inFlight.set(false);
            return;
        }
        try {
            current.execute(this::runTask);
        } catch (RejectedExecutionException e) {
            // stopped between the tick firing and the hand-off
            inFlight.set(false);
        }
    }

    private void runTask() {
        try {
            task.run();
        } catch (RuntimeException e) {
            LOG.error("Scheduled evaluation failed", e);
        } finally {
            completedRuns.incrementAndGet();
            inFlight.set(false);
        }
    }
}
