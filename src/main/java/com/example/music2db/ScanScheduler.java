package com.example.music2db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

public final class ScanScheduler implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(ScanScheduler.class);

    /**
     * The work a trigger performs, normally {@link ScanOrchestrator#scan}.
     */
    @FunctionalInterface
    public interface ScanTask {
        ScanReport run(CancellationToken token);
    }

    private final ScanTask task;
    private final CancellationToken token;
    private final ScheduledExecutorService executor;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean();

    public ScanScheduler(ScanTask task, CancellationToken token) {
        this(task, token, newExecutor(), Clock.systemDefaultZone());
    }

    ScanScheduler(ScanTask task, CancellationToken token, ScheduledExecutorService executor, Clock clock) {
        this.task = task;
        this.token = token;
        this.executor = executor;
        this.clock = clock;
    }

    /**
     * Runs a scan on the calling thread unless one is already active.
     */
    public Optional<ScanReport> runNow() {
        if (!running.compareAndSet(false, true)) {
            LOGGER.info("Scan already in progress, ignoring trigger");
            return Optional.empty();
        }
        try {
            if (token.isCancellationRequested()) {
                return Optional.empty();
            }
            ScanReport report = task.run(token);
            LOGGER.debug("Scan result: {}", report);
            return Optional.of(report);
        } catch (RuntimeException ex) {
            LOGGER.error("Scan failed unexpectedly; will retry on the next trigger", ex);
            return Optional.empty();
        } finally {
            running.set(false);
        }
    }

    /**
     * Schedules a scan every day at {@code time}, local time.
     */
    public void scheduleDaily(LocalTime time) {
        Duration delay = delayUntil(time, ZonedDateTime.now(clock));
        LOGGER.info("Next scan scheduled at {} (in {})", time, delay);
        executor.schedule(() -> {
            runNow();
            if (!token.isCancellationRequested() && !executor.isShutdown()) {
                scheduleDaily(time);
            }
        }, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Schedules a scan every {@code interval}, starting one interval from now.
     */
    public void scheduleEvery(Duration interval) {
        LOGGER.info("Scanning every {}", interval);
        executor.scheduleWithFixedDelay(this::runNow, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Blocks until {@link #close()} has been called and the executor is idle.
     */
    public void awaitShutdown() throws InterruptedException {
        while (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
            LOGGER.trace("Scheduler still active");
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                LOGGER.warn("Scan did not stop within 30 seconds");
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while waiting for the scheduler to stop", ex);
        }
    }

    private static ScheduledExecutorService newExecutor() {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, "scan-scheduler");
            thread.setDaemon(true);
            return thread;
        });
        // pending triggers are dropped on shutdown; an active scan finishes its current file
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        executor.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
        return executor;
    }

    static Duration delayUntil(LocalTime time, ZonedDateTime now) {
        ZonedDateTime next = now.with(time);
        if (!next.isAfter(now)) {
            next = next.plusDays(1);
        }
        return Duration.between(now, next);
    }
}
