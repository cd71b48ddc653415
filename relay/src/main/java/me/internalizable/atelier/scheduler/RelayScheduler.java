package me.internalizable.atelier.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Timer service for request deadlines, heartbeats and handshake timeouts.
 *
 * <p>Every task is wrapped so that a failing task is logged instead of silently cancelling
 * its repetitions.</p>
 */
public class RelayScheduler {

    private static final Logger LOGGER = LoggerFactory.getLogger(RelayScheduler.class);

    private final ScheduledExecutorService executor;

    public RelayScheduler() {
        this(Math.max(2, Runtime.getRuntime().availableProcessors() / 2));
    }

    public RelayScheduler(int threads) {
        AtomicInteger counter = new AtomicInteger();
        ScheduledThreadPoolExecutor pool = new ScheduledThreadPoolExecutor(threads, r -> {
            Thread t = new Thread(r, "Atelier-Scheduler-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        // queued timers are dropped on shutdown
        pool.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        pool.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
        pool.setRemoveOnCancelPolicy(true);
        this.executor = pool;
    }

    public RelayScheduler(@Nonnull ScheduledExecutorService executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Run a task once after a delay.
     *
     * @param name short task name used in error logs
     * @param task the task
     * @param delay the delay
     * @return a future that can cancel the task
     */
    @Nonnull
    public ScheduledFuture<?> runLater(@Nonnull String name, @Nonnull Runnable task, @Nonnull Duration delay) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(task, "task");
        Objects.requireNonNull(delay, "delay");
        return executor.schedule(wrap(name, task), Math.max(0, delay.toNanos()), TimeUnit.NANOSECONDS);
    }

    /**
     * Run a task at a fixed rate until cancelled or until the scheduler shuts down.
     */
    @Nonnull
    public ScheduledFuture<?> runRepeating(@Nonnull String name, @Nonnull Runnable task,
                                           @Nonnull Duration initialDelay, @Nonnull Duration period) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(task, "task");
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be positive");
        }
        return executor.scheduleAtFixedRate(wrap(name, task),
            Math.max(0, initialDelay.toNanos()), period.toNanos(), TimeUnit.NANOSECONDS);
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    /**
     * Shutdown the scheduler.
     */
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static Runnable wrap(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                LOGGER.error("Error executing scheduled task {}", name, e);
            }
        };
    }
}
