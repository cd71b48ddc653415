package me.internalizable.atelier.scheduler;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

final class RelaySchedulerTest {

    @Test
    void shutdownDoesNotWaitForQueuedTimers() {
        RelayScheduler scheduler = new RelayScheduler(1);
        AtomicBoolean ran = new AtomicBoolean();
        scheduler.runLater("handshake conn-1", () -> ran.set(true), Duration.ofHours(1));
        scheduler.runRepeating("heartbeat", () -> ran.set(true), Duration.ofHours(1), Duration.ofHours(1));

        long started = System.nanoTime();
        scheduler.shutdown();
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        Assertions.assertTrue(elapsedMillis < 1000, "shutdown took " + elapsedMillis + "ms");
        Assertions.assertTrue(scheduler.isShutdown());
        Assertions.assertFalse(ran.get());
    }

    @Test
    void failingRepeatingTaskKeepsRunning() throws InterruptedException {
        RelayScheduler scheduler = new RelayScheduler(1);
        CountDownLatch runs = new CountDownLatch(3);
        AtomicInteger attempts = new AtomicInteger();

        ScheduledFuture<?> task = scheduler.runRepeating("flaky", () -> {
            attempts.incrementAndGet();
            runs.countDown();
            throw new IllegalStateException("boom");
        }, Duration.ZERO, Duration.ofMillis(10));

        try {
            Assertions.assertTrue(runs.await(5, TimeUnit.SECONDS));
            Assertions.assertTrue(attempts.get() >= 3);
        } finally {
            task.cancel(false);
            scheduler.shutdown();
        }
    }
}
