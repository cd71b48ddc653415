package me.internalizable.atelier.server;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.LongAdder;

/**
 * Counters updated from socket threads.
 */
public class RelayStats {

    private final Instant startedAt = Instant.now();
    private final LongAdder totalConnections = new LongAdder();
    private final LongAdder rejectedConnections = new LongAdder();
    private final LongAdder framesReceived = new LongAdder();
    private final LongAdder protocolErrors = new LongAdder();

    public void connectionAccepted() {
        totalConnections.increment();
    }

    public void connectionRejected() {
        rejectedConnections.increment();
    }

    public void frameReceived() {
        framesReceived.increment();
    }

    public void protocolError() {
        protocolErrors.increment();
    }

    @Nonnull
    public Instant getStartedAt() {
        return startedAt;
    }

    @Nonnull
    public Duration getUptime() {
        return Duration.between(startedAt, Instant.now());
    }

    public long getTotalConnections() {
        return totalConnections.sum();
    }

    public long getRejectedConnections() {
        return rejectedConnections.sum();
    }

    public long getFramesReceived() {
        return framesReceived.sum();
    }

    public long getProtocolErrors() {
        return protocolErrors.sum();
    }
}
