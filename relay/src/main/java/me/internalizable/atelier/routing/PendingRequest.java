package me.internalizable.atelier.routing;

import com.fasterxml.jackson.databind.JsonNode;
import me.internalizable.atelier.api.command.Command;
import me.internalizable.atelier.api.error.RelayException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A command waiting for its response.
 *
 * <p>The resolution slot is filled at most once. Whoever fills it completes the caller's
 * future; later attempts return {@code false} and change nothing.</p>
 */
public final class PendingRequest {

    private final String correlationId;
    private final Command command;
    private final Duration timeout;
    private final Instant createdAt;
    private final Set<String> responders = ConcurrentHashMap.newKeySet();
    private final CompletableFuture<JsonNode> future = new CompletableFuture<>();
    private final AtomicReference<Resolution> resolution = new AtomicReference<>();
    private volatile ScheduledFuture<?> timeoutTask;

    PendingRequest(@Nonnull String correlationId, @Nonnull Command command,
                   @Nonnull Collection<String> responderIds, @Nonnull Duration timeout) {
        this.correlationId = Objects.requireNonNull(correlationId, "correlationId");
        this.command = Objects.requireNonNull(command, "command");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.createdAt = Instant.now();
        this.responders.addAll(responderIds);
    }

    @Nonnull
    public String getCorrelationId() {
        return correlationId;
    }

    @Nonnull
    public Command getCommand() {
        return command;
    }

    @Nonnull
    public String getChannel() {
        return command.channel();
    }

    @Nonnull
    public Duration getTimeout() {
        return timeout;
    }

    @Nonnull
    public Instant getCreatedAt() {
        return createdAt;
    }

    @Nonnull
    CompletableFuture<JsonNode> future() {
        return future;
    }

    @Nullable
    public Resolution getResolution() {
        return resolution.get();
    }

    public boolean isResolved() {
        return resolution.get() != null;
    }

    // ==================== Responders ====================

    public boolean isEligible(@Nonnull String connectionId) {
        return responders.contains(connectionId);
    }

    /**
     * Remove a responder.
     *
     * @return true if this removal left the request without any responder
     */
    boolean dropResponder(@Nonnull String connectionId) {
        return responders.remove(connectionId) && responders.isEmpty();
    }

    // ==================== Resolution ====================

    boolean succeed(@Nonnull JsonNode result) {
        if (!resolution.compareAndSet(null, Resolution.SUCCESS)) {
            return false;
        }
        cancelTimeout();
        future.complete(result);
        return true;
    }

    boolean fail(@Nonnull Resolution outcome, @Nonnull RelayException failure) {
        if (outcome == Resolution.SUCCESS) {
            throw new IllegalArgumentException("fail() needs a failure outcome");
        }
        if (!resolution.compareAndSet(null, outcome)) {
            return false;
        }
        cancelTimeout();
        future.completeExceptionally(failure);
        return true;
    }

    void setTimeoutTask(@Nonnull ScheduledFuture<?> task) {
        this.timeoutTask = task;
        if (isResolved() || future.isDone()) {
            task.cancel(false);
        }
    }

    private void cancelTimeout() {
        ScheduledFuture<?> task = timeoutTask;
        if (task != null) {
            task.cancel(false);
        }
    }

    @Override
    public String toString() {
        return "PendingRequest{" +
            "id=" + correlationId +
            ", tool=" + command.toolName() +
            ", channel=" + command.channel() +
            ", responders=" + responders +
            ", resolution=" + resolution.get() +
            '}';
    }
}
