package me.internalizable.atelier.routing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.google.common.annotations.VisibleForTesting;
import me.internalizable.atelier.api.command.Command;
import me.internalizable.atelier.api.error.ChannelNotFoundException;
import me.internalizable.atelier.api.error.CommandFailedException;
import me.internalizable.atelier.api.error.ConnectionLostException;
import me.internalizable.atelier.api.error.RelayOverloadedException;
import me.internalizable.atelier.api.error.RelayTimeoutException;
import me.internalizable.atelier.api.error.ValidationException;
import me.internalizable.atelier.channel.ChannelRegistry;
import me.internalizable.atelier.common.protocol.Frame;
import me.internalizable.atelier.common.protocol.FrameError;
import me.internalizable.atelier.config.DeliveryMode;
import me.internalizable.atelier.connection.Connection;
import me.internalizable.atelier.scheduler.RelayScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Correlates commands with their responses.
 *
 * <h2>Exactly-once resolution</h2>
 * <p>Every request registered here ends in exactly one of: a response (success or error),
 * its deadline passing, or the loss of every connection that could answer it. All of these
 * paths go through {@code pending.remove(id, request)}; only the caller that removes the entry
 * completes the future, so a late or duplicate response is dropped and logged.</p>
 *
 * <p>Futures are completed on the thread that resolves them (a socket thread for responses,
 * a scheduler thread for timeouts). Callers that do slow work in dependent stages should use
 * the {@code *Async} variants.</p>
 */
public class MessageRouter {

    private static final Logger LOGGER = LoggerFactory.getLogger(MessageRouter.class);

    private final ChannelRegistry channelRegistry;
    private final RelayScheduler scheduler;
    private final DeliveryMode deliveryMode;
    private final int maxPendingRequests;

    private final AtomicLong idGenerator = new AtomicLong(0);
    private final ConcurrentHashMap<String, PendingRequest> pending = new ConcurrentHashMap<>();
    private final LongAdder droppedResponses = new LongAdder();

    public MessageRouter(@Nonnull ChannelRegistry channelRegistry, @Nonnull RelayScheduler scheduler,
                         @Nonnull DeliveryMode deliveryMode, int maxPendingRequests) {
        this.channelRegistry = Objects.requireNonNull(channelRegistry, "channelRegistry");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.deliveryMode = Objects.requireNonNull(deliveryMode, "deliveryMode");
        this.maxPendingRequests = maxPendingRequests;
    }

    // ==================== Sending ====================

    /**
     * Stamp a command with a fresh correlation id and deliver it to the channel.
     *
     * @param command the validated command
     * @param timeout time allowed for the response
     * @return a future completed with the response payload or a typed failure
     */
    @Nonnull
    public CompletableFuture<JsonNode> send(@Nonnull Command command, @Nonnull Duration timeout) {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(timeout, "timeout");

        if (pending.size() >= maxPendingRequests) {
            LOGGER.warn("Rejecting '{}' on channel '{}': {} commands already in flight",
                command.toolName(), command.channel(), pending.size());
            return CompletableFuture.failedFuture(new RelayOverloadedException(maxPendingRequests));
        }

        List<Connection> targets = channelRegistry.selectTargets(command.channel(), deliveryMode);
        if (targets.isEmpty()) {
            return CompletableFuture.failedFuture(new ChannelNotFoundException(command.channel()));
        }

        String id = "cmd_" + idGenerator.incrementAndGet();
        PendingRequest request = new PendingRequest(id, command,
            targets.stream().map(Connection::getId).toList(), timeout);
        pending.put(id, request);
        try {
            request.setTimeoutTask(scheduler.runLater("timeout " + id, () -> expire(request), timeout));
        } catch (RejectedExecutionException e) {
            pending.remove(id, request);
            return CompletableFuture.failedFuture(new ConnectionLostException(
                id, command.channel(), command.toolName(), "relay is shutting down"));
        } catch (RuntimeException e) {
            pending.remove(id, request);
            LOGGER.warn("Request {}: cannot schedule a {} deadline: {}", id, timeout, e.toString());
            return CompletableFuture.failedFuture(
                ValidationException.of(command.toolName(), "timeout " + timeout + " cannot be scheduled"));
        }

        // a caller giving up on its future must not leave the entry behind
        request.future().whenComplete((result, error) -> {
            if (request.future().isCancelled() && pending.remove(id, request)) {
                LOGGER.debug("Request {} cancelled by caller", id);
            }
        });

        Frame frame = Frame.command(id, command.channel(), command.toolName(), command.args());
        List<Connection> skipped = channelRegistry.deliver(command.channel(), targets, frame,
            (connection, future) -> future.addListener(f -> {
                if (!f.isSuccess()) {
                    LOGGER.warn("Request {}: write to connection {} failed: {}",
                        id, connection.getId(), String.valueOf(f.cause()));
                    dropResponder(request, connection.getId(), "write failed");
                }
            }));
        for (Connection connection : skipped) {
            dropResponder(request, connection.getId(), "connection left before delivery");
        }

        LOGGER.debug("Request {}: '{}' sent to {} connection(s) on channel '{}' (timeout {}ms)",
            id, command.toolName(), targets.size() - skipped.size(), command.channel(), timeout.toMillis());
        return request.future();
    }

    // ==================== Resolution ====================

    /**
     * Apply a response frame.
     *
     * @param connectionId the connection the frame arrived on
     * @param response the response frame
     * @return true if the response resolved a pending request, false if it was dropped
     */
    public boolean resolve(@Nonnull String connectionId, @Nonnull Frame response) {
        String id = response.id();
        if (id == null) {
            dropResponse(connectionId, "<none>", "response without id");
            return false;
        }

        PendingRequest request = pending.get(id);
        if (request == null) {
            dropResponse(connectionId, id, "no pending request (already resolved, timed out or unknown)");
            return false;
        }
        if (!request.isEligible(connectionId)) {
            dropResponse(connectionId, id, "connection is not a responder for this request");
            return false;
        }
        if (!pending.remove(id, request)) {
            dropResponse(connectionId, id, "resolved concurrently");
            return false;
        }

        Command command = request.getCommand();
        FrameError error = response.error();
        if (error != null) {
            LOGGER.debug("Request {}: plugin error [{}] {}", id, error.kind(), error.message());
            request.fail(Resolution.ERROR, new CommandFailedException(
                id, command.channel(), command.toolName(), error.kind(), error.message()));
        } else {
            JsonNode result = response.result() == null ? NullNode.getInstance() : response.result();
            LOGGER.debug("Request {}: resolved by connection {}", id, connectionId);
            request.succeed(result);
        }
        return true;
    }

    private void expire(PendingRequest request) {
        if (!pending.remove(request.getCorrelationId(), request)) {
            return;
        }
        Command command = request.getCommand();
        LOGGER.warn("Request {}: '{}' on channel '{}' timed out after {}ms",
            request.getCorrelationId(), command.toolName(), command.channel(), request.getTimeout().toMillis());
        request.fail(Resolution.TIMEOUT, new RelayTimeoutException(
            request.getCorrelationId(), command.channel(), command.toolName(), request.getTimeout()));
    }

    /**
     * Fail every request that has no responder left once this connection is gone.
     *
     * @param connectionId the closed connection
     * @param reason why it closed, for the failure message
     * @return the number of requests failed
     */
    public int onConnectionClosed(@Nonnull String connectionId, @Nonnull String reason) {
        int failed = 0;
        for (PendingRequest request : pending.values()) {
            if (request.isEligible(connectionId) && dropResponder(request, connectionId, reason)) {
                failed++;
            }
        }
        if (failed > 0) {
            LOGGER.info("Connection {} closed with {} request(s) in flight", connectionId, failed);
        }
        return failed;
    }

    private boolean dropResponder(PendingRequest request, String connectionId, String reason) {
        if (!request.dropResponder(connectionId)) {
            return false;
        }
        if (!pending.remove(request.getCorrelationId(), request)) {
            return false;
        }
        Command command = request.getCommand();
        LOGGER.warn("Request {}: no responder left on channel '{}' ({})",
            request.getCorrelationId(), command.channel(), reason);
        return request.fail(Resolution.CONNECTION_LOST, new ConnectionLostException(
            request.getCorrelationId(), command.channel(), command.toolName(), reason));
    }

    /**
     * Fail everything still pending, used on shutdown.
     */
    public void failAll(@Nonnull String reason) {
        for (PendingRequest request : pending.values()) {
            if (pending.remove(request.getCorrelationId(), request)) {
                Command command = request.getCommand();
                request.fail(Resolution.CONNECTION_LOST, new ConnectionLostException(
                    request.getCorrelationId(), command.channel(), command.toolName(), reason));
            }
        }
    }

    private void dropResponse(String connectionId, String id, String why) {
        droppedResponses.increment();
        LOGGER.warn("Connection {}: dropped response {} - {}", connectionId, id, why);
    }

    // ==================== Stats ====================

    public int pendingCount() {
        return pending.size();
    }

    public long droppedResponseCount() {
        return droppedResponses.sum();
    }

    @VisibleForTesting
    @Nonnull
    Optional<PendingRequest> findPending(@Nonnull String correlationId) {
        return Optional.ofNullable(pending.get(correlationId));
    }

    @Nonnull
    public DeliveryMode getDeliveryMode() {
        return deliveryMode;
    }
}
