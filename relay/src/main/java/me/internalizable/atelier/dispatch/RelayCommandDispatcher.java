package me.internalizable.atelier.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.internalizable.atelier.adapter.AdapterRegistry;
import me.internalizable.atelier.api.adapter.ApplicationAdapter;
import me.internalizable.atelier.api.command.Command;
import me.internalizable.atelier.api.command.CommandDispatcher;
import me.internalizable.atelier.api.command.RelayStatus;
import me.internalizable.atelier.api.error.ChannelNotFoundException;
import me.internalizable.atelier.api.error.ProtocolViolationException;
import me.internalizable.atelier.api.error.ValidationException;
import me.internalizable.atelier.channel.ChannelRegistry;
import me.internalizable.atelier.common.protocol.Frame;
import me.internalizable.atelier.common.protocol.FrameCodec;
import me.internalizable.atelier.config.RelayConfig;
import me.internalizable.atelier.connection.ConnectionManager;
import me.internalizable.atelier.routing.MessageRouter;
import me.internalizable.atelier.server.RelayStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * {@link CommandDispatcher} backed by the relay's router.
 *
 * <p>Validation failures and empty channels fail the returned future without touching any
 * socket or registering a pending request.</p>
 */
public class RelayCommandDispatcher implements CommandDispatcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(RelayCommandDispatcher.class);

    // longest deadline the scheduler can represent in nanoseconds
    static final Duration MAX_TIMEOUT = Duration.ofNanos(Long.MAX_VALUE);

    private final RelayConfig config;
    private final ChannelRegistry channelRegistry;
    private final MessageRouter messageRouter;
    private final AdapterRegistry adapterRegistry;
    private final ConnectionManager connectionManager;
    private final RelayStats stats;
    private final String version;

    public RelayCommandDispatcher(@Nonnull RelayConfig config,
                                  @Nonnull ChannelRegistry channelRegistry,
                                  @Nonnull MessageRouter messageRouter,
                                  @Nonnull AdapterRegistry adapterRegistry,
                                  @Nonnull ConnectionManager connectionManager,
                                  @Nonnull RelayStats stats,
                                  @Nonnull String version) {
        this.config = Objects.requireNonNull(config, "config");
        this.channelRegistry = Objects.requireNonNull(channelRegistry, "channelRegistry");
        this.messageRouter = Objects.requireNonNull(messageRouter, "messageRouter");
        this.adapterRegistry = Objects.requireNonNull(adapterRegistry, "adapterRegistry");
        this.connectionManager = Objects.requireNonNull(connectionManager, "connectionManager");
        this.stats = Objects.requireNonNull(stats, "stats");
        this.version = Objects.requireNonNull(version, "version");
    }

    @Override
    @Nonnull
    public CompletableFuture<JsonNode> execute(@Nonnull String toolName, @Nullable JsonNode args, @Nonnull String channel) {
        return execute(toolName, args, channel, null);
    }

    @Override
    @Nonnull
    public CompletableFuture<JsonNode> execute(@Nonnull String toolName, @Nullable JsonNode args,
                                               @Nonnull String channel, @Nullable Duration timeout) {
        Command command;
        Optional<ApplicationAdapter> adapter;
        try {
            command = validate(toolName, args, channel, timeout);
            adapter = adapterRegistry.forChannel(channel);
            if (adapter.isPresent()) {
                adapter.get().validate(toolName, command.args());
            }
        } catch (ValidationException e) {
            LOGGER.debug("Rejected '{}' for channel '{}': {}", toolName, channel, e.getMessage());
            return CompletableFuture.failedFuture(e);
        }

        if (channelRegistry.membersOf(channel).isEmpty()) {
            return CompletableFuture.failedFuture(new ChannelNotFoundException(channel));
        }

        Duration deadline = timeout != null ? timeout
            : adapter.flatMap(ApplicationAdapter::defaultTimeout)
                .orElse(Duration.ofMillis(config.getCommandTimeoutMillis()));
        return messageRouter.send(command, deadline);
    }

    @Override
    @Nonnull
    public <T> CompletableFuture<T> execute(@Nonnull String toolName, @Nullable JsonNode args,
                                            @Nonnull String channel, @Nullable Duration timeout,
                                            @Nonnull Class<T> resultType) {
        Objects.requireNonNull(resultType, "resultType");
        return execute(toolName, args, channel, timeout).thenApply(result -> decode(toolName, result, resultType));
    }

    private static <T> T decode(String toolName, JsonNode result, Class<T> resultType) {
        try {
            return FrameCodec.mapper().convertValue(result, resultType);
        } catch (IllegalArgumentException e) {
            throw new ProtocolViolationException(
                "Result of '" + toolName + "' does not decode to " + resultType.getSimpleName(), e);
        }
    }

    private static Command validate(@Nullable String toolName, @Nullable JsonNode args,
                                    @Nullable String channel, @Nullable Duration timeout) {
        String tool = toolName == null ? "<none>" : toolName;
        if (toolName == null || toolName.isBlank()) {
            throw ValidationException.of(tool, "tool name is required");
        }
        if (channel == null || channel.isBlank()) {
            throw ValidationException.of(tool, "channel is required");
        }
        if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
            throw ValidationException.of(tool, "timeout must be positive");
        }
        if (timeout != null && timeout.compareTo(MAX_TIMEOUT) > 0) {
            throw ValidationException.of(tool, "timeout must not exceed " + MAX_TIMEOUT.toDays() + " days");
        }

        ObjectNode payload;
        if (args == null || args.isNull() || args.isMissingNode()) {
            payload = FrameCodec.mapper().createObjectNode();
        } else if (args instanceof ObjectNode object) {
            payload = object.deepCopy();
        } else {
            throw ValidationException.of(tool, "arguments must be a JSON object");
        }
        return new Command(toolName, payload, channel);
    }

    @Override
    public int broadcastEvent(@Nonnull String channel, @Nonnull String name, @Nullable JsonNode payload) {
        if (channel == null || channel.isBlank()) {
            throw ValidationException.of(String.valueOf(name), "channel is required");
        }
        if (name == null || name.isBlank()) {
            throw ValidationException.of("<event>", "event name is required");
        }
        ObjectNode params;
        if (payload == null || payload.isNull()) {
            params = null;
        } else if (payload instanceof ObjectNode object) {
            params = object.deepCopy();
        } else {
            throw ValidationException.of(name, "event payload must be a JSON object");
        }
        return channelRegistry.broadcast(channel, Frame.event(channel, name, params));
    }

    @Override
    @Nonnull
    public RelayStatus status() {
        return new RelayStatus(
            config.getServerName(),
            version,
            stats.getStartedAt(),
            stats.getUptime(),
            stats.getTotalConnections(),
            connectionManager.getConnectionCount(),
            stats.getFramesReceived(),
            stats.getProtocolErrors(),
            messageRouter.droppedResponseCount(),
            messageRouter.pendingCount(),
            channelRegistry.channelNames(),
            adapterRegistry.all().stream().map(ApplicationAdapter::id).toList()
        );
    }
}
