package me.internalizable.atelier.connection;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import io.netty.channel.Channel;
import me.internalizable.atelier.adapter.AdapterRegistry;
import me.internalizable.atelier.api.adapter.ApplicationAdapter;
import me.internalizable.atelier.api.error.ErrorKind;
import me.internalizable.atelier.channel.ChannelRegistry;
import me.internalizable.atelier.common.protocol.Frame;
import me.internalizable.atelier.common.protocol.FrameCodec;
import me.internalizable.atelier.common.protocol.Protocol;
import me.internalizable.atelier.config.ReconnectPolicy;
import me.internalizable.atelier.config.RelayConfig;
import me.internalizable.atelier.routing.MessageRouter;
import me.internalizable.atelier.scheduler.RelayScheduler;
import me.internalizable.atelier.server.RelayStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Owns every {@link Connection} from TCP accept until its cleanup.
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>{@code CONNECTING} - accepted, waiting for the plugin's {@code join}</li>
 *   <li>{@code OPEN} - joined a channel, eligible for commands</li>
 *   <li>{@code CLOSING} - close frame queued, waiting for the socket to go away</li>
 *   <li>{@code CLOSED} - gone; cleanup has run</li>
 * </ul>
 *
 * <p>A failed handshake goes from {@code CONNECTING} straight to {@code CLOSED}. Cleanup runs
 * once per connection, guarded by removal from the connection table.</p>
 */
public class ConnectionManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConnectionManager.class);

    private final RelayConfig config;
    private final ChannelRegistry channelRegistry;
    private final MessageRouter messageRouter;
    private final AdapterRegistry adapterRegistry;
    private final RelayScheduler scheduler;
    private final RelayStats stats;
    private final Ticker ticker;
    private final String serverVersion;

    private final Map<String, Connection> connections = new ConcurrentHashMap<>();
    private final Map<String, ScheduledFuture<?>> handshakeTimers = new ConcurrentHashMap<>();
    private final Cache<String, String> lastChannelByClient;

    private volatile ScheduledFuture<?> heartbeatTask;

    public ConnectionManager(@Nonnull RelayConfig config,
                             @Nonnull ChannelRegistry channelRegistry,
                             @Nonnull MessageRouter messageRouter,
                             @Nonnull AdapterRegistry adapterRegistry,
                             @Nonnull RelayScheduler scheduler,
                             @Nonnull RelayStats stats,
                             @Nonnull Ticker ticker,
                             @Nonnull String serverVersion) {
        this.config = Objects.requireNonNull(config, "config");
        this.channelRegistry = Objects.requireNonNull(channelRegistry, "channelRegistry");
        this.messageRouter = Objects.requireNonNull(messageRouter, "messageRouter");
        this.adapterRegistry = Objects.requireNonNull(adapterRegistry, "adapterRegistry");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.stats = Objects.requireNonNull(stats, "stats");
        this.ticker = Objects.requireNonNull(ticker, "ticker");
        this.serverVersion = Objects.requireNonNull(serverVersion, "serverVersion");
        this.lastChannelByClient = CacheBuilder.newBuilder()
            .expireAfterWrite(config.getResumeWindowSeconds(), TimeUnit.SECONDS)
            .maximumSize(Math.max(1000, config.getMaxConnections() * 4L))
            .ticker(ticker)
            .build();
    }

    // ==================== Accept ====================

    /**
     * Track a freshly accepted socket and start its handshake timer.
     *
     * @param channel the accepted socket
     * @return the new connection, or null if the relay is full and the socket was closed
     */
    @Nullable
    public Connection register(@Nonnull Channel channel) {
        if (connections.size() >= config.getMaxConnections()) {
            stats.connectionRejected();
            LOGGER.warn("Max connections reached ({}), rejecting {}", config.getMaxConnections(), channel.remoteAddress());
            channel.close();
            return null;
        }

        Connection connection = new Connection(channel, ticker.read());
        connections.put(connection.getId(), connection);
        stats.connectionAccepted();

        Duration timeout = Duration.ofSeconds(config.getHandshakeTimeoutSeconds());
        try {
            handshakeTimers.put(connection.getId(),
                scheduler.runLater("handshake " + connection.getId(), () -> expireHandshake(connection), timeout));
        } catch (RejectedExecutionException e) {
            LOGGER.warn("Connection {}: cannot schedule handshake timeout, relay is shutting down", connection.getId());
            close(connection, CloseReason.SERVER_SHUTDOWN, "relay shutting down");
        }

        LOGGER.info("New connection from {} (Connection {})", connection.getRemoteAddress(), connection.getId());
        return connection;
    }

    @VisibleForTesting
    void expireHandshake(@Nonnull Connection connection) {
        if (connection.getState() != ConnectionState.CONNECTING) {
            return;
        }
        failHandshake(connection, CloseReason.HANDSHAKE_TIMEOUT, ErrorKind.TIMEOUT,
            "no join within " + config.getHandshakeTimeoutSeconds() + "s");
    }

    // ==================== Handshake ====================

    /**
     * Apply a {@code join} frame.
     *
     * <p>The first join opens the connection. A later join moves an open connection to
     * another channel.</p>
     *
     * @param connection the connection the frame arrived on
     * @param join the join frame
     */
    public void handleJoin(@Nonnull Connection connection, @Nonnull Frame join) {
        ConnectionState state = connection.getState();
        if (state != ConnectionState.CONNECTING && state != ConnectionState.OPEN) {
            LOGGER.debug("Connection {}: ignoring join in state {}", connection.getId(), state);
            return;
        }

        JsonNode params = join.params();
        Optional<String> versionError = checkProtocolVersion(params);
        if (versionError.isPresent()) {
            protocolViolation(connection, versionError.get());
            return;
        }

        PluginInfo info = PluginInfo.fromJoinParams(params);
        String channelName = resolveChannel(join.channel(), info);

        if (state == ConnectionState.CONNECTING) {
            connection.setPluginInfo(info);
            if (!connection.transition(ConnectionState.CONNECTING, ConnectionState.OPEN)) {
                return;
            }
            cancelHandshakeTimer(connection);
        }

        channelRegistry.join(connection, channelName);
        if (connection.getState().isTerminal()) {
            // closed while joining; cleanup may already have run
            channelRegistry.leave(connection);
            return;
        }

        if (info.clientId() != null) {
            lastChannelByClient.put(info.clientId(), channelName);
        }

        connection.send(Frame.joinAccepted(channelName, joinResult(connection, channelName)));
        LOGGER.info("Connection {}: joined channel '{}' (application={}, client={}, version={})",
            connection.getId(), channelName, info.application(), info.clientId(), info.version());
    }

    private static Optional<String> checkProtocolVersion(@Nullable JsonNode params) {
        if (params == null) {
            return Optional.empty();
        }
        JsonNode version = params.get(Protocol.PARAM_PROTOCOL_VERSION);
        if (version == null || version.isNull()) {
            return Optional.empty();
        }
        if (!version.canConvertToInt() || !version.isIntegralNumber()
                || !Protocol.SUPPORTED_VERSIONS.contains(version.intValue())) {
            return Optional.of("unsupported protocol version " + version);
        }
        return Optional.empty();
    }

    /**
     * Channel for a join: the requested one, then the client's previous channel if the policy
     * allows, then the application's default channel, then the relay default.
     */
    @Nonnull
    String resolveChannel(@Nullable String requested, @Nonnull PluginInfo info) {
        if (requested != null && !requested.isBlank()) {
            return requested;
        }
        if (config.getReconnectPolicy() == ReconnectPolicy.RESUME_PREVIOUS && info.clientId() != null) {
            String previous = lastChannelByClient.getIfPresent(info.clientId());
            if (previous != null) {
                LOGGER.debug("Client {} resumes channel '{}'", info.clientId(), previous);
                return previous;
            }
        }
        if (info.application() != null) {
            Optional<ApplicationAdapter> adapter = adapterRegistry.forApplication(info.application());
            if (adapter.isPresent()) {
                return adapter.get().defaultChannel();
            }
        }
        return config.getDefaultChannel();
    }

    private ObjectNode joinResult(Connection connection, String channelName) {
        ObjectNode result = FrameCodec.mapper().createObjectNode();
        result.put(Protocol.RESULT_CONNECTION_ID, connection.getId());
        result.put(Protocol.RESULT_CHANNEL, channelName);
        result.put(Protocol.PARAM_PROTOCOL_VERSION, Protocol.CURRENT_VERSION);

        ObjectNode server = result.putObject(Protocol.RESULT_SERVER);
        server.put("name", config.getServerName());
        server.put("version", serverVersion);
        ArrayNode capabilities = server.putArray("capabilities");
        adapterRegistry.forChannel(channelName)
            .ifPresent(adapter -> adapter.capabilities().stream().sorted().forEach(capabilities::add));
        return result;
    }

    /**
     * Reject a connection that has not joined yet. It goes straight to CLOSED.
     */
    public void failHandshake(@Nonnull Connection connection, @Nonnull CloseReason reason,
                              @Nonnull ErrorKind kind, @Nonnull String message) {
        connection.recordCloseReason(reason);
        if (connection.markClosed() == null) {
            return;
        }
        cancelHandshakeTimer(connection);
        LOGGER.warn("Connection {}: handshake failed ({}): {}", connection.getId(), reason, message);
        if (connection.isUpgraded()) {
            connection.send(Frame.joinRejected(kind, message));
        }
        connection.closeSocket(reason, message);
    }

    // ==================== Traffic ====================

    /**
     * Record inbound activity. Every frame counts, not only {@code pong}.
     */
    public void onFrameReceived(@Nonnull Connection connection) {
        connection.markActive(ticker.read());
        stats.frameReceived();
    }

    /**
     * Handle a frame the protocol does not allow.
     */
    public void protocolViolation(@Nonnull Connection connection, @Nonnull String detail) {
        stats.protocolError();
        if (connection.getState() == ConnectionState.CONNECTING) {
            failHandshake(connection, CloseReason.HANDSHAKE_FAILED, ErrorKind.PROTOCOL_VIOLATION, detail);
            return;
        }
        LOGGER.warn("Connection {}: protocol violation: {}", connection.getId(), detail);
        close(connection, CloseReason.PROTOCOL_VIOLATION, detail);
    }

    // ==================== Close ====================

    /**
     * Start closing a connection. Queued writes are flushed before the close frame.
     *
     * @param connection the connection
     * @param reason why
     * @param detail text for the close frame and the log
     */
    public void close(@Nonnull Connection connection, @Nonnull CloseReason reason, @Nonnull String detail) {
        connection.recordCloseReason(reason);
        ConnectionState state = connection.getState();
        if (state == ConnectionState.CONNECTING) {
            if (connection.markClosed() == null) {
                return;
            }
            cancelHandshakeTimer(connection);
        } else if (!connection.transition(ConnectionState.OPEN, ConnectionState.CLOSING)) {
            return;
        }
        LOGGER.info("Connection {}: closing ({}): {}", connection.getId(), reason, detail);
        connection.closeSocket(reason, detail);
    }

    /**
     * Cleanup once the socket is gone. Safe to call more than once; only the first call acts.
     */
    public void onChannelClosed(@Nonnull Connection connection) {
        connection.recordCloseReason(CloseReason.PEER_CLOSED);
        connection.markClosed();
        if (!connections.remove(connection.getId(), connection)) {
            return;
        }
        cancelHandshakeTimer(connection);

        Optional<String> left = channelRegistry.leave(connection);
        CloseReason reason = connection.getCloseReason();
        String reasonText = "connection " + connection.getId() + " closed ("
            + (reason == null ? CloseReason.PEER_CLOSED : reason) + ")";
        messageRouter.onConnectionClosed(connection.getId(), reasonText);

        LOGGER.info("Connection {} closed{} ({})", connection.getId(),
            left.map(c -> ", left channel '" + c + "'").orElse(""), reason);
    }

    private void cancelHandshakeTimer(Connection connection) {
        ScheduledFuture<?> timer = handshakeTimers.remove(connection.getId());
        if (timer != null) {
            timer.cancel(false);
        }
    }

    /**
     * Close every connection, used on shutdown.
     */
    public void closeAll() {
        for (Connection connection : new ArrayList<>(connections.values())) {
            close(connection, CloseReason.SERVER_SHUTDOWN, "relay shutting down");
        }
    }

    // ==================== Heartbeat ====================

    public void startHeartbeats() {
        Duration interval = Duration.ofSeconds(config.getHeartbeatIntervalSeconds());
        heartbeatTask = scheduler.runRepeating("heartbeat", this::sweepHeartbeats, interval, interval);
    }

    public void stopHeartbeats() {
        ScheduledFuture<?> task = heartbeatTask;
        if (task != null) {
            task.cancel(false);
        }
    }

    /**
     * Ping every open connection and close the ones that went silent.
     *
     * @return the number of connections closed
     */
    public int sweepHeartbeats() {
        long now = ticker.read();
        long limit = TimeUnit.SECONDS.toNanos(
            (long) config.getHeartbeatIntervalSeconds() + config.getHeartbeatGraceSeconds());
        int closed = 0;
        for (Connection connection : connections.values()) {
            if (!connection.isOpen()) {
                continue;
            }
            long silentFor = now - connection.getLastActivityNanos();
            if (silentFor > limit) {
                close(connection, CloseReason.HEARTBEAT_TIMEOUT,
                    "no activity for " + TimeUnit.NANOSECONDS.toSeconds(silentFor) + "s");
                closed++;
            } else {
                connection.send(Frame.ping());
            }
        }
        return closed;
    }

    // ==================== Lookup ====================

    @Nonnull
    public Optional<Connection> getConnection(@Nonnull String connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    @Nonnull
    public Collection<Connection> getConnections() {
        return Collections.unmodifiableCollection(connections.values());
    }

    public int getConnectionCount() {
        return connections.size();
    }
}
