package me.internalizable.atelier.connection;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import me.internalizable.atelier.common.protocol.Frame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.channels.ClosedChannelException;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One plugin socket.
 *
 * <p>Owned by {@link ConnectionManager}. The channel registry and the message router only
 * hold references to it.</p>
 */
public class Connection {

    private static final Logger LOGGER = LoggerFactory.getLogger(Connection.class);
    private static final AtomicLong CONNECTION_ID_GENERATOR = new AtomicLong(0);

    private final String id;
    private final Channel channel;
    private final InetSocketAddress remoteAddress;
    private final Instant connectedAt;

    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.CONNECTING);
    private final AtomicReference<CloseReason> closeReason = new AtomicReference<>();

    // guarded by the ChannelRegistry monitor for writes
    private volatile String channelName;
    private volatile long lastActivityNanos;
    private volatile PluginInfo pluginInfo = PluginInfo.UNKNOWN;
    private volatile boolean upgraded;

    public Connection(@Nonnull Channel channel, long nowNanos) {
        this.id = "conn-" + CONNECTION_ID_GENERATOR.incrementAndGet();
        this.channel = Objects.requireNonNull(channel, "channel");
        this.connectedAt = Instant.now();
        this.lastActivityNanos = nowNanos;

        SocketAddress remoteAddr = channel.remoteAddress();
        if (remoteAddr instanceof InetSocketAddress inet) {
            this.remoteAddress = inet;
        } else {
            this.remoteAddress = new InetSocketAddress("0.0.0.0", 0);
        }
    }

    // ==========================================
    // Identity
    // ==========================================

    @Nonnull
    public String getId() {
        return id;
    }

    @Nonnull
    public Channel getChannel() {
        return channel;
    }

    @Nonnull
    public InetSocketAddress getRemoteAddress() {
        return remoteAddress;
    }

    @Nonnull
    public Instant getConnectedAt() {
        return connectedAt;
    }

    @Nonnull
    public PluginInfo getPluginInfo() {
        return pluginInfo;
    }

    void setPluginInfo(@Nonnull PluginInfo pluginInfo) {
        this.pluginInfo = Objects.requireNonNull(pluginInfo, "pluginInfo");
    }

    // ==========================================
    // State
    // ==========================================

    @Nonnull
    public ConnectionState getState() {
        return state.get();
    }

    public boolean isOpen() {
        return state.get() == ConnectionState.OPEN;
    }

    /**
     * Move from {@code expected} to {@code next} if nobody else moved first.
     */
    boolean transition(@Nonnull ConnectionState expected, @Nonnull ConnectionState next) {
        if (state.compareAndSet(expected, next)) {
            LOGGER.debug("Connection {} state changed: {} -> {}", id, expected, next);
            return true;
        }
        return false;
    }

    /**
     * Enter CLOSED.
     *
     * @return the state the connection was in, or null if it was already CLOSED
     */
    @Nullable
    ConnectionState markClosed() {
        ConnectionState previous = state.getAndSet(ConnectionState.CLOSED);
        if (previous == ConnectionState.CLOSED) {
            return null;
        }
        LOGGER.debug("Connection {} state changed: {} -> {}", id, previous, ConnectionState.CLOSED);
        return previous;
    }

    @Nullable
    public CloseReason getCloseReason() {
        return closeReason.get();
    }

    void recordCloseReason(@Nonnull CloseReason reason) {
        closeReason.compareAndSet(null, reason);
    }

    /**
     * Whether the WebSocket upgrade finished, so frames can be written.
     */
    public boolean isUpgraded() {
        return upgraded;
    }

    public void markUpgraded() {
        this.upgraded = true;
    }

    // ==========================================
    // Channel Membership
    // ==========================================

    @Nullable
    public String getChannelName() {
        return channelName;
    }

    /**
     * Only {@link me.internalizable.atelier.channel.ChannelRegistry} calls this.
     */
    public void setChannelName(@Nullable String channelName) {
        this.channelName = channelName;
    }

    // ==========================================
    // Liveness
    // ==========================================

    public long getLastActivityNanos() {
        return lastActivityNanos;
    }

    public void markActive(long nowNanos) {
        this.lastActivityNanos = nowNanos;
    }

    // ==========================================
    // Frame Sending
    // ==========================================

    /**
     * Write a frame to the plugin. Safe to call from any thread.
     *
     * @param frame the frame
     * @return the write future, already failed if the socket is gone
     */
    @Nonnull
    public ChannelFuture send(@Nonnull Frame frame) {
        Objects.requireNonNull(frame, "frame");
        if (!channel.isActive()) {
            LOGGER.debug("Connection {}: Cannot send {} - socket not active", id, frame.type().getWireName());
            return channel.newFailedFuture(new ClosedChannelException());
        }
        return channel.writeAndFlush(frame);
    }

    /**
     * Send a close frame after everything already queued, then close the socket.
     */
    void closeSocket(@Nonnull CloseReason reason, @Nonnull String detail) {
        if (!channel.isActive() || !upgraded) {
            channel.close();
            return;
        }
        channel.writeAndFlush(new CloseWebSocketFrame(reason.getCloseStatus().code(), truncate(detail)))
            .addListener(ChannelFutureListener.CLOSE);
    }

    private static String truncate(String detail) {
        // close frame reason must fit in a 125 byte control frame
        return detail.length() > 40 ? detail.substring(0, 40) : detail;
    }

    @Override
    public String toString() {
        return "Connection{" +
            "id=" + id +
            ", channel=" + channelName +
            ", state=" + state.get() +
            ", remoteAddress=" + remoteAddress +
            ", application=" + pluginInfo.application() +
            '}';
    }
}
