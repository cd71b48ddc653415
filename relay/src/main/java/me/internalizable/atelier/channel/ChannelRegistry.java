package me.internalizable.atelier.channel;

import io.netty.channel.ChannelFuture;
import me.internalizable.atelier.common.protocol.Frame;
import me.internalizable.atelier.config.DeliveryMode;
import me.internalizable.atelier.connection.Connection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiConsumer;

/**
 * Groups connections into named channels and keeps traffic inside them.
 *
 * <p>Membership changes and deliveries are serialized on the {@code channels} monitor. Reads
 * of a member list never lock; they see the last complete snapshot.</p>
 *
 * <h2>Isolation</h2>
 * <p>A frame routed to a channel is written only to connections that are members of that
 * channel at the moment of the write. A connection belongs to at most one channel.</p>
 */
public class ChannelRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChannelRegistry.class);

    private final Map<String, RelayChannel> channels = new ConcurrentHashMap<>();

    // ==================== Membership ====================

    /**
     * Put a connection into a channel, leaving its previous channel first.
     * Joining the channel it is already in changes nothing.
     *
     * @param connection the connection
     * @param channelName the channel to join, created if absent
     * @return the joined channel
     */
    @Nonnull
    public RelayChannel join(@Nonnull Connection connection, @Nonnull String channelName) {
        Objects.requireNonNull(connection, "connection");
        Objects.requireNonNull(channelName, "channelName");
        if (channelName.isBlank()) {
            throw new IllegalArgumentException("channelName cannot be blank");
        }

        synchronized (channels) {
            String current = connection.getChannelName();
            if (channelName.equals(current)) {
                RelayChannel existing = channels.get(channelName);
                if (existing != null && existing.contains(connection)) {
                    return existing;
                }
            }

            if (current != null) {
                removeMember(connection, current);
            }

            RelayChannel channel = channels.computeIfAbsent(channelName, RelayChannel::new);
            channel.addMember(connection);
            connection.setChannelName(channelName);

            LOGGER.info("Connection {} joined channel '{}' ({} member(s))",
                connection.getId(), channelName, channel.size());
            return channel;
        }
    }

    /**
     * Take a connection out of its channel. An emptied channel is evicted.
     *
     * @param connection the connection
     * @return the channel it left, empty if it was in none
     */
    @Nonnull
    public Optional<String> leave(@Nonnull Connection connection) {
        Objects.requireNonNull(connection, "connection");
        synchronized (channels) {
            String current = connection.getChannelName();
            if (current == null) {
                return Optional.empty();
            }
            removeMember(connection, current);
            connection.setChannelName(null);
            return Optional.of(current);
        }
    }

    private void removeMember(Connection connection, String channelName) {
        RelayChannel channel = channels.get(channelName);
        if (channel == null) {
            return;
        }
        if (channel.removeMember(connection)) {
            LOGGER.info("Connection {} left channel '{}' ({} member(s) left)",
                connection.getId(), channelName, channel.size());
        }
        if (channel.isEmpty()) {
            channels.remove(channelName, channel);
            LOGGER.debug("Evicted empty channel '{}'", channelName);
        }
    }

    // ==================== Lookup ====================

    /**
     * Current members of a channel in join order.
     *
     * @param channelName the channel
     * @return an immutable snapshot, empty when the channel does not exist
     */
    @Nonnull
    public List<Connection> membersOf(@Nonnull String channelName) {
        RelayChannel channel = channels.get(channelName);
        return channel == null ? List.of() : channel.getMembers();
    }

    /**
     * The channel a connection currently belongs to.
     */
    @Nonnull
    public Optional<String> channelOf(@Nonnull Connection connection) {
        return Optional.ofNullable(connection.getChannelName());
    }

    @Nonnull
    public Optional<RelayChannel> getChannel(@Nonnull String channelName) {
        return Optional.ofNullable(channels.get(channelName));
    }

    @Nonnull
    public List<String> channelNames() {
        return channels.keySet().stream().sorted().toList();
    }

    public int channelCount() {
        return channels.size();
    }

    // ==================== Routing ====================

    /**
     * Pick the connections that should receive a command.
     *
     * @param channelName the target channel
     * @param mode unicast picks the earliest joined open member, broadcast every open member
     * @return the selected connections, empty when nobody can answer
     */
    @Nonnull
    public List<Connection> selectTargets(@Nonnull String channelName, @Nonnull DeliveryMode mode) {
        List<Connection> open = membersOf(channelName).stream()
            .filter(Connection::isOpen)
            .toList();
        if (open.isEmpty() || mode == DeliveryMode.BROADCAST) {
            return open;
        }
        return List.of(open.get(0));
    }

    /**
     * Write a frame to previously selected targets that are still open members of the channel.
     *
     * @param channelName the channel the targets were selected from
     * @param targets the selected connections
     * @param frame the frame to write
     * @param onWrite receives each connection written to with its write future
     * @return the targets that were not written to because they left or closed meanwhile
     */
    @Nonnull
    public List<Connection> deliver(@Nonnull String channelName, @Nonnull List<Connection> targets,
                                    @Nonnull Frame frame, @Nullable BiConsumer<Connection, ChannelFuture> onWrite) {
        List<Connection> skipped = new ArrayList<>();
        synchronized (channels) {
            for (Connection target : targets) {
                if (!channelName.equals(target.getChannelName()) || !target.isOpen()) {
                    skipped.add(target);
                    continue;
                }
                ChannelFuture future = target.send(frame);
                if (onWrite != null) {
                    onWrite.accept(target, future);
                }
            }
        }
        return skipped;
    }

    /**
     * Write a frame to every open member of a channel.
     *
     * @return the number of connections written to
     */
    public int broadcast(@Nonnull String channelName, @Nonnull Frame frame) {
        int count = 0;
        synchronized (channels) {
            for (Connection member : membersOf(channelName)) {
                if (member.isOpen()) {
                    member.send(frame);
                    count++;
                }
            }
        }
        LOGGER.debug("Broadcast {} frame to {} connection(s) in channel '{}'",
            frame.type().getWireName(), count, channelName);
        return count;
    }
}
