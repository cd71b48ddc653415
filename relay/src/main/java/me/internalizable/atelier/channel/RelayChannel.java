package me.internalizable.atelier.channel;

import me.internalizable.atelier.connection.Connection;

import javax.annotation.Nonnull;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A named group of plugin connections.
 *
 * <p>The member list is an immutable snapshot replaced on every change, so readers never
 * observe a half-applied join or leave. Mutations happen only under the
 * {@link ChannelRegistry} monitor.</p>
 */
public final class RelayChannel {

    private final String name;
    private final Instant createdAt;
    private volatile List<Connection> members = List.of();

    RelayChannel(@Nonnull String name) {
        this.name = Objects.requireNonNull(name, "name");
        this.createdAt = Instant.now();
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Nonnull
    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * Members in join order.
     */
    @Nonnull
    public List<Connection> getMembers() {
        return members;
    }

    public int size() {
        return members.size();
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    public boolean contains(@Nonnull Connection connection) {
        return members.contains(connection);
    }

    void addMember(Connection connection) {
        if (members.contains(connection)) {
            return;
        }
        List<Connection> updated = new ArrayList<>(members.size() + 1);
        updated.addAll(members);
        updated.add(connection);
        members = List.copyOf(updated);
    }

    boolean removeMember(Connection connection) {
        if (!members.contains(connection)) {
            return false;
        }
        List<Connection> updated = new ArrayList<>(members);
        updated.remove(connection);
        members = List.copyOf(updated);
        return true;
    }

    @Override
    public String toString() {
        return "RelayChannel{name=" + name + ", members=" + members.size() + '}';
    }
}
