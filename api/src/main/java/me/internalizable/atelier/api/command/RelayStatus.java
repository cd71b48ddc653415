package me.internalizable.atelier.api.command;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of a running relay.
 *
 * @param serverName the relay's advertised name
 * @param version the relay version
 * @param startedAt when the relay started accepting connections
 * @param uptime time since {@code startedAt}
 * @param totalConnections connections accepted since start
 * @param activeConnections connections not yet closed
 * @param framesReceived inbound frames decoded since start
 * @param protocolErrors protocol violations seen since start
 * @param droppedResponses duplicate, late or misdirected responses dropped since start
 * @param pendingRequests commands waiting for a response right now
 * @param channels names of the channels that currently have members
 * @param adapters ids of the registered application adapters
 */
public record RelayStatus(
        @Nonnull String serverName,
        @Nonnull String version,
        @Nonnull Instant startedAt,
        @Nonnull Duration uptime,
        long totalConnections,
        int activeConnections,
        long framesReceived,
        long protocolErrors,
        long droppedResponses,
        int pendingRequests,
        @Nonnull List<String> channels,
        @Nonnull List<String> adapters
) {

    public RelayStatus {
        channels = List.copyOf(channels);
        adapters = List.copyOf(adapters);
    }
}
