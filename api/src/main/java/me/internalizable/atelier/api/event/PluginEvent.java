package me.internalizable.atelier.api.event;

import com.fasterxml.jackson.databind.JsonNode;

import javax.annotation.Nonnull;
import java.time.Instant;
import java.util.Objects;

/**
 * An unsolicited event emitted by a plugin, such as a selection change.
 *
 * @param channel the channel the emitting connection belongs to
 * @param connectionId the emitting connection
 * @param name the event name chosen by the plugin
 * @param payload the event parameters, an empty object when the plugin sent none
 * @param receivedAt when the relay decoded the frame
 */
public record PluginEvent(
        @Nonnull String channel,
        @Nonnull String connectionId,
        @Nonnull String name,
        @Nonnull JsonNode payload,
        @Nonnull Instant receivedAt
) {

    public PluginEvent {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(connectionId, "connectionId");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(receivedAt, "receivedAt");
    }
}
