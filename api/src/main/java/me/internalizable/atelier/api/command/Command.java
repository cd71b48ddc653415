package me.internalizable.atelier.api.command;

import com.fasterxml.jackson.databind.node.ObjectNode;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * A validated tool invocation addressed to a channel.
 *
 * @param toolName the tool the plugin should run
 * @param args the argument object, passed to the plugin untouched
 * @param channel the channel whose plugin should run it
 */
public record Command(
        @Nonnull String toolName,
        @Nonnull ObjectNode args,
        @Nonnull String channel
) {

    public Command {
        Objects.requireNonNull(toolName, "toolName");
        Objects.requireNonNull(args, "args");
        Objects.requireNonNull(channel, "channel");
        if (toolName.isBlank()) {
            throw new IllegalArgumentException("toolName cannot be blank");
        }
        if (channel.isBlank()) {
            throw new IllegalArgumentException("channel cannot be blank");
        }
    }
}
