package me.internalizable.atelier.common.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.internalizable.atelier.api.error.ErrorKind;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * One JSON message exchanged between the relay and a plugin.
 *
 * <p>Which fields are set depends on {@link #type()}:</p>
 * <ul>
 *   <li>{@code command} - id, channel, name (the tool), params (the arguments)</li>
 *   <li>{@code response} - id, and result or error</li>
 *   <li>{@code event} - name, params; channel when sent by the relay</li>
 *   <li>{@code join} - channel and params from the plugin; result or error in the relay's answer</li>
 *   <li>{@code ping} / {@code pong} - nothing else</li>
 * </ul>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Frame(
        @Nullable String id,
        @Nonnull FrameType type,
        @Nullable String channel,
        @Nullable String name,
        @Nullable ObjectNode params,
        @Nullable JsonNode result,
        @Nullable FrameError error
) {

    public Frame {
        Objects.requireNonNull(type, "type");
    }

    // ==================== Factories ====================

    @Nonnull
    public static Frame command(@Nonnull String id, @Nonnull String channel,
                                @Nonnull String toolName, @Nonnull ObjectNode args) {
        return new Frame(id, FrameType.COMMAND, channel, toolName, args, null, null);
    }

    @Nonnull
    public static Frame response(@Nonnull String id, @Nonnull JsonNode result) {
        return new Frame(id, FrameType.RESPONSE, null, null, null, result, null);
    }

    @Nonnull
    public static Frame errorResponse(@Nonnull String id, @Nonnull String kind, @Nonnull String message) {
        return new Frame(id, FrameType.RESPONSE, null, null, null, null, new FrameError(kind, message));
    }

    @Nonnull
    public static Frame event(@Nullable String channel, @Nonnull String name, @Nullable ObjectNode params) {
        return new Frame(null, FrameType.EVENT, channel, name, params, null, null);
    }

    @Nonnull
    public static Frame join(@Nullable String channel, @Nullable ObjectNode params) {
        return new Frame(null, FrameType.JOIN, channel, null, params, null, null);
    }

    @Nonnull
    public static Frame joinAccepted(@Nonnull String channel, @Nonnull JsonNode result) {
        return new Frame(null, FrameType.JOIN, channel, null, null, result, null);
    }

    @Nonnull
    public static Frame joinRejected(@Nonnull ErrorKind kind, @Nonnull String message) {
        return new Frame(null, FrameType.JOIN, null, null, null, null, new FrameError(kind.getWireName(), message));
    }

    @Nonnull
    public static Frame ping() {
        return new Frame(null, FrameType.PING, null, null, null, null, null);
    }

    @Nonnull
    public static Frame pong() {
        return new Frame(null, FrameType.PONG, null, null, null, null, null);
    }

    // ==================== Queries ====================

    @JsonIgnore
    public boolean hasError() {
        return error != null;
    }
}
