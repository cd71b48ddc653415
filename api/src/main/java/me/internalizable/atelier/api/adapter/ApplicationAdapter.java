package me.internalizable.atelier.api.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import me.internalizable.atelier.api.error.ValidationException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Capability set of one creative application.
 *
 * <p>An adapter does not change how frames travel. It only tells the relay which tools the
 * application's plugin understands, what their arguments look like, and which channel and
 * deadline to use when a caller does not say.</p>
 */
public interface ApplicationAdapter {

    /**
     * Stable identifier used in configuration, e.g. {@code "figma"}.
     */
    @Nonnull
    String id();

    @Nonnull
    String displayName();

    /**
     * Channel the application's plugin joins when nothing else is configured.
     */
    @Nonnull
    String defaultChannel();

    /**
     * Deadline for commands on this application's channels, when it differs from the relay default.
     */
    @Nonnull
    default Optional<Duration> defaultTimeout() {
        return Optional.empty();
    }

    /**
     * The tool catalog, keyed by tool name.
     */
    @Nonnull
    Map<String, ToolSchema> tools();

    @Nonnull
    default Optional<ToolSchema> tool(@Nonnull String toolName) {
        return Optional.ofNullable(tools().get(toolName));
    }

    @Nonnull
    default Set<String> capabilities() {
        return tools().keySet();
    }

    /**
     * Reject a tool call this application cannot take.
     *
     * @param toolName the tool name
     * @param args the arguments, or null
     * @throws ValidationException if the tool is unknown or the arguments do not fit its schema
     */
    default void validate(@Nonnull String toolName, @Nullable JsonNode args) {
        ToolSchema schema = tools().get(toolName);
        if (schema == null) {
            throw ValidationException.of(toolName, "unknown tool for " + displayName());
        }
        schema.validate(args);
    }
}
