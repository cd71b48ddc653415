package me.internalizable.atelier.api.command;

import com.fasterxml.jackson.databind.JsonNode;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point for callers that want a plugin to run a tool.
 *
 * <p>Each call resolves exactly once: with the plugin's result, or exceptionally with one of
 * the {@link me.internalizable.atelier.api.error.RelayException} subtypes.</p>
 *
 * <h2>Failures</h2>
 * <ul>
 *   <li>{@code ValidationException} - bad input, nothing was sent</li>
 *   <li>{@code ChannelNotFoundException} - the channel has no connected plugin</li>
 *   <li>{@code RelayTimeoutException} - no answer before the deadline</li>
 *   <li>{@code ConnectionLostException} - the plugin disconnected mid-flight</li>
 *   <li>{@code CommandFailedException} - the plugin answered with an error</li>
 *   <li>{@code ProtocolViolationException} - the result did not decode to the requested type</li>
 * </ul>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * ObjectNode args = mapper.createObjectNode().put("x", 0).put("y", 0).put("width", 10).put("height", 10);
 * NodeRef ref = dispatcher.execute("create_rectangle", args, "figma", Duration.ofSeconds(5), NodeRef.class)
 *     .get();
 * }</pre>
 */
public interface CommandDispatcher {

    /**
     * Execute a tool with the default deadline.
     *
     * @param toolName the tool name
     * @param args the argument object, or null for none
     * @param channel the target channel
     * @return a future completed with the raw result payload
     */
    @Nonnull
    CompletableFuture<JsonNode> execute(@Nonnull String toolName, @Nullable JsonNode args, @Nonnull String channel);

    /**
     * Execute a tool with an explicit deadline.
     *
     * @param toolName the tool name
     * @param args the argument object, or null for none
     * @param channel the target channel
     * @param timeout the deadline, or null for the default
     * @return a future completed with the raw result payload
     */
    @Nonnull
    CompletableFuture<JsonNode> execute(@Nonnull String toolName, @Nullable JsonNode args,
                                        @Nonnull String channel, @Nullable Duration timeout);

    /**
     * Execute a tool and decode its result.
     *
     * @param toolName the tool name
     * @param args the argument object, or null for none
     * @param channel the target channel
     * @param timeout the deadline, or null for the default
     * @param resultType the type to decode the result payload into
     * @param <T> the result type
     * @return a future completed with the decoded result
     */
    @Nonnull
    <T> CompletableFuture<T> execute(@Nonnull String toolName, @Nullable JsonNode args,
                                     @Nonnull String channel, @Nullable Duration timeout,
                                     @Nonnull Class<T> resultType);

    /**
     * Push an unsolicited event to every plugin in a channel.
     *
     * @param channel the target channel
     * @param name the event name
     * @param payload the event payload, or null
     * @return the number of connections the event was written to
     */
    int broadcastEvent(@Nonnull String channel, @Nonnull String name, @Nullable JsonNode payload);

    /**
     * Snapshot of the relay's connections, channels and counters.
     *
     * @return the current status
     */
    @Nonnull
    RelayStatus status();
}
