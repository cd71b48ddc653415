package me.internalizable.atelier.api.event;

import javax.annotation.Nonnull;

/**
 * Delivery of unsolicited plugin events.
 *
 * <p>Events carry no correlation id and never pass through request matching, so a late
 * event can never be mistaken for a response.</p>
 *
 * <h2>Thread Safety</h2>
 * <p>All methods are thread-safe. Handlers run on a dedicated executor, never on a socket
 * thread, and should not block for long. An exception thrown by a handler is logged and does
 * not affect other handlers.</p>
 *
 * <h2>Programmatic API</h2>
 * <pre>{@code
 * Subscription sub = events.subscribe("figma", "selection_changed",
 *     event -> logger.info("Selection: {}", event.payload()));
 * ...
 * sub.unsubscribe();
 * }</pre>
 *
 * @see Subscribe
 */
public interface EventService {

    /**
     * Receive every event emitted on a channel.
     */
    @Nonnull
    Subscription subscribe(@Nonnull String channel, @Nonnull PluginEventHandler handler);

    /**
     * Receive events with a given name emitted on a channel.
     */
    @Nonnull
    Subscription subscribe(@Nonnull String channel, @Nonnull String eventName, @Nonnull PluginEventHandler handler);

    /**
     * Receive every event on every channel.
     */
    @Nonnull
    Subscription subscribeAll(@Nonnull PluginEventHandler handler);

    /**
     * Remove every handler bound to a channel. Handlers registered with
     * {@link #subscribeAll(PluginEventHandler)} are kept.
     *
     * @param channel the channel
     */
    void unsubscribeAll(@Nonnull String channel);

    // ==================== Annotation-Based API ====================

    /**
     * Register every {@link Subscribe}-annotated method of an object.
     *
     * @param listener the listener object
     * @return a subscription covering all of its methods
     * @throws IllegalArgumentException if an annotated method has an unsupported signature
     */
    @Nonnull
    Subscription registerListener(@Nonnull Object listener);

    void unregisterListener(@Nonnull Object listener);
}
