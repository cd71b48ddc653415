package me.internalizable.atelier.api.event;

import javax.annotation.Nullable;

/**
 * Handle for a registered event handler.
 */
public interface Subscription {

    /**
     * The channel this subscription listens on.
     *
     * @return the channel name, or null when it listens on every channel
     */
    @Nullable
    String getChannel();

    /**
     * The event name this subscription filters on.
     *
     * @return the event name, or null for every event
     */
    @Nullable
    String getEventName();

    boolean isActive();

    /**
     * Stop delivering events to the handler. Calling it twice is harmless.
     */
    void unsubscribe();
}
