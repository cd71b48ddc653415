package me.internalizable.atelier.event.subscription;

import me.internalizable.atelier.api.event.PluginEvent;
import me.internalizable.atelier.api.event.PluginEventHandler;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * One registered handler together with its filters.
 */
public final class SubscriptionEntry {

    private final long id;
    private final String channel;
    private final String eventName;
    private final PluginEventHandler handler;
    private volatile boolean active = true;

    public SubscriptionEntry(long id, @Nullable String channel, @Nullable String eventName,
                             @Nonnull PluginEventHandler handler) {
        this.id = id;
        this.channel = channel;
        this.eventName = eventName;
        this.handler = handler;
    }

    public long getId() {
        return id;
    }

    @Nullable
    public String getChannel() {
        return channel;
    }

    @Nullable
    public String getEventName() {
        return eventName;
    }

    @Nonnull
    public PluginEventHandler getHandler() {
        return handler;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public boolean matches(@Nonnull PluginEvent event) {
        if (!active) {
            return false;
        }
        if (channel != null && !channel.equals(event.channel())) {
            return false;
        }
        return eventName == null || eventName.equals(event.name());
    }
}
