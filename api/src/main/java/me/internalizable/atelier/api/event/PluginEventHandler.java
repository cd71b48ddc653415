package me.internalizable.atelier.api.event;

import javax.annotation.Nonnull;

/**
 * Callback for plugin events.
 */
@FunctionalInterface
public interface PluginEventHandler {

    void handle(@Nonnull PluginEvent event);
}
