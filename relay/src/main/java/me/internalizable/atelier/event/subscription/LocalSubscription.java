package me.internalizable.atelier.event.subscription;

import me.internalizable.atelier.api.event.Subscription;

import javax.annotation.Nullable;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * Subscription handle for the in-process event service.
 *
 * <p>Wraps a {@link SubscriptionEntry} and provides lifecycle management.</p>
 */
public final class LocalSubscription implements Subscription {

    private final SubscriptionEntry entry;
    private final BooleanSupplier serviceRunning;
    private final Consumer<SubscriptionEntry> removeCallback;

    /**
     * @param entry the subscription entry
     * @param serviceRunning supplies whether the event service still delivers
     * @param removeCallback called when unsubscribing
     */
    public LocalSubscription(
            SubscriptionEntry entry,
            BooleanSupplier serviceRunning,
            Consumer<SubscriptionEntry> removeCallback) {
        this.entry = entry;
        this.serviceRunning = serviceRunning;
        this.removeCallback = removeCallback;
    }

    @Override
    @Nullable
    public String getChannel() {
        return entry.getChannel();
    }

    @Override
    @Nullable
    public String getEventName() {
        return entry.getEventName();
    }

    @Override
    public boolean isActive() {
        return entry.isActive() && serviceRunning.getAsBoolean();
    }

    @Override
    public void unsubscribe() {
        if (!entry.isActive()) {
            return;
        }
        entry.setActive(false);
        removeCallback.accept(entry);
    }
}
