package me.internalizable.atelier.event.subscription;

import me.internalizable.atelier.api.event.Subscription;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;

/**
 * Subscription that groups multiple subscriptions together.
 *
 * <p>Used when registering a listener object with multiple {@code @Subscribe} methods, so
 * all of them can be unsubscribed at once.</p>
 *
 * <p>{@link #getChannel()} and {@link #getEventName()} return the common value when every
 * wrapped subscription shares it, otherwise null.</p>
 */
public final class CompositeSubscription implements Subscription {

    private final List<Subscription> subscriptions;
    private volatile boolean active = true;

    public CompositeSubscription(List<Subscription> subscriptions) {
        this.subscriptions = List.copyOf(subscriptions);
    }

    @Override
    @Nullable
    public String getChannel() {
        return common(getChannels());
    }

    @Override
    @Nullable
    public String getEventName() {
        return common(subscriptions.stream().map(Subscription::getEventName).distinct().toList());
    }

    /**
     * Returns all distinct channels the wrapped subscriptions listen on; null stands for all channels.
     *
     * @return list of distinct channels
     */
    @Nonnull
    public List<String> getChannels() {
        return subscriptions.stream()
                .map(Subscription::getChannel)
                .distinct()
                .toList();
    }

    @Override
    public boolean isActive() {
        return active && subscriptions.stream().anyMatch(Subscription::isActive);
    }

    @Override
    public void unsubscribe() {
        active = false;
        subscriptions.forEach(Subscription::unsubscribe);
    }

    /**
     * Get the number of subscriptions in this composite.
     *
     * @return the subscription count
     */
    public int size() {
        return subscriptions.size();
    }

    private static String common(List<String> values) {
        if (values.size() != 1) {
            return null;
        }
        return values.get(0);
    }
}
