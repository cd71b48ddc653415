package me.internalizable.atelier.event;

import me.internalizable.atelier.api.event.EventService;
import me.internalizable.atelier.api.event.PluginEvent;
import me.internalizable.atelier.api.event.PluginEventHandler;
import me.internalizable.atelier.api.event.Subscribe;
import me.internalizable.atelier.api.event.Subscription;
import me.internalizable.atelier.event.subscription.CompositeSubscription;
import me.internalizable.atelier.event.subscription.LocalSubscription;
import me.internalizable.atelier.event.subscription.SubscribeMethodProcessor;
import me.internalizable.atelier.event.subscription.SubscriptionEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process {@link EventService} fed by the relay's socket handlers.
 *
 * <p>Handlers run on a single dispatch thread by default, so each handler sees events in the
 * order the relay received them.</p>
 */
public final class LocalEventService implements EventService {

    private static final Logger LOGGER = LoggerFactory.getLogger(LocalEventService.class);
    private static final String ALL_CHANNELS = "*";

    private final Executor executor;
    private final ExecutorService ownedExecutor;
    private final SubscribeMethodProcessor methodProcessor;

    private final Map<String, List<SubscriptionEntry>> subscriptions = new ConcurrentHashMap<>();
    private final Map<Object, List<Subscription>> listenerSubscriptions = new ConcurrentHashMap<>();
    private final AtomicLong subscriptionIdCounter = new AtomicLong(0);
    private final AtomicBoolean running = new AtomicBoolean(true);

    public LocalEventService() {
        this.ownedExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "Atelier-Events");
            t.setDaemon(true);
            return t;
        });
        this.executor = ownedExecutor;
        this.methodProcessor = new SubscribeMethodProcessor(this::addSubscription);
    }

    /**
     * @param executor runs handlers; the caller keeps ownership of it
     */
    public LocalEventService(@Nonnull Executor executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.ownedExecutor = null;
        this.methodProcessor = new SubscribeMethodProcessor(this::addSubscription);
    }

    public boolean isRunning() {
        return running.get();
    }

    public void shutdown() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        LOGGER.info("Shutting down event service");
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
            try {
                if (!ownedExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    ownedExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                ownedExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    // ==================== Publishing ====================

    /**
     * Hand an event to every matching handler.
     *
     * @param event the event received from a plugin
     */
    public void publish(@Nonnull PluginEvent event) {
        Objects.requireNonNull(event, "event");
        if (!running.get()) {
            LOGGER.debug("Dropping event {} from {}: event service stopped", event.name(), event.connectionId());
            return;
        }

        List<SubscriptionEntry> matching = new ArrayList<>();
        collect(subscriptions.get(event.channel()), event, matching);
        collect(subscriptions.get(ALL_CHANNELS), event, matching);
        if (matching.isEmpty()) {
            LOGGER.debug("No subscribers for event {} on channel '{}'", event.name(), event.channel());
            return;
        }

        try {
            executor.execute(() -> deliver(event, matching));
        } catch (RejectedExecutionException e) {
            LOGGER.warn("Event {} on channel '{}' not delivered: executor rejected it", event.name(), event.channel());
        }
    }

    private static void collect(@Nullable List<SubscriptionEntry> entries, PluginEvent event, List<SubscriptionEntry> out) {
        if (entries == null) {
            return;
        }
        for (SubscriptionEntry entry : entries) {
            if (entry.matches(event)) {
                out.add(entry);
            }
        }
    }

    private static void deliver(PluginEvent event, List<SubscriptionEntry> entries) {
        for (SubscriptionEntry entry : entries) {
            if (!entry.isActive()) {
                continue;
            }
            try {
                entry.getHandler().handle(event);
            } catch (Exception e) {
                LOGGER.error("Error in event handler for {} on channel '{}'", event.name(), event.channel(), e);
            }
        }
    }

    // ==================== Subscribing ====================

    @Override
    @Nonnull
    public Subscription subscribe(@Nonnull String channel, @Nonnull PluginEventHandler handler) {
        Objects.requireNonNull(channel, "channel");
        return addSubscription(channel, null, handler);
    }

    @Override
    @Nonnull
    public Subscription subscribe(@Nonnull String channel, @Nonnull String eventName, @Nonnull PluginEventHandler handler) {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(eventName, "eventName");
        return addSubscription(channel, eventName, handler);
    }

    @Override
    @Nonnull
    public Subscription subscribeAll(@Nonnull PluginEventHandler handler) {
        return addSubscription(null, null, handler);
    }

    @Override
    public void unsubscribeAll(@Nonnull String channel) {
        synchronized (subscriptions) {
            List<SubscriptionEntry> handlers = subscriptions.remove(channel);
            if (handlers != null) {
                handlers.forEach(e -> e.setActive(false));
                LOGGER.debug("Removed {} handler(s) from channel '{}'", handlers.size(), channel);
            }
        }
    }

    // ==================== Annotation-Based API ====================

    @Override
    @Nonnull
    public Subscription registerListener(@Nonnull Object listener) {
        Objects.requireNonNull(listener, "listener");
        List<Subscription> subs = new ArrayList<>();

        for (Method method : listener.getClass().getDeclaredMethods()) {
            Subscribe annotation = method.getAnnotation(Subscribe.class);
            if (annotation == null) {
                continue;
            }
            try {
                subs.add(methodProcessor.process(listener, method, annotation));
            } catch (IllegalArgumentException e) {
                subs.forEach(Subscription::unsubscribe);
                throw e;
            }
        }

        if (subs.isEmpty()) {
            LOGGER.warn("No @Subscribe methods found in {}", listener.getClass().getSimpleName());
        } else {
            listenerSubscriptions.merge(listener, subs, (a, b) -> {
                List<Subscription> merged = new ArrayList<>(a);
                merged.addAll(b);
                return merged;
            });
            LOGGER.debug("Registered {} @Subscribe methods from {}",
                    subs.size(), listener.getClass().getSimpleName());
        }

        return new CompositeSubscription(subs);
    }

    @Override
    public void unregisterListener(@Nonnull Object listener) {
        List<Subscription> subs = listenerSubscriptions.remove(listener);
        if (subs != null) {
            subs.forEach(Subscription::unsubscribe);
            LOGGER.debug("Unregistered {} subscriptions from {}",
                    subs.size(), listener.getClass().getSimpleName());
        }
    }

    // ==================== Internal ====================

    private Subscription addSubscription(@Nullable String channel, @Nullable String eventName,
                                         @Nonnull PluginEventHandler handler) {
        Objects.requireNonNull(handler, "handler");
        long id = subscriptionIdCounter.incrementAndGet();
        SubscriptionEntry entry = new SubscriptionEntry(id, channel, eventName, handler);

        String key = channel == null ? ALL_CHANNELS : channel;
        synchronized (subscriptions) {
            subscriptions.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).add(entry);
        }
        LOGGER.debug("Subscribed to events {} on {}", eventName == null ? "*" : eventName,
            channel == null ? "all channels" : "channel '" + channel + "'");

        return new LocalSubscription(entry, running::get, this::removeSubscription);
    }

    private void removeSubscription(SubscriptionEntry entry) {
        String key = entry.getChannel() == null ? ALL_CHANNELS : entry.getChannel();
        synchronized (subscriptions) {
            List<SubscriptionEntry> handlers = subscriptions.get(key);
            if (handlers != null) {
                handlers.removeIf(e -> e.getId() == entry.getId());
                if (handlers.isEmpty()) {
                    subscriptions.remove(key);
                }
            }
        }
    }
}
