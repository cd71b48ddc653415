package me.internalizable.atelier.event.subscription;

import com.fasterxml.jackson.databind.JsonNode;
import me.internalizable.atelier.api.event.PluginEvent;
import me.internalizable.atelier.api.event.PluginEventHandler;
import me.internalizable.atelier.api.event.Subscribe;
import me.internalizable.atelier.api.event.Subscription;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;

/**
 * Turns a {@link Subscribe}-annotated method into a subscription.
 */
public final class SubscribeMethodProcessor {

    /**
     * Registers the handler built for a method.
     */
    @FunctionalInterface
    public interface SubscriptionFactory {
        @Nonnull
        Subscription subscribe(@Nullable String channel, @Nullable String eventName,
                               @Nonnull PluginEventHandler handler);
    }

    private final SubscriptionFactory factory;

    public SubscribeMethodProcessor(@Nonnull SubscriptionFactory factory) {
        this.factory = factory;
    }

    /**
     * @throws IllegalArgumentException if the method signature is not supported
     */
    @Nonnull
    public Subscription process(@Nonnull Object listener, @Nonnull Method method, @Nonnull Subscribe annotation) {
        Class<?>[] params = method.getParameterTypes();
        if (params.length != 1) {
            throw new IllegalArgumentException("@Subscribe method " + describe(listener, method)
                + " must take exactly one parameter");
        }

        boolean wantsEvent;
        if (params[0] == PluginEvent.class) {
            wantsEvent = true;
        } else if (params[0] == JsonNode.class) {
            wantsEvent = false;
        } else {
            throw new IllegalArgumentException("@Subscribe method " + describe(listener, method)
                + " must take PluginEvent or JsonNode, not " + params[0].getSimpleName());
        }

        method.setAccessible(true);
        PluginEventHandler handler = event -> invoke(listener, method, wantsEvent ? event : event.payload());

        return factory.subscribe(blankToNull(annotation.channel()), blankToNull(annotation.event()), handler);
    }

    private static void invoke(Object listener, Method method, Object argument) {
        try {
            method.invoke(listener, argument);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot access " + describe(listener, method), e);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException(describe(listener, method) + " failed", cause);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static String describe(Object listener, Method method) {
        return listener.getClass().getSimpleName() + "." + method.getName();
    }
}
