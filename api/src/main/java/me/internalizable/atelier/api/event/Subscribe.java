package me.internalizable.atelier.api.event;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a method as a plugin event handler.
 *
 * <p>The method must take exactly one parameter: either the whole {@link PluginEvent} or the
 * payload as a {@link com.fasterxml.jackson.databind.JsonNode}.</p>
 *
 * <pre>{@code
 * public class SelectionTracker {
 *
 *     @Subscribe(channel = "figma", event = "selection_changed")
 *     public void onSelection(PluginEvent event) {
 *         logger.info("Selection on {} is now {}", event.channel(), event.payload());
 *     }
 *
 *     @Subscribe(event = "document_saved")
 *     public void onSaved(JsonNode payload) {
 *         // any channel
 *     }
 * }
 *
 * eventService.registerListener(new SelectionTracker());
 * }</pre>
 *
 * @see EventService#registerListener(Object)
 */
@Documented
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Subscribe {

    /**
     * Channel to listen on. Empty means every channel.
     */
    String channel() default "";

    /**
     * Event name to listen for. Empty means every event.
     */
    String event() default "";
}
