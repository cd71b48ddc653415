/**
 * Subscription API for events that plugins emit on their own.
 *
 * <h2>Core Types</h2>
 * <ul>
 *   <li>{@link EventService} - subscribe and unsubscribe</li>
 *   <li>{@link PluginEvent} - one received event</li>
 *   <li>{@link Subscription} - an active registration</li>
 *   <li>{@link Subscribe} - annotation for listener methods</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * EventService events = relay.getEventService();
 *
 * events.subscribe("blender", event -> logger.info("{}: {}", event.name(), event.payload()));
 *
 * events.registerListener(new Object() {
 *     @Subscribe(channel = "figma", event = "selection_changed")
 *     public void onSelection(PluginEvent event) { ... }
 * });
 * }</pre>
 */
package me.internalizable.atelier.api.event;
