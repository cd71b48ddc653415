package me.internalizable.atelier.config;

/**
 * What a plugin gets when it reconnects without naming a channel in its join frame.
 */
public enum ReconnectPolicy {

    /**
     * Nothing is remembered; the connection joins the configured default channel.
     */
    REJOIN_REQUIRED,

    /**
     * A join carrying a known {@code clientId} rejoins the channel that client last used,
     * as long as it reconnects within the resume window.
     */
    RESUME_PREVIOUS
}
