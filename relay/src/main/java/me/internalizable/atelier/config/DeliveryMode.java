package me.internalizable.atelier.config;

/**
 * Which members of a channel receive a command.
 */
public enum DeliveryMode {

    /**
     * Only the member that joined the channel first. It is the sole eligible responder.
     */
    UNICAST,

    /**
     * Every member. The first response wins and the others are dropped as duplicates.
     */
    BROADCAST
}
