package me.internalizable.atelier.routing;

/**
 * How a pending request ended.
 */
public enum Resolution {
    SUCCESS,
    ERROR,
    TIMEOUT,
    CONNECTION_LOST
}
