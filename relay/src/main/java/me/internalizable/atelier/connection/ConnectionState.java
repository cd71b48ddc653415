package me.internalizable.atelier.connection;

/**
 * Lifecycle of a plugin connection.
 *
 * <pre>
 * CONNECTING --join accepted--> OPEN --close requested--> CLOSING --socket closed--> CLOSED
 *     |                                                                                 ^
 *     +------------------------handshake failed / socket closed-------------------------+
 * </pre>
 */
public enum ConnectionState {

    /**
     * Socket accepted, join handshake not completed yet.
     */
    CONNECTING,

    /**
     * Joined a channel and eligible for commands.
     */
    OPEN,

    /**
     * Draining queued writes before the socket closes. Receives no new commands.
     */
    CLOSING,

    /**
     * Terminal. Cleanup has run.
     */
    CLOSED;

    public boolean isTerminal() {
        return this == CLOSED;
    }
}
