package me.internalizable.atelier.common.protocol;

import java.util.Set;

/**
 * Protocol constants shared by both ends of a relay connection.
 */
public final class Protocol {

    public static final int CURRENT_VERSION = 1;
    public static final Set<Integer> SUPPORTED_VERSIONS = Set.of(CURRENT_VERSION);

    // join params
    public static final String PARAM_PROTOCOL_VERSION = "protocolVersion";
    public static final String PARAM_CLIENT_ID = "clientId";
    public static final String PARAM_APPLICATION = "application";
    public static final String PARAM_VERSION = "version";

    // join ack result
    public static final String RESULT_CONNECTION_ID = "connectionId";
    public static final String RESULT_CHANNEL = "channel";
    public static final String RESULT_SERVER = "server";

    private Protocol() {
    }
}
