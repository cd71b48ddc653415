package me.internalizable.atelier.api.error;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Failure categories of the relay.
 *
 * <p>The wire name is what travels in the {@code error.kind} field of a frame and what
 * callers see in logs. Only {@link #DUPLICATE_RESPONSE} never reaches a caller.</p>
 */
public enum ErrorKind {

    VALIDATION_ERROR("ValidationError"),
    CHANNEL_NOT_FOUND("ChannelNotFound"),
    TIMEOUT("Timeout"),
    CONNECTION_LOST("ConnectionLost"),
    PROTOCOL_VIOLATION("ProtocolViolation"),
    COMMAND_FAILED("CommandFailed"),
    OVERLOADED("Overloaded"),
    DUPLICATE_RESPONSE("DuplicateResponse");

    private final String wireName;

    ErrorKind(String wireName) {
        this.wireName = wireName;
    }

    @Nonnull
    public String getWireName() {
        return wireName;
    }

    /**
     * Look up a kind by its wire name.
     *
     * @param wireName the name as found on the wire
     * @return the matching kind, or null for names this relay does not know
     */
    @Nullable
    public static ErrorKind fromWireName(@Nullable String wireName) {
        if (wireName == null) {
            return null;
        }
        for (ErrorKind kind : values()) {
            if (kind.wireName.equals(wireName)) {
                return kind;
            }
        }
        return null;
    }
}
