package me.internalizable.atelier.api.error;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A frame could not be decoded, broke the protocol, or carried a payload that does not
 * fit the type the caller asked for.
 */
public final class ProtocolViolationException extends RelayException {

    public ProtocolViolationException(@Nonnull String message) {
        super(ErrorKind.PROTOCOL_VIOLATION, message);
    }

    public ProtocolViolationException(@Nonnull String message, @Nullable Throwable cause) {
        super(ErrorKind.PROTOCOL_VIOLATION, message, cause);
    }
}
