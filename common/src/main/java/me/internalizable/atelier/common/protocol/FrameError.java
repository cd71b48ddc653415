package me.internalizable.atelier.common.protocol;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * The {@code error} object of a frame.
 *
 * @param kind the error category, e.g. {@code "ValidationError"} or a plugin-defined kind
 * @param message a human readable description
 */
public record FrameError(
        @Nonnull String kind,
        @Nonnull String message
) {

    public FrameError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }
}
