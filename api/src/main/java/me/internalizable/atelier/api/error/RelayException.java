package me.internalizable.atelier.api.error;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Base class of every typed failure the relay hands to a caller.
 *
 * <p>Failures arrive as the cause of an exceptionally completed future returned by
 * {@link me.internalizable.atelier.api.command.CommandDispatcher}. Match on the subclass
 * or on {@link #getKind()}:</p>
 *
 * <pre>{@code
 * dispatcher.execute("get_selection", null, "figma")
 *     .exceptionally(ex -> {
 *         Throwable cause = ex instanceof CompletionException ? ex.getCause() : ex;
 *         if (cause instanceof RelayException relay && relay.isRetryable()) {
 *             // schedule a retry
 *         }
 *         return null;
 *     });
 * }</pre>
 */
public abstract class RelayException extends RuntimeException {

    private final ErrorKind kind;

    protected RelayException(@Nonnull ErrorKind kind, @Nonnull String message) {
        this(kind, message, null);
    }

    protected RelayException(@Nonnull ErrorKind kind, @Nonnull String message, @Nullable Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    @Nonnull
    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Whether issuing the same command again may succeed without changing it.
     *
     * @return true for transient failures
     */
    public boolean isRetryable() {
        return false;
    }
}
