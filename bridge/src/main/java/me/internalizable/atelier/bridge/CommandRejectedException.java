package me.internalizable.atelier.bridge;

import javax.annotation.Nonnull;

/**
 * Thrown by a {@link CommandHandler} to answer with an explicit error kind.
 */
public class CommandRejectedException extends Exception {

    private final String kind;

    public CommandRejectedException(@Nonnull String kind, @Nonnull String message) {
        super(message);
        this.kind = kind;
    }

    @Nonnull
    public String getKind() {
        return kind;
    }
}
