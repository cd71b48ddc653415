package me.internalizable.atelier.bridge;

import javax.annotation.Nonnull;

/**
 * The relay refused the bridge's join.
 */
public class JoinRejectedException extends RuntimeException {

    private final String kind;

    public JoinRejectedException(@Nonnull String kind, @Nonnull String message) {
        super(kind + ": " + message);
        this.kind = kind;
    }

    @Nonnull
    public String getKind() {
        return kind;
    }
}
