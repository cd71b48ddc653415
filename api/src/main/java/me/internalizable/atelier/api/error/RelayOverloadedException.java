package me.internalizable.atelier.api.error;

/**
 * Too many requests are already waiting for a response.
 */
public final class RelayOverloadedException extends RelayException {

    private final int pendingLimit;

    public RelayOverloadedException(int pendingLimit) {
        super(ErrorKind.OVERLOADED, "Too many in-flight commands (limit " + pendingLimit + ")");
        this.pendingLimit = pendingLimit;
    }

    public int getPendingLimit() {
        return pendingLimit;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
