package me.internalizable.atelier.api.error;

import javax.annotation.Nonnull;

/**
 * Every plugin that could have answered a request disconnected before it did.
 */
public final class ConnectionLostException extends RelayException {

    private final String correlationId;
    private final String channel;
    private final String toolName;

    public ConnectionLostException(@Nonnull String correlationId, @Nonnull String channel,
                                   @Nonnull String toolName, @Nonnull String reason) {
        super(ErrorKind.CONNECTION_LOST, "Command '" + toolName + "' (" + correlationId + ") on channel '"
            + channel + "' lost its connection: " + reason);
        this.correlationId = correlationId;
        this.channel = channel;
        this.toolName = toolName;
    }

    @Nonnull
    public String getCorrelationId() {
        return correlationId;
    }

    @Nonnull
    public String getChannel() {
        return channel;
    }

    @Nonnull
    public String getToolName() {
        return toolName;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
