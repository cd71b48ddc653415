package me.internalizable.atelier.api.error;

import javax.annotation.Nonnull;
import java.time.Duration;

/**
 * No response arrived before the request deadline.
 */
public final class RelayTimeoutException extends RelayException {

    private final String correlationId;
    private final String channel;
    private final String toolName;
    private final Duration timeout;

    public RelayTimeoutException(@Nonnull String correlationId, @Nonnull String channel,
                                 @Nonnull String toolName, @Nonnull Duration timeout) {
        super(ErrorKind.TIMEOUT, "Command '" + toolName + "' (" + correlationId + ") on channel '"
            + channel + "' timed out after " + timeout.toMillis() + "ms");
        this.correlationId = correlationId;
        this.channel = channel;
        this.toolName = toolName;
        this.timeout = timeout;
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

    @Nonnull
    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
