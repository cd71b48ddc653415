package me.internalizable.atelier.api.error;

import javax.annotation.Nonnull;

/**
 * The plugin answered the command with an error instead of a result.
 *
 * <p>{@link #getRemoteKind()} is whatever the plugin put in {@code error.kind}; the relay
 * does not interpret it.</p>
 */
public final class CommandFailedException extends RelayException {

    private final String correlationId;
    private final String channel;
    private final String toolName;
    private final String remoteKind;
    private final String remoteMessage;

    public CommandFailedException(@Nonnull String correlationId, @Nonnull String channel,
                                  @Nonnull String toolName, @Nonnull String remoteKind,
                                  @Nonnull String remoteMessage) {
        super(ErrorKind.COMMAND_FAILED, "Command '" + toolName + "' (" + correlationId + ") failed in plugin: ["
            + remoteKind + "] " + remoteMessage);
        this.correlationId = correlationId;
        this.channel = channel;
        this.toolName = toolName;
        this.remoteKind = remoteKind;
        this.remoteMessage = remoteMessage;
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
    public String getRemoteKind() {
        return remoteKind;
    }

    @Nonnull
    public String getRemoteMessage() {
        return remoteMessage;
    }
}
