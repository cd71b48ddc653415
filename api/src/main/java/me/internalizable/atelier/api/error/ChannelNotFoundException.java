package me.internalizable.atelier.api.error;

import javax.annotation.Nonnull;

/**
 * The target channel has no connected plugin that could answer.
 */
public final class ChannelNotFoundException extends RelayException {

    private final String channel;

    public ChannelNotFoundException(@Nonnull String channel) {
        super(ErrorKind.CHANNEL_NOT_FOUND, "No plugin connected to channel '" + channel + "'");
        this.channel = channel;
    }

    @Nonnull
    public String getChannel() {
        return channel;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
