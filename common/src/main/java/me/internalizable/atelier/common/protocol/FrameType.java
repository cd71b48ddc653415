package me.internalizable.atelier.common.protocol;

import com.fasterxml.jackson.annotation.JsonValue;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * The {@code type} discriminator of a wire frame.
 */
public enum FrameType {

    COMMAND("command"),
    RESPONSE("response"),
    EVENT("event"),
    JOIN("join"),
    PING("ping"),
    PONG("pong");

    private final String wireName;

    FrameType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    @Nonnull
    public String getWireName() {
        return wireName;
    }

    @Nullable
    public static FrameType fromWireName(@Nullable String wireName) {
        if (wireName == null) {
            return null;
        }
        for (FrameType type : values()) {
            if (type.wireName.equals(wireName)) {
                return type;
            }
        }
        return null;
    }
}
