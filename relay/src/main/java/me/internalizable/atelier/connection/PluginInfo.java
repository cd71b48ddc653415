package me.internalizable.atelier.connection;

import com.fasterxml.jackson.databind.JsonNode;
import me.internalizable.atelier.common.protocol.Protocol;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * What a plugin said about itself in its join frame. Every field is optional.
 *
 * @param clientId stable id the plugin keeps across reconnects
 * @param application application adapter id, e.g. {@code "blender"}
 * @param version plugin version string
 */
public record PluginInfo(
        @Nullable String clientId,
        @Nullable String application,
        @Nullable String version
) {

    public static final PluginInfo UNKNOWN = new PluginInfo(null, null, null);

    @Nonnull
    public static PluginInfo fromJoinParams(@Nullable JsonNode params) {
        if (params == null || !params.isObject()) {
            return UNKNOWN;
        }
        return new PluginInfo(
            textOrNull(params, Protocol.PARAM_CLIENT_ID),
            textOrNull(params, Protocol.PARAM_APPLICATION),
            textOrNull(params, Protocol.PARAM_VERSION)
        );
    }

    private static String textOrNull(JsonNode params, String field) {
        JsonNode node = params.get(field);
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            return null;
        }
        return node.asText();
    }
}
