package me.internalizable.atelier.common.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.internalizable.atelier.api.error.ProtocolViolationException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * JSON text encoding of {@link Frame}s.
 *
 * <p>Decoding is strict about what routing depends on (a known {@code type}, an {@code id} on
 * commands and responses, a {@code name} on events) and lenient about everything else:
 * unknown properties are ignored.</p>
 */
public final class FrameCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .findAndRegisterModules()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private FrameCodec() {
    }

    @Nonnull
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    @Nonnull
    public static String encode(@Nonnull Frame frame) {
        try {
            return MAPPER.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + frame.type().getWireName() + " frame", e);
        }
    }

    /**
     * Decode one frame.
     *
     * @param text the JSON text of a WebSocket text frame
     * @return the decoded frame
     * @throws ProtocolViolationException if the text is not a well-formed frame
     */
    @Nonnull
    public static Frame decode(@Nonnull String text) {
        JsonNode root;
        try {
            root = MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            throw new ProtocolViolationException("Malformed JSON: " + e.getOriginalMessage(), e);
        }

        if (root == null || !root.isObject()) {
            throw new ProtocolViolationException("Frame must be a JSON object");
        }

        String typeName = textField(root, "type");
        FrameType type = FrameType.fromWireName(typeName);
        if (type == null) {
            throw new ProtocolViolationException("Unknown frame type: " + typeName);
        }

        String id = textField(root, "id");
        String channel = textField(root, "channel");
        String name = textField(root, "name");
        ObjectNode params = objectField(root, "params");
        JsonNode result = root.get("result");
        FrameError error = errorField(root);

        switch (type) {
            case COMMAND -> {
                requireField(type, "id", id);
                requireField(type, "name", name);
            }
            case RESPONSE -> {
                requireField(type, "id", id);
                if (error != null && result != null && !result.isNull()) {
                    throw new ProtocolViolationException("Response " + id + " carries both result and error");
                }
                if (error == null && result == null) {
                    result = NullNode.getInstance();
                }
            }
            case EVENT -> requireField(type, "name", name);
            default -> {
            }
        }

        return new Frame(id, type, channel, name, params, result, error);
    }

    // ==================== Field Helpers ====================

    @Nullable
    private static String textField(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        if (node.isNumber()) {
            // plugins written against looser clients send numeric ids
            return node.asText();
        }
        throw new ProtocolViolationException("Field '" + field + "' must be a string");
    }

    @Nullable
    private static ObjectNode objectField(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node instanceof ObjectNode object) {
            return object;
        }
        throw new ProtocolViolationException("Field '" + field + "' must be an object");
    }

    @Nullable
    private static FrameError errorField(JsonNode root) {
        JsonNode node = root.get("error");
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return new FrameError("Error", node.asText());
        }
        if (!node.isObject()) {
            throw new ProtocolViolationException("Field 'error' must be an object");
        }
        String kind = node.path("kind").asText("Error");
        String message = node.path("message").asText("");
        return new FrameError(kind, message);
    }

    private static void requireField(FrameType type, String field, @Nullable String value) {
        if (value == null || value.isBlank()) {
            throw new ProtocolViolationException(
                "Frame of type '" + type.getWireName() + "' requires '" + field + "'");
        }
    }
}
