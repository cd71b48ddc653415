package me.internalizable.atelier.api.adapter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.internalizable.atelier.api.error.ErrorKind;
import me.internalizable.atelier.api.error.ValidationException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class ToolSchemaTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final ToolSchema MOVE = ToolSchema.builder("move_node")
        .description("Move a node")
        .required("node_id", ParamType.STRING)
        .required("x", ParamType.NUMBER)
        .required("y", ParamType.NUMBER)
        .optional("relative", ParamType.BOOLEAN)
        .build();

    @Test
    void acceptsDeclaredAndUndeclaredParameters() {
        ObjectNode args = MAPPER.createObjectNode()
            .put("node_id", "1:2")
            .put("x", 10)
            .put("y", 2.5)
            .put("animate", "ease");

        Assertions.assertDoesNotThrow(() -> MOVE.validate(args));
    }

    @Test
    void reportsEveryViolationAtOnce() {
        ObjectNode args = MAPPER.createObjectNode()
            .put("x", "ten")
            .put("relative", 1);

        ValidationException e = Assertions.assertThrows(ValidationException.class, () -> MOVE.validate(args));

        Assertions.assertEquals(ErrorKind.VALIDATION_ERROR, e.getKind());
        Assertions.assertEquals("move_node", e.getToolName());
        Assertions.assertEquals(4, e.getViolations().size());
        Assertions.assertTrue(e.getViolations().contains("missing required parameter 'node_id'"));
        Assertions.assertTrue(e.getViolations().contains("parameter 'x' must be a number"));
        Assertions.assertTrue(e.getViolations().contains("missing required parameter 'y'"));
        Assertions.assertTrue(e.getViolations().contains("parameter 'relative' must be a boolean"));
    }

    @Test
    void treatsNullArgumentsAsEmpty() {
        ToolSchema noParams = ToolSchema.builder("get_selection").build();

        Assertions.assertDoesNotThrow(() -> noParams.validate(null));
        Assertions.assertThrows(ValidationException.class, () -> MOVE.validate(null));
    }

    @Test
    void rejectsNonObjectArguments() {
        ValidationException e = Assertions.assertThrows(ValidationException.class,
            () -> MOVE.validate(MAPPER.createArrayNode().add(1)));

        Assertions.assertEquals(1, e.getViolations().size());
    }

    @Test
    void adapterRejectsUnknownTool() {
        ApplicationAdapter adapter = new ApplicationAdapter() {
            @Override
            public String id() {
                return "sketch";
            }

            @Override
            public String displayName() {
                return "Sketch";
            }

            @Override
            public String defaultChannel() {
                return "sketch";
            }

            @Override
            public java.util.Map<String, ToolSchema> tools() {
                return java.util.Map.of(MOVE.name(), MOVE);
            }
        };

        Assertions.assertThrows(ValidationException.class,
            () -> adapter.validate("create_ellipse", MAPPER.createObjectNode()));
        Assertions.assertEquals(java.util.Set.of("move_node"), adapter.capabilities());
        Assertions.assertTrue(adapter.defaultTimeout().isEmpty());
    }
}
