package me.internalizable.atelier.adapter;

import me.internalizable.atelier.api.adapter.ApplicationAdapter;
import me.internalizable.atelier.api.adapter.ParamType;
import me.internalizable.atelier.api.adapter.ToolSchema;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Map;

/**
 * Tools understood by the Figma plugin.
 */
public final class FigmaAdapter implements ApplicationAdapter {

    public static final String ID = "figma";

    private final Map<String, ToolSchema> tools = Adapters.catalog(List.of(
        ToolSchema.builder("get_document_info")
            .description("Describe the current document")
            .build(),
        ToolSchema.builder("get_selection")
            .description("Describe the current selection")
            .build(),
        ToolSchema.builder("get_node_info")
            .description("Describe one node")
            .required("node_id", ParamType.STRING)
            .build(),
        ToolSchema.builder("create_rectangle")
            .description("Create a rectangle")
            .optional("x", ParamType.NUMBER)
            .optional("y", ParamType.NUMBER)
            .optional("width", ParamType.NUMBER)
            .optional("height", ParamType.NUMBER)
            .optional("name", ParamType.STRING)
            .optional("parent_id", ParamType.STRING)
            .build(),
        ToolSchema.builder("create_frame")
            .description("Create a frame")
            .optional("x", ParamType.NUMBER)
            .optional("y", ParamType.NUMBER)
            .optional("width", ParamType.NUMBER)
            .optional("height", ParamType.NUMBER)
            .optional("name", ParamType.STRING)
            .optional("parent_id", ParamType.STRING)
            .build(),
        ToolSchema.builder("create_text")
            .description("Create a text node")
            .required("text", ParamType.STRING)
            .optional("x", ParamType.NUMBER)
            .optional("y", ParamType.NUMBER)
            .optional("font_size", ParamType.NUMBER)
            .optional("font_family", ParamType.STRING)
            .optional("name", ParamType.STRING)
            .optional("parent_id", ParamType.STRING)
            .build(),
        ToolSchema.builder("set_text_content")
            .description("Replace the characters of a text node")
            .required("node_id", ParamType.STRING)
            .required("text", ParamType.STRING)
            .build(),
        ToolSchema.builder("move_node")
            .description("Move a node to absolute coordinates")
            .required("node_id", ParamType.STRING)
            .required("x", ParamType.NUMBER)
            .required("y", ParamType.NUMBER)
            .build(),
        ToolSchema.builder("resize_node")
            .description("Resize a node")
            .required("node_id", ParamType.STRING)
            .required("width", ParamType.NUMBER)
            .required("height", ParamType.NUMBER)
            .build(),
        ToolSchema.builder("delete_node")
            .description("Delete a node")
            .required("node_id", ParamType.STRING)
            .build(),
        ToolSchema.builder("set_fill_color")
            .description("Set a solid fill, channels in 0..1")
            .required("node_id", ParamType.STRING)
            .required("r", ParamType.NUMBER)
            .required("g", ParamType.NUMBER)
            .required("b", ParamType.NUMBER)
            .optional("a", ParamType.NUMBER)
            .build(),
        ToolSchema.builder("get_server_status")
            .description("Report plugin connection status")
            .build()
    ));

    @Override
    @Nonnull
    public String id() {
        return ID;
    }

    @Override
    @Nonnull
    public String displayName() {
        return "Figma";
    }

    @Override
    @Nonnull
    public String defaultChannel() {
        return "figma";
    }

    @Override
    @Nonnull
    public Map<String, ToolSchema> tools() {
        return tools;
    }
}
