package me.internalizable.atelier.adapter;

import me.internalizable.atelier.api.adapter.ApplicationAdapter;
import me.internalizable.atelier.api.adapter.ParamType;
import me.internalizable.atelier.api.adapter.ToolSchema;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Map;

public final class PhotoshopAdapter implements ApplicationAdapter {

    public static final String ID = "photoshop";

    private final Map<String, ToolSchema> tools = Adapters.catalog(List.of(
        ToolSchema.builder("get_document_info")
            .description("Describe the active document")
            .build(),
        ToolSchema.builder("execute_jsx")
            .description("Run an ExtendScript snippet in Photoshop")
            .required("jsx_code", ParamType.STRING)
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
        return "Photoshop";
    }

    @Override
    @Nonnull
    public String defaultChannel() {
        return "photoshop";
    }

    @Override
    @Nonnull
    public Map<String, ToolSchema> tools() {
        return tools;
    }
}
