package me.internalizable.atelier.adapter;

import me.internalizable.atelier.api.adapter.ApplicationAdapter;
import me.internalizable.atelier.api.adapter.ParamType;
import me.internalizable.atelier.api.adapter.ToolSchema;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tools understood by the Blender add-on. Scripts run inside Blender, so the deadline is short.
 */
public final class BlenderAdapter implements ApplicationAdapter {

    public static final String ID = "blender";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(15);

    private final Map<String, ToolSchema> tools = Adapters.catalog(List.of(
        ToolSchema.builder("get_state")
            .description("Describe the open scene")
            .build(),
        ToolSchema.builder("execute_command")
            .description("Run a Python snippet in Blender")
            .required("code_to_execute", ParamType.STRING)
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
        return "Blender";
    }

    @Override
    @Nonnull
    public String defaultChannel() {
        return "blender";
    }

    @Override
    @Nonnull
    public Optional<Duration> defaultTimeout() {
        return Optional.of(DEFAULT_TIMEOUT);
    }

    @Override
    @Nonnull
    public Map<String, ToolSchema> tools() {
        return tools;
    }
}
