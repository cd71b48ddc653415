package me.internalizable.atelier.adapter;

import com.google.common.collect.ImmutableMap;
import me.internalizable.atelier.api.adapter.ToolSchema;

import java.util.List;
import java.util.Map;

final class Adapters {

    private Adapters() {
    }

    static Map<String, ToolSchema> catalog(List<ToolSchema> schemas) {
        ImmutableMap.Builder<String, ToolSchema> builder = ImmutableMap.builder();
        for (ToolSchema schema : schemas) {
            builder.put(schema.name(), schema);
        }
        return builder.buildOrThrow();
    }
}
