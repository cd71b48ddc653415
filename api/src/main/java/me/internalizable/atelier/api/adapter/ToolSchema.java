package me.internalizable.atelier.api.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import me.internalizable.atelier.api.error.ValidationException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Transport-level shape of one tool's arguments.
 *
 * <p>Declared parameters are type-checked and required ones must be present. Keys the schema
 * does not declare are passed through to the plugin unchecked.</p>
 *
 * <pre>{@code
 * ToolSchema move = ToolSchema.builder("move_node")
 *     .description("Move a node to absolute coordinates")
 *     .required("node_id", ParamType.STRING)
 *     .required("x", ParamType.NUMBER)
 *     .required("y", ParamType.NUMBER)
 *     .build();
 * }</pre>
 *
 * @param name the tool name
 * @param description a one-line description
 * @param params the declared parameters in declaration order
 */
public record ToolSchema(
        @Nonnull String name,
        @Nonnull String description,
        @Nonnull List<ParamSpec> params
) {

    public ToolSchema {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(description, "description");
        params = List.copyOf(params);
    }

    @Nonnull
    public static Builder builder(@Nonnull String name) {
        return new Builder(name);
    }

    /**
     * Check an argument object against this schema.
     *
     * @param args the arguments, null meaning none
     * @throws ValidationException listing every violation found
     */
    public void validate(@Nullable JsonNode args) {
        List<String> violations = new ArrayList<>();

        if (args != null && !args.isNull() && !args.isObject()) {
            throw ValidationException.of(name, "arguments must be a JSON object");
        }

        for (ParamSpec param : params) {
            JsonNode value = args == null ? null : args.get(param.name());
            if (value == null || value.isNull()) {
                if (param.required()) {
                    violations.add("missing required parameter '" + param.name() + "'");
                }
                continue;
            }
            if (!param.type().matches(value)) {
                violations.add("parameter '" + param.name() + "' must be " + param.type().getDescription());
            }
        }

        if (!violations.isEmpty()) {
            throw new ValidationException(name, violations);
        }
    }

    public static final class Builder {
        private final String name;
        private String description = "";
        private final Map<String, ParamSpec> params = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        @Nonnull
        public Builder description(@Nonnull String description) {
            this.description = Objects.requireNonNull(description, "description");
            return this;
        }

        @Nonnull
        public Builder required(@Nonnull String param, @Nonnull ParamType type) {
            params.put(param, new ParamSpec(param, type, true));
            return this;
        }

        @Nonnull
        public Builder optional(@Nonnull String param, @Nonnull ParamType type) {
            params.put(param, new ParamSpec(param, type, false));
            return this;
        }

        @Nonnull
        public ToolSchema build() {
            return new ToolSchema(name, description, new ArrayList<>(params.values()));
        }
    }
}
