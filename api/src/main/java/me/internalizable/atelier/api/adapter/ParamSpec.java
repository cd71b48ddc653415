package me.internalizable.atelier.api.adapter;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * One declared parameter of a tool.
 *
 * @param name the argument key
 * @param type the expected JSON type
 * @param required whether the key must be present and non-null
 */
public record ParamSpec(
        @Nonnull String name,
        @Nonnull ParamType type,
        boolean required
) {

    public ParamSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name cannot be blank");
        }
    }
}
