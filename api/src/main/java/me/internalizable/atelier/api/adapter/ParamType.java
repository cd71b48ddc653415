package me.internalizable.atelier.api.adapter;

import com.fasterxml.jackson.databind.JsonNode;

import javax.annotation.Nonnull;
import java.util.function.Predicate;

/**
 * JSON value types a tool parameter can declare.
 */
public enum ParamType {

    STRING("a string", JsonNode::isTextual),
    NUMBER("a number", JsonNode::isNumber),
    INTEGER("an integer", JsonNode::isIntegralNumber),
    BOOLEAN("a boolean", JsonNode::isBoolean),
    OBJECT("an object", JsonNode::isObject),
    ARRAY("an array", JsonNode::isArray),
    ANY("any value", node -> true);

    private final String description;
    private final Predicate<JsonNode> matcher;

    ParamType(String description, Predicate<JsonNode> matcher) {
        this.description = description;
        this.matcher = matcher;
    }

    public boolean matches(@Nonnull JsonNode value) {
        return matcher.test(value);
    }

    @Nonnull
    public String getDescription() {
        return description;
    }
}
