package me.internalizable.atelier.bridge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Runs one tool inside the host application.
 *
 * <p>Throw {@link CommandRejectedException} to answer with a specific error kind; any other
 * exception is reported as {@code CommandFailed}.</p>
 */
@FunctionalInterface
public interface CommandHandler {

    /**
     * @param toolName the tool the relay asked for
     * @param params the tool arguments, never null
     * @return the result payload, null meaning JSON null
     */
    @Nullable
    JsonNode handle(@Nonnull String toolName, @Nonnull ObjectNode params) throws Exception;
}
