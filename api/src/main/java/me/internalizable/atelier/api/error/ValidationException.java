package me.internalizable.atelier.api.error;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;

/**
 * Caller input was rejected before anything was sent to a plugin.
 */
public final class ValidationException extends RelayException {

    private final String toolName;
    private final List<String> violations;

    public ValidationException(@Nullable String toolName, @Nonnull List<String> violations) {
        super(ErrorKind.VALIDATION_ERROR, buildMessage(toolName, violations));
        this.toolName = toolName;
        this.violations = List.copyOf(violations);
    }

    @Nonnull
    public static ValidationException of(@Nullable String toolName, @Nonnull String violation) {
        return new ValidationException(toolName, List.of(violation));
    }

    @Nullable
    public String getToolName() {
        return toolName;
    }

    @Nonnull
    public List<String> getViolations() {
        return violations;
    }

    private static String buildMessage(String toolName, List<String> violations) {
        String target = toolName == null ? "command" : "'" + toolName + "'";
        return "Invalid " + target + ": " + String.join("; ", violations);
    }
}
