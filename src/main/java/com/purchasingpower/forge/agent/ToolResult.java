package com.purchasingpower.forge.agent;

/**
 * Result of one tool call.
 *
 * <p>{@code message} is what the model reads. An artifact result additionally carries the
 * rendered document, which goes to the user instead of back to the model.
 */
public interface ToolResult {

    boolean isSuccess();

    String getMessage();

    /**
     * Rendered document for the user, or null.
     */
    String getArtifact();

    default boolean hasArtifact() {
        return getArtifact() != null;
    }

    static ToolResult success(String message) {
        return new ToolResultImpl(true, message, null);
    }

    static ToolResult failure(String message) {
        return new ToolResultImpl(false, message, null);
    }

    static ToolResult artifact(String rendered) {
        return new ToolResultImpl(true, "Artifact rendered and displayed to user.", rendered);
    }
}

record ToolResultImpl(boolean isSuccess, String message, String artifact) implements ToolResult {

    @Override
    public boolean isSuccess() {
        return isSuccess;
    }

    @Override
    public String getMessage() {
        return message;
    }

    @Override
    public String getArtifact() {
        return artifact;
    }
}
