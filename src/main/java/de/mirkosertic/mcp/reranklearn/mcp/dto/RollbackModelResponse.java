package de.mirkosertic.mcp.reranklearn.mcp.dto;

/**
 * Response DTO for the rollbackModel tool.
 * An unknown version is a regular outcome: success with {@code rolledBack=false}.
 */
public record RollbackModelResponse(
        boolean success,
        Boolean rolledBack,
        String versionId,
        String message,
        String error
) {
    public static RollbackModelResponse rolledBack(final String versionId) {
        return new RollbackModelResponse(true, true, versionId, "Model rolled back to version " + versionId, null);
    }

    public static RollbackModelResponse unknownVersion(final String versionId) {
        return new RollbackModelResponse(true, false, versionId, "Unknown model version " + versionId, null);
    }

    public static RollbackModelResponse error(final String errorMessage) {
        return new RollbackModelResponse(false, null, null, null, errorMessage);
    }
}
