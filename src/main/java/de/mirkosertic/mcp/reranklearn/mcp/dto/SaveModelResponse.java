package de.mirkosertic.mcp.reranklearn.mcp.dto;

import de.mirkosertic.mcp.reranklearn.model.ModelVersion;

/**
 * Response DTO for the saveModel tool.
 */
public record SaveModelResponse(
        boolean success,
        String versionId,
        String createdAt,
        String error
) {
    public static SaveModelResponse success(final ModelVersion version) {
        return new SaveModelResponse(true, version.versionId(), version.createdAt().toString(), null);
    }

    public static SaveModelResponse error(final String errorMessage) {
        return new SaveModelResponse(false, null, null, errorMessage);
    }
}
