package de.mirkosertic.mcp.reranklearn.mcp.dto;

import de.mirkosertic.mcp.reranklearn.model.ModelVersion;

/**
 * A stored model version without its weights.
 */
public record ModelVersionSummary(
        String versionId,
        String createdAt,
        boolean current
) {
    public static ModelVersionSummary from(final ModelVersion version, final String currentVersionId) {
        return new ModelVersionSummary(version.versionId(), version.createdAt().toString(),
                version.versionId().equals(currentVersionId));
    }
}
