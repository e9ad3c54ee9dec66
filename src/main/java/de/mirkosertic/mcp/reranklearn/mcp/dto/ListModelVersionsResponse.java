package de.mirkosertic.mcp.reranklearn.mcp.dto;

import java.util.List;

/**
 * Response DTO for the listModelVersions tool. Versions are listed oldest first.
 */
public record ListModelVersionsResponse(
        boolean success,
        String currentVersion,
        List<ModelVersionSummary> versions,
        String error
) {
    public static ListModelVersionsResponse success(final String currentVersion, final List<ModelVersionSummary> versions) {
        return new ListModelVersionsResponse(true, currentVersion, versions, null);
    }

    public static ListModelVersionsResponse error(final String errorMessage) {
        return new ListModelVersionsResponse(false, null, null, errorMessage);
    }
}
