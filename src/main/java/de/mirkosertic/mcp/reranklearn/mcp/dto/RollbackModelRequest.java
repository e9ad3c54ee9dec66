package de.mirkosertic.mcp.reranklearn.mcp.dto;

import de.mirkosertic.mcp.reranklearn.mcp.ToolParam;

import java.util.Map;

/**
 * Request DTO for the rollbackModel tool.
 */
public record RollbackModelRequest(
        @ToolParam("Version identifier to make live, e.g. '1.0.3'. Use listModelVersions to see the stored versions.")
        String versionId
) {
    public static RollbackModelRequest fromMap(final Map<String, Object> args) {
        final Object versionId = args.get("versionId");
        return new RollbackModelRequest(versionId != null ? versionId.toString() : null);
    }
}
