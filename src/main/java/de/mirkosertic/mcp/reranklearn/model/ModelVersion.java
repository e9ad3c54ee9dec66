package de.mirkosertic.mcp.reranklearn.model;

import de.mirkosertic.mcp.reranklearn.adaptation.AdaptiveWeights;

import java.time.Instant;

/**
 * Immutable, timestamped snapshot of the adaptive weights.
 */
public record ModelVersion(
        /** Semantic version string, e.g. {@code 1.0.3}. */
        String versionId,
        AdaptiveWeights weights,
        Instant createdAt
) {
}
