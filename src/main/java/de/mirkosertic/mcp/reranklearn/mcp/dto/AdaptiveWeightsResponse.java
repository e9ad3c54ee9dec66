package de.mirkosertic.mcp.reranklearn.mcp.dto;

import de.mirkosertic.mcp.reranklearn.adaptation.AdaptiveWeights;

import java.util.List;

/**
 * Response DTO for the getAdaptiveWeights and loadModel tools.
 */
public record AdaptiveWeightsResponse(
        boolean success,
        String algorithm,
        String currentVersion,
        List<WeightEntry> weights,
        String error
) {
    public static AdaptiveWeightsResponse success(final AdaptiveWeights weights,
                                                  final String algorithm,
                                                  final String currentVersion) {
        return new AdaptiveWeightsResponse(true, algorithm, currentVersion, WeightEntry.fromWeights(weights), null);
    }

    public static AdaptiveWeightsResponse error(final String errorMessage) {
        return new AdaptiveWeightsResponse(false, null, null, null, errorMessage);
    }
}
