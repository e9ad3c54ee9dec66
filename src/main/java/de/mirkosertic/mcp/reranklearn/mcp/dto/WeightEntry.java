package de.mirkosertic.mcp.reranklearn.mcp.dto;

import de.mirkosertic.mcp.reranklearn.adaptation.AdaptiveWeight;
import de.mirkosertic.mcp.reranklearn.adaptation.AdaptiveWeights;

import java.util.ArrayList;
import java.util.List;

/**
 * One feature weight as reported to MCP clients.
 */
public record WeightEntry(
        String name,
        double value,
        double confidence,
        String lastUpdated
) {
    public static WeightEntry from(final AdaptiveWeight weight) {
        return new WeightEntry(weight.name(), weight.value(), weight.confidence(), weight.lastUpdated().toString());
    }

    public static List<WeightEntry> fromWeights(final AdaptiveWeights weights) {
        final List<WeightEntry> entries = new ArrayList<>();
        for (final AdaptiveWeight weight : weights.weights().values()) {
            entries.add(from(weight));
        }
        return entries;
    }
}
