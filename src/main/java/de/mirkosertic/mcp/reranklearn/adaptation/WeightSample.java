package de.mirkosertic.mcp.reranklearn.adaptation;

/**
 * One observation for a feature weight together with how much it should count.
 */
public record WeightSample(double value, double confidence) {
}
