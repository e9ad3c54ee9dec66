package de.mirkosertic.mcp.reranklearn.adaptation;

/**
 * Update rule applied per feature when a feedback batch is committed.
 */
public enum AdaptationAlgorithm {
    /** {@code previous + alpha * (observed - previous)}. */
    EXPONENTIAL_MOVING_AVERAGE,
    /** Confidence-weighted mean of the previous weight and all observations. */
    CONFIDENCE_WEIGHTED_AVERAGE,
    /** {@code current - learningRate * (observed - current)}. */
    REGRET_BASED
}
