package de.mirkosertic.mcp.reranklearn.adaptation;

import java.util.List;

/**
 * The three weight update rules. Stateless and side-effect free.
 */
public final class AdaptiveAlgorithms {

    /**
     * Move {@code previous} towards {@code observed}; larger alpha favours recent observations.
     *
     * @param alpha smoothing factor in (0,1]
     */
    public double exponentialMovingAverage(final double previous, final double observed, final double alpha) {
        if (alpha <= 0.0 || alpha > 1.0) {
            throw new IllegalArgumentException("alpha must be within (0,1], was " + alpha);
        }
        return previous + alpha * (observed - previous);
    }

    /**
     * {@code sum(value * confidence) / sum(confidence)}.
     *
     * @throws EmptyBatchException if there are no samples or all confidences are zero
     */
    public double confidenceWeightedAverage(final List<WeightSample> samples) {
        if (samples == null || samples.isEmpty()) {
            throw new EmptyBatchException("No samples for confidence weighted average");
        }
        double weightedSum = 0.0;
        double confidenceSum = 0.0;
        for (final WeightSample sample : samples) {
            weightedSum += sample.value() * sample.confidence();
            confidenceSum += sample.confidence();
        }
        if (confidenceSum == 0.0) {
            throw new EmptyBatchException("All sample confidences are zero");
        }
        return weightedSum / confidenceSum;
    }

    /**
     * {@code current - learningRate * (observedReward - current)}.
     * <p>
     * A reward above the current estimate lowers the weight. This sign convention is kept for
     * compatibility with existing calibrated models and is pending product review; see DESIGN.md.
     */
    public double regretBasedAdjustment(final double current, final double observedReward, final double learningRate) {
        return current - learningRate * (observedReward - current);
    }
}
