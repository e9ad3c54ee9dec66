package de.mirkosertic.mcp.reranklearn.adaptation;

import de.mirkosertic.mcp.reranklearn.feedback.FeedbackEvent;

import java.util.List;
import java.util.Map;

/**
 * Turns a feedback batch into per-feature observations.
 * <p>
 * Implementations decide how a (query, result) pair maps onto ranking features. They must not
 * modify the batch or the weights they are given.
 */
@FunctionalInterface
public interface SignalExtractor {

    /**
     * @param batch   the non-empty batch being processed
     * @param current the weights the batch is applied to
     * @return observations per feature name; features without observations may be absent
     */
    Map<String, List<WeightSample>> extract(List<FeedbackEvent> batch, AdaptiveWeights current);
}
