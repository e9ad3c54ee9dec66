package de.mirkosertic.mcp.reranklearn.adaptation;

import de.mirkosertic.mcp.reranklearn.feedback.FeedbackEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Default signal extraction: groups the batch by query and derives one target per feature
 * and query group.
 * <p>
 * A group whose mean relevance is at least {@value #REINFORCE_THRESHOLD} asks for every feature
 * weight to grow by 5%, a mean of at most {@value #DAMPEN_THRESHOLD} asks for a 10% reduction,
 * anything in between asks to keep the weight. The group's share of the batch is the
 * confidence of its sample.
 */
public class QueryGroupedSignalExtractor implements SignalExtractor {

    private static final Logger logger = LoggerFactory.getLogger(QueryGroupedSignalExtractor.class);

    static final double REINFORCE_THRESHOLD = 0.7;
    static final double DAMPEN_THRESHOLD = 0.3;
    private static final double REINFORCE_FACTOR = 1.05;
    private static final double DAMPEN_FACTOR = 0.9;

    @Override
    public Map<String, List<WeightSample>> extract(final List<FeedbackEvent> batch, final AdaptiveWeights current) {
        final Map<String, List<FeedbackEvent>> byQuery = new LinkedHashMap<>();
        for (final FeedbackEvent event : batch) {
            byQuery.computeIfAbsent(event.query(), k -> new ArrayList<>()).add(event);
        }

        final Map<String, List<WeightSample>> samples = new LinkedHashMap<>();
        for (final Map.Entry<String, List<FeedbackEvent>> group : byQuery.entrySet()) {
            final double meanRelevance = group.getValue().stream()
                    .mapToDouble(FeedbackEvent::relevanceScore)
                    .average()
                    .orElse(0.0);
            final double factor = targetFactor(meanRelevance);
            final double share = (double) group.getValue().size() / batch.size();

            for (final AdaptiveWeight weight : current.weights().values()) {
                final double target = Math.max(0.0, Math.min(1.0, weight.value() * factor));
                samples.computeIfAbsent(weight.name(), k -> new ArrayList<>())
                        .add(new WeightSample(target, share));
            }
            logger.debug("Query group '{}': {} events, mean relevance {}", group.getKey(),
                    group.getValue().size(), meanRelevance);
        }
        return samples;
    }

    static double targetFactor(final double meanRelevance) {
        if (meanRelevance >= REINFORCE_THRESHOLD) {
            return REINFORCE_FACTOR;
        }
        if (meanRelevance <= DAMPEN_THRESHOLD) {
            return DAMPEN_FACTOR;
        }
        return 1.0;
    }
}
