package de.mirkosertic.mcp.reranklearn.adaptation;

import de.mirkosertic.mcp.reranklearn.feedback.FeedbackEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes updated adaptive weights from a feedback batch.
 * <p>
 * The engine never mutates its inputs. It returns a new {@link AdaptiveWeights} and leaves the
 * decision whether and when to commit it to the caller.
 */
public class WeightAdaptationEngine {

    private static final Logger logger = LoggerFactory.getLogger(WeightAdaptationEngine.class);

    /** Confidence gained per unit of weight movement. */
    private static final double CONFIDENCE_GAIN = 0.1;

    private final SignalExtractor signalExtractor;
    private final AdaptiveAlgorithms algorithms;
    private final double alpha;
    private final double learningRate;
    private final Clock clock;

    public WeightAdaptationEngine(final SignalExtractor signalExtractor,
                                  final double alpha,
                                  final double learningRate) {
        this(signalExtractor, new AdaptiveAlgorithms(), alpha, learningRate, Clock.systemUTC());
    }

    public WeightAdaptationEngine(final SignalExtractor signalExtractor,
                                  final AdaptiveAlgorithms algorithms,
                                  final double alpha,
                                  final double learningRate,
                                  final Clock clock) {
        this.signalExtractor = signalExtractor;
        this.algorithms = algorithms;
        this.alpha = alpha;
        this.learningRate = learningRate;
        this.clock = clock;
    }

    /**
     * Apply a batch to the given weights using the selected rule.
     *
     * @param batch          the feedback batch
     * @param currentWeights the weights to start from, not modified
     * @param algorithm      the update rule to apply per feature
     * @return the updated weights
     * @throws EmptyBatchException if the batch is empty
     */
    public AdaptiveWeights apply(final List<FeedbackEvent> batch,
                                 final AdaptiveWeights currentWeights,
                                 final AdaptationAlgorithm algorithm) {
        if (batch == null || batch.isEmpty()) {
            throw new EmptyBatchException("Cannot adapt weights from an empty batch");
        }

        final Map<String, List<WeightSample>> signals = signalExtractor.extract(batch, currentWeights);
        final Map<String, AdaptiveWeight> updates = new LinkedHashMap<>();

        for (final AdaptiveWeight weight : currentWeights.weights().values()) {
            final List<WeightSample> samples = signals.getOrDefault(weight.name(), List.of());
            if (samples.isEmpty()) {
                continue;
            }
            final double updated;
            try {
                updated = clamp(computeValue(weight, samples, algorithm));
            } catch (final EmptyBatchException e) {
                logger.debug("No usable samples for feature '{}': {}", weight.name(), e.getMessage());
                continue;
            }
            final double delta = updated - weight.value();
            if (delta == 0.0) {
                continue;
            }
            final double confidence = Math.min(1.0, weight.confidence() + Math.abs(delta) * CONFIDENCE_GAIN);
            updates.put(weight.name(), new AdaptiveWeight(weight.name(), updated, confidence, clock.instant()));
        }

        logger.debug("Adapted {} of {} features with {} from {} events",
                updates.size(), currentWeights.weights().size(), algorithm, batch.size());
        return currentWeights.withUpdates(updates);
    }

    private double computeValue(final AdaptiveWeight weight,
                                final List<WeightSample> samples,
                                final AdaptationAlgorithm algorithm) {
        return switch (algorithm) {
            case EXPONENTIAL_MOVING_AVERAGE -> algorithms.exponentialMovingAverage(
                    weight.value(), algorithms.confidenceWeightedAverage(samples), alpha);
            case CONFIDENCE_WEIGHTED_AVERAGE -> {
                final List<WeightSample> withPrevious = new ArrayList<>(samples.size() + 1);
                withPrevious.add(new WeightSample(weight.value(), weight.confidence()));
                withPrevious.addAll(samples);
                yield algorithms.confidenceWeightedAverage(withPrevious);
            }
            case REGRET_BASED -> algorithms.regretBasedAdjustment(
                    weight.value(), algorithms.confidenceWeightedAverage(samples), learningRate);
        };
    }

    private static double clamp(final double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    public AdaptiveAlgorithms getAlgorithms() {
        return algorithms;
    }
}
