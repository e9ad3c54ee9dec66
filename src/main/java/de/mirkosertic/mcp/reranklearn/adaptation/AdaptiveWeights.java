package de.mirkosertic.mcp.reranklearn.adaptation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable set of feature weights used to rerank search results.
 * <p>
 * The feature names are fixed when the first instance is created; every later instance is
 * derived through {@link #withUpdates(Map)}, which refuses to add or remove features.
 */
public record AdaptiveWeights(Map<String, AdaptiveWeight> weights) {

    public AdaptiveWeights {
        if (weights == null || weights.isEmpty()) {
            throw new IllegalArgumentException("Adaptive weights need at least one feature");
        }
        for (final Map.Entry<String, AdaptiveWeight> entry : weights.entrySet()) {
            if (!entry.getKey().equals(entry.getValue().name())) {
                throw new IllegalArgumentException("Weight stored under '" + entry.getKey()
                        + "' is named '" + entry.getValue().name() + "'");
            }
        }
        weights = Collections.unmodifiableMap(new LinkedHashMap<>(weights));
    }

    public Set<String> featureNames() {
        return weights.keySet();
    }

    public AdaptiveWeight get(final String feature) {
        final AdaptiveWeight weight = weights.get(feature);
        if (weight == null) {
            throw new IllegalArgumentException("Unknown feature: " + feature);
        }
        return weight;
    }

    public double valueOf(final String feature) {
        return get(feature).value();
    }

    /**
     * Feature name to weight value, in feature order.
     */
    public Map<String, Double> values() {
        final Map<String, Double> values = new LinkedHashMap<>();
        weights.forEach((name, weight) -> values.put(name, weight.value()));
        return values;
    }

    /**
     * Derive a new instance with some weights replaced.
     *
     * @param updates replacements keyed by feature name; every key must already exist
     * @return a new instance, this one is left untouched
     */
    public AdaptiveWeights withUpdates(final Map<String, AdaptiveWeight> updates) {
        final Map<String, AdaptiveWeight> merged = new LinkedHashMap<>(weights);
        for (final Map.Entry<String, AdaptiveWeight> entry : updates.entrySet()) {
            if (!merged.containsKey(entry.getKey())) {
                throw new IllegalArgumentException("Cannot add feature '" + entry.getKey() + "' after initialization");
            }
            merged.put(entry.getKey(), entry.getValue());
        }
        return new AdaptiveWeights(merged);
    }

    /**
     * True if both instances describe the same feature set.
     */
    public boolean hasSameFeatures(final AdaptiveWeights other) {
        return weights.keySet().equals(other.weights.keySet());
    }
}
