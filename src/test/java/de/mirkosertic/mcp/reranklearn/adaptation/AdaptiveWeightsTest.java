package de.mirkosertic.mcp.reranklearn.adaptation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AdaptiveWeights Tests")
class AdaptiveWeightsTest {

    private final AdaptiveWeights weights = new AdaptiveWeights(Map.of(
            "semantic", new AdaptiveWeight("semantic", 0.3, 0.8, Instant.EPOCH),
            "graph", new AdaptiveWeight("graph", 0.2, 0.7, Instant.EPOCH)));

    @Test
    @DisplayName("Updates never add features")
    void updatesCannotAddFeatures() {
        assertThatThrownBy(() -> weights.withUpdates(Map.of(
                "popularity", new AdaptiveWeight("popularity", 0.1, 0.5, Instant.EPOCH))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("popularity");
    }

    @Test
    @DisplayName("Updates produce a new instance")
    void updatesProduceNewInstance() {
        final AdaptiveWeights updated = weights.withUpdates(Map.of(
                "graph", new AdaptiveWeight("graph", 0.25, 0.7, Instant.EPOCH)));

        assertThat(updated.valueOf("graph")).isEqualTo(0.25);
        assertThat(weights.valueOf("graph")).isEqualTo(0.2);
        assertThat(updated.hasSameFeatures(weights)).isTrue();
    }

    @Test
    @DisplayName("The weight map is read-only")
    void weightMapIsReadOnly() {
        assertThatThrownBy(() -> weights.weights().remove("graph"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Empty weights and mismatched names are rejected")
    void invalidWeightsAreRejected() {
        assertThatThrownBy(() -> new AdaptiveWeights(Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new AdaptiveWeights(Map.of(
                "semantic", new AdaptiveWeight("graph", 0.2, 0.7, Instant.EPOCH))))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
