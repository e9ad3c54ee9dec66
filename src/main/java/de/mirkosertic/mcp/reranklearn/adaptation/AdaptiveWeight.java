package de.mirkosertic.mcp.reranklearn.adaptation;

import java.time.Instant;

/**
 * Current value of one ranking feature weight.
 */
public record AdaptiveWeight(
        String name,
        /** Weight in [0,1]. */
        double value,
        /** Confidence in the value, grows as feedback moves the weight. */
        double confidence,
        Instant lastUpdated
) {
}
