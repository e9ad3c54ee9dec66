package de.mirkosertic.mcp.reranklearn.monitor;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.List;

/**
 * Read-only copy of the learning statistics at one point in time.
 */
public record PerformanceSnapshot(
        long totalFeedback,
        long positiveFeedback,
        long negativeFeedback,
        /** positiveFeedback / totalFeedback, 0 before the first batch. */
        double modelAccuracy,
        long batchesProcessed,
        /** Number of checkpoints that could not be persisted. */
        long storageFailures,
        @Nullable String lastStorageError,
        /** Oldest first, capped at the configured history length. */
        List<HistoryPoint> performanceHistory
) {

    /** Accuracy after one processed batch. */
    public record HistoryPoint(Instant timestamp, double accuracy, long feedbackCount) {
    }
}
