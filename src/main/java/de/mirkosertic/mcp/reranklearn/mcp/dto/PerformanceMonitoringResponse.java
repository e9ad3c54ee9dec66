package de.mirkosertic.mcp.reranklearn.mcp.dto;

import de.mirkosertic.mcp.reranklearn.monitor.PerformanceSnapshot;

import java.util.ArrayList;
import java.util.List;

/**
 * Response DTO for the getPerformanceMonitoring tool.
 */
public record PerformanceMonitoringResponse(
        boolean success,
        Long totalFeedback,
        Long positiveFeedback,
        Long negativeFeedback,
        Double modelAccuracy,
        Long batchesProcessed,
        Long storageFailures,
        String lastStorageError,
        Integer pendingFeedback,
        String state,
        List<HistoryEntry> performanceHistory,
        String error
) {

    public record HistoryEntry(String timestamp, double accuracy, long feedbackCount) {
    }

    public static PerformanceMonitoringResponse success(final PerformanceSnapshot snapshot,
                                                        final int pendingFeedback,
                                                        final String state) {
        final List<HistoryEntry> history = new ArrayList<>();
        for (final PerformanceSnapshot.HistoryPoint point : snapshot.performanceHistory()) {
            history.add(new HistoryEntry(point.timestamp().toString(), point.accuracy(), point.feedbackCount()));
        }
        return new PerformanceMonitoringResponse(true,
                snapshot.totalFeedback(),
                snapshot.positiveFeedback(),
                snapshot.negativeFeedback(),
                snapshot.modelAccuracy(),
                snapshot.batchesProcessed(),
                snapshot.storageFailures(),
                snapshot.lastStorageError(),
                pendingFeedback,
                state,
                history,
                null);
    }

    public static PerformanceMonitoringResponse error(final String errorMessage) {
        return new PerformanceMonitoringResponse(false, null, null, null, null, null, null, null,
                null, null, null, errorMessage);
    }
}
