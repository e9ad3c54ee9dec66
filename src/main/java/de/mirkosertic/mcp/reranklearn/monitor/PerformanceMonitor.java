package de.mirkosertic.mcp.reranklearn.monitor;

import de.mirkosertic.mcp.reranklearn.feedback.FeedbackEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Running statistics over processed feedback batches.
 * <p>
 * Counters only grow; the accuracy history is a ring buffer holding the last
 * {@code maxHistoryLength} points. Model rollbacks do not reset anything here.
 */
public class PerformanceMonitor {

    private static final Logger logger = LoggerFactory.getLogger(PerformanceMonitor.class);

    private final double positiveThreshold;
    private final int maxHistoryLength;
    private final Clock clock;

    private final Object lock = new Object();
    private final Deque<PerformanceSnapshot.HistoryPoint> history = new ArrayDeque<>();
    private long totalFeedback = 0;
    private long positiveFeedback = 0;
    private long negativeFeedback = 0;
    private long batchesProcessed = 0;
    private long storageFailures = 0;
    private String lastStorageError;

    public PerformanceMonitor(final double positiveThreshold, final int maxHistoryLength) {
        this(positiveThreshold, maxHistoryLength, Clock.systemUTC());
    }

    public PerformanceMonitor(final double positiveThreshold, final int maxHistoryLength, final Clock clock) {
        if (maxHistoryLength < 1) {
            throw new IllegalArgumentException("maxHistoryLength must be at least 1");
        }
        this.positiveThreshold = positiveThreshold;
        this.maxHistoryLength = maxHistoryLength;
        this.clock = clock;
    }

    /**
     * Account for a committed batch. Empty batches are ignored.
     */
    public void record(final List<FeedbackEvent> batch) {
        if (batch.isEmpty()) {
            return;
        }
        int positives = 0;
        for (final FeedbackEvent event : batch) {
            if (event.isPositive(positiveThreshold)) {
                positives++;
            }
        }

        synchronized (lock) {
            totalFeedback += batch.size();
            positiveFeedback += positives;
            negativeFeedback += batch.size() - positives;
            batchesProcessed++;

            final double accuracy = accuracy();
            history.addLast(new PerformanceSnapshot.HistoryPoint(clock.instant(), accuracy, totalFeedback));
            while (history.size() > maxHistoryLength) {
                history.removeFirst();
            }
            logger.debug("Recorded batch of {} ({} positive), accuracy now {}", batch.size(), positives, accuracy);
        }
    }

    public void recordStorageFailure(final String message) {
        synchronized (lock) {
            storageFailures++;
            lastStorageError = message;
        }
    }

    public PerformanceSnapshot snapshot() {
        synchronized (lock) {
            return new PerformanceSnapshot(
                    totalFeedback,
                    positiveFeedback,
                    negativeFeedback,
                    accuracy(),
                    batchesProcessed,
                    storageFailures,
                    lastStorageError,
                    List.copyOf(new ArrayList<>(history))
            );
        }
    }

    private double accuracy() {
        return totalFeedback == 0 ? 0.0 : (double) positiveFeedback / totalFeedback;
    }
}
