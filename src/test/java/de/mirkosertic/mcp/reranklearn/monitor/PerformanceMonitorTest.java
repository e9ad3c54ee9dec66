package de.mirkosertic.mcp.reranklearn.monitor;

import de.mirkosertic.mcp.reranklearn.feedback.FeedbackEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("PerformanceMonitor Tests")
class PerformanceMonitorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private final PerformanceMonitor monitor = new PerformanceMonitor(0.5, 3, Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    @DisplayName("Initial snapshot is all zero")
    void initialState() {
        final PerformanceSnapshot snapshot = monitor.snapshot();

        assertThat(snapshot.totalFeedback()).isZero();
        assertThat(snapshot.modelAccuracy()).isEqualTo(0.0);
        assertThat(snapshot.performanceHistory()).isEmpty();
        assertThat(snapshot.lastStorageError()).isNull();
    }

    @Test
    @DisplayName("Accuracy is the share of positive feedback")
    void accuracyIsPositiveShare() {
        monitor.record(List.of(
                FeedbackEvent.of("q", "a", 0.9),
                FeedbackEvent.of("q", "b", 0.5),
                FeedbackEvent.of("q", "c", 0.2),
                FeedbackEvent.of("q", "d", 0.1)));

        final PerformanceSnapshot snapshot = monitor.snapshot();
        assertThat(snapshot.totalFeedback()).isEqualTo(4);
        assertThat(snapshot.positiveFeedback()).isEqualTo(2);
        assertThat(snapshot.negativeFeedback()).isEqualTo(2);
        assertThat(snapshot.modelAccuracy()).isCloseTo(0.5, within(1e-9));
        assertThat(snapshot.performanceHistory()).singleElement()
                .satisfies(point -> {
                    assertThat(point.timestamp()).isEqualTo(NOW);
                    assertThat(point.feedbackCount()).isEqualTo(4);
                });
    }

    @Test
    @DisplayName("History keeps only the newest entries")
    void historyIsCapped() {
        for (int i = 0; i < 5; i++) {
            monitor.record(List.of(FeedbackEvent.of("q", "r" + i, i % 2 == 0 ? 0.9 : 0.1)));
        }

        final PerformanceSnapshot snapshot = monitor.snapshot();
        assertThat(snapshot.batchesProcessed()).isEqualTo(5);
        assertThat(snapshot.performanceHistory()).hasSize(3);
        assertThat(snapshot.performanceHistory()).extracting(PerformanceSnapshot.HistoryPoint::feedbackCount)
                .containsExactly(3L, 4L, 5L);
    }

    @Test
    @DisplayName("Empty batches are ignored")
    void emptyBatchIsIgnored() {
        monitor.record(List.of());

        assertThat(monitor.snapshot().batchesProcessed()).isZero();
    }

    @Test
    @DisplayName("Storage failures are counted with the last message")
    void storageFailuresAreCounted() {
        monitor.recordStorageFailure("disk full");
        monitor.recordStorageFailure("read-only file system");

        assertThat(monitor.snapshot().storageFailures()).isEqualTo(2);
        assertThat(monitor.snapshot().lastStorageError()).isEqualTo("read-only file system");
    }
}
