package de.mirkosertic.mcp.reranklearn;

import de.mirkosertic.mcp.reranklearn.adaptation.AdaptiveWeights;
import de.mirkosertic.mcp.reranklearn.config.ApplicationConfig;
import de.mirkosertic.mcp.reranklearn.feedback.FeedbackEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RerankLearningApplication Tests")
class RerankLearningApplicationTest {

    @TempDir
    Path tempDir;

    private ApplicationConfig config() {
        return ApplicationConfig.fromYaml(Map.of("reranklearn", Map.of(
                "learning", Map.of("batch-threshold", 2, "flush-interval-ms", 0),
                "model", Map.of("path", tempDir.toString()))));
    }

    @Test
    @DisplayName("Default weights follow the configured features")
    void defaultWeights() {
        final AdaptiveWeights weights = RerankLearningApplication.defaultWeights(ApplicationConfig.defaults());

        assertThat(weights.featureNames())
                .containsExactly("semantic", "graph", "contextual", "recency", "popularity", "original");
        assertThat(weights.get("original").confidence()).isEqualTo(0.9);
    }

    @Test
    @DisplayName("Learned weights survive a restart through the model directory")
    void weightsSurviveRestart() throws Exception {
        final RerankLearningApplication first = new RerankLearningApplication(config());
        first.init();
        first.getLearningService().collectFeedback(FeedbackEvent.of("q", "a", 0.9));
        first.getLearningService().collectFeedback(FeedbackEvent.of("q", "b", 0.9));
        first.getLearningService().flushFeedbackBuffer();
        final AdaptiveWeights learned = first.getLearningService().getAdaptiveWeights();
        first.shutdown();

        final RerankLearningApplication second = new RerankLearningApplication(config());
        second.init();
        try {
            assertThat(second.getLearningService().getAdaptiveWeights()).isEqualTo(learned);
            assertThat(second.getLearningService().getCurrentVersionId()).contains("1.0.0");
        } finally {
            second.shutdown();
        }
    }

    @Test
    @DisplayName("Shutdown flushes buffered feedback")
    void shutdownFlushesFeedback() throws Exception {
        final RerankLearningApplication app = new RerankLearningApplication(config());
        app.init();
        app.getLearningService().collectFeedback(FeedbackEvent.of("q", "a", 0.9));

        app.shutdown();

        assertThat(app.getLearningService().getPerformanceMonitoring().totalFeedback()).isEqualTo(1);
        assertThat(app.getLearningService().getModelHistory()).hasSize(1);
    }
}
