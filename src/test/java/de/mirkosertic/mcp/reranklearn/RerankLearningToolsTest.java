package de.mirkosertic.mcp.reranklearn;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.mcp.reranklearn.adaptation.QueryGroupedSignalExtractor;
import de.mirkosertic.mcp.reranklearn.adaptation.WeightAdaptationEngine;
import de.mirkosertic.mcp.reranklearn.config.ApplicationConfig;
import de.mirkosertic.mcp.reranklearn.model.InMemoryModelRepository;
import de.mirkosertic.mcp.reranklearn.model.ModelStore;
import de.mirkosertic.mcp.reranklearn.monitor.PerformanceMonitor;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("RerankLearningTools Tests")
class RerankLearningToolsTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private LearningService learningService;
    private RerankLearningTools tools;

    @BeforeEach
    void setUp() throws Exception {
        final ApplicationConfig config = ApplicationConfig.fromYaml(Map.of("reranklearn", Map.of(
                "learning", Map.of("batch-threshold", 3, "flush-interval-ms", 0, "checkpoint-on-flush", false),
                "model", Map.of("storage", "memory"))));
        learningService = new LearningService(config,
                new WeightAdaptationEngine(new QueryGroupedSignalExtractor(), config.getEmaAlpha(),
                        config.getRegretLearningRate()),
                new ModelStore(new InMemoryModelRepository(), RerankLearningApplication.defaultWeights(config)),
                new PerformanceMonitor(config.getPositiveThreshold(), config.getMaxHistoryLength()));
        learningService.init();
        tools = new RerankLearningTools(learningService);
    }

    @AfterEach
    void tearDown() {
        learningService.close();
    }

    private static JsonNode json(final McpSchema.CallToolResult result) throws Exception {
        return MAPPER.readTree(((McpSchema.TextContent) result.content().get(0)).text());
    }

    private static Map<String, Object> feedback(final String query, final Object score) {
        final Map<String, Object> args = new HashMap<>();
        args.put("query", query);
        args.put("resultId", "doc-1");
        args.put("relevanceScore", score);
        return args;
    }

    @Test
    @DisplayName("All learning tools are registered with input schemas")
    void toolsAreRegistered() {
        assertThat(tools.getToolSpecifications())
                .extracting(spec -> spec.tool().name())
                .containsExactly("submitFeedback", "flushFeedback", "getAdaptiveWeights", "saveModel",
                        "loadModel", "rollbackModel", "listModelVersions", "getPerformanceMonitoring");
        assertThat(tools.getToolSpecifications())
                .extracting(McpServerFeatures.SyncToolSpecification::tool)
                .allSatisfy(tool -> assertThat(tool.inputSchema()).isNotNull());
    }

    @Test
    @DisplayName("Valid feedback is accepted and buffered")
    void submitFeedback() throws Exception {
        final McpSchema.CallToolResult result = tools.submitFeedback(feedback("java", 0.8));

        assertThat(result.isError()).isFalse();
        final JsonNode body = json(result);
        assertThat(body.get("success").asBoolean()).isTrue();
        assertThat(body.get("pendingFeedback").asInt()).isEqualTo(1);
    }

    @Test
    @DisplayName("Integer scores are accepted")
    void integerScoreIsAccepted() throws Exception {
        assertThat(tools.submitFeedback(feedback("java", 1)).isError()).isFalse();
    }

    @Test
    @DisplayName("Invalid feedback is reported as an error result")
    void invalidFeedback() throws Exception {
        final McpSchema.CallToolResult outOfRange = tools.submitFeedback(feedback("java", 1.5));
        final McpSchema.CallToolResult missingScore = tools.submitFeedback(feedback("java", null));
        final Map<String, Object> badTimestamp = feedback("java", 0.5);
        badTimestamp.put("timestamp", "yesterday");

        assertThat(outOfRange.isError()).isTrue();
        assertThat(json(outOfRange).get("error").asText()).contains("relevanceScore");
        assertThat(missingScore.isError()).isTrue();
        assertThat(tools.submitFeedback(badTimestamp).isError()).isTrue();
        assertThat(learningService.getPendingFeedbackCount()).isZero();
    }

    @Test
    @DisplayName("Flush reports the number of processed events")
    void flushFeedback() throws Exception {
        tools.submitFeedback(feedback("java", 0.9));
        tools.submitFeedback(feedback("java", 0.9));

        final JsonNode body = json(tools.flushFeedback());

        assertThat(body.get("success").asBoolean()).isTrue();
        assertThat(body.get("flushedEvents").asInt()).isEqualTo(2);
        assertThat(body.get("completedFlushCycles").asLong()).isEqualTo(1);
    }

    @Test
    @DisplayName("Weights are listed with value and confidence")
    void getAdaptiveWeights() throws Exception {
        final JsonNode body = json(tools.getAdaptiveWeights());

        assertThat(body.get("algorithm").asText()).isEqualTo("EXPONENTIAL_MOVING_AVERAGE");
        assertThat(body.get("weights")).hasSize(6);
        assertThat(body.get("weights").get(0).get("name").asText()).isEqualTo("semantic");
        assertThat(body.get("weights").get(0).get("value").asDouble()).isEqualTo(0.3);
        assertThat(body.has("currentVersion")).isFalse();
    }

    @Test
    @DisplayName("Save, list and roll back model versions")
    void modelVersionLifecycle() throws Exception {
        assertThat(json(tools.saveModel()).get("versionId").asText()).isEqualTo("1.0.0");
        assertThat(json(tools.saveModel()).get("versionId").asText()).isEqualTo("1.0.1");

        final JsonNode rolledBack = json(tools.rollbackModel(Map.of("versionId", "1.0.0")));
        assertThat(rolledBack.get("rolledBack").asBoolean()).isTrue();

        final JsonNode versions = json(tools.listModelVersions());
        assertThat(versions.get("currentVersion").asText()).isEqualTo("1.0.0");
        assertThat(versions.get("versions")).hasSize(2);
        assertThat(versions.get("versions").get(0).get("current").asBoolean()).isTrue();

        assertThat(json(tools.loadModel()).get("currentVersion").asText()).isEqualTo("1.0.0");
    }

    @Test
    @DisplayName("Rolling back to an unknown version is not an error")
    void rollbackToUnknownVersion() throws Exception {
        final McpSchema.CallToolResult result = tools.rollbackModel(Map.of("versionId", "9.9.9"));

        assertThat(result.isError()).isFalse();
        assertThat(json(result).get("rolledBack").asBoolean()).isFalse();
        assertThat(tools.rollbackModel(Map.of()).isError()).isTrue();
    }

    @Test
    @DisplayName("Monitoring exposes counters and history")
    void performanceMonitoring() throws Exception {
        tools.submitFeedback(feedback("java", 0.9));
        tools.submitFeedback(feedback("java", 0.9));
        tools.submitFeedback(feedback("java", 0.1));
        learningService.flushFeedbackBuffer();

        final JsonNode body = json(tools.getPerformanceMonitoring());

        assertThat(body.get("totalFeedback").asLong()).isEqualTo(3);
        assertThat(body.get("positiveFeedback").asLong()).isEqualTo(2);
        assertThat(body.get("negativeFeedback").asLong()).isEqualTo(1);
        assertThat(body.get("modelAccuracy").asDouble()).isCloseTo(2.0 / 3.0, within(1e-9));
        assertThat(body.get("performanceHistory")).hasSize(1);
        assertThat(body.get("state").asText()).isEqualTo("IDLE");
    }
}
