package de.mirkosertic.mcp.reranklearn;

import de.mirkosertic.mcp.reranklearn.adaptation.AdaptiveWeights;
import de.mirkosertic.mcp.reranklearn.feedback.FeedbackEvent;
import de.mirkosertic.mcp.reranklearn.feedback.InvalidFeedbackException;
import de.mirkosertic.mcp.reranklearn.mcp.SchemaGenerator;
import de.mirkosertic.mcp.reranklearn.mcp.ToolResultHelper;
import de.mirkosertic.mcp.reranklearn.mcp.dto.AdaptiveWeightsResponse;
import de.mirkosertic.mcp.reranklearn.mcp.dto.FlushFeedbackResponse;
import de.mirkosertic.mcp.reranklearn.mcp.dto.ListModelVersionsResponse;
import de.mirkosertic.mcp.reranklearn.mcp.dto.ModelVersionSummary;
import de.mirkosertic.mcp.reranklearn.mcp.dto.PerformanceMonitoringResponse;
import de.mirkosertic.mcp.reranklearn.mcp.dto.RollbackModelRequest;
import de.mirkosertic.mcp.reranklearn.mcp.dto.RollbackModelResponse;
import de.mirkosertic.mcp.reranklearn.mcp.dto.SaveModelResponse;
import de.mirkosertic.mcp.reranklearn.mcp.dto.SubmitFeedbackRequest;
import de.mirkosertic.mcp.reranklearn.mcp.dto.SubmitFeedbackResponse;
import de.mirkosertic.mcp.reranklearn.model.ModelStoreException;
import de.mirkosertic.mcp.reranklearn.model.ModelVersion;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * MCP tools for the feedback learning loop.
 * Thin adapters: every tool delegates to {@link LearningService} and maps the outcome to a DTO.
 */
public class RerankLearningTools {

    private static final Logger logger = LoggerFactory.getLogger(RerankLearningTools.class);

    private final LearningService learningService;

    public RerankLearningTools(final LearningService learningService) {
        this.learningService = learningService;
    }

    public List<McpServerFeatures.SyncToolSpecification> getToolSpecifications() {
        final List<McpServerFeatures.SyncToolSpecification> tools = new ArrayList<>();

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("submitFeedback")
                        .description("Record how relevant a search result was for a query. "
                                + "Feedback is buffered and applied to the reranking weights in batches.")
                        .inputSchema(SchemaGenerator.generateSchema(SubmitFeedbackRequest.class))
                        .build())
                .callHandler((exchange, request) -> submitFeedback(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("flushFeedback")
                        .description("Apply all buffered feedback now and wait until the weights are updated. "
                                + "Returns the number of events flushed.")
                        .inputSchema(SchemaGenerator.emptySchema())
                        .build())
                .callHandler((exchange, request) -> flushFeedback())
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("getAdaptiveWeights")
                        .description("Get the live reranking weights with their confidence and last update time.")
                        .inputSchema(SchemaGenerator.emptySchema())
                        .build())
                .callHandler((exchange, request) -> getAdaptiveWeights())
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("saveModel")
                        .description("Snapshot the live weights as a new model version and make it current.")
                        .inputSchema(SchemaGenerator.emptySchema())
                        .build())
                .callHandler((exchange, request) -> saveModel())
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("loadModel")
                        .description("Replace the live weights with the current stored model version, "
                                + "or the defaults if no version was saved yet.")
                        .inputSchema(SchemaGenerator.emptySchema())
                        .build())
                .callHandler((exchange, request) -> loadModel())
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("rollbackModel")
                        .description("Make an earlier model version live. "
                                + "Returns rolledBack=false if the version does not exist.")
                        .inputSchema(SchemaGenerator.generateSchema(RollbackModelRequest.class))
                        .build())
                .callHandler((exchange, request) -> rollbackModel(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("listModelVersions")
                        .description("List the stored model versions, oldest first, and mark the current one.")
                        .inputSchema(SchemaGenerator.emptySchema())
                        .build())
                .callHandler((exchange, request) -> listModelVersions())
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("getPerformanceMonitoring")
                        .description("Get feedback counters, model accuracy and the accuracy history per batch.")
                        .inputSchema(SchemaGenerator.emptySchema())
                        .build())
                .callHandler((exchange, request) -> getPerformanceMonitoring())
                .build());

        return tools;
    }

    McpSchema.CallToolResult submitFeedback(final Map<String, Object> args) {
        final SubmitFeedbackRequest request = SubmitFeedbackRequest.fromMap(args);

        try {
            final FeedbackEvent event = request.toFeedbackEvent();
            learningService.collectFeedback(event);
            return ToolResultHelper.createResult(SubmitFeedbackResponse.success(learningService.getPendingFeedbackCount()));

        } catch (final InvalidFeedbackException e) {
            logger.warn("Rejected invalid feedback: {}", e.getMessage());
            return ToolResultHelper.createResult(SubmitFeedbackResponse.error("Invalid feedback: " + e.getMessage()));
        } catch (final RuntimeException e) {
            logger.error("Error collecting feedback", e);
            return ToolResultHelper.createResult(SubmitFeedbackResponse.error("Error collecting feedback: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult flushFeedback() {
        logger.info("Flush feedback request");

        try {
            final int flushed = learningService.flushFeedbackBuffer();
            return ToolResultHelper.createResult(
                    FlushFeedbackResponse.success(flushed, learningService.getCompletedFlushCycles()));

        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while flushing feedback");
            return ToolResultHelper.createResult(FlushFeedbackResponse.error("Interrupted while flushing feedback"));
        } catch (final RuntimeException e) {
            logger.error("Error flushing feedback", e);
            return ToolResultHelper.createResult(FlushFeedbackResponse.error("Error flushing feedback: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult getAdaptiveWeights() {
        final AdaptiveWeights weights = learningService.getAdaptiveWeights();
        return ToolResultHelper.createResult(AdaptiveWeightsResponse.success(
                weights,
                learningService.getAlgorithm().name(),
                learningService.getCurrentVersionId().orElse(null)));
    }

    McpSchema.CallToolResult saveModel() {
        logger.info("Save model request");

        try {
            final ModelVersion version = learningService.saveModel();
            return ToolResultHelper.createResult(SaveModelResponse.success(version));

        } catch (final ModelStoreException e) {
            return ToolResultHelper.createResult(SaveModelResponse.error("Error saving model: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult loadModel() {
        logger.info("Load model request");

        try {
            final AdaptiveWeights weights = learningService.loadModel();
            return ToolResultHelper.createResult(AdaptiveWeightsResponse.success(
                    weights,
                    learningService.getAlgorithm().name(),
                    learningService.getCurrentVersionId().orElse(null)));

        } catch (final ModelStoreException e) {
            return ToolResultHelper.createResult(AdaptiveWeightsResponse.error("Error loading model: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult rollbackModel(final Map<String, Object> args) {
        final RollbackModelRequest request = RollbackModelRequest.fromMap(args);

        if (request.versionId() == null || request.versionId().isBlank()) {
            return ToolResultHelper.createResult(RollbackModelResponse.error("versionId is required"));
        }

        try {
            if (learningService.rollbackToVersion(request.versionId())) {
                return ToolResultHelper.createResult(RollbackModelResponse.rolledBack(request.versionId()));
            }
            return ToolResultHelper.createResult(RollbackModelResponse.unknownVersion(request.versionId()));

        } catch (final ModelStoreException e) {
            return ToolResultHelper.createResult(RollbackModelResponse.error(
                    "Error rolling back to " + request.versionId() + ": " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult listModelVersions() {
        final String current = learningService.getCurrentVersionId().orElse(null);
        final List<ModelVersionSummary> versions = new ArrayList<>();
        for (final ModelVersion version : learningService.getModelHistory()) {
            versions.add(ModelVersionSummary.from(version, current));
        }
        return ToolResultHelper.createResult(ListModelVersionsResponse.success(current, versions));
    }

    McpSchema.CallToolResult getPerformanceMonitoring() {
        return ToolResultHelper.createResult(PerformanceMonitoringResponse.success(
                learningService.getPerformanceMonitoring(),
                learningService.getPendingFeedbackCount(),
                learningService.getState().name()));
    }
}
