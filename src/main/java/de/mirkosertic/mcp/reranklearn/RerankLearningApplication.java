package de.mirkosertic.mcp.reranklearn;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.mcp.reranklearn.adaptation.AdaptiveWeight;
import de.mirkosertic.mcp.reranklearn.adaptation.AdaptiveWeights;
import de.mirkosertic.mcp.reranklearn.adaptation.QueryGroupedSignalExtractor;
import de.mirkosertic.mcp.reranklearn.adaptation.WeightAdaptationEngine;
import de.mirkosertic.mcp.reranklearn.config.ApplicationConfig;
import de.mirkosertic.mcp.reranklearn.config.BuildInfo;
import de.mirkosertic.mcp.reranklearn.config.LoggingConfigurator;
import de.mirkosertic.mcp.reranklearn.mcp.RerankStdioServerTransportProvider;
import de.mirkosertic.mcp.reranklearn.model.InMemoryModelRepository;
import de.mirkosertic.mcp.reranklearn.model.ModelRepository;
import de.mirkosertic.mcp.reranklearn.model.ModelStore;
import de.mirkosertic.mcp.reranklearn.model.ModelStoreException;
import de.mirkosertic.mcp.reranklearn.model.YamlModelRepository;
import de.mirkosertic.mcp.reranklearn.monitor.PerformanceMonitor;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Main entry point for the rerank learning server.
 * Wires all components and serves the learning tools over MCP STDIO transport.
 */
public class RerankLearningApplication {

    private static final Logger logger = LoggerFactory.getLogger(RerankLearningApplication.class);

    private final LearningService learningService;
    private final RerankLearningTools tools;
    private McpSyncServer mcpServer;

    public RerankLearningApplication(final ApplicationConfig config) {
        final ModelRepository repository = config.isInMemoryModelStorage()
                ? new InMemoryModelRepository()
                : new YamlModelRepository(Paths.get(config.getModelPath()));

        final ModelStore modelStore = new ModelStore(repository, defaultWeights(config));

        final WeightAdaptationEngine engine = new WeightAdaptationEngine(
                new QueryGroupedSignalExtractor(),
                config.getEmaAlpha(),
                config.getRegretLearningRate());

        final PerformanceMonitor monitor = new PerformanceMonitor(
                config.getPositiveThreshold(),
                config.getMaxHistoryLength());

        this.learningService = new LearningService(config, engine, modelStore, monitor);
        this.tools = new RerankLearningTools(learningService);
    }

    /**
     * Initial weights of every configured feature.
     */
    static AdaptiveWeights defaultWeights(final ApplicationConfig config) {
        final Instant now = Instant.now();
        final Map<String, AdaptiveWeight> weights = new LinkedHashMap<>();
        for (final ApplicationConfig.FeatureDefault feature : config.getDefaultWeights()) {
            weights.put(feature.name(), new AdaptiveWeight(feature.name(), feature.value(), feature.confidence(), now));
        }
        return new AdaptiveWeights(weights);
    }

    /**
     * Read the model history and make the current stored version live.
     */
    public void init() throws ModelStoreException {
        logger.info("Initializing rerank learning server...");

        learningService.init();
        try {
            learningService.loadModel();
        } catch (final ModelStoreException e) {
            // defaults stay live
            logger.error("Could not load the current model version, continuing with default weights", e);
        }

        logger.info("All services initialized successfully");
    }

    /**
     * Start the MCP server and block until the process is terminated.
     */
    public void start() {
        logger.info("Starting MCP server with STDIO transport...");

        final McpSchema.ServerCapabilities capabilities = McpSchema.ServerCapabilities.builder()
                .tools(true)
                .build();

        final McpSchema.Implementation serverInfo = new McpSchema.Implementation(
                "MCP Rerank Learning Server",
                BuildInfo.getVersion()
        );

        final JacksonMcpJsonMapper jsonMapper = new JacksonMcpJsonMapper(new ObjectMapper());
        final RerankStdioServerTransportProvider transportProvider = new RerankStdioServerTransportProvider(jsonMapper);

        mcpServer = McpServer.sync(transportProvider)
                .serverInfo(serverInfo)
                .capabilities(capabilities)
                .tools(tools.getToolSpecifications())
                .build();

        logger.info("MCP server started successfully");

        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "shutdown-hook"));

        try {
            Thread.currentThread().join();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Main thread interrupted, shutting down...");
        }

        logger.info("Main thread finished, shutting down...");
    }

    /**
     * Close the MCP server, then flush buffered feedback and stop the learning service.
     */
    public void shutdown() {
        logger.info("Shutting down rerank learning server...");

        try {
            if (mcpServer != null) {
                mcpServer.close();
            }
        } catch (final Exception e) {
            logger.error("Error closing MCP server", e);
        }

        try {
            learningService.close();
        } catch (final Exception e) {
            logger.error("Error shutting down learning service", e);
        }

        logger.info("Rerank learning server shutdown complete");
    }

    LearningService getLearningService() {
        return learningService;
    }

    public static void main(final String[] args) {
        try {
            // Logging must be configured before anything logs; in deployed mode stdout belongs to MCP
            final boolean deployedMode = "deployed".equalsIgnoreCase(System.getProperty("profile"));
            LoggingConfigurator.configure(deployedMode);

            final ApplicationConfig config = ApplicationConfig.load();

            if (!config.isDeployedMode()) {
                logger.info("Running in development mode (console logging enabled)");
                logger.info("Model path: {}", config.getModelPath());
            }

            final RerankLearningApplication app = new RerankLearningApplication(config);
            app.init();
            app.start();

            logger.info("Rerank learning server finished.");

        } catch (final Exception e) {
            System.err.println("Failed to start rerank learning server: " + e.getMessage());
            e.printStackTrace(System.err);
            System.exit(1);
        }
    }
}
