package de.mirkosertic.mcp.medialibrary;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.mcp.medialibrary.catalog.LuceneLibraryCatalog;
import de.mirkosertic.mcp.medialibrary.config.ApplicationConfig;
import de.mirkosertic.mcp.medialibrary.config.BuildInfo;
import de.mirkosertic.mcp.medialibrary.config.LoggingConfigurator;
import de.mirkosertic.mcp.medialibrary.crawler.LibraryCrawler;
import de.mirkosertic.mcp.medialibrary.crawler.MediaFileMatcher;
import de.mirkosertic.mcp.medialibrary.job.ExecutorJobQueue;
import de.mirkosertic.mcp.medialibrary.job.JobName;
import de.mirkosertic.mcp.medialibrary.job.JobStatisticsTracker;
import de.mirkosertic.mcp.medialibrary.library.LibraryReconciler;
import de.mirkosertic.mcp.medialibrary.library.LibraryService;
import de.mirkosertic.mcp.medialibrary.media.TikaMimeTypeClassifier;
import de.mirkosertic.mcp.medialibrary.worker.LibraryFileOfflineWorker;
import de.mirkosertic.mcp.medialibrary.worker.LibraryFileRefreshWorker;
import de.mirkosertic.mcp.medialibrary.worker.PathLockRegistry;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Main entry point for the MCP media library server.
 * Wires catalog, crawler, job queue and workers and serves the library tools over STDIO.
 */
public class MediaLibraryApplication {

    private static final Logger logger = LoggerFactory.getLogger(MediaLibraryApplication.class);

    private final LuceneLibraryCatalog catalog;
    private final ExecutorJobQueue jobQueue;
    private final LibraryTools libraryTools;
    private final AtomicBoolean shutDown = new AtomicBoolean(false);
    private McpSyncServer mcpServer;

    public MediaLibraryApplication(final ApplicationConfig config) throws IOException {
        this.catalog = LuceneLibraryCatalog.open(Path.of(config.getCatalogPath()), config.getCommitIntervalMs());

        this.jobQueue = new ExecutorJobQueue(config, new JobStatisticsTracker());

        final PathLockRegistry pathLocks = new PathLockRegistry();
        jobQueue.register(JobName.REFRESH_LIBRARY_FILE,
                new LibraryFileRefreshWorker(catalog, new TikaMimeTypeClassifier(), jobQueue, pathLocks));
        jobQueue.register(JobName.OFFLINE_LIBRARY_FILE, new LibraryFileOfflineWorker(catalog, pathLocks));

        final LibraryCrawler crawler = new LibraryCrawler(MediaFileMatcher.fromConfig(config));
        final LibraryReconciler reconciler = new LibraryReconciler(crawler, catalog, jobQueue);
        final LibraryService libraryService = new LibraryService(catalog, reconciler);

        this.libraryTools = new LibraryTools(libraryService, jobQueue, config.getDefaultOwnerId());
    }

    public void init() throws IOException {
        logger.info("Initializing {}", BuildInfo.describe());
        catalog.init();
        logger.info("All services initialized successfully");
    }

    /**
     * Start the MCP server and block until the process is asked to stop.
     */
    public void start() {
        logger.info("Starting MCP server with STDIO transport...");

        final McpSchema.ServerCapabilities capabilities = McpSchema.ServerCapabilities.builder()
                .tools(true)
                .build();

        final McpSchema.Implementation serverInfo = new McpSchema.Implementation(
                "MCP Media Library Server",
                BuildInfo.getVersion()
        );

        final StdioServerTransportProvider transportProvider =
                new StdioServerTransportProvider(new JacksonMcpJsonMapper(new ObjectMapper()));

        mcpServer = McpServer.sync(transportProvider)
                .serverInfo(serverInfo)
                .capabilities(capabilities)
                .tools(libraryTools.getToolSpecifications())
                .build();

        logger.info("MCP server started successfully");

        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "shutdown-hook"));
        new McpServerLifecycleManager(() -> System.exit(0)).start();

        // The STDIO transport runs on its own threads
        try {
            Thread.currentThread().join();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Main thread interrupted, shutting down...");
        }
    }

    /**
     * Shutdown all services gracefully. Safe to call more than once.
     */
    public void shutdown() {
        if (!shutDown.compareAndSet(false, true)) {
            return;
        }
        logger.info("Shutting down MCP Media Library Server...");

        try {
            if (mcpServer != null) {
                mcpServer.close();
            }
        } catch (final Exception e) {
            logger.error("Error closing MCP server", e);
        }

        try {
            jobQueue.shutdown();
        } catch (final Exception e) {
            logger.error("Error shutting down job queue", e);
        }

        try {
            catalog.close();
        } catch (final IOException e) {
            logger.error("Error closing catalog", e);
        }

        logger.info("MCP Media Library Server shutdown complete");
    }

    public static void main(final String[] args) {
        try {
            // Configure logging FIRST, before any other code that might log
            LoggingConfigurator.configure(ApplicationConfig.isDeployedProfileRequested());

            final ApplicationConfig config = ApplicationConfig.load();

            if (!config.isDeployedMode()) {
                logger.info("Running in development mode (console logging enabled)");
                logger.info("Catalog path: {}", config.getCatalogPath());
            }

            final MediaLibraryApplication app = new MediaLibraryApplication(config);
            app.init();
            app.start();

        } catch (final Exception e) {
            // In deployed mode, we can't log to console, so write to stderr
            System.err.println("Failed to start MCP Media Library Server: " + e.getMessage());
            e.printStackTrace(System.err);
            System.exit(1);
        }
    }
}
