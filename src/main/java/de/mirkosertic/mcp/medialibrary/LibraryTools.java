package de.mirkosertic.mcp.medialibrary;

import de.mirkosertic.mcp.medialibrary.catalog.Library;
import de.mirkosertic.mcp.medialibrary.job.ExecutorJobQueue;
import de.mirkosertic.mcp.medialibrary.library.InvalidRequestException;
import de.mirkosertic.mcp.medialibrary.library.LibraryException;
import de.mirkosertic.mcp.medialibrary.library.LibraryService;
import de.mirkosertic.mcp.medialibrary.library.ReconciliationResult;
import de.mirkosertic.mcp.medialibrary.mcp.SchemaGenerator;
import de.mirkosertic.mcp.medialibrary.mcp.ToolResultHelper;
import de.mirkosertic.mcp.medialibrary.mcp.dto.CreateLibraryRequest;
import de.mirkosertic.mcp.medialibrary.mcp.dto.JobStatisticsResponse;
import de.mirkosertic.mcp.medialibrary.mcp.dto.LibraryResponse;
import de.mirkosertic.mcp.medialibrary.mcp.dto.ListLibrariesRequest;
import de.mirkosertic.mcp.medialibrary.mcp.dto.ListLibrariesResponse;
import de.mirkosertic.mcp.medialibrary.mcp.dto.RefreshLibraryRequest;
import de.mirkosertic.mcp.medialibrary.mcp.dto.RefreshLibraryResponse;
import de.mirkosertic.mcp.medialibrary.mcp.dto.SetImportPathsRequest;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * MCP tools for library administration.
 * Each tool answers with a JSON DTO carrying {@code success} and, on failure, a descriptive {@code error}.
 */
public class LibraryTools {

    private static final Logger logger = LoggerFactory.getLogger(LibraryTools.class);

    private static final String REFRESH_DESCRIPTION = """
            Refresh an IMPORT library: crawl its import paths and queue one job per file found on disk \
            and one per cataloged file that is gone. Files are (re-)imported when they are new, when their \
            modification time changed or when forceRefresh is set. Missing files are marked offline, or \
            deleted from the catalog when emptyTrash is set. Returns the number of queued jobs; \
            per-file results are reported by getJobStatistics.""";

    private final LibraryService libraryService;
    private final ExecutorJobQueue jobQueue;
    private final String defaultOwnerId;

    public LibraryTools(final LibraryService libraryService, final ExecutorJobQueue jobQueue,
                        final String defaultOwnerId) {
        this.libraryService = libraryService;
        this.jobQueue = jobQueue;
        this.defaultOwnerId = defaultOwnerId;
    }

    /**
     * Returns all MCP tool specifications for registration with the MCP server.
     */
    public List<McpServerFeatures.SyncToolSpecification> getToolSpecifications() {
        final List<McpServerFeatures.SyncToolSpecification> tools = new ArrayList<>();

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("createLibrary")
                        .description("Create a new library. IMPORT libraries reference files in place and can be refreshed.")
                        .inputSchema(SchemaGenerator.generateSchema(CreateLibraryRequest.class))
                        .build())
                .callHandler((exchange, request) -> createLibrary(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("listLibraries")
                        .description("List the libraries of an owner together with their import paths.")
                        .inputSchema(SchemaGenerator.generateSchema(ListLibrariesRequest.class))
                        .build())
                .callHandler((exchange, request) -> listLibraries(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("setImportPaths")
                        .description("Replace the import paths of an IMPORT library. Not allowed while the library is being refreshed.")
                        .inputSchema(SchemaGenerator.generateSchema(SetImportPathsRequest.class))
                        .build())
                .callHandler((exchange, request) -> setImportPaths(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("refreshLibrary")
                        .description(REFRESH_DESCRIPTION)
                        .inputSchema(SchemaGenerator.generateSchema(RefreshLibraryRequest.class))
                        .build())
                .callHandler((exchange, request) -> refreshLibrary(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("getJobStatistics")
                        .description("Get per job type counters (enqueued, completed, failed, retried, unhandled) and the most recent job failures.")
                        .inputSchema(SchemaGenerator.emptySchema())
                        .build())
                .callHandler((exchange, request) -> getJobStatistics())
                .build());

        return tools;
    }

    McpSchema.CallToolResult createLibrary(final Map<String, Object> args) {
        try {
            final CreateLibraryRequest request = CreateLibraryRequest.fromMap(args);
            logger.info("Create library request: name='{}', type={}", request.name(), request.type());

            final Library library = libraryService.create(request.effectiveOwnerId(defaultOwnerId), request.name(),
                    request.effectiveType(), request.effectiveVisible());
            return ToolResultHelper.createResult(LibraryResponse.success(library));
        } catch (final LibraryException e) {
            logger.warn("Create library rejected: {}", e.getMessage());
            return ToolResultHelper.createResult(LibraryResponse.error(e.getMessage()));
        } catch (final IOException e) {
            logger.error("Error creating library", e);
            return ToolResultHelper.createResult(LibraryResponse.error("Catalog error: " + e.getMessage()));
        } catch (final Exception e) {
            logger.error("Unexpected error creating library", e);
            return ToolResultHelper.createResult(LibraryResponse.error("Unexpected error: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult listLibraries(final Map<String, Object> args) {
        try {
            final String ownerId = ListLibrariesRequest.fromMap(args).effectiveOwnerId(defaultOwnerId);
            final List<Library> libraries = libraryService.getAll(ownerId);
            final long count = libraryService.getCount(ownerId);
            return ToolResultHelper.createResult(ListLibrariesResponse.success(ownerId, count, libraries));
        } catch (final IOException e) {
            logger.error("Error listing libraries", e);
            return ToolResultHelper.createResult(ListLibrariesResponse.error("Catalog error: " + e.getMessage()));
        } catch (final Exception e) {
            logger.error("Unexpected error listing libraries", e);
            return ToolResultHelper.createResult(ListLibrariesResponse.error("Unexpected error: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult setImportPaths(final Map<String, Object> args) {
        try {
            final SetImportPathsRequest request = SetImportPathsRequest.fromMap(args);
            requireLibraryId(request.libraryId());
            logger.info("Set import paths request: libraryId={}, paths={}", request.libraryId(), request.importPaths());

            final Library library = libraryService.setImportPaths(request.libraryId(), request.importPaths());
            return ToolResultHelper.createResult(LibraryResponse.success(library));
        } catch (final LibraryException e) {
            logger.warn("Set import paths rejected: {}", e.getMessage());
            return ToolResultHelper.createResult(LibraryResponse.error(e.getMessage()));
        } catch (final IOException e) {
            logger.error("Error setting import paths", e);
            return ToolResultHelper.createResult(LibraryResponse.error("Catalog error: " + e.getMessage()));
        } catch (final Exception e) {
            logger.error("Unexpected error setting import paths", e);
            return ToolResultHelper.createResult(LibraryResponse.error("Unexpected error: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult refreshLibrary(final Map<String, Object> args) {
        try {
            final RefreshLibraryRequest request = RefreshLibraryRequest.fromMap(args);
            requireLibraryId(request.libraryId());
            logger.info("Refresh library request: libraryId={}, options={}", request.libraryId(), request.toOptions());

            final ReconciliationResult result = libraryService.refresh(request.libraryId(), request.toOptions());
            return ToolResultHelper.createResult(RefreshLibraryResponse.success(result));
        } catch (final LibraryException e) {
            logger.warn("Refresh rejected: {}", e.getMessage());
            return ToolResultHelper.createResult(RefreshLibraryResponse.error(e.getMessage()));
        } catch (final IOException e) {
            logger.error("Error refreshing library", e);
            return ToolResultHelper.createResult(RefreshLibraryResponse.error("Refresh aborted: " + e.getMessage()));
        } catch (final Exception e) {
            logger.error("Unexpected error refreshing library", e);
            return ToolResultHelper.createResult(RefreshLibraryResponse.error("Unexpected error: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult getJobStatistics() {
        try {
            return ToolResultHelper.createResult(JobStatisticsResponse.success(jobQueue.getStatistics()));
        } catch (final Exception e) {
            logger.error("Error reading job statistics", e);
            return ToolResultHelper.createResult(JobStatisticsResponse.error("Unexpected error: " + e.getMessage()));
        }
    }

    private static void requireLibraryId(final String libraryId) {
        if (libraryId == null || libraryId.isBlank()) {
            throw new InvalidRequestException("libraryId is required");
        }
    }
}
