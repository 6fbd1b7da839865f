package de.mirkosertic.mcp.medialibrary.library;

import de.mirkosertic.mcp.medialibrary.catalog.Asset;
import de.mirkosertic.mcp.medialibrary.catalog.Library;
import de.mirkosertic.mcp.medialibrary.catalog.LibraryCatalog;
import de.mirkosertic.mcp.medialibrary.crawler.LibraryCrawler;
import de.mirkosertic.mcp.medialibrary.job.JobName;
import de.mirkosertic.mcp.medialibrary.job.JobQueue;
import de.mirkosertic.mcp.medialibrary.job.LibraryJob;
import de.mirkosertic.mcp.medialibrary.util.PathNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Diffs the files below a library's import paths against the library's cataloged assets and
 * turns the diff into per-file jobs.
 * <p>
 * Algorithm:
 * <ol>
 *   <li>Crawl every import path and normalize the paths found.</li>
 *   <li>Load the library's assets and normalize their original paths.</li>
 *   <li>Every crawled path gets a {@link JobName#REFRESH_LIBRARY_FILE} job. Every cataloged path
 *       that was not crawled gets a {@link JobName#OFFLINE_LIBRARY_FILE} job.</li>
 * </ol>
 * Jobs are only emitted once both snapshots are complete, so a failing crawl or catalog read
 * leaves no partial set of jobs behind. Whether a file actually changed is decided later by the
 * refresh worker, not here.
 */
public class LibraryReconciler {

    private static final Logger logger = LoggerFactory.getLogger(LibraryReconciler.class);

    private final LibraryCrawler crawler;
    private final LibraryCatalog catalog;
    private final JobQueue jobQueue;

    public LibraryReconciler(final LibraryCrawler crawler, final LibraryCatalog catalog, final JobQueue jobQueue) {
        this.crawler = crawler;
        this.catalog = catalog;
        this.jobQueue = jobQueue;
    }

    /**
     * @throws InvalidRequestException if the library is not an import library
     * @throws IOException             if the catalog cannot be read, no jobs are emitted then
     */
    public ReconciliationResult reconcile(final Library library, final boolean forceRefresh,
                                          final boolean emptyTrash) throws IOException {
        if (!library.isImportLibrary()) {
            throw new InvalidRequestException("Can only refresh import libraries");
        }

        final long startTime = System.currentTimeMillis();

        // Step 1: Snapshot the filesystem
        final Set<String> crawledPaths = new LinkedHashSet<>();
        try (final Stream<Path> files = crawler.crawl(library.importPaths())) {
            files.forEach(file -> crawledPaths.add(PathNormalizer.normalize(file)));
        }
        logger.debug("Library {}: {} files on disk", library.id(), crawledPaths.size());

        // Step 2: Snapshot the catalog
        final List<Asset> assets = catalog.getAssetsByLibrary(List.of(library.id()));
        final Set<String> offlinePaths = new LinkedHashSet<>();
        for (final Asset asset : assets) {
            final String assetPath = PathNormalizer.normalize(asset.originalPath());
            if (!crawledPaths.contains(assetPath)) {
                offlinePaths.add(assetPath);
            }
        }

        // Step 3: Emit jobs, a path seen on disk is never marked offline
        for (final String path : crawledPaths) {
            jobQueue.enqueue(JobName.REFRESH_LIBRARY_FILE,
                    new LibraryJob(path, library.ownerId(), library.id(), forceRefresh, emptyTrash));
        }
        for (final String path : offlinePaths) {
            jobQueue.enqueue(JobName.OFFLINE_LIBRARY_FILE,
                    new LibraryJob(path, library.ownerId(), library.id(), false, emptyTrash));
        }

        final long reconciliationTimeMs = System.currentTimeMillis() - startTime;
        logger.info("Library {} reconciled in {}ms: {} to refresh, {} to mark offline (cataloged {})",
                library.id(), reconciliationTimeMs, crawledPaths.size(), offlinePaths.size(), assets.size());

        return new ReconciliationResult(library.id(), crawledPaths, offlinePaths, reconciliationTimeMs);
    }
}
