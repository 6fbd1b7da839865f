package de.mirkosertic.mcp.medialibrary.worker;

import de.mirkosertic.mcp.medialibrary.catalog.Asset;
import de.mirkosertic.mcp.medialibrary.catalog.AssetUpdate;
import de.mirkosertic.mcp.medialibrary.catalog.LibraryCatalog;
import de.mirkosertic.mcp.medialibrary.job.JobHandler;
import de.mirkosertic.mcp.medialibrary.job.LibraryJob;
import de.mirkosertic.mcp.medialibrary.library.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.locks.Lock;

/**
 * Handles a cataloged file that was not found on disk: hard delete with {@code emptyTrash},
 * otherwise mark offline so the refresh worker can bring it back later.
 */
public class LibraryFileOfflineWorker implements JobHandler<LibraryJob> {

    private static final Logger logger = LoggerFactory.getLogger(LibraryFileOfflineWorker.class);

    private final LibraryCatalog catalog;
    private final PathLockRegistry locks;

    public LibraryFileOfflineWorker(final LibraryCatalog catalog, final PathLockRegistry locks) {
        this.catalog = catalog;
        this.locks = locks;
    }

    @Override
    public boolean handle(final LibraryJob job) throws IOException {
        final Lock lock = locks.lockFor(job.libraryId(), job.assetPath());
        lock.lock();
        try {
            final Asset asset = catalog.getAssetByLibraryAndPath(job.libraryId(), job.assetPath())
                    .orElseThrow(() -> new NotFoundException("Asset does not exist in catalog: " + job.assetPath()));

            if (job.emptyTrash()) {
                catalog.deleteAsset(asset.id());
                logger.info("Deleted asset {} for missing file {}", asset.id(), job.assetPath());
            } else if (!asset.offline()) {
                catalog.updateAsset(asset.id(), AssetUpdate.offline(true));
                logger.info("Marked asset {} offline: {}", asset.id(), job.assetPath());
            }
            return true;
        } finally {
            lock.unlock();
        }
    }
}
