package de.mirkosertic.mcp.medialibrary.worker;

import com.google.common.hash.HashCode;
import com.google.common.hash.Hashing;
import com.google.common.io.MoreFiles;
import de.mirkosertic.mcp.medialibrary.catalog.Asset;
import de.mirkosertic.mcp.medialibrary.catalog.AssetType;
import de.mirkosertic.mcp.medialibrary.catalog.AssetUpdate;
import de.mirkosertic.mcp.medialibrary.catalog.LibraryCatalog;
import de.mirkosertic.mcp.medialibrary.catalog.NewAsset;
import de.mirkosertic.mcp.medialibrary.job.AssetJob;
import de.mirkosertic.mcp.medialibrary.job.JobHandler;
import de.mirkosertic.mcp.medialibrary.job.JobName;
import de.mirkosertic.mcp.medialibrary.job.JobQueue;
import de.mirkosertic.mcp.medialibrary.job.LibraryJob;
import de.mirkosertic.mcp.medialibrary.library.InvalidRequestException;
import de.mirkosertic.mcp.medialibrary.library.UnprocessableAssetException;
import de.mirkosertic.mcp.medialibrary.media.MimeClass;
import de.mirkosertic.mcp.medialibrary.media.MimeTypeClassifier;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.locks.Lock;

/**
 * Brings the catalog record of one file in line with the file on disk.
 * <p>
 * Decision table, evaluated under the path lock:
 * <ol>
 *   <li>stat fails and an asset exists: mark it offline, done</li>
 *   <li>stat fails and no asset exists: the job is invalid</li>
 *   <li>the asset is offline: clear the flag, the file is back</li>
 *   <li>import if forced, if the file is new or if its mtime differs from the cataloged one</li>
 *   <li>otherwise nothing to do</li>
 * </ol>
 */
public class LibraryFileRefreshWorker implements JobHandler<LibraryJob> {

    private static final Logger logger = LoggerFactory.getLogger(LibraryFileRefreshWorker.class);

    static final String DEVICE_ID = "Library Import";
    static final String SIDECAR_EXTENSION = ".xmp";

    private final LibraryCatalog catalog;
    private final MimeTypeClassifier classifier;
    private final JobQueue jobQueue;
    private final PathLockRegistry locks;

    public LibraryFileRefreshWorker(final LibraryCatalog catalog, final MimeTypeClassifier classifier,
                                    final JobQueue jobQueue, final PathLockRegistry locks) {
        this.catalog = catalog;
        this.classifier = classifier;
        this.jobQueue = jobQueue;
        this.locks = locks;
    }

    @Override
    public boolean handle(final LibraryJob job) throws IOException {
        final Lock lock = locks.lockFor(job.libraryId(), job.assetPath());
        lock.lock();
        try {
            return refresh(job);
        } finally {
            lock.unlock();
        }
    }

    private boolean refresh(final LibraryJob job) throws IOException {
        final Asset existing = catalog.getAssetByLibraryAndPath(job.libraryId(), job.assetPath()).orElse(null);
        final Path file = Path.of(job.assetPath());

        final BasicFileAttributes attributes;
        try {
            attributes = Files.readAttributes(file, BasicFileAttributes.class);
        } catch (final IOException e) {
            if (existing != null) {
                logger.info("Cannot access {}, marking asset {} offline", job.assetPath(), existing.id());
                catalog.updateAsset(existing.id(), AssetUpdate.offline(true));
                return true;
            }
            throw new InvalidRequestException("Can't access file " + job.assetPath(), e);
        }

        if (existing != null && existing.offline()) {
            logger.info("Asset {} is back online: {}", existing.id(), job.assetPath());
            catalog.updateAsset(existing.id(), AssetUpdate.offline(false));
        }

        final Instant modifiedAt = toMillis(attributes.lastModifiedTime().toInstant());
        final boolean doImport = job.forceRefresh()
                || existing == null
                || !modifiedAt.equals(existing.fileModifiedAt());

        if (!doImport) {
            logger.debug("Unchanged, skipping import of {}", job.assetPath());
            return true;
        }

        importFile(job, file, attributes, modifiedAt, existing);
        return true;
    }

    private void importFile(final LibraryJob job, final Path file, final BasicFileAttributes attributes,
                            final Instant modifiedAt, final @Nullable Asset existing) throws IOException {
        final String mimeType = classifier.detect(file)
                .orElseThrow(() -> new UnprocessableAssetException("Cannot determine mime type of asset: " + job.assetPath()));
        final MimeClass mimeClass = classifier.classify(mimeType);
        if (!mimeClass.isAsset()) {
            throw new UnprocessableAssetException("Unsupported file type " + mimeType);
        }

        final HashCode checksum = checksum(file);
        final String deviceAssetId = (file.getFileName() + "-" + attributes.size()).replaceAll("\\s+", "");
        final AssetType type = AssetType.of(mimeClass);
        final Instant createdAt = toMillis(attributes.creationTime().toInstant());

        // The sidecar keeps the full file name, IMG_1.jpg pairs with IMG_1.jpg.xmp
        final Path sidecar = Path.of(job.assetPath() + SIDECAR_EXTENSION);
        final @Nullable String sidecarPath = Files.isReadable(sidecar) ? sidecar.toString() : null;

        final Asset asset;
        if (existing == null) {
            asset = catalog.createAsset(new NewAsset(
                    job.ownerId(),
                    job.libraryId(),
                    job.assetPath(),
                    MoreFiles.getNameWithoutExtension(file),
                    deviceAssetId,
                    DEVICE_ID,
                    checksum,
                    type,
                    createdAt,
                    modifiedAt,
                    false,
                    sidecarPath,
                    true));
            logger.info("Imported {} as {} asset {}", job.assetPath(), type, asset.id());
        } else {
            asset = catalog.updateAsset(existing.id(), AssetUpdate.builder()
                    .checksum(checksum)
                    .deviceAssetId(deviceAssetId)
                    .type(type)
                    .fileCreatedAt(createdAt)
                    .fileModifiedAt(modifiedAt)
                    .offline(false)
                    .readOnly(true)
                    .sidecarPath(sidecarPath)
                    .build());
            logger.info("Re-imported {} into asset {}", job.assetPath(), asset.id());
        }

        jobQueue.enqueue(JobName.METADATA_EXTRACTION, new AssetJob(asset.id()));
        if (asset.type() == AssetType.VIDEO) {
            jobQueue.enqueue(JobName.VIDEO_CONVERSION, new AssetJob(asset.id()));
        }
    }

    // SHA-1 is the catalog's content checksum, not a security boundary
    @SuppressWarnings("deprecation")
    private static HashCode checksum(final Path file) throws IOException {
        return MoreFiles.asByteSource(file).hash(Hashing.sha1());
    }

    private static Instant toMillis(final Instant instant) {
        return instant.truncatedTo(ChronoUnit.MILLIS);
    }
}
