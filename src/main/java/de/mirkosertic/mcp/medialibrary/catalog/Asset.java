package de.mirkosertic.mcp.medialibrary.catalog;

import com.google.common.hash.HashCode;
import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * A cataloged media file.
 * <p>
 * {@code originalPath} is unique within a library. Timestamps are mirrored from the
 * filesystem with millisecond precision so they can be compared with a fresh stat.
 */
public record Asset(
        String id,
        String ownerId,
        String libraryId,
        String originalPath,
        String originalFileName,
        String deviceAssetId,
        String deviceId,
        HashCode checksum,
        AssetType type,
        Instant fileCreatedAt,
        Instant fileModifiedAt,
        boolean offline,
        @Nullable String sidecarPath,
        boolean readOnly
) {
}
