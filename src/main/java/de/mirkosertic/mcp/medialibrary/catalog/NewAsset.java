package de.mirkosertic.mcp.medialibrary.catalog;

import com.google.common.hash.HashCode;
import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * Fields of an asset about to be created; the catalog assigns the id.
 */
public record NewAsset(
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

    Asset withId(final String id) {
        return new Asset(id, ownerId, libraryId, originalPath, originalFileName, deviceAssetId, deviceId,
                checksum, type, fileCreatedAt, fileModifiedAt, offline, sidecarPath, readOnly);
    }
}
