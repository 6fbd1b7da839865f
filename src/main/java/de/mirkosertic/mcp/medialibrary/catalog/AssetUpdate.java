package de.mirkosertic.mcp.medialibrary.catalog;

import com.google.common.hash.HashCode;
import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * Partial update of an asset. Only fields that were explicitly set on the builder are applied.
 */
public final class AssetUpdate {

    private final @Nullable HashCode checksum;
    private final @Nullable String deviceAssetId;
    private final @Nullable AssetType type;
    private final @Nullable Instant fileCreatedAt;
    private final @Nullable Instant fileModifiedAt;
    private final @Nullable Boolean offline;
    private final @Nullable Boolean readOnly;
    private final boolean sidecarPathSet;
    private final @Nullable String sidecarPath;

    private AssetUpdate(final Builder builder) {
        this.checksum = builder.checksum;
        this.deviceAssetId = builder.deviceAssetId;
        this.type = builder.type;
        this.fileCreatedAt = builder.fileCreatedAt;
        this.fileModifiedAt = builder.fileModifiedAt;
        this.offline = builder.offline;
        this.readOnly = builder.readOnly;
        this.sidecarPathSet = builder.sidecarPathSet;
        this.sidecarPath = builder.sidecarPath;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static AssetUpdate offline(final boolean offline) {
        return builder().offline(offline).build();
    }

    public @Nullable Boolean offline() {
        return offline;
    }

    Asset applyTo(final Asset asset) {
        return new Asset(
                asset.id(),
                asset.ownerId(),
                asset.libraryId(),
                asset.originalPath(),
                asset.originalFileName(),
                deviceAssetId != null ? deviceAssetId : asset.deviceAssetId(),
                asset.deviceId(),
                checksum != null ? checksum : asset.checksum(),
                type != null ? type : asset.type(),
                fileCreatedAt != null ? fileCreatedAt : asset.fileCreatedAt(),
                fileModifiedAt != null ? fileModifiedAt : asset.fileModifiedAt(),
                offline != null ? offline : asset.offline(),
                sidecarPathSet ? sidecarPath : asset.sidecarPath(),
                readOnly != null ? readOnly : asset.readOnly());
    }

    @Override
    public String toString() {
        return "AssetUpdate{checksum=" + checksum
                + ", deviceAssetId=" + deviceAssetId
                + ", type=" + type
                + ", fileModifiedAt=" + fileModifiedAt
                + ", offline=" + offline
                + (sidecarPathSet ? ", sidecarPath=" + sidecarPath : "")
                + "}";
    }

    public static final class Builder {

        private @Nullable HashCode checksum;
        private @Nullable String deviceAssetId;
        private @Nullable AssetType type;
        private @Nullable Instant fileCreatedAt;
        private @Nullable Instant fileModifiedAt;
        private @Nullable Boolean offline;
        private @Nullable Boolean readOnly;
        private boolean sidecarPathSet;
        private @Nullable String sidecarPath;

        private Builder() {
        }

        public Builder checksum(final HashCode checksum) {
            this.checksum = checksum;
            return this;
        }

        public Builder deviceAssetId(final String deviceAssetId) {
            this.deviceAssetId = deviceAssetId;
            return this;
        }

        public Builder type(final AssetType type) {
            this.type = type;
            return this;
        }

        public Builder fileCreatedAt(final Instant fileCreatedAt) {
            this.fileCreatedAt = fileCreatedAt;
            return this;
        }

        public Builder fileModifiedAt(final Instant fileModifiedAt) {
            this.fileModifiedAt = fileModifiedAt;
            return this;
        }

        public Builder offline(final boolean offline) {
            this.offline = offline;
            return this;
        }

        public Builder readOnly(final boolean readOnly) {
            this.readOnly = readOnly;
            return this;
        }

        /**
         * Set or clear (with {@code null}) the sidecar path.
         */
        public Builder sidecarPath(final @Nullable String sidecarPath) {
            this.sidecarPathSet = true;
            this.sidecarPath = sidecarPath;
            return this;
        }

        public AssetUpdate build() {
            return new AssetUpdate(this);
        }
    }
}
