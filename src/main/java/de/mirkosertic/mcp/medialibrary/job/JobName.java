package de.mirkosertic.mcp.medialibrary.job;

/**
 * Kinds of background work. Each name carries exactly one payload type.
 */
public enum JobName {
    REFRESH_LIBRARY_FILE(LibraryJob.class),
    OFFLINE_LIBRARY_FILE(LibraryJob.class),
    METADATA_EXTRACTION(AssetJob.class),
    VIDEO_CONVERSION(AssetJob.class);

    private final Class<?> payloadType;

    JobName(final Class<?> payloadType) {
        this.payloadType = payloadType;
    }

    public Class<?> payloadType() {
        return payloadType;
    }
}
