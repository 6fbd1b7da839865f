package de.mirkosertic.mcp.medialibrary.media;

/**
 * Coarse classification of a MIME type.
 */
public enum MimeClass {
    IMAGE,
    VIDEO,
    AUDIO,
    OTHER,
    UNSUPPORTED;

    /**
     * Only images and videos are imported as assets.
     */
    public boolean isAsset() {
        return this == IMAGE || this == VIDEO;
    }
}
