package de.mirkosertic.mcp.medialibrary.catalog;

import de.mirkosertic.mcp.medialibrary.media.MimeClass;

public enum AssetType {
    IMAGE,
    VIDEO,
    AUDIO,
    OTHER;

    /**
     * Derive the asset type from the top-level class of a MIME type.
     */
    public static AssetType of(final MimeClass mimeClass) {
        return switch (mimeClass) {
            case IMAGE -> IMAGE;
            case VIDEO -> VIDEO;
            case AUDIO -> AUDIO;
            case OTHER, UNSUPPORTED -> OTHER;
        };
    }
}
