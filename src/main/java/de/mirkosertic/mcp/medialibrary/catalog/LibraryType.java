package de.mirkosertic.mcp.medialibrary.catalog;

public enum LibraryType {
    /** Assets are discovered by crawling the library's import paths. */
    IMPORT,
    /** Assets are uploaded by clients; such libraries are never refreshed. */
    UPLOAD
}
