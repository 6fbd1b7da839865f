package de.mirkosertic.mcp.medialibrary.catalog;

/**
 * Fields required to create a library. New libraries start without import paths.
 */
public record NewLibrary(
        String ownerId,
        String name,
        LibraryType type,
        boolean visible
) {
}
