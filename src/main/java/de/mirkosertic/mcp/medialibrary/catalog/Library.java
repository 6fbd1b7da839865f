package de.mirkosertic.mcp.medialibrary.catalog;

import java.util.List;

/**
 * A library as stored in the catalog.
 * <p>
 * Import paths are kept in the order the operator declared them.
 */
public record Library(
        String id,
        String ownerId,
        String name,
        LibraryType type,
        List<String> importPaths,
        boolean visible
) {
    public Library {
        importPaths = List.copyOf(importPaths);
    }

    public boolean isImportLibrary() {
        return type == LibraryType.IMPORT;
    }
}
