package de.mirkosertic.mcp.medialibrary.mcp.dto;

import de.mirkosertic.mcp.medialibrary.catalog.Library;
import de.mirkosertic.mcp.medialibrary.mcp.ToolResponse;

/**
 * Response DTO for the tools that create or change a single library.
 */
public record LibraryResponse(
        boolean success,
        Library library,
        String error
) implements ToolResponse {

    public static LibraryResponse success(final Library library) {
        return new LibraryResponse(true, library, null);
    }

    public static LibraryResponse error(final String errorMessage) {
        return new LibraryResponse(false, null, errorMessage);
    }
}
