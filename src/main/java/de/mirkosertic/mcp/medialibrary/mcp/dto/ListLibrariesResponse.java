package de.mirkosertic.mcp.medialibrary.mcp.dto;

import de.mirkosertic.mcp.medialibrary.catalog.Library;
import de.mirkosertic.mcp.medialibrary.mcp.ToolResponse;

import java.util.List;

public record ListLibrariesResponse(
        boolean success,
        String ownerId,
        long count,
        List<Library> libraries,
        String error
) implements ToolResponse {

    public static ListLibrariesResponse success(final String ownerId, final long count, final List<Library> libraries) {
        return new ListLibrariesResponse(true, ownerId, count, libraries, null);
    }

    public static ListLibrariesResponse error(final String errorMessage) {
        return new ListLibrariesResponse(false, null, 0, null, errorMessage);
    }
}
