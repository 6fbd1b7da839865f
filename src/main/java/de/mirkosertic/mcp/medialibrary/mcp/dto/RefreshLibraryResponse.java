package de.mirkosertic.mcp.medialibrary.mcp.dto;

import de.mirkosertic.mcp.medialibrary.library.ReconciliationResult;
import de.mirkosertic.mcp.medialibrary.mcp.ToolResponse;

public record RefreshLibraryResponse(
        boolean success,
        String libraryId,
        int refreshJobs,
        int offlineJobs,
        long reconciliationTimeMs,
        String error
) implements ToolResponse {

    public static RefreshLibraryResponse success(final ReconciliationResult result) {
        return new RefreshLibraryResponse(true, result.libraryId(), result.pathsToRefresh().size(),
                result.pathsToMarkOffline().size(), result.reconciliationTimeMs(), null);
    }

    public static RefreshLibraryResponse error(final String errorMessage) {
        return new RefreshLibraryResponse(false, null, 0, 0, 0, errorMessage);
    }
}
