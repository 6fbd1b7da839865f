package de.mirkosertic.mcp.medialibrary.library;

import java.util.Set;

/**
 * Outcome of one library refresh pass.
 */
public record ReconciliationResult(
        String libraryId,
        /** Paths found on disk, each received a refresh job. */
        Set<String> pathsToRefresh,
        /** Cataloged paths not found on disk, each received an offline job. */
        Set<String> pathsToMarkOffline,
        /** Wall-clock time in milliseconds spent crawling and diffing. */
        long reconciliationTimeMs
) {
    public ReconciliationResult {
        pathsToRefresh = Set.copyOf(pathsToRefresh);
        pathsToMarkOffline = Set.copyOf(pathsToMarkOffline);
    }

    public int jobsEmitted() {
        return pathsToRefresh.size() + pathsToMarkOffline.size();
    }
}
