package de.mirkosertic.mcp.medialibrary.job;

/**
 * Payload of the per-file library jobs.
 *
 * @param assetPath    normalized absolute path of the file
 * @param ownerId      owner of the library
 * @param libraryId    library the file belongs to
 * @param forceRefresh re-import even if the file looks unchanged
 * @param emptyTrash   delete instead of marking offline
 */
public record LibraryJob(
        String assetPath,
        String ownerId,
        String libraryId,
        boolean forceRefresh,
        boolean emptyTrash
) {
}
