package de.mirkosertic.mcp.medialibrary.library;

/**
 * @param forceRefresh re-import every file found on disk, changed or not
 * @param emptyTrash   delete assets whose file disappeared instead of marking them offline
 */
public record RefreshOptions(boolean forceRefresh, boolean emptyTrash) {

    public static RefreshOptions defaults() {
        return new RefreshOptions(false, false);
    }
}
