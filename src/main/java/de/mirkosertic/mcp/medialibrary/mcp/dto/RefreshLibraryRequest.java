package de.mirkosertic.mcp.medialibrary.mcp.dto;

import de.mirkosertic.mcp.medialibrary.library.RefreshOptions;
import de.mirkosertic.mcp.medialibrary.mcp.Description;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Request DTO for the refreshLibrary tool.
 */
public record RefreshLibraryRequest(
        @Description("Id of the import library to refresh")
        String libraryId,

        @Nullable
        @Description("Re-import every file, even if its modification time did not change. Default is false.")
        Boolean forceRefresh,

        @Nullable
        @Description("Delete assets whose files are gone instead of marking them offline. Default is false.")
        Boolean emptyTrash
) {
    public static RefreshLibraryRequest fromMap(final Map<String, Object> args) {
        return new RefreshLibraryRequest(
                (String) args.get("libraryId"),
                (Boolean) args.get("forceRefresh"),
                (Boolean) args.get("emptyTrash")
        );
    }

    public RefreshOptions toOptions() {
        return new RefreshOptions(forceRefresh != null && forceRefresh, emptyTrash != null && emptyTrash);
    }
}
