package de.mirkosertic.mcp.medialibrary.mcp.dto;

import de.mirkosertic.mcp.medialibrary.mcp.Description;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Request DTO for the setImportPaths tool.
 */
public record SetImportPathsRequest(
        @Description("Id of the import library")
        String libraryId,

        @Description("Absolute directory paths to crawl. Replaces the current list; an empty list removes all paths.")
        List<String> importPaths
) {
    public static SetImportPathsRequest fromMap(final Map<String, Object> args) {
        final List<String> paths = new ArrayList<>();
        if (args.get("importPaths") instanceof List<?> list) {
            for (final Object entry : list) {
                if (entry != null) {
                    paths.add(entry.toString());
                }
            }
        }
        return new SetImportPathsRequest((String) args.get("libraryId"), paths);
    }
}
