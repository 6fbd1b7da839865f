package de.mirkosertic.mcp.medialibrary.mcp.dto;

import de.mirkosertic.mcp.medialibrary.mcp.Description;
import org.jspecify.annotations.Nullable;

import java.util.Map;

public record ListLibrariesRequest(
        @Nullable
        @Description("Owner whose libraries are listed. Defaults to the configured default owner.")
        String ownerId
) {
    public static ListLibrariesRequest fromMap(final Map<String, Object> args) {
        return new ListLibrariesRequest((String) args.get("ownerId"));
    }

    public String effectiveOwnerId(final String defaultOwnerId) {
        return ownerId == null || ownerId.isBlank() ? defaultOwnerId : ownerId;
    }
}
