package de.mirkosertic.mcp.medialibrary.mcp.dto;

import de.mirkosertic.mcp.medialibrary.catalog.LibraryType;
import de.mirkosertic.mcp.medialibrary.library.InvalidRequestException;
import de.mirkosertic.mcp.medialibrary.mcp.Description;
import org.jspecify.annotations.Nullable;

import java.util.Locale;
import java.util.Map;

/**
 * Request DTO for the createLibrary tool.
 */
public record CreateLibraryRequest(
        @Description("Display name of the new library")
        String name,

        @Nullable
        @Description("Library type, IMPORT (files stay where they are) or UPLOAD. Default is IMPORT.")
        String type,

        @Nullable
        @Description("Owner of the library. Defaults to the configured default owner.")
        String ownerId,

        @Nullable
        @Description("Whether the library is visible in the timeline. Default is true.")
        Boolean visible
) {
    public static CreateLibraryRequest fromMap(final Map<String, Object> args) {
        return new CreateLibraryRequest(
                (String) args.get("name"),
                (String) args.get("type"),
                (String) args.get("ownerId"),
                (Boolean) args.get("visible")
        );
    }

    public LibraryType effectiveType() {
        if (type == null || type.isBlank()) {
            return LibraryType.IMPORT;
        }
        try {
            return LibraryType.valueOf(type.trim().toUpperCase(Locale.ROOT));
        } catch (final IllegalArgumentException e) {
            throw new InvalidRequestException("Unknown library type: " + type, e);
        }
    }

    public String effectiveOwnerId(final String defaultOwnerId) {
        return ownerId == null || ownerId.isBlank() ? defaultOwnerId : ownerId;
    }

    public boolean effectiveVisible() {
        return visible == null || visible;
    }
}
