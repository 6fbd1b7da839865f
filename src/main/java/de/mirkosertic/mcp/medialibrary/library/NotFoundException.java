package de.mirkosertic.mcp.medialibrary.library;

public class NotFoundException extends LibraryException {

    public NotFoundException(final String message) {
        super(message);
    }
}
