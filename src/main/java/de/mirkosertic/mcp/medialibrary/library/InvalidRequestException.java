package de.mirkosertic.mcp.medialibrary.library;

/**
 * The operation is not allowed for the given library or input, e.g. refreshing an
 * UPLOAD library or ingesting a path that can be neither read nor found in the catalog.
 */
public class InvalidRequestException extends LibraryException {

    public InvalidRequestException(final String message) {
        super(message);
    }

    public InvalidRequestException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
