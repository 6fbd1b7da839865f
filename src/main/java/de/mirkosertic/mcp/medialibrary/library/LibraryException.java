package de.mirkosertic.mcp.medialibrary.library;

/**
 * Base class of permanent failures: the request or job is invalid as such, and retrying it
 * cannot succeed. Transient problems are reported as {@link java.io.IOException} instead.
 */
public abstract class LibraryException extends RuntimeException {

    protected LibraryException(final String message) {
        super(message);
    }

    protected LibraryException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
