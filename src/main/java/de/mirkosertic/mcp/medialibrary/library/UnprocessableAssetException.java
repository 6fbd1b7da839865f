package de.mirkosertic.mcp.medialibrary.library;

/**
 * A file cannot be imported because its MIME type is unknown or not a supported media type.
 * Fails only the job for that file.
 */
public class UnprocessableAssetException extends LibraryException {

    public UnprocessableAssetException(final String message) {
        super(message);
    }
}
