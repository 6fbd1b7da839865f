package de.mirkosertic.mcp.medialibrary.media;

import java.nio.file.Path;
import java.util.Optional;

public interface MimeTypeClassifier {

    /**
     * Resolve the MIME type of a file, empty if it cannot be determined.
     */
    Optional<String> detect(Path file);

    MimeClass classify(String mimeType);

    default MimeClass classify(final Path file) {
        return detect(file).map(this::classify).orElse(MimeClass.UNSUPPORTED);
    }
}
