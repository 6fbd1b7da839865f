package de.mirkosertic.mcp.medialibrary.media;

import org.apache.tika.Tika;
import org.apache.tika.mime.MimeTypes;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Name based MIME detection through Tika's registry. File contents are never read, so
 * classification is cheap enough to run for every crawled file.
 */
public class TikaMimeTypeClassifier implements MimeTypeClassifier {

    private final Tika tika = new Tika();

    @Override
    public Optional<String> detect(final Path file) {
        final Path fileName = file.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        final String mimeType = tika.detect(fileName.toString());
        if (mimeType == null || MimeTypes.OCTET_STREAM.equals(mimeType)) {
            return Optional.empty();
        }
        return Optional.of(mimeType);
    }

    @Override
    public MimeClass classify(final String mimeType) {
        final int slash = mimeType.indexOf('/');
        if (slash <= 0) {
            return MimeClass.UNSUPPORTED;
        }
        return switch (mimeType.substring(0, slash).toLowerCase(Locale.ROOT)) {
            case "image" -> MimeClass.IMAGE;
            case "video" -> MimeClass.VIDEO;
            case "audio" -> MimeClass.AUDIO;
            default -> MimeClass.OTHER;
        };
    }
}
