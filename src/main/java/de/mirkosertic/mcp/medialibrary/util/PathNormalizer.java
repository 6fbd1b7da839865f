package de.mirkosertic.mcp.medialibrary.util;

import java.nio.file.Path;

/**
 * Canonical string form of a filesystem path: absolute, with "." and ".." segments removed.
 * Symbolic links are not resolved, so two spellings of the same location compare equal only
 * when they differ lexically.
 */
public final class PathNormalizer {

    private PathNormalizer() {
    }

    public static String normalize(final String path) {
        return normalize(Path.of(path));
    }

    public static String normalize(final Path path) {
        return path.toAbsolutePath().normalize().toString();
    }
}
