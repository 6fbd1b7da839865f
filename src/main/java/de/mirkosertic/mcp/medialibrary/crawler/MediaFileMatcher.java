package de.mirkosertic.mcp.medialibrary.crawler;

import de.mirkosertic.mcp.medialibrary.config.ApplicationConfig;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.Locale;

/**
 * Decides whether a crawled file is a media candidate.
 * <p>
 * Include globs are matched against the lower-cased file name, so {@code *.jpg} also accepts
 * {@code IMG_0001.JPG}. Exclude globs are matched against the full path.
 */
public class MediaFileMatcher {

    private final List<PathMatcher> includeMatchers;
    private final List<PathMatcher> excludeMatchers;

    public MediaFileMatcher(final List<String> includePatterns, final List<String> excludePatterns) {
        this.includeMatchers = includePatterns.stream()
                .map(pattern -> FileSystems.getDefault().getPathMatcher("glob:" + pattern.toLowerCase(Locale.ROOT)))
                .toList();
        this.excludeMatchers = excludePatterns.stream()
                .map(pattern -> FileSystems.getDefault().getPathMatcher("glob:" + pattern))
                .toList();
    }

    public static MediaFileMatcher fromConfig(final ApplicationConfig config) {
        return new MediaFileMatcher(config.getIncludePatterns(), config.getExcludePatterns());
    }

    public boolean isExcluded(final Path path) {
        for (final PathMatcher excludeMatcher : excludeMatchers) {
            if (excludeMatcher.matches(path)) {
                return true;
            }
        }
        return false;
    }

    public boolean shouldInclude(final Path file) {
        if (isExcluded(file)) {
            return false;
        }

        // No include patterns means every file that is not excluded
        if (includeMatchers.isEmpty()) {
            return true;
        }

        final Path fileName = file.getFileName();
        if (fileName == null) {
            return false;
        }
        final Path lowerCaseName = Path.of(fileName.toString().toLowerCase(Locale.ROOT));
        for (final PathMatcher includeMatcher : includeMatchers) {
            if (includeMatcher.matches(lowerCaseName)) {
                return true;
            }
        }

        return false;
    }
}
