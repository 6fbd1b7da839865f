package de.mirkosertic.mcp.medialibrary.crawler;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.Streams;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.Iterator;
import java.util.stream.Stream;

/**
 * Walks import roots and yields the media candidates below them.
 * <p>
 * The walk is lazy: directories are opened one at a time while the returned stream is consumed,
 * so memory does not grow with the size of the tree. The stream must be closed to release the
 * directory handle that is open at that moment.
 * <p>
 * Rules:
 * <ul>
 *     <li>a root that is missing or not a directory is skipped with a warning</li>
 *     <li>a directory that cannot be opened or read is skipped together with its subtree</li>
 *     <li>symbolic links to directories are not followed, links to regular files are yielded</li>
 * </ul>
 * Output order is unspecified.
 */
public class LibraryCrawler {

    private static final Logger logger = LoggerFactory.getLogger(LibraryCrawler.class);

    private final MediaFileMatcher matcher;

    public LibraryCrawler(final MediaFileMatcher matcher) {
        this.matcher = matcher;
    }

    public Stream<Path> crawl(final Collection<String> roots) {
        final CrawlIterator iterator = new CrawlIterator(roots);
        return Streams.stream(iterator).onClose(iterator::close);
    }

    private record PendingDirectory(Path directory, boolean root) {
    }

    private final class CrawlIterator extends AbstractIterator<Path> {

        private final Deque<PendingDirectory> pending = new ArrayDeque<>();
        private @Nullable DirectoryStream<Path> currentStream;
        private @Nullable Iterator<Path> currentEntries;
        private @Nullable Path currentDirectory;

        CrawlIterator(final Collection<String> roots) {
            for (final String root : roots) {
                pending.add(new PendingDirectory(Path.of(root).toAbsolutePath().normalize(), true));
            }
        }

        @Override
        protected Path computeNext() {
            while (true) {
                if (currentEntries != null) {
                    final Path next = nextFromCurrentDirectory();
                    if (next != null) {
                        return next;
                    }
                    closeCurrent();
                }

                final PendingDirectory next = pending.poll();
                if (next == null) {
                    return endOfData();
                }
                open(next);
            }
        }

        private @Nullable Path nextFromCurrentDirectory() {
            try {
                while (currentEntries.hasNext()) {
                    final Path entry = currentEntries.next();
                    final BasicFileAttributes attributes;
                    try {
                        attributes = Files.readAttributes(entry, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
                    } catch (final IOException e) {
                        logger.debug("Cannot stat {}, skipping: {}", entry, e.getMessage());
                        continue;
                    }

                    if (attributes.isDirectory()) {
                        pending.push(new PendingDirectory(entry, false));
                    } else if (attributes.isSymbolicLink()) {
                        if (Files.isRegularFile(entry) && matcher.shouldInclude(entry)) {
                            return entry;
                        }
                    } else if (attributes.isRegularFile() && matcher.shouldInclude(entry)) {
                        return entry;
                    }
                }
            } catch (final DirectoryIteratorException e) {
                logger.warn("Error reading directory {}, skipping the rest of it: {}",
                        currentDirectory, e.getCause().getMessage());
            }
            return null;
        }

        private void open(final PendingDirectory pendingDirectory) {
            final Path directory = pendingDirectory.directory();
            if (pendingDirectory.root() && !Files.isDirectory(directory)) {
                logger.warn("Import path {} does not exist or is not a directory, skipping", directory);
                return;
            }
            try {
                currentStream = Files.newDirectoryStream(directory);
                currentEntries = currentStream.iterator();
                currentDirectory = directory;
            } catch (final IOException e) {
                logger.warn("Cannot open directory {}, skipping subtree: {}", directory, e.getMessage());
            }
        }

        private void closeCurrent() {
            if (currentStream != null) {
                try {
                    currentStream.close();
                } catch (final IOException e) {
                    logger.debug("Error closing directory stream for {}", currentDirectory, e);
                }
            }
            currentStream = null;
            currentEntries = null;
            currentDirectory = null;
        }

        void close() {
            closeCurrent();
            pending.clear();
        }
    }
}
