package de.mirkosertic.mcp.medialibrary.library;

import de.mirkosertic.mcp.medialibrary.catalog.Library;
import de.mirkosertic.mcp.medialibrary.catalog.LibraryCatalog;
import de.mirkosertic.mcp.medialibrary.catalog.LibraryType;
import de.mirkosertic.mcp.medialibrary.catalog.NewLibrary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Library level operations: creation, lookup, import path management and refresh.
 * <p>
 * A library's import paths cannot change while a refresh of that library is running, and two
 * refreshes of the same library never overlap.
 */
public class LibraryService {

    private static final Logger logger = LoggerFactory.getLogger(LibraryService.class);

    private final LibraryCatalog catalog;
    private final LibraryReconciler reconciler;
    private final Set<String> refreshesInFlight = new HashSet<>();

    public LibraryService(final LibraryCatalog catalog, final LibraryReconciler reconciler) {
        this.catalog = catalog;
        this.reconciler = reconciler;
    }

    public Library create(final String ownerId, final String name, final LibraryType type,
                          final boolean visible) throws IOException {
        if (ownerId == null || ownerId.isBlank()) {
            throw new InvalidRequestException("Owner id is required");
        }
        if (name == null || name.isBlank()) {
            throw new InvalidRequestException("Library name is required");
        }
        return catalog.createLibrary(new NewLibrary(ownerId, name.trim(), type, visible));
    }

    public Library get(final String libraryId) throws IOException {
        return catalog.getLibrary(libraryId)
                .orElseThrow(() -> new NotFoundException("Library not found: " + libraryId));
    }

    public List<Library> getAll(final String ownerId) throws IOException {
        return catalog.getLibrariesByOwner(ownerId);
    }

    public long getCount(final String ownerId) throws IOException {
        return catalog.countLibrariesByOwner(ownerId);
    }

    public List<String> getImportPaths(final String libraryId) throws IOException {
        return get(libraryId).importPaths();
    }

    /**
     * Replace the import paths of an import library. Entries are trimmed, blank entries dropped
     * and duplicates removed keeping the first occurrence. Paths are not checked for existence,
     * a missing path is reported by the next refresh.
     */
    public Library setImportPaths(final String libraryId, final List<String> importPaths) throws IOException {
        final Library library = get(libraryId);
        if (!library.isImportLibrary()) {
            throw new InvalidRequestException("Can only set import paths on an import library");
        }

        final Set<String> cleaned = new LinkedHashSet<>();
        for (final String path : importPaths) {
            if (path != null && !path.isBlank()) {
                cleaned.add(path.trim());
            }
        }

        synchronized (refreshesInFlight) {
            if (refreshesInFlight.contains(libraryId)) {
                throw new InvalidRequestException("Library " + libraryId + " is being refreshed, try again later");
            }
            final Library updated = catalog.setLibraryImportPaths(libraryId, new ArrayList<>(cleaned));
            logger.info("Library {} import paths set to {}", libraryId, updated.importPaths());
            return updated;
        }
    }

    /**
     * Crawl the library's import paths and enqueue per-file jobs.
     *
     * @throws NotFoundException       if the library does not exist
     * @throws InvalidRequestException if it is not an import library or is already being refreshed
     */
    public ReconciliationResult refresh(final String libraryId, final RefreshOptions options) throws IOException {
        synchronized (refreshesInFlight) {
            if (!refreshesInFlight.add(libraryId)) {
                throw new InvalidRequestException("Library " + libraryId + " is already being refreshed");
            }
        }
        try {
            // Read under the in-flight marker so the import paths cannot change during the pass
            final Library library = get(libraryId);
            logger.info("Refreshing library {} ({}), forceRefresh={}, emptyTrash={}",
                    library.id(), library.name(), options.forceRefresh(), options.emptyTrash());
            return reconciler.reconcile(library, options.forceRefresh(), options.emptyTrash());
        } finally {
            synchronized (refreshesInFlight) {
                refreshesInFlight.remove(libraryId);
            }
        }
    }

    public boolean isRefreshing(final String libraryId) {
        synchronized (refreshesInFlight) {
            return refreshesInFlight.contains(libraryId);
        }
    }
}
