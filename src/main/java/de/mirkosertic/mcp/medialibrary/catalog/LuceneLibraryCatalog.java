package de.mirkosertic.mcp.medialibrary.catalog;

import com.google.common.hash.HashCode;
import com.google.common.util.concurrent.Striped;
import de.mirkosertic.mcp.medialibrary.library.NotFoundException;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.apache.lucene.util.BytesRef;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;

/**
 * Catalog stored in a Lucene index. Libraries and assets are documents distinguished by
 * {@code doc_type}; every field is indexed verbatim or only stored, nothing is analyzed.
 * <p>
 * Each write refreshes the {@link SearcherManager} before it returns, so a read that follows
 * a write always sees it. Commits happen on a timer (or after every write when the interval
 * is not positive) and on {@link #close()}.
 */
public class LuceneLibraryCatalog implements LibraryCatalog {

    private static final Logger logger = LoggerFactory.getLogger(LuceneLibraryCatalog.class);

    static final String DOC_TYPE = "doc_type";
    static final String TYPE_LIBRARY = "library";
    static final String TYPE_ASSET = "asset";

    static final String ID = "id";
    static final String OWNER_ID = "owner_id";

    // Library fields
    static final String NAME = "name";
    static final String LIBRARY_TYPE = "library_type";
    static final String IMPORT_PATH = "import_path";
    static final String VISIBLE = "visible";

    // Asset fields
    static final String LIBRARY_ID = "library_id";
    static final String LIBRARY_PATH_KEY = "library_path_key";
    static final String ORIGINAL_PATH = "original_path";
    static final String ORIGINAL_FILE_NAME = "original_file_name";
    static final String DEVICE_ASSET_ID = "device_asset_id";
    static final String DEVICE_ID = "device_id";
    static final String CHECKSUM = "checksum";
    static final String ASSET_TYPE = "asset_type";
    static final String FILE_CREATED_AT = "file_created_at";
    static final String FILE_MODIFIED_AT = "file_modified_at";
    static final String OFFLINE = "offline";
    static final String SIDECAR_PATH = "sidecar_path";
    static final String READ_ONLY = "read_only";

    private final Directory directory;
    private final long commitIntervalMs;
    private final Striped<Lock> writeLocks = Striped.lazyWeakLock(64);

    private IndexWriter indexWriter;
    private SearcherManager searcherManager;
    private ScheduledExecutorService commitTimer;

    public LuceneLibraryCatalog(final Directory directory, final long commitIntervalMs) {
        this.directory = directory;
        this.commitIntervalMs = commitIntervalMs;
    }

    /**
     * Create a catalog on disk. The directory is created if it does not exist yet.
     */
    public static LuceneLibraryCatalog open(final Path catalogPath, final long commitIntervalMs) throws IOException {
        if (!Files.exists(catalogPath)) {
            Files.createDirectories(catalogPath);
            logger.info("Created catalog directory: {}", catalogPath.toAbsolutePath());
        }
        return new LuceneLibraryCatalog(FSDirectory.open(catalogPath), commitIntervalMs);
    }

    /**
     * Open the index. Must be called before using the catalog.
     */
    public void init() throws IOException {
        final IndexWriterConfig config = new IndexWriterConfig();
        config.setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
        indexWriter = new IndexWriter(directory, config);
        indexWriter.commit();

        searcherManager = new SearcherManager(indexWriter, null);

        if (commitIntervalMs > 0) {
            commitTimer = Executors.newSingleThreadScheduledExecutor(r -> {
                final Thread t = new Thread(r, "catalog-commit");
                t.setDaemon(true);
                return t;
            });
            commitTimer.scheduleAtFixedRate(this::periodicCommit, commitIntervalMs, commitIntervalMs,
                    TimeUnit.MILLISECONDS);
        }

        logger.info("Catalog opened with {} documents, commit interval {}ms",
                indexWriter.getDocStats().numDocs, commitIntervalMs);
    }

    private void periodicCommit() {
        try {
            if (indexWriter.hasUncommittedChanges()) {
                indexWriter.commit();
            }
        } catch (final IOException e) {
            logger.error("Error during periodic catalog commit", e);
        }
    }

    public void close() throws IOException {
        if (commitTimer != null) {
            commitTimer.shutdown();
            try {
                if (!commitTimer.awaitTermination(5, TimeUnit.SECONDS)) {
                    commitTimer.shutdownNow();
                }
            } catch (final InterruptedException e) {
                commitTimer.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        if (searcherManager != null) {
            searcherManager.close();
        }
        if (indexWriter != null) {
            indexWriter.commit();
            indexWriter.close();
        }
        directory.close();
        logger.info("Catalog closed");
    }

    // ==================== Libraries ====================

    @Override
    public Optional<Library> getLibrary(final String libraryId) throws IOException {
        return findFirst(typed(TYPE_LIBRARY, new TermQuery(new Term(ID, libraryId))))
                .map(LuceneLibraryCatalog::toLibrary);
    }

    @Override
    public List<Library> getLibrariesByOwner(final String ownerId) throws IOException {
        final List<Library> libraries = new ArrayList<>();
        for (final Document document : findAll(typed(TYPE_LIBRARY, new TermQuery(new Term(OWNER_ID, ownerId))))) {
            libraries.add(toLibrary(document));
        }
        libraries.sort(Comparator.comparing(Library::name));
        return libraries;
    }

    @Override
    public long countLibrariesByOwner(final String ownerId) throws IOException {
        final IndexSearcher searcher = searcherManager.acquire();
        try {
            return searcher.count(typed(TYPE_LIBRARY, new TermQuery(new Term(OWNER_ID, ownerId))));
        } finally {
            searcherManager.release(searcher);
        }
    }

    @Override
    public Library createLibrary(final NewLibrary newLibrary) throws IOException {
        final Library library = new Library(UUID.randomUUID().toString(), newLibrary.ownerId(), newLibrary.name(),
                newLibrary.type(), List.of(), newLibrary.visible());
        indexWriter.updateDocument(new Term(ID, library.id()), toDocument(library));
        afterWrite();
        logger.info("Created {} library '{}' with id {}", library.type(), library.name(), library.id());
        return library;
    }

    @Override
    public Library setLibraryImportPaths(final String libraryId, final List<String> importPaths) throws IOException {
        final Lock lock = writeLocks.get(TYPE_LIBRARY + ':' + libraryId);
        lock.lock();
        try {
            final Library current = getLibrary(libraryId)
                    .orElseThrow(() -> new NotFoundException("Library not found: " + libraryId));
            final Library updated = new Library(current.id(), current.ownerId(), current.name(), current.type(),
                    importPaths, current.visible());
            indexWriter.updateDocument(new Term(ID, libraryId), toDocument(updated));
            afterWrite();
            return updated;
        } finally {
            lock.unlock();
        }
    }

    // ==================== Assets ====================

    @Override
    public Optional<Asset> getAsset(final String assetId) throws IOException {
        return findFirst(typed(TYPE_ASSET, new TermQuery(new Term(ID, assetId))))
                .map(LuceneLibraryCatalog::toAsset);
    }

    @Override
    public List<Asset> getAssetsByLibrary(final Collection<String> libraryIds) throws IOException {
        if (libraryIds.isEmpty()) {
            return List.of();
        }
        final BooleanQuery.Builder anyLibrary = new BooleanQuery.Builder();
        for (final String libraryId : libraryIds) {
            anyLibrary.add(new TermQuery(new Term(LIBRARY_ID, libraryId)), BooleanClause.Occur.SHOULD);
        }
        anyLibrary.setMinimumNumberShouldMatch(1);

        final List<Asset> assets = new ArrayList<>();
        for (final Document document : findAll(typed(TYPE_ASSET, anyLibrary.build()))) {
            assets.add(toAsset(document));
        }
        return assets;
    }

    @Override
    public Optional<Asset> getAssetByLibraryAndPath(final String libraryId, final String originalPath) throws IOException {
        return findFirst(new TermQuery(new Term(LIBRARY_PATH_KEY, pathKey(libraryId, originalPath))))
                .map(LuceneLibraryCatalog::toAsset);
    }

    @Override
    public Asset createAsset(final NewAsset newAsset) throws IOException {
        final String key = pathKey(newAsset.libraryId(), newAsset.originalPath());
        final Lock lock = writeLocks.get(key);
        lock.lock();
        try {
            final String id = getAssetByLibraryAndPath(newAsset.libraryId(), newAsset.originalPath())
                    .map(Asset::id)
                    .orElseGet(() -> UUID.randomUUID().toString());
            final Asset asset = newAsset.withId(id);
            indexWriter.updateDocument(new Term(LIBRARY_PATH_KEY, key), toDocument(asset));
            afterWrite();
            return asset;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Asset updateAsset(final String assetId, final AssetUpdate update) throws IOException {
        final Asset located = getAsset(assetId)
                .orElseThrow(() -> new NotFoundException("Asset not found: " + assetId));
        final Lock lock = writeLocks.get(pathKey(located.libraryId(), located.originalPath()));
        lock.lock();
        try {
            // Re-read under the lock, the record may have changed since it was located
            final Asset current = getAsset(assetId)
                    .orElseThrow(() -> new NotFoundException("Asset not found: " + assetId));
            final Asset updated = update.applyTo(current);
            indexWriter.updateDocument(new Term(ID, assetId), toDocument(updated));
            afterWrite();
            logger.debug("Updated asset {} with {}", assetId, update);
            return updated;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void deleteAsset(final String assetId) throws IOException {
        final Optional<Asset> located = getAsset(assetId);
        if (located.isEmpty()) {
            return;
        }
        // Same stripe as updateAsset, so an update cannot write the record back after the delete
        final Lock lock = writeLocks.get(pathKey(located.get().libraryId(), located.get().originalPath()));
        lock.lock();
        try {
            indexWriter.deleteDocuments(new Term(ID, assetId));
            afterWrite();
            logger.debug("Deleted asset {}", assetId);
        } finally {
            lock.unlock();
        }
    }

    // ==================== Index plumbing ====================

    private void afterWrite() throws IOException {
        searcherManager.maybeRefreshBlocking();
        if (commitIntervalMs <= 0) {
            indexWriter.commit();
        }
    }

    private static Query typed(final String docType, final Query query) {
        return new BooleanQuery.Builder()
                .add(new TermQuery(new Term(DOC_TYPE, docType)), BooleanClause.Occur.FILTER)
                .add(query, BooleanClause.Occur.FILTER)
                .build();
    }

    private Optional<Document> findFirst(final Query query) throws IOException {
        final IndexSearcher searcher = searcherManager.acquire();
        try {
            final TopDocs topDocs = searcher.search(query, 1);
            if (topDocs.scoreDocs.length == 0) {
                return Optional.empty();
            }
            return Optional.of(searcher.storedFields().document(topDocs.scoreDocs[0].doc));
        } finally {
            searcherManager.release(searcher);
        }
    }

    private List<Document> findAll(final Query query) throws IOException {
        final IndexSearcher searcher = searcherManager.acquire();
        try {
            final int limit = Math.max(1, searcher.getIndexReader().maxDoc());
            final TopDocs topDocs = searcher.search(query, limit);
            final StoredFields storedFields = searcher.storedFields();
            final List<Document> documents = new ArrayList<>(topDocs.scoreDocs.length);
            for (final ScoreDoc scoreDoc : topDocs.scoreDocs) {
                documents.add(storedFields.document(scoreDoc.doc));
            }
            return documents;
        } finally {
            searcherManager.release(searcher);
        }
    }

    static String pathKey(final String libraryId, final String originalPath) {
        return libraryId + '\u0000' + originalPath;
    }

    // ==================== Document mapping ====================

    private static Document toDocument(final Library library) {
        final Document doc = new Document();
        doc.add(new StringField(DOC_TYPE, TYPE_LIBRARY, Field.Store.YES));
        doc.add(new StringField(ID, library.id(), Field.Store.YES));
        doc.add(new StringField(OWNER_ID, library.ownerId(), Field.Store.YES));
        doc.add(new StoredField(NAME, library.name()));
        doc.add(new StoredField(LIBRARY_TYPE, library.type().name()));
        // Stored values keep their insertion order, which preserves the declared path order
        for (final String importPath : library.importPaths()) {
            doc.add(new StoredField(IMPORT_PATH, importPath));
        }
        doc.add(new StoredField(VISIBLE, Boolean.toString(library.visible())));
        return doc;
    }

    private static Library toLibrary(final Document doc) {
        return new Library(
                doc.get(ID),
                doc.get(OWNER_ID),
                doc.get(NAME),
                LibraryType.valueOf(doc.get(LIBRARY_TYPE)),
                Arrays.asList(doc.getValues(IMPORT_PATH)),
                Boolean.parseBoolean(doc.get(VISIBLE)));
    }

    private static Document toDocument(final Asset asset) {
        final Document doc = new Document();
        doc.add(new StringField(DOC_TYPE, TYPE_ASSET, Field.Store.YES));
        doc.add(new StringField(ID, asset.id(), Field.Store.YES));
        doc.add(new StringField(OWNER_ID, asset.ownerId(), Field.Store.YES));
        doc.add(new StringField(LIBRARY_ID, asset.libraryId(), Field.Store.YES));
        doc.add(new StringField(LIBRARY_PATH_KEY, pathKey(asset.libraryId(), asset.originalPath()), Field.Store.NO));
        doc.add(new StringField(ORIGINAL_PATH, asset.originalPath(), Field.Store.YES));
        doc.add(new StoredField(ORIGINAL_FILE_NAME, asset.originalFileName()));
        doc.add(new StoredField(DEVICE_ASSET_ID, asset.deviceAssetId()));
        doc.add(new StoredField(DEVICE_ID, asset.deviceId()));
        doc.add(new StoredField(CHECKSUM, asset.checksum().asBytes()));
        doc.add(new StringField(ASSET_TYPE, asset.type().name(), Field.Store.YES));
        doc.add(new StoredField(FILE_CREATED_AT, asset.fileCreatedAt().toEpochMilli()));
        doc.add(new StoredField(FILE_MODIFIED_AT, asset.fileModifiedAt().toEpochMilli()));
        doc.add(new StringField(OFFLINE, Boolean.toString(asset.offline()), Field.Store.YES));
        if (asset.sidecarPath() != null) {
            doc.add(new StoredField(SIDECAR_PATH, asset.sidecarPath()));
        }
        doc.add(new StoredField(READ_ONLY, Boolean.toString(asset.readOnly())));
        return doc;
    }

    private static Asset toAsset(final Document doc) {
        final BytesRef checksum = doc.getBinaryValue(CHECKSUM);
        final @Nullable String sidecarPath = doc.get(SIDECAR_PATH);
        return new Asset(
                doc.get(ID),
                doc.get(OWNER_ID),
                doc.get(LIBRARY_ID),
                doc.get(ORIGINAL_PATH),
                doc.get(ORIGINAL_FILE_NAME),
                doc.get(DEVICE_ASSET_ID),
                doc.get(DEVICE_ID),
                HashCode.fromBytes(Arrays.copyOfRange(checksum.bytes, checksum.offset, checksum.offset + checksum.length)),
                AssetType.valueOf(doc.get(ASSET_TYPE)),
                Instant.ofEpochMilli(doc.getField(FILE_CREATED_AT).numericValue().longValue()),
                Instant.ofEpochMilli(doc.getField(FILE_MODIFIED_AT).numericValue().longValue()),
                Boolean.parseBoolean(doc.get(OFFLINE)),
                sidecarPath,
                Boolean.parseBoolean(doc.get(READ_ONLY)));
    }
}
