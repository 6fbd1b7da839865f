package de.mirkosertic.mcp.medialibrary.catalog;

import com.google.common.hash.HashCode;
import de.mirkosertic.mcp.medialibrary.library.NotFoundException;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("LuceneLibraryCatalog Tests")
class LuceneLibraryCatalogTest {

    private static final HashCode CHECKSUM = HashCode.fromString("a94a8fe5ccb19ba61c4c0873d391e987982fbbd3");
    private static final Instant MODIFIED = Instant.ofEpochMilli(1_700_000_000_123L);

    private LuceneLibraryCatalog catalog;

    @BeforeEach
    void setUp() throws IOException {
        catalog = new LuceneLibraryCatalog(new ByteBuffersDirectory(), 0);
        catalog.init();
    }

    @AfterEach
    void tearDown() throws IOException {
        catalog.close();
    }

    static NewAsset newAsset(final String libraryId, final String path) {
        return new NewAsset("owner", libraryId, path, "a", "a.jpg-1", "Library Import", CHECKSUM,
                AssetType.IMAGE, MODIFIED, MODIFIED, false, null, true);
    }

    @Nested
    @DisplayName("Libraries")
    class Libraries {

        @Test
        @DisplayName("Should create and read back a library")
        void shouldCreateAndRead() throws IOException {
            // When
            final Library created = catalog.createLibrary(new NewLibrary("owner", "Photos", LibraryType.IMPORT, true));

            // Then
            assertThat(created.id()).isNotBlank();
            assertThat(created.importPaths()).isEmpty();
            assertThat(catalog.getLibrary(created.id())).contains(created);
        }

        @Test
        @DisplayName("Should keep import path order")
        void shouldKeepImportPathOrder() throws IOException {
            final Library library = catalog.createLibrary(new NewLibrary("owner", "Photos", LibraryType.IMPORT, true));

            catalog.setLibraryImportPaths(library.id(), List.of("/z", "/a", "/m"));

            assertThat(catalog.getLibrary(library.id()).orElseThrow().importPaths()).containsExactly("/z", "/a", "/m");
        }

        @Test
        @DisplayName("Setting paths on an unknown library fails")
        void setPathsOnUnknownLibraryFails() {
            assertThatThrownBy(() -> catalog.setLibraryImportPaths("nope", List.of("/x")))
                    .isInstanceOf(NotFoundException.class);
        }

        @Test
        @DisplayName("Should list and count libraries per owner")
        void shouldListAndCountPerOwner() throws IOException {
            catalog.createLibrary(new NewLibrary("owner", "B", LibraryType.IMPORT, true));
            catalog.createLibrary(new NewLibrary("owner", "A", LibraryType.UPLOAD, false));
            catalog.createLibrary(new NewLibrary("someone-else", "C", LibraryType.IMPORT, true));

            assertThat(catalog.getLibrariesByOwner("owner")).extracting(Library::name).containsExactly("A", "B");
            assertThat(catalog.countLibrariesByOwner("owner")).isEqualTo(2);
            assertThat(catalog.countLibrariesByOwner("nobody")).isZero();
        }
    }

    @Nested
    @DisplayName("Assets")
    class Assets {

        @Test
        @DisplayName("Should round-trip every asset field")
        void shouldRoundTripFields() throws IOException {
            // Given
            final NewAsset newAsset = new NewAsset("owner", "lib", "/media/a.jpg", "a", "a.jpg-10", "Library Import",
                    CHECKSUM, AssetType.VIDEO, Instant.ofEpochMilli(5), MODIFIED, false, "/media/a.jpg.xmp", true);

            // When
            final Asset created = catalog.createAsset(newAsset);

            // Then
            final Asset read = catalog.getAssetByLibraryAndPath("lib", "/media/a.jpg").orElseThrow();
            assertThat(read).isEqualTo(created);
            assertThat(read.checksum()).isEqualTo(CHECKSUM);
            assertThat(read.fileModifiedAt()).isEqualTo(MODIFIED);
            assertThat(read.sidecarPath()).isEqualTo("/media/a.jpg.xmp");
        }

        @Test
        @DisplayName("Creating the same path twice keeps one record and its id")
        void createIsUpsertPerPath() throws IOException {
            final Asset first = catalog.createAsset(newAsset("lib", "/media/a.jpg"));
            final Asset second = catalog.createAsset(newAsset("lib", "/media/a.jpg"));

            assertThat(second.id()).isEqualTo(first.id());
            assertThat(catalog.getAssetsByLibrary(List.of("lib"))).hasSize(1);
        }

        @Test
        @DisplayName("Same path in different libraries are different assets")
        void samePathDifferentLibraries() throws IOException {
            catalog.createAsset(newAsset("lib1", "/media/a.jpg"));
            catalog.createAsset(newAsset("lib2", "/media/a.jpg"));

            assertThat(catalog.getAssetsByLibrary(List.of("lib1"))).hasSize(1);
            assertThat(catalog.getAssetsByLibrary(List.of("lib1", "lib2"))).hasSize(2);
            assertThat(catalog.getAssetsByLibrary(List.of())).isEmpty();
        }

        @Test
        @DisplayName("Partial update changes only the given fields")
        void partialUpdate() throws IOException {
            final Asset asset = catalog.createAsset(newAsset("lib", "/media/a.jpg"));

            final Asset updated = catalog.updateAsset(asset.id(), AssetUpdate.offline(true));

            assertThat(updated.offline()).isTrue();
            assertThat(updated.checksum()).isEqualTo(asset.checksum());
            assertThat(updated.originalPath()).isEqualTo(asset.originalPath());
            assertThat(catalog.getAsset(asset.id()).orElseThrow().offline()).isTrue();
        }

        @Test
        @DisplayName("Sidecar path can be cleared")
        void sidecarCanBeCleared() throws IOException {
            final Asset asset = catalog.createAsset(new NewAsset("owner", "lib", "/m/a.jpg", "a", "d", "Library Import",
                    CHECKSUM, AssetType.IMAGE, MODIFIED, MODIFIED, false, "/m/a.jpg.xmp", true));

            catalog.updateAsset(asset.id(), AssetUpdate.builder().sidecarPath(null).build());

            assertThat(catalog.getAsset(asset.id()).orElseThrow().sidecarPath()).isNull();
        }

        @Test
        @DisplayName("Updating an unknown asset fails")
        void updateUnknownFails() {
            assertThatThrownBy(() -> catalog.updateAsset("nope", AssetUpdate.offline(true)))
                    .isInstanceOf(NotFoundException.class);
        }

        @Test
        @DisplayName("Delete removes the record")
        void deleteRemovesRecord() throws IOException {
            final Asset asset = catalog.createAsset(newAsset("lib", "/media/a.jpg"));

            catalog.deleteAsset(asset.id());

            assertThat(catalog.getAsset(asset.id())).isEmpty();
            assertThat(catalog.getAssetByLibraryAndPath("lib", "/media/a.jpg")).isEmpty();
        }

        @Test
        @DisplayName("Deleting an unknown asset is a no-op")
        void deleteUnknownIsNoOp() throws IOException {
            catalog.deleteAsset("nope");

            assertThat(catalog.getAssetsByLibrary(List.of("lib"))).isEmpty();
        }

        @Test
        @DisplayName("A concurrent update never brings a deleted asset back")
        void concurrentUpdateDoesNotUndoDelete() throws Exception {
            final ExecutorService pool = Executors.newFixedThreadPool(2);
            try {
                for (int round = 0; round < 200; round++) {
                    // Given
                    final Asset asset = catalog.createAsset(newAsset("lib", "/media/race-" + round + ".jpg"));
                    final CountDownLatch start = new CountDownLatch(1);

                    // When: update and delete are released together
                    final Future<?> update = pool.submit(() -> {
                        start.await();
                        try {
                            catalog.updateAsset(asset.id(), AssetUpdate.offline(true));
                        } catch (final NotFoundException e) {
                            // the delete won
                        }
                        return null;
                    });
                    final Future<?> delete = pool.submit(() -> {
                        start.await();
                        catalog.deleteAsset(asset.id());
                        return null;
                    });
                    start.countDown();
                    update.get(5, TimeUnit.SECONDS);
                    delete.get(5, TimeUnit.SECONDS);

                    // Then
                    assertThat(catalog.getAsset(asset.id())).as("round %d", round).isEmpty();
                }
            } finally {
                pool.shutdownNow();
            }
        }
    }

    @Test
    @DisplayName("Records survive a reopen of an on-disk catalog")
    void shouldPersistAcrossReopen(@TempDir final Path dir) throws IOException {
        final LuceneLibraryCatalog onDisk = LuceneLibraryCatalog.open(dir.resolve("catalog"), 60_000);
        onDisk.init();
        final Library library = onDisk.createLibrary(new NewLibrary("owner", "Photos", LibraryType.IMPORT, true));
        onDisk.createAsset(newAsset(library.id(), "/media/a.jpg"));
        onDisk.close();

        final LuceneLibraryCatalog reopened = LuceneLibraryCatalog.open(dir.resolve("catalog"), 60_000);
        reopened.init();
        try {
            assertThat(reopened.getLibrary(library.id())).isPresent();
            assertThat(reopened.getAssetsByLibrary(List.of(library.id()))).hasSize(1);
        } finally {
            reopened.close();
        }
    }
}
