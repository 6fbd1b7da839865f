package de.mirkosertic.mcp.medialibrary.library;

import de.mirkosertic.mcp.medialibrary.catalog.Library;
import de.mirkosertic.mcp.medialibrary.catalog.LibraryType;
import de.mirkosertic.mcp.medialibrary.catalog.LuceneLibraryCatalog;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("LibraryService Tests")
class LibraryServiceTest {

    private LuceneLibraryCatalog catalog;
    private LibraryReconciler reconciler;
    private LibraryService service;

    @BeforeEach
    void setUp() throws IOException {
        catalog = new LuceneLibraryCatalog(new ByteBuffersDirectory(), 0);
        catalog.init();
        reconciler = mock(LibraryReconciler.class);
        service = new LibraryService(catalog, reconciler);
    }

    @AfterEach
    void tearDown() throws IOException {
        catalog.close();
    }

    @Nested
    @DisplayName("Create and read")
    class CreateAndRead {

        @Test
        @DisplayName("Should create, get, list and count libraries")
        void shouldCreateAndRead() throws IOException {
            // When
            final Library photos = service.create("owner", "  Photos ", LibraryType.IMPORT, true);
            service.create("owner", "Uploads", LibraryType.UPLOAD, true);

            // Then
            assertThat(photos.name()).isEqualTo("Photos");
            assertThat(service.get(photos.id())).isEqualTo(photos);
            assertThat(service.getAll("owner")).hasSize(2);
            assertThat(service.getCount("owner")).isEqualTo(2);
            assertThat(service.getImportPaths(photos.id())).isEmpty();
        }

        @Test
        @DisplayName("Unknown library is not found")
        void unknownLibraryIsNotFound() {
            assertThatThrownBy(() -> service.get("nope"))
                    .isInstanceOf(NotFoundException.class)
                    .hasMessageContaining("nope");
        }

        @Test
        @DisplayName("Blank names are rejected")
        void blankNameIsRejected() {
            assertThatThrownBy(() -> service.create("owner", " ", LibraryType.IMPORT, true))
                    .isInstanceOf(InvalidRequestException.class);
        }
    }

    @Nested
    @DisplayName("Import paths")
    class ImportPaths {

        @Test
        @DisplayName("Should trim, drop blanks and de-duplicate while keeping order")
        void shouldCleanPaths() throws IOException {
            final Library library = service.create("owner", "Photos", LibraryType.IMPORT, true);

            final Library updated = service.setImportPaths(library.id(),
                    Arrays.asList(" /b ", "/a", "", null, "/b", "/does/not/exist"));

            assertThat(updated.importPaths()).containsExactly("/b", "/a", "/does/not/exist");
            assertThat(service.getImportPaths(library.id())).containsExactly("/b", "/a", "/does/not/exist");
        }

        @Test
        @DisplayName("Upload libraries have no import paths")
        void uploadLibraryIsRejected() throws IOException {
            final Library upload = service.create("owner", "Uploads", LibraryType.UPLOAD, true);

            assertThatThrownBy(() -> service.setImportPaths(upload.id(), List.of("/x")))
                    .isInstanceOf(InvalidRequestException.class);
            assertThat(service.getImportPaths(upload.id())).isEmpty();
        }

        @Test
        @DisplayName("Import paths cannot change while the library is refreshed")
        void rejectedDuringRefresh() throws IOException {
            // Given: a reconciler that tries to change the paths mid-pass
            final Library library = service.create("owner", "Photos", LibraryType.IMPORT, true);
            service.setImportPaths(library.id(), List.of("/media"));
            when(reconciler.reconcile(any(), anyBoolean(), anyBoolean())).thenAnswer(invocation -> {
                assertThat(service.isRefreshing(library.id())).isTrue();
                assertThatThrownBy(() -> service.setImportPaths(library.id(), List.of("/other")))
                        .isInstanceOf(InvalidRequestException.class)
                        .hasMessageContaining("being refreshed");
                return new ReconciliationResult(library.id(), Set.of(), Set.of(), 0);
            });

            // When
            service.refresh(library.id(), RefreshOptions.defaults());

            // Then
            assertThat(service.getImportPaths(library.id())).containsExactly("/media");
            assertThat(service.isRefreshing(library.id())).isFalse();
            service.setImportPaths(library.id(), List.of("/other"));
            assertThat(service.getImportPaths(library.id())).containsExactly("/other");
        }
    }

    @Nested
    @DisplayName("Refresh")
    class Refresh {

        @Test
        @DisplayName("Should hand the stored library and options to the reconciler")
        void shouldDelegate() throws IOException {
            final Library library = service.create("owner", "Photos", LibraryType.IMPORT, true);
            final Library withPaths = service.setImportPaths(library.id(), List.of("/media"));
            final ReconciliationResult expected = new ReconciliationResult(library.id(), Set.of("/media/a.jpg"), Set.of(), 3);
            when(reconciler.reconcile(withPaths, true, false)).thenReturn(expected);

            final ReconciliationResult result = service.refresh(library.id(), new RefreshOptions(true, false));

            assertThat(result).isEqualTo(expected);
        }

        @Test
        @DisplayName("Unknown library is not found and nothing is reconciled")
        void unknownLibrary() throws IOException {
            assertThatThrownBy(() -> service.refresh("nope", RefreshOptions.defaults()))
                    .isInstanceOf(NotFoundException.class);
            verify(reconciler, never()).reconcile(any(), anyBoolean(), anyBoolean());
            assertThat(service.isRefreshing("nope")).isFalse();
        }

        @Test
        @DisplayName("A second refresh of the same library is rejected while the first runs")
        void overlappingRefreshIsRejected() throws IOException {
            final Library library = service.create("owner", "Photos", LibraryType.IMPORT, true);
            when(reconciler.reconcile(any(), anyBoolean(), anyBoolean())).thenAnswer(invocation -> {
                assertThatThrownBy(() -> service.refresh(library.id(), RefreshOptions.defaults()))
                        .isInstanceOf(InvalidRequestException.class)
                        .hasMessageContaining("already being refreshed");
                return new ReconciliationResult(library.id(), Set.of(), Set.of(), 0);
            });

            service.refresh(library.id(), RefreshOptions.defaults());

            verify(reconciler).reconcile(any(), eq(false), eq(false));
        }

        @Test
        @DisplayName("Reconciler failures propagate and release the library")
        void failureReleasesLibrary() throws IOException {
            final Library library = service.create("owner", "Photos", LibraryType.IMPORT, true);
            when(reconciler.reconcile(any(), anyBoolean(), anyBoolean())).thenThrow(new IOException("boom"));

            assertThatThrownBy(() -> service.refresh(library.id(), RefreshOptions.defaults()))
                    .isInstanceOf(IOException.class);
            assertThat(service.isRefreshing(library.id())).isFalse();
        }
    }
}
