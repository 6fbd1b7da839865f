package de.mirkosertic.mcp.medialibrary.library;

import com.google.common.hash.HashCode;
import de.mirkosertic.mcp.medialibrary.catalog.Asset;
import de.mirkosertic.mcp.medialibrary.catalog.AssetType;
import de.mirkosertic.mcp.medialibrary.catalog.Library;
import de.mirkosertic.mcp.medialibrary.catalog.LibraryCatalog;
import de.mirkosertic.mcp.medialibrary.catalog.LibraryType;
import de.mirkosertic.mcp.medialibrary.crawler.LibraryCrawler;
import de.mirkosertic.mcp.medialibrary.crawler.MediaFileMatcher;
import de.mirkosertic.mcp.medialibrary.job.JobName;
import de.mirkosertic.mcp.medialibrary.job.LibraryJob;
import de.mirkosertic.mcp.medialibrary.job.RecordingJobQueue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("LibraryReconciler Tests")
class LibraryReconcilerTest {

    @TempDir
    Path media;

    private LibraryCatalog catalog;
    private RecordingJobQueue jobQueue;
    private LibraryReconciler reconciler;

    @BeforeEach
    void setUp() {
        catalog = mock(LibraryCatalog.class);
        jobQueue = new RecordingJobQueue();
        final LibraryCrawler crawler = new LibraryCrawler(new MediaFileMatcher(List.of("*.jpg", "*.mp4"), List.of()));
        reconciler = new LibraryReconciler(crawler, catalog, jobQueue);
    }

    private Library importLibrary(final String... importPaths) {
        return new Library("lib", "owner", "Photos", LibraryType.IMPORT, List.of(importPaths), true);
    }

    private static Asset asset(final String id, final String path) {
        return new Asset(id, "owner", "lib", path, "b", "b.jpg-1", "Library Import",
                HashCode.fromInt(1), AssetType.IMAGE, Instant.EPOCH, Instant.EPOCH, false, null, true);
    }

    @Test
    @DisplayName("New file is refreshed and vanished asset goes offline")
    void newAndVanished() throws IOException {
        // Given: a.jpg on disk, b.jpg only in the catalog
        final Path a = Files.writeString(media.resolve("a.jpg"), "x");
        final String b = media.resolve("b.jpg").toString();
        when(catalog.getAssetsByLibrary(List.of("lib"))).thenReturn(List.of(asset("1", b)));

        // When
        final ReconciliationResult result = reconciler.reconcile(importLibrary(media.toString()), false, false);

        // Then
        assertThat(result.pathsToRefresh()).containsExactly(a.toString());
        assertThat(result.pathsToMarkOffline()).containsExactly(b);
        assertThat(jobQueue.<LibraryJob>payloads(JobName.REFRESH_LIBRARY_FILE))
                .containsExactly(new LibraryJob(a.toString(), "owner", "lib", false, false));
        assertThat(jobQueue.<LibraryJob>payloads(JobName.OFFLINE_LIBRARY_FILE))
                .containsExactly(new LibraryJob(b, "owner", "lib", false, false));
    }

    @Test
    @DisplayName("A path on disk and in the catalog only gets a refresh job")
    void seenOnDiskWins() throws IOException {
        final Path a = Files.writeString(media.resolve("a.jpg"), "x");
        // Catalog spells the same path with a redundant segment
        final String spelledDifferently = media + "/./a.jpg";
        when(catalog.getAssetsByLibrary(List.of("lib"))).thenReturn(List.of(asset("1", spelledDifferently)));

        final ReconciliationResult result = reconciler.reconcile(importLibrary(media.toString()), false, false);

        assertThat(result.pathsToRefresh()).containsExactly(a.toString());
        assertThat(result.pathsToMarkOffline()).isEmpty();
        assertThat(jobQueue.payloads(JobName.OFFLINE_LIBRARY_FILE)).isEmpty();
    }

    @Test
    @DisplayName("Flags are passed on: refresh jobs carry forceRefresh, offline jobs only emptyTrash")
    void flagsArePassedOn() throws IOException {
        Files.writeString(media.resolve("a.jpg"), "x");
        when(catalog.getAssetsByLibrary(List.of("lib")))
                .thenReturn(List.of(asset("1", media.resolve("gone.jpg").toString())));

        reconciler.reconcile(importLibrary(media.toString()), true, true);

        assertThat(jobQueue.<LibraryJob>payloads(JobName.REFRESH_LIBRARY_FILE))
                .allSatisfy(job -> {
                    assertThat(job.forceRefresh()).isTrue();
                    assertThat(job.emptyTrash()).isTrue();
                });
        assertThat(jobQueue.<LibraryJob>payloads(JobName.OFFLINE_LIBRARY_FILE))
                .allSatisfy(job -> {
                    assertThat(job.forceRefresh()).isFalse();
                    assertThat(job.emptyTrash()).isTrue();
                });
    }

    @Test
    @DisplayName("Missing import path marks everything offline")
    void missingImportPathMarksOffline() throws IOException {
        final String old = media.resolve("gone/old.jpg").toString();
        when(catalog.getAssetsByLibrary(List.of("lib"))).thenReturn(List.of(asset("1", old)));

        final ReconciliationResult result =
                reconciler.reconcile(importLibrary(media.resolve("gone").toString()), false, false);

        assertThat(result.pathsToRefresh()).isEmpty();
        assertThat(result.pathsToMarkOffline()).containsExactly(old);
    }

    @Test
    @DisplayName("Upload libraries are rejected before anything happens")
    void uploadLibraryIsRejected() {
        final Library upload = new Library("lib", "owner", "Uploads", LibraryType.UPLOAD, List.of(), true);

        assertThatThrownBy(() -> reconciler.reconcile(upload, false, false))
                .isInstanceOf(InvalidRequestException.class);
        assertThat(jobQueue.entries()).isEmpty();
        verifyNoInteractions(catalog);
    }

    @Test
    @DisplayName("A catalog failure aborts the pass without emitting jobs")
    void catalogFailureEmitsNothing() throws IOException {
        Files.writeString(media.resolve("a.jpg"), "x");
        when(catalog.getAssetsByLibrary(anyCollection())).thenThrow(new IOException("catalog down"));

        assertThatThrownBy(() -> reconciler.reconcile(importLibrary(media.toString()), false, false))
                .isInstanceOf(IOException.class)
                .hasMessage("catalog down");
        assertThat(jobQueue.entries()).isEmpty();
    }

    @Test
    @DisplayName("Overlapping import paths yield one job per file")
    void overlappingImportPaths() throws IOException {
        final Path nested = Files.createDirectories(media.resolve("2024"));
        Files.writeString(nested.resolve("a.jpg"), "x");
        when(catalog.getAssetsByLibrary(List.of("lib"))).thenReturn(List.of());

        final ReconciliationResult result =
                reconciler.reconcile(importLibrary(media.toString(), nested.toString()), false, false);

        assertThat(result.pathsToRefresh()).hasSize(1);
        assertThat(jobQueue.entries()).hasSize(1);
    }
}
