package de.mirkosertic.mcp.medialibrary.catalog;

import java.io.IOException;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * CRUD access to library and asset records.
 * <p>
 * Every single-record write is atomic. Nothing is coordinated across records; callers that
 * need read-decide-write sequences on one asset path must serialise them themselves.
 */
public interface LibraryCatalog {

    Optional<Library> getLibrary(String libraryId) throws IOException;

    List<Library> getLibrariesByOwner(String ownerId) throws IOException;

    long countLibrariesByOwner(String ownerId) throws IOException;

    Library createLibrary(NewLibrary library) throws IOException;

    /**
     * Replace the import paths of a library.
     *
     * @throws de.mirkosertic.mcp.medialibrary.library.NotFoundException if the library does not exist
     */
    Library setLibraryImportPaths(String libraryId, List<String> importPaths) throws IOException;

    Optional<Asset> getAsset(String assetId) throws IOException;

    List<Asset> getAssetsByLibrary(Collection<String> libraryIds) throws IOException;

    Optional<Asset> getAssetByLibraryAndPath(String libraryId, String originalPath) throws IOException;

    /**
     * Create an asset. If an asset with the same library and original path already exists it is
     * replaced and keeps its id, so a library never holds two records for one path.
     */
    Asset createAsset(NewAsset asset) throws IOException;

    /**
     * @throws de.mirkosertic.mcp.medialibrary.library.NotFoundException if the asset does not exist
     */
    Asset updateAsset(String assetId, AssetUpdate update) throws IOException;

    void deleteAsset(String assetId) throws IOException;
}
