package de.mirkosertic.mcp.medialibrary.job;

public record AssetJob(String assetId) {
}
