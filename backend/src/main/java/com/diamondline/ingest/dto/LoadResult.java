package com.diamondline.ingest.dto;

public record LoadResult(int inserted, int updated, int skipped) {

    public static final LoadResult EMPTY = new LoadResult(0, 0, 0);

    public LoadResult plus(LoadResult other) {
        if (other == null) return this;
        return new LoadResult(inserted + other.inserted, updated + other.updated, skipped + other.skipped);
    }

    public int total() {
        return inserted + updated + skipped;
    }
}
