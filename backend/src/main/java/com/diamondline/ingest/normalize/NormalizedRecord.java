package com.diamondline.ingest.normalize;

/** Canonical shape of one record, with every identifier already resolved. */
public interface NormalizedRecord {

    /** Natural key in the canonical store, for logging and in-batch ordering. */
    String naturalKey();
}
