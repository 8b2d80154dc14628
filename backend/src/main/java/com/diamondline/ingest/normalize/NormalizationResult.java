package com.diamondline.ingest.normalize;

import com.diamondline.ingest.dto.SourceRecord;

import java.util.List;

/** Canonical records of one unit plus the raw records that were rejected on the way. */
public record NormalizationResult(List<NormalizedRecord> records, List<Rejection> rejections) {

    public record Rejection(SourceRecord record, String category, String reason) {}

    public static final String UNRESOLVED_ALIAS = "UNRESOLVED_ALIAS";
    public static final String VALIDATION = "VALIDATION";
}
