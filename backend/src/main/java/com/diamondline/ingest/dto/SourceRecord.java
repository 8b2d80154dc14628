package com.diamondline.ingest.dto;

import java.util.Locale;
import java.util.Map;

/**
 * One raw record as handed over by a provider: the source name and a loosely typed field map.
 * Source names are case-insensitive and stored lower-cased.
 */
public record SourceRecord(String source, RecordType recordType, Map<String, Object> payload) {

    public SourceRecord {
        source = source == null ? null : source.trim().toLowerCase(Locale.ROOT);
        payload = payload == null ? Map.of() : payload;
    }
}
