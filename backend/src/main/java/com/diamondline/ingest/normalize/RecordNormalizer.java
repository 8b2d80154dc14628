package com.diamondline.ingest.normalize;

import com.diamondline.ingest.dto.RecordType;
import com.diamondline.ingest.dto.SourceRecord;

import java.util.List;

/**
 * Turns one raw record into zero or more canonical records.
 *
 * @see NormalizerRegistry
 */
public interface RecordNormalizer {

    RecordType supports();

    /**
     * @throws com.diamondline.ingest.exception.RecordValidationException for missing or out-of-range fields
     * @throws com.diamondline.ingest.exception.UnresolvedAliasException when an identifier cannot be resolved
     */
    List<NormalizedRecord> normalize(SourceRecord record);
}
