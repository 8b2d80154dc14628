package com.diamondline.ingest.normalize;

import com.diamondline.ingest.dto.RecordType;
import com.diamondline.ingest.dto.SourceRecord;
import com.diamondline.ingest.exception.RecordValidationException;
import com.diamondline.ingest.exception.UnresolvedAliasException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Dispatches raw records to the normalizer for their type. Records of one unit are handled
 * games first, so the games that an authoritative source registers exist before its box
 * scores and pitches refer to them. A rejected record never stops the others; only losing
 * the store fails the whole unit.
 */
@Component
public class NormalizerRegistry {
    private static final Logger log = LoggerFactory.getLogger(NormalizerRegistry.class);

    private static final int MAX_SOURCE_LENGTH = 64;

    private final Map<RecordType, RecordNormalizer> normalizers = new EnumMap<>(RecordType.class);

    public NormalizerRegistry(List<RecordNormalizer> normalizers) {
        for (RecordNormalizer n : normalizers) {
            RecordNormalizer previous = this.normalizers.put(n.supports(), n);
            if (previous != null) {
                throw new IllegalStateException("Two normalizers for " + n.supports() + ": "
                        + previous.getClass().getSimpleName() + ", " + n.getClass().getSimpleName());
            }
        }
    }

    public NormalizationResult normalizeAll(List<SourceRecord> records) {
        List<SourceRecord> ordered = new ArrayList<>(records);
        ordered.sort(Comparator.comparing(SourceRecord::recordType, Comparator.nullsLast(Comparator.naturalOrder())));

        List<NormalizedRecord> out = new ArrayList<>();
        List<NormalizationResult.Rejection> rejections = new ArrayList<>();
        for (SourceRecord record : ordered) {
            try {
                out.addAll(normalize(record));
            } catch (UnresolvedAliasException e) {
                rejections.add(new NormalizationResult.Rejection(record, NormalizationResult.UNRESOLVED_ALIAS, e.getMessage()));
                log.warn("[Normalize][Rejected] source={}, type={}, category={}, reason={}",
                        record.source(), record.recordType(), NormalizationResult.UNRESOLVED_ALIAS, e.getMessage());
            } catch (RecordValidationException e) {
                rejections.add(new NormalizationResult.Rejection(record, NormalizationResult.VALIDATION, e.getMessage()));
                log.warn("[Normalize][Rejected] source={}, type={}, category={}, reason={}",
                        record.source(), record.recordType(), NormalizationResult.VALIDATION, e.getMessage());
            } catch (DataAccessResourceFailureException | TransientDataAccessException | CannotCreateTransactionException e) {
                throw e;
            } catch (RuntimeException e) {
                rejections.add(new NormalizationResult.Rejection(record, NormalizationResult.VALIDATION, e.toString()));
                log.warn("[Normalize][Rejected] source={}, type={}, category={}, unexpected error: {}",
                        record.source(), record.recordType(), NormalizationResult.VALIDATION, e.toString());
            }
        }
        return new NormalizationResult(out, rejections);
    }

    public List<NormalizedRecord> normalize(SourceRecord record) {
        if (record.source() == null || record.source().isBlank()) {
            throw new RecordValidationException("source", "is required");
        }
        if (record.source().trim().length() > MAX_SOURCE_LENGTH) {
            throw new RecordValidationException("source", "longer than " + MAX_SOURCE_LENGTH + " characters");
        }
        if (record.recordType() == null) {
            throw new RecordValidationException("recordType", "is required");
        }
        RecordNormalizer normalizer = normalizers.get(record.recordType());
        if (normalizer == null) {
            throw new RecordValidationException("recordType", "no normalizer for " + record.recordType());
        }
        return normalizer.normalize(record);
    }
}
