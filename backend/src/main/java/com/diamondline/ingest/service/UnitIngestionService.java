package com.diamondline.ingest.service;

import com.diamondline.ingest.batch.BatchModels;
import com.diamondline.ingest.dto.LoadResult;
import com.diamondline.ingest.dto.SourceRecord;
import com.diamondline.ingest.exception.UnitFailureException;
import com.diamondline.ingest.normalize.NormalizationResult;
import com.diamondline.ingest.normalize.NormalizerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Normalizes and loads one unit of raw records. Normalization runs outside the load
 * transaction; the load of the surviving records is a single transaction.
 */
@Service
public class UnitIngestionService {
    private static final Logger log = LoggerFactory.getLogger(UnitIngestionService.class);

    private final NormalizerRegistry normalizerRegistry;
    private final LoadEngine loadEngine;
    private final IngestionRunService runService;

    public UnitIngestionService(NormalizerRegistry normalizerRegistry, LoadEngine loadEngine, IngestionRunService runService) {
        this.normalizerRegistry = normalizerRegistry;
        this.loadEngine = loadEngine;
        this.runService = runService;
    }

    /**
     * @param runId owning job run, or null for records pushed outside a job
     * @throws UnitFailureException when the load itself fails; nothing of the unit is stored then
     */
    public BatchModels.UnitOutcome ingestUnit(Long runId, String unitKey, List<SourceRecord> records) {
        NormalizationResult normalized = normalizerRegistry.normalizeAll(records);
        runService.recordRejections(runId, unitKey, normalized.rejections());

        LoadResult load;
        try {
            load = normalized.records().isEmpty() ? LoadResult.EMPTY : loadEngine.upsert(normalized.records());
        } catch (RuntimeException e) {
            throw new UnitFailureException(unitKey, "Load failed for unit " + unitKey + ": " + e.getMessage(), e);
        }
        log.info("[Ingest][Unit] unit={}, raw={}, normalized={}, inserted={}, updated={}, skipped={}, rejected={}",
                unitKey, records.size(), normalized.records().size(), load.inserted(), load.updated(), load.skipped(),
                normalized.rejections().size());
        return BatchModels.UnitOutcome.loaded(unitKey, load, normalized.rejections().size());
    }
}
