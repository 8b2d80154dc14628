package com.diamondline.ingest.service;

import com.diamondline.ingest.batch.BatchModels;
import com.diamondline.ingest.dto.DateRange;
import com.diamondline.ingest.dto.LoadResult;
import com.diamondline.ingest.dto.WatermarkAdvance;
import com.diamondline.ingest.model.IngestionRun;
import com.diamondline.ingest.model.RejectedRecord;
import com.diamondline.ingest.normalize.NormalizationResult;
import com.diamondline.ingest.repository.IngestionRunRepository;
import com.diamondline.ingest.repository.RejectedRecordRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** Bookkeeping of job runs and of the raw records they rejected. */
@Service
public class IngestionRunService {
    private static final Logger log = LoggerFactory.getLogger(IngestionRunService.class);

    public static final String STATUS_IN_PROGRESS = "IN_PROGRESS";
    public static final String STATUS_COMPLETED = "COMPLETED";
    public static final String STATUS_COMPLETED_WITH_FAILURES = "COMPLETED_WITH_FAILURES";
    public static final String STATUS_FAILED = "FAILED";

    private final IngestionRunRepository runRepository;
    private final RejectedRecordRepository rejectedRecordRepository;
    private final ObjectMapper objectMapper;

    public IngestionRunService(IngestionRunRepository runRepository,
                               RejectedRecordRepository rejectedRecordRepository,
                               ObjectMapper objectMapper) {
        this.runRepository = runRepository;
        this.rejectedRecordRepository = rejectedRecordRepository;
        this.objectMapper = objectMapper;
    }

    @Transactional
    public IngestionRun open(String jobName, String source) {
        IngestionRun run = new IngestionRun();
        run.setJobName(jobName);
        run.setSource(source);
        run.setStartedAt(Instant.now());
        run.setStatus(STATUS_IN_PROGRESS);
        return runRepository.save(run);
    }

    @Transactional
    public IngestionRun close(Long runId, DateRange window, BatchModels.BatchResult<?> batch,
                              int extraRejected, int extraFailedUnits, WatermarkAdvance advance) {
        IngestionRun run = runRepository.findById(runId)
                .orElseThrow(() -> new IllegalStateException("Ingestion run " + runId + " not found"));
        if (window != null) {
            run.setWindowStart(window.start());
            run.setWindowEnd(window.end());
        }
        int succeeded = batch == null ? 0 : batch.succeeded.size();
        int failed = (batch == null ? 0 : batch.failed.size()) + extraFailedUnits;
        int skipped = batch == null ? 0 : batch.skippedCount();
        LoadResult load = batch == null ? LoadResult.EMPTY : batch.totalLoad();
        run.setUnitsTotal(succeeded + failed);
        run.setUnitsSucceeded(succeeded);
        run.setUnitsFailed(failed);
        run.setUnitsSkipped(skipped);
        run.setRecordsInserted(load.inserted());
        run.setRecordsUpdated(load.updated());
        run.setRecordsSkipped(load.skipped());
        run.setRecordsRejected((batch == null ? 0 : batch.totalRejected()) + extraRejected);
        run.setWatermarkBlockedAt(advance == null ? null : advance.blockedAt());
        run.setFinishedAt(Instant.now());
        run.setStatus(failed == 0 ? STATUS_COMPLETED : STATUS_COMPLETED_WITH_FAILURES);
        return runRepository.save(run);
    }

    @Transactional
    public void fail(Long runId, String reason) {
        runRepository.findById(runId).ifPresent(run -> {
            run.setFinishedAt(Instant.now());
            run.setStatus(STATUS_FAILED);
            runRepository.save(run);
            log.warn("[Ingest][Run] runId={} failed: {}", runId, reason);
        });
    }

    /** Stores rejected raw records with their payload serialized as JSON. */
    @Transactional
    public void recordRejections(Long runId, String unitKey, List<NormalizationResult.Rejection> rejections) {
        if (rejections == null || rejections.isEmpty()) return;
        List<RejectedRecord> rows = new ArrayList<>(rejections.size());
        for (NormalizationResult.Rejection rej : rejections) {
            RejectedRecord row = new RejectedRecord();
            row.setIngestionRunId(runId);
            row.setUnitKey(unitKey);
            row.setSource(rej.record().source());
            row.setRecordType(rej.record().recordType() == null ? null : rej.record().recordType().name());
            row.setCategory(rej.category());
            row.setPayload(toJson(rej.record().payload()));
            row.setReason(rej.reason());
            row.setCreatedAt(Instant.now());
            rows.add(row);
        }
        rejectedRecordRepository.saveAll(rows);
    }

    private String toJson(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.warn("[Ingest][Rejected] payload not serializable as JSON: {}", e.getOriginalMessage());
            return String.valueOf(payload);
        }
    }
}
