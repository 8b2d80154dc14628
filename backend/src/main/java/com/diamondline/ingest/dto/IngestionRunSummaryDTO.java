package com.diamondline.ingest.dto;

import com.diamondline.ingest.model.IngestionRun;

import java.time.Instant;
import java.time.LocalDate;

public class IngestionRunSummaryDTO {
    private Long id;
    private String jobName;
    private String source;
    private String status;
    private LocalDate windowStart;
    private LocalDate windowEnd;
    private Integer unitsTotal;
    private Integer unitsSucceeded;
    private Integer unitsFailed;
    private Integer unitsSkipped;
    private Integer recordsInserted;
    private Integer recordsUpdated;
    private Integer recordsSkipped;
    private Integer recordsRejected;
    private LocalDate watermarkBlockedAt;
    private Instant startedAt;
    private Instant finishedAt;

    public IngestionRunSummaryDTO() {}

    public static IngestionRunSummaryDTO from(IngestionRun run) {
        IngestionRunSummaryDTO d = new IngestionRunSummaryDTO();
        d.id = run.getId();
        d.jobName = run.getJobName();
        d.source = run.getSource();
        d.status = run.getStatus();
        d.windowStart = run.getWindowStart();
        d.windowEnd = run.getWindowEnd();
        d.unitsTotal = run.getUnitsTotal();
        d.unitsSucceeded = run.getUnitsSucceeded();
        d.unitsFailed = run.getUnitsFailed();
        d.unitsSkipped = run.getUnitsSkipped();
        d.recordsInserted = run.getRecordsInserted();
        d.recordsUpdated = run.getRecordsUpdated();
        d.recordsSkipped = run.getRecordsSkipped();
        d.recordsRejected = run.getRecordsRejected();
        d.watermarkBlockedAt = run.getWatermarkBlockedAt();
        d.startedAt = run.getStartedAt();
        d.finishedAt = run.getFinishedAt();
        return d;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getJobName() { return jobName; }
    public void setJobName(String jobName) { this.jobName = jobName; }
    public String getSource() { return source; }
    public void setSource(String source) { this.source = source; }
    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }
    public LocalDate getWindowStart() { return windowStart; }
    public void setWindowStart(LocalDate windowStart) { this.windowStart = windowStart; }
    public LocalDate getWindowEnd() { return windowEnd; }
    public void setWindowEnd(LocalDate windowEnd) { this.windowEnd = windowEnd; }
    public Integer getUnitsTotal() { return unitsTotal; }
    public void setUnitsTotal(Integer unitsTotal) { this.unitsTotal = unitsTotal; }
    public Integer getUnitsSucceeded() { return unitsSucceeded; }
    public void setUnitsSucceeded(Integer unitsSucceeded) { this.unitsSucceeded = unitsSucceeded; }
    public Integer getUnitsFailed() { return unitsFailed; }
    public void setUnitsFailed(Integer unitsFailed) { this.unitsFailed = unitsFailed; }
    public Integer getUnitsSkipped() { return unitsSkipped; }
    public void setUnitsSkipped(Integer unitsSkipped) { this.unitsSkipped = unitsSkipped; }
    public Integer getRecordsInserted() { return recordsInserted; }
    public void setRecordsInserted(Integer recordsInserted) { this.recordsInserted = recordsInserted; }
    public Integer getRecordsUpdated() { return recordsUpdated; }
    public void setRecordsUpdated(Integer recordsUpdated) { this.recordsUpdated = recordsUpdated; }
    public Integer getRecordsSkipped() { return recordsSkipped; }
    public void setRecordsSkipped(Integer recordsSkipped) { this.recordsSkipped = recordsSkipped; }
    public Integer getRecordsRejected() { return recordsRejected; }
    public void setRecordsRejected(Integer recordsRejected) { this.recordsRejected = recordsRejected; }
    public LocalDate getWatermarkBlockedAt() { return watermarkBlockedAt; }
    public void setWatermarkBlockedAt(LocalDate watermarkBlockedAt) { this.watermarkBlockedAt = watermarkBlockedAt; }
    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }
    public Instant getFinishedAt() { return finishedAt; }
    public void setFinishedAt(Instant finishedAt) { this.finishedAt = finishedAt; }
}
