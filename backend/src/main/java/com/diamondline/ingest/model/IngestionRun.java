package com.diamondline.ingest.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "ingestion_run", indexes = {
        @Index(name = "idx_ingestion_run_job", columnList = "job_name")
})
public class IngestionRun {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_name", length = 64, nullable = false)
    private String jobName;

    @Column(length = 64)
    private String source;

    @Column(name = "window_start")
    private LocalDate windowStart;

    @Column(name = "window_end")
    private LocalDate windowEnd;

    @Column(name = "units_total")
    private Integer unitsTotal = 0;

    @Column(name = "units_succeeded")
    private Integer unitsSucceeded = 0;

    @Column(name = "units_failed")
    private Integer unitsFailed = 0;

    @Column(name = "units_skipped")
    private Integer unitsSkipped = 0;

    @Column(name = "records_inserted")
    private Integer recordsInserted = 0;

    @Column(name = "records_updated")
    private Integer recordsUpdated = 0;

    @Column(name = "records_skipped")
    private Integer recordsSkipped = 0;

    @Column(name = "records_rejected")
    private Integer recordsRejected = 0;

    @Column(name = "watermark_blocked_at")
    private LocalDate watermarkBlockedAt; // first incomplete date that held the watermark back

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(length = 32)
    private String status = "IN_PROGRESS";

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getJobName() { return jobName; }
    public void setJobName(String jobName) { this.jobName = jobName; }
    public String getSource() { return source; }
    public void setSource(String source) { this.source = source; }
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
    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }
}
