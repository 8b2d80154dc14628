package com.diamondline.ingest.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.time.LocalDate;

/** One row per job; {@code lastCompletedDate} only ever moves forward. */
@Entity
@Table(name = "processing_watermarks")
public class ProcessingWatermark {

    @Id
    @Column(name = "job_name", length = 64)
    private String jobName;

    @Column(name = "last_completed_date", nullable = false)
    private LocalDate lastCompletedDate;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public ProcessingWatermark() {}

    public ProcessingWatermark(String jobName, LocalDate lastCompletedDate) {
        this.jobName = jobName;
        this.lastCompletedDate = lastCompletedDate;
    }

    @PrePersist
    @PreUpdate
    private void touch() {
        this.updatedAt = Instant.now();
    }

    public String getJobName() { return jobName; }
    public void setJobName(String jobName) { this.jobName = jobName; }
    public LocalDate getLastCompletedDate() { return lastCompletedDate; }
    public void setLastCompletedDate(LocalDate lastCompletedDate) { this.lastCompletedDate = lastCompletedDate; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
