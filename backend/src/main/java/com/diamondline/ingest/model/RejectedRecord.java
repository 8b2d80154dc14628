package com.diamondline.ingest.model;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "rejected_record", indexes = {
        @Index(name = "idx_rejected_record_run", columnList = "ingestion_run_id")
})
public class RejectedRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // null for records pushed outside a job run
    @Column(name = "ingestion_run_id")
    private Long ingestionRunId;

    @Column(name = "unit_key", length = 128)
    private String unitKey;

    @Column(length = 64)
    private String source;

    @Column(name = "record_type", length = 16)
    private String recordType;

    // rejected because of an unresolved alias or a validation error
    @Column(length = 32)
    private String category;

    @Column(columnDefinition = "TEXT")
    private String payload;

    @Column(columnDefinition = "TEXT")
    private String reason;

    @Column(name = "created_at")
    private Instant createdAt;

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public Long getIngestionRunId() { return ingestionRunId; }
    public void setIngestionRunId(Long ingestionRunId) { this.ingestionRunId = ingestionRunId; }
    public String getUnitKey() { return unitKey; }
    public void setUnitKey(String unitKey) { this.unitKey = unitKey; }
    public String getSource() { return source; }
    public void setSource(String source) { this.source = source; }
    public String getRecordType() { return recordType; }
    public void setRecordType(String recordType) { this.recordType = recordType; }
    public String getCategory() { return category; }
    public void setCategory(String category) { this.category = category; }
    public String getPayload() { return payload; }
    public void setPayload(String payload) { this.payload = payload; }
    public String getReason() { return reason; }
    public void setReason(String reason) { this.reason = reason; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
