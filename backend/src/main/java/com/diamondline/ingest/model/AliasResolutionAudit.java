package com.diamondline.ingest.model;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "alias_resolution_audit", indexes = {
        @Index(name = "idx_alias_audit_resolved_at", columnList = "resolved_at")
})
public class AliasResolutionAudit {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64)
    private String source;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private EntityKind kind;

    @Column(name = "raw_token", nullable = false, length = 191)
    private String rawToken;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ResolutionMethod method;

    @Column(name = "canonical_id", nullable = false)
    private Long canonicalId;

    @Column(length = 255)
    private String detail;

    @Column(name = "resolved_at", nullable = false)
    private Instant resolvedAt;

    public AliasResolutionAudit() {}

    public AliasResolutionAudit(String source, EntityKind kind, String rawToken, ResolutionMethod method, Long canonicalId, String detail) {
        this.source = source;
        this.kind = kind;
        this.rawToken = rawToken;
        this.method = method;
        this.canonicalId = canonicalId;
        this.detail = detail;
        this.resolvedAt = Instant.now();
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getSource() { return source; }
    public void setSource(String source) { this.source = source; }
    public EntityKind getKind() { return kind; }
    public void setKind(EntityKind kind) { this.kind = kind; }
    public String getRawToken() { return rawToken; }
    public void setRawToken(String rawToken) { this.rawToken = rawToken; }
    public ResolutionMethod getMethod() { return method; }
    public void setMethod(ResolutionMethod method) { this.method = method; }
    public Long getCanonicalId() { return canonicalId; }
    public void setCanonicalId(Long canonicalId) { this.canonicalId = canonicalId; }
    public String getDetail() { return detail; }
    public void setDetail(String detail) { this.detail = detail; }
    public Instant getResolvedAt() { return resolvedAt; }
    public void setResolvedAt(Instant resolvedAt) { this.resolvedAt = resolvedAt; }
}
