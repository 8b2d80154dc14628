package com.diamondline.ingest.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * A source-scoped token that denotes one canonical team, player or game.
 * Rows are only ever added; a (source, kind, alias) triple never changes its canonical id.
 */
@Entity
@Table(name = "entity_alias", uniqueConstraints = {
        @UniqueConstraint(name = "uk_entity_alias", columnNames = {"source", "kind", "alias"})
}, indexes = {
        @Index(name = "idx_alias_normalized", columnList = "source, kind, normalized_alias"),
        @Index(name = "idx_alias_canonical", columnList = "kind, canonical_id")
})
public class EntityAlias {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64)
    private String source;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private EntityKind kind;

    @Column(nullable = false, length = 191)
    private String alias;

    @Column(name = "normalized_alias", nullable = false, length = 191)
    private String normalizedAlias;

    @Column(name = "canonical_id", nullable = false)
    private Long canonicalId;

    @Enumerated(EnumType.STRING)
    @Column(name = "learned_by", nullable = false, length = 16)
    private ResolutionMethod learnedBy;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public EntityAlias() {}

    public EntityAlias(String source, EntityKind kind, String alias, String normalizedAlias, Long canonicalId, ResolutionMethod learnedBy) {
        this.source = source;
        this.kind = kind;
        this.alias = alias;
        this.normalizedAlias = normalizedAlias;
        this.canonicalId = canonicalId;
        this.learnedBy = learnedBy;
        this.createdAt = Instant.now();
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getSource() { return source; }
    public void setSource(String source) { this.source = source; }
    public EntityKind getKind() { return kind; }
    public void setKind(EntityKind kind) { this.kind = kind; }
    public String getAlias() { return alias; }
    public void setAlias(String alias) { this.alias = alias; }
    public String getNormalizedAlias() { return normalizedAlias; }
    public void setNormalizedAlias(String normalizedAlias) { this.normalizedAlias = normalizedAlias; }
    public Long getCanonicalId() { return canonicalId; }
    public void setCanonicalId(Long canonicalId) { this.canonicalId = canonicalId; }
    public ResolutionMethod getLearnedBy() { return learnedBy; }
    public void setLearnedBy(ResolutionMethod learnedBy) { this.learnedBy = learnedBy; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
