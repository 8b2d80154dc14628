package com.diamondline.ingest.model;

import com.diamondline.ingest.util.NameNormalizer;
import jakarta.persistence.*;

@Entity
@Table(name = "teams", uniqueConstraints = {
        @UniqueConstraint(name = "uk_team_abbreviation", columnNames = {"abbreviation"})
}, indexes = {
        @Index(name = "idx_team_normalized_name", columnList = "normalized_name")
})
public class Team {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 32)
    private String abbreviation;

    @Column(nullable = false)
    private String name;

    @Column(name = "normalized_name", nullable = false)
    private String normalizedName;

    public Team() {}

    public Team(String abbreviation, String name) {
        this.abbreviation = abbreviation;
        this.name = name;
        this.normalizedName = NameNormalizer.normalizeName(name);
    }

    @PrePersist
    @PreUpdate
    private void prePersistUpdate() {
        if (this.abbreviation != null) {
            this.abbreviation = NameNormalizer.normalizeToken(this.abbreviation);
        }
        this.normalizedName = NameNormalizer.normalizeName(this.name);
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getAbbreviation() { return abbreviation; }
    public void setAbbreviation(String abbreviation) { this.abbreviation = abbreviation; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getNormalizedName() { return normalizedName; }
    public void setNormalizedName(String normalizedName) { this.normalizedName = normalizedName; }
}
