package com.diamondline.ingest.model;

import com.diamondline.ingest.util.NameNormalizer;
import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "players", indexes = {
        @Index(name = "idx_player_normalized_name", columnList = "normalized_name"),
        @Index(name = "idx_player_team", columnList = "team_id")
})
public class Player {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "full_name", nullable = false)
    private String fullName;

    @Column(name = "normalized_name", nullable = false)
    private String normalizedName;

    @Column(name = "team_id")
    private Long teamId;

    // most recent observation; breaks ties between equally close fuzzy name matches
    @Column(name = "last_seen_at")
    private Instant lastSeenAt;

    public Player() {}

    public Player(String fullName, Long teamId) {
        this.fullName = fullName;
        this.teamId = teamId;
        this.normalizedName = NameNormalizer.normalizePlayerName(fullName);
    }

    @PrePersist
    @PreUpdate
    private void prePersistUpdate() {
        this.normalizedName = NameNormalizer.normalizePlayerName(this.fullName);
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getFullName() { return fullName; }
    public void setFullName(String fullName) { this.fullName = fullName; }

    public String getNormalizedName() { return normalizedName; }
    public void setNormalizedName(String normalizedName) { this.normalizedName = normalizedName; }

    public Long getTeamId() { return teamId; }
    public void setTeamId(Long teamId) { this.teamId = teamId; }

    public Instant getLastSeenAt() { return lastSeenAt; }
    public void setLastSeenAt(Instant lastSeenAt) { this.lastSeenAt = lastSeenAt; }
}
