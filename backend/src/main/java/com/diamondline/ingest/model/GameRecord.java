package com.diamondline.ingest.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Canonical game. A row is created as a shell when an authoritative source first
 * mentions the game and is filled in by later loads; once {@link GameStatus#FINAL}
 * it is never modified again.
 */
@Entity
@Table(name = "games", uniqueConstraints = {
        @UniqueConstraint(name = "uk_game_natural", columnNames = {"official_date", "home_team_id", "away_team_id", "game_number"})
}, indexes = {
        @Index(name = "idx_game_date", columnList = "official_date"),
        @Index(name = "idx_game_status", columnList = "status")
})
public class GameRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "official_date", nullable = false)
    private LocalDate officialDate;

    @Column(name = "home_team_id", nullable = false)
    private Long homeTeamId;

    @Column(name = "away_team_id", nullable = false)
    private Long awayTeamId;

    // doubleheaders
    @Column(name = "game_number", nullable = false)
    private Integer gameNumber = 1;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private GameStatus status = GameStatus.SCHEDULED;

    @Column(name = "home_score")
    private Integer homeScore;

    @Column(name = "away_score")
    private Integer awayScore;

    /** Source observation time of the last accepted load; null for a shell never loaded. */
    @Column(name = "observed_at")
    private Instant observedAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public GameRecord() {}

    public GameRecord(LocalDate officialDate, Long homeTeamId, Long awayTeamId, Integer gameNumber) {
        this.officialDate = officialDate;
        this.homeTeamId = homeTeamId;
        this.awayTeamId = awayTeamId;
        this.gameNumber = gameNumber == null ? 1 : gameNumber;
    }

    @PrePersist
    @PreUpdate
    private void touch() {
        this.updatedAt = Instant.now();
        if (this.gameNumber == null) this.gameNumber = 1;
        if (this.status == null) this.status = GameStatus.SCHEDULED;
    }

    public boolean isFinal() {
        return status == GameStatus.FINAL;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public LocalDate getOfficialDate() { return officialDate; }
    public void setOfficialDate(LocalDate officialDate) { this.officialDate = officialDate; }

    public Long getHomeTeamId() { return homeTeamId; }
    public void setHomeTeamId(Long homeTeamId) { this.homeTeamId = homeTeamId; }

    public Long getAwayTeamId() { return awayTeamId; }
    public void setAwayTeamId(Long awayTeamId) { this.awayTeamId = awayTeamId; }

    public Integer getGameNumber() { return gameNumber; }
    public void setGameNumber(Integer gameNumber) { this.gameNumber = gameNumber; }

    public GameStatus getStatus() { return status; }
    public void setStatus(GameStatus status) { this.status = status; }

    public Integer getHomeScore() { return homeScore; }
    public void setHomeScore(Integer homeScore) { this.homeScore = homeScore; }

    public Integer getAwayScore() { return awayScore; }
    public void setAwayScore(Integer awayScore) { this.awayScore = awayScore; }

    public Instant getObservedAt() { return observedAt; }
    public void setObservedAt(Instant observedAt) { this.observedAt = observedAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
