package com.diamondline.ingest.model;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * One season aggregate of one player, such as {@code batting.homeRuns} or {@code pitching.era},
 * as of the Final game it was reported with.
 */
@Entity
@Table(name = "player_season_stats", uniqueConstraints = {
        @UniqueConstraint(name = "uk_player_season_stat", columnNames = {"season", "player_id", "stat"})
})
public class PlayerSeasonStat {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Integer season;

    @Column(name = "player_id", nullable = false)
    private Long playerId;

    @Column(nullable = false, length = 48)
    private String stat;

    @Column(name = "stat_value", nullable = false, precision = 12, scale = 3)
    private BigDecimal value;

    @Column(name = "as_of_game_id", nullable = false)
    private Long asOfGameId;

    @Column(name = "as_of_date", nullable = false)
    private LocalDate asOfDate;

    @Column(name = "as_of_game_number", nullable = false)
    private Integer asOfGameNumber;

    @Column(length = 64)
    private String source;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public PlayerSeasonStat() {}

    public PlayerSeasonStat(Integer season, Long playerId, String stat) {
        this.season = season;
        this.playerId = playerId;
        this.stat = stat;
    }

    @PrePersist
    @PreUpdate
    private void touch() {
        updatedAt = Instant.now();
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public Integer getSeason() { return season; }
    public void setSeason(Integer season) { this.season = season; }
    public Long getPlayerId() { return playerId; }
    public void setPlayerId(Long playerId) { this.playerId = playerId; }
    public String getStat() { return stat; }
    public void setStat(String stat) { this.stat = stat; }
    public BigDecimal getValue() { return value; }
    public void setValue(BigDecimal value) { this.value = value; }
    public Long getAsOfGameId() { return asOfGameId; }
    public void setAsOfGameId(Long asOfGameId) { this.asOfGameId = asOfGameId; }
    public LocalDate getAsOfDate() { return asOfDate; }
    public void setAsOfDate(LocalDate asOfDate) { this.asOfDate = asOfDate; }
    public Integer getAsOfGameNumber() { return asOfGameNumber; }
    public void setAsOfGameNumber(Integer asOfGameNumber) { this.asOfGameNumber = asOfGameNumber; }
    public String getSource() { return source; }
    public void setSource(String source) { this.source = source; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
