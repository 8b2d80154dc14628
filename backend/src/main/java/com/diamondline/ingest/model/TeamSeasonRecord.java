package com.diamondline.ingest.model;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/** A team's standing in one season, as of the Final game it was reported with. */
@Entity
@Table(name = "team_season_records", uniqueConstraints = {
        @UniqueConstraint(name = "uk_team_season_record", columnNames = {"season", "team_id"})
})
public class TeamSeasonRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Integer season;

    @Column(name = "team_id", nullable = false)
    private Long teamId;

    @Column(nullable = false)
    private Integer wins;

    @Column(nullable = false)
    private Integer losses;

    private Integer ties;

    @Column(name = "winning_pct", precision = 5, scale = 3)
    private BigDecimal winningPct;

    @Column(name = "division_rank")
    private Integer divisionRank;

    @Column(name = "games_back", precision = 5, scale = 1)
    private BigDecimal gamesBack;

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

    public TeamSeasonRecord() {}

    public TeamSeasonRecord(Integer season, Long teamId) {
        this.season = season;
        this.teamId = teamId;
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
    public Long getTeamId() { return teamId; }
    public void setTeamId(Long teamId) { this.teamId = teamId; }
    public Integer getWins() { return wins; }
    public void setWins(Integer wins) { this.wins = wins; }
    public Integer getLosses() { return losses; }
    public void setLosses(Integer losses) { this.losses = losses; }
    public Integer getTies() { return ties; }
    public void setTies(Integer ties) { this.ties = ties; }
    public BigDecimal getWinningPct() { return winningPct; }
    public void setWinningPct(BigDecimal winningPct) { this.winningPct = winningPct; }
    public Integer getDivisionRank() { return divisionRank; }
    public void setDivisionRank(Integer divisionRank) { this.divisionRank = divisionRank; }
    public BigDecimal getGamesBack() { return gamesBack; }
    public void setGamesBack(BigDecimal gamesBack) { this.gamesBack = gamesBack; }
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
