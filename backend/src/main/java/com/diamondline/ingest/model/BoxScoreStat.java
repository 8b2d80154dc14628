package com.diamondline.ingest.model;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "box_score_stats", uniqueConstraints = {
        @UniqueConstraint(name = "uk_box_score_stat", columnNames = {"game_id", "player_id", "metric"})
}, indexes = {
        @Index(name = "idx_box_score_player", columnList = "player_id")
})
public class BoxScoreStat {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "game_id", nullable = false)
    private Long gameId;

    @Column(name = "player_id", nullable = false)
    private Long playerId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private Metric metric;

    @Column(name = "stat_value", nullable = false, precision = 12, scale = 3)
    private BigDecimal value;

    @Column(length = 64)
    private String source;

    @Column(name = "observed_at", nullable = false)
    private Instant observedAt;

    public BoxScoreStat() {}

    public BoxScoreStat(Long gameId, Long playerId, Metric metric) {
        this.gameId = gameId;
        this.playerId = playerId;
        this.metric = metric;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public Long getGameId() { return gameId; }
    public void setGameId(Long gameId) { this.gameId = gameId; }
    public Long getPlayerId() { return playerId; }
    public void setPlayerId(Long playerId) { this.playerId = playerId; }
    public Metric getMetric() { return metric; }
    public void setMetric(Metric metric) { this.metric = metric; }
    public BigDecimal getValue() { return value; }
    public void setValue(BigDecimal value) { this.value = value; }
    public String getSource() { return source; }
    public void setSource(String source) { this.source = source; }
    public Instant getObservedAt() { return observedAt; }
    public void setObservedAt(Instant observedAt) { this.observedAt = observedAt; }
}
