package com.diamondline.ingest.model;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * Player proposition bet. Created by ingestion, owned by settlement afterwards:
 * status moves from {@link BetStatus#OPEN} to exactly one terminal status and stays there.
 */
@Entity
@Table(name = "prop_bets", uniqueConstraints = {
        @UniqueConstraint(name = "uk_prop_bet_external", columnNames = {"bet_id"})
}, indexes = {
        @Index(name = "idx_prop_bet_status", columnList = "status"),
        @Index(name = "idx_prop_bet_game", columnList = "game_id")
})
public class PropBet {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "bet_id", nullable = false, length = 128)
    private String betId;

    @Column(length = 64)
    private String source;

    @Column(name = "game_id", nullable = false)
    private Long gameId;

    @Column(name = "player_id", nullable = false)
    private Long playerId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private Metric metric;

    @Column(name = "line_value", nullable = false, precision = 10, scale = 3)
    private BigDecimal lineValue;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private BetSide side;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private BetStatus status = BetStatus.OPEN;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal stake = BigDecimal.ONE;

    // decimal odds
    @Column(nullable = false, precision = 10, scale = 4)
    private BigDecimal price = new BigDecimal("2.0");

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "settled_at")
    private Instant settledAt;

    @Version
    private Long version;

    @PrePersist
    private void prePersist() {
        if (createdAt == null) createdAt = Instant.now();
        if (status == null) status = BetStatus.OPEN;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getBetId() { return betId; }
    public void setBetId(String betId) { this.betId = betId; }
    public String getSource() { return source; }
    public void setSource(String source) { this.source = source; }
    public Long getGameId() { return gameId; }
    public void setGameId(Long gameId) { this.gameId = gameId; }
    public Long getPlayerId() { return playerId; }
    public void setPlayerId(Long playerId) { this.playerId = playerId; }
    public Metric getMetric() { return metric; }
    public void setMetric(Metric metric) { this.metric = metric; }
    public BigDecimal getLineValue() { return lineValue; }
    public void setLineValue(BigDecimal lineValue) { this.lineValue = lineValue; }
    public BetSide getSide() { return side; }
    public void setSide(BetSide side) { this.side = side; }
    public BetStatus getStatus() { return status; }
    public void setStatus(BetStatus status) { this.status = status; }
    public BigDecimal getStake() { return stake; }
    public void setStake(BigDecimal stake) { this.stake = stake; }
    public BigDecimal getPrice() { return price; }
    public void setPrice(BigDecimal price) { this.price = price; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public Instant getSettledAt() { return settledAt; }
    public void setSettledAt(Instant settledAt) { this.settledAt = settledAt; }
    public Long getVersion() { return version; }
    public void setVersion(Long version) { this.version = version; }
}
