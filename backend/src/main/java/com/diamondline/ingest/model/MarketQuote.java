package com.diamondline.ingest.model;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;

/** Append-only price observation. The observation time is part of the natural key. */
@Entity
@Table(name = "market_quotes", uniqueConstraints = {
        @UniqueConstraint(name = "uk_market_quote", columnNames = {"source", "market_id", "runner_id", "observed_at"})
}, indexes = {
        @Index(name = "idx_quote_runner", columnList = "source, market_id, runner_id")
})
public class MarketQuote {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64)
    private String source;

    @Column(name = "market_id", nullable = false, length = 128)
    private String marketId;

    @Column(name = "runner_id", nullable = false, length = 128)
    private String runnerId;

    @Column(name = "game_id")
    private Long gameId;

    @Column(name = "player_id")
    private Long playerId;

    @Column(name = "line_value", precision = 10, scale = 3)
    private BigDecimal lineValue;

    // decimal odds
    @Column(nullable = false, precision = 10, scale = 4)
    private BigDecimal price;

    @Column(name = "observed_at", nullable = false)
    private Instant observedAt;

    public MarketQuote() {}

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getSource() { return source; }
    public void setSource(String source) { this.source = source; }
    public String getMarketId() { return marketId; }
    public void setMarketId(String marketId) { this.marketId = marketId; }
    public String getRunnerId() { return runnerId; }
    public void setRunnerId(String runnerId) { this.runnerId = runnerId; }
    public Long getGameId() { return gameId; }
    public void setGameId(Long gameId) { this.gameId = gameId; }
    public Long getPlayerId() { return playerId; }
    public void setPlayerId(Long playerId) { this.playerId = playerId; }
    public BigDecimal getLineValue() { return lineValue; }
    public void setLineValue(BigDecimal lineValue) { this.lineValue = lineValue; }
    public BigDecimal getPrice() { return price; }
    public void setPrice(BigDecimal price) { this.price = price; }
    public Instant getObservedAt() { return observedAt; }
    public void setObservedAt(Instant observedAt) { this.observedAt = observedAt; }
}
