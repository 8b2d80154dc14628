package com.diamondline.ingest.model;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "line_movements", indexes = {
        @Index(name = "idx_line_movement_runner", columnList = "source, market_id, runner_id")
})
public class LineMovement {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64)
    private String source;

    @Column(name = "market_id", nullable = false, length = 128)
    private String marketId;

    @Column(name = "runner_id", nullable = false, length = 128)
    private String runnerId;

    @Column(name = "old_line", precision = 10, scale = 3)
    private BigDecimal oldLine;

    @Column(name = "new_line", precision = 10, scale = 3)
    private BigDecimal newLine;

    @Column(name = "old_price", precision = 10, scale = 4)
    private BigDecimal oldPrice;

    @Column(name = "new_price", precision = 10, scale = 4)
    private BigDecimal newPrice;

    @Column(name = "moved_at", nullable = false)
    private Instant movedAt;

    public LineMovement() {}

    public LineMovement(MarketQuote previous, MarketQuote current) {
        this.source = current.getSource();
        this.marketId = current.getMarketId();
        this.runnerId = current.getRunnerId();
        this.oldLine = previous.getLineValue();
        this.newLine = current.getLineValue();
        this.oldPrice = previous.getPrice();
        this.newPrice = current.getPrice();
        this.movedAt = current.getObservedAt();
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getSource() { return source; }
    public void setSource(String source) { this.source = source; }
    public String getMarketId() { return marketId; }
    public void setMarketId(String marketId) { this.marketId = marketId; }
    public String getRunnerId() { return runnerId; }
    public void setRunnerId(String runnerId) { this.runnerId = runnerId; }
    public BigDecimal getOldLine() { return oldLine; }
    public void setOldLine(BigDecimal oldLine) { this.oldLine = oldLine; }
    public BigDecimal getNewLine() { return newLine; }
    public void setNewLine(BigDecimal newLine) { this.newLine = newLine; }
    public BigDecimal getOldPrice() { return oldPrice; }
    public void setOldPrice(BigDecimal oldPrice) { this.oldPrice = oldPrice; }
    public BigDecimal getNewPrice() { return newPrice; }
    public void setNewPrice(BigDecimal newPrice) { this.newPrice = newPrice; }
    public Instant getMovedAt() { return movedAt; }
    public void setMovedAt(Instant movedAt) { this.movedAt = movedAt; }
}
