package com.diamondline.ingest.model;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "bet_settlements", uniqueConstraints = {
        @UniqueConstraint(name = "uk_bet_settlement_bet", columnNames = {"prop_bet_id"})
})
public class BetSettlement {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "prop_bet_id", nullable = false)
    private Long propBetId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private BetStatus outcome;

    // null when voided
    @Column(name = "actual_value", precision = 12, scale = 3)
    private BigDecimal actualValue;

    @Column(name = "line_value", nullable = false, precision = 10, scale = 3)
    private BigDecimal lineValue;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal stake;

    @Column(nullable = false, precision = 14, scale = 4)
    private BigDecimal payout;

    @Column(name = "settled_at", nullable = false)
    private Instant settledAt;

    public BetSettlement() {}

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public Long getPropBetId() { return propBetId; }
    public void setPropBetId(Long propBetId) { this.propBetId = propBetId; }
    public BetStatus getOutcome() { return outcome; }
    public void setOutcome(BetStatus outcome) { this.outcome = outcome; }
    public BigDecimal getActualValue() { return actualValue; }
    public void setActualValue(BigDecimal actualValue) { this.actualValue = actualValue; }
    public BigDecimal getLineValue() { return lineValue; }
    public void setLineValue(BigDecimal lineValue) { this.lineValue = lineValue; }
    public BigDecimal getStake() { return stake; }
    public void setStake(BigDecimal stake) { this.stake = stake; }
    public BigDecimal getPayout() { return payout; }
    public void setPayout(BigDecimal payout) { this.payout = payout; }
    public Instant getSettledAt() { return settledAt; }
    public void setSettledAt(Instant settledAt) { this.settledAt = settledAt; }
}
