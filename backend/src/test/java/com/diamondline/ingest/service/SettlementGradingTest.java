package com.diamondline.ingest.service;

import com.diamondline.ingest.model.BetSide;
import com.diamondline.ingest.model.BetStatus;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class SettlementGradingTest {

    private static final BigDecimal LINE = new BigDecimal("1.5");

    @Test
    void overLineOfOneAndAHalf() {
        assertThat(SettlementService.grade(BetSide.OVER, new BigDecimal("2"), LINE)).isEqualTo(BetStatus.WON);
        assertThat(SettlementService.grade(BetSide.OVER, BigDecimal.ONE, LINE)).isEqualTo(BetStatus.LOST);
        assertThat(SettlementService.grade(BetSide.OVER, new BigDecimal("1.50"), LINE)).isEqualTo(BetStatus.PUSH);
    }

    @Test
    void underMirrorsOver() {
        assertThat(SettlementService.grade(BetSide.UNDER, BigDecimal.ONE, LINE)).isEqualTo(BetStatus.WON);
        assertThat(SettlementService.grade(BetSide.UNDER, new BigDecimal("2"), LINE)).isEqualTo(BetStatus.LOST);
        assertThat(SettlementService.grade(BetSide.UNDER, BigDecimal.ZERO, BigDecimal.ZERO)).isEqualTo(BetStatus.PUSH);
    }

    @Test
    void payoutReturnsStakeOnPushAndVoid() {
        BigDecimal stake = new BigDecimal("10");
        BigDecimal price = new BigDecimal("2.5");
        assertThat(SettlementService.payout(BetStatus.WON, stake, price)).isEqualByComparingTo("25");
        assertThat(SettlementService.payout(BetStatus.PUSH, stake, price)).isEqualByComparingTo("10");
        assertThat(SettlementService.payout(BetStatus.VOID, stake, price)).isEqualByComparingTo("10");
        assertThat(SettlementService.payout(BetStatus.LOST, stake, price)).isEqualByComparingTo("0");
    }
}
