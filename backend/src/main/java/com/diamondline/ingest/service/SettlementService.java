package com.diamondline.ingest.service;

import com.diamondline.ingest.dto.SettlementSummaryDTO;
import com.diamondline.ingest.model.BetSettlement;
import com.diamondline.ingest.model.BetSide;
import com.diamondline.ingest.model.BetStatus;
import com.diamondline.ingest.model.BoxScoreStat;
import com.diamondline.ingest.model.GameRecord;
import com.diamondline.ingest.model.Metric;
import com.diamondline.ingest.model.PropBet;
import com.diamondline.ingest.repository.BetSettlementRepository;
import com.diamondline.ingest.repository.BoxScoreStatRepository;
import com.diamondline.ingest.repository.GameRecordRepository;
import com.diamondline.ingest.repository.PropBetRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Settles open proposition bets against final box scores. Every bet is settled in its own
 * transaction: the status change and the ledger row commit together or not at all.
 * Settled bets are never revisited.
 */
@Service
public class SettlementService {
    private static final Logger log = LoggerFactory.getLogger(SettlementService.class);

    private final PropBetRepository propBetRepository;
    private final BetSettlementRepository settlementRepository;
    private final GameRecordRepository gameRepository;
    private final BoxScoreStatRepository statRepository;
    private final TransactionTemplate perBet;
    private final Clock clock;

    public SettlementService(PropBetRepository propBetRepository,
                             BetSettlementRepository settlementRepository,
                             GameRecordRepository gameRepository,
                             BoxScoreStatRepository statRepository,
                             PlatformTransactionManager transactionManager,
                             Clock clock) {
        this.propBetRepository = propBetRepository;
        this.settlementRepository = settlementRepository;
        this.gameRepository = gameRepository;
        this.statRepository = statRepository;
        this.perBet = new TransactionTemplate(transactionManager);
        this.perBet.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    /** Scans every open bet once. */
    public SettlementSummaryDTO settleOpenBets() {
        long t0 = System.currentTimeMillis();
        List<Long> openIds = propBetRepository.findIdsByStatus(BetStatus.OPEN);
        SettlementSummaryDTO summary = new SettlementSummaryDTO();
        summary.setChecked(openIds.size());
        for (Long id : openIds) {
            try {
                BetStatus outcome = perBet.execute(tx -> settleOne(id));
                if (outcome != null) tally(summary, outcome);
            } catch (ObjectOptimisticLockingFailureException e) {
                // a concurrent run got there first
                log.info("[Settlement][Skip] bet={} settled concurrently", id);
            } catch (RuntimeException e) {
                summary.setErrors(summary.getErrors() + 1);
                log.warn("[Settlement][Error] bet={}: {}", id, e.toString());
            }
        }
        summary.setDurationMs(System.currentTimeMillis() - t0);
        log.info("[Settlement][End] checked={}, won={}, lost={}, push={}, void={}, open={}, errors={}, durationMs={}",
                summary.getChecked(), summary.getWon(), summary.getLost(), summary.getPush(), summary.getVoided(),
                summary.getStillOpen(), summary.getErrors(), summary.getDurationMs());
        return summary;
    }

    /**
     * Returns the outcome recorded now, OPEN when the bet cannot be settled yet, or null when
     * the bet is gone or was already settled.
     */
    BetStatus settleOne(Long propBetId) {
        PropBet bet = propBetRepository.findById(propBetId).orElse(null);
        if (bet == null || bet.getStatus().isSettled() || settlementRepository.existsByPropBetId(propBetId)) {
            return null;
        }
        Optional<GameRecord> game = gameRepository.findById(bet.getGameId());
        if (game.isEmpty() || !game.get().isFinal()) {
            return BetStatus.OPEN;
        }

        List<BoxScoreStat> rows = statRepository.findAllByGameIdAndPlayerId(bet.getGameId(), bet.getPlayerId());
        if (rows.isEmpty()) {
            return record(bet, BetStatus.VOID, null);
        }
        Map<Metric, BigDecimal> stats = new EnumMap<>(Metric.class);
        for (BoxScoreStat row : rows) {
            stats.put(row.getMetric(), row.getValue());
        }
        Optional<BigDecimal> actual = bet.getMetric().valueFrom(stats);
        if (actual.isEmpty()) {
            log.debug("[Settlement][Pending] bet={} metric={} not in box score yet", bet.getBetId(), bet.getMetric());
            return BetStatus.OPEN;
        }
        return record(bet, grade(bet.getSide(), actual.get(), bet.getLineValue()), actual.get());
    }

    static BetStatus grade(BetSide side, BigDecimal actual, BigDecimal line) {
        int cmp = actual.compareTo(line);
        if (cmp == 0) return BetStatus.PUSH;
        boolean over = cmp > 0;
        return (side == BetSide.OVER) == over ? BetStatus.WON : BetStatus.LOST;
    }

    static BigDecimal payout(BetStatus outcome, BigDecimal stake, BigDecimal price) {
        switch (outcome) {
            case WON: return stake.multiply(price);
            case PUSH:
            case VOID: return stake;
            default: return BigDecimal.ZERO;
        }
    }

    private BetStatus record(PropBet bet, BetStatus outcome, BigDecimal actual) {
        Instant now = clock.instant();
        bet.setStatus(outcome);
        bet.setSettledAt(now);
        propBetRepository.saveAndFlush(bet);

        BetSettlement row = new BetSettlement();
        row.setPropBetId(bet.getId());
        row.setOutcome(outcome);
        row.setActualValue(actual);
        row.setLineValue(bet.getLineValue());
        row.setStake(bet.getStake());
        row.setPayout(payout(outcome, bet.getStake(), bet.getPrice()));
        row.setSettledAt(now);
        settlementRepository.save(row);
        log.info("[Settlement][Settled] bet={}, metric={}, side={}, line={}, actual={}, outcome={}, payout={}",
                bet.getBetId(), bet.getMetric(), bet.getSide(), bet.getLineValue(), actual, outcome, row.getPayout());
        return outcome;
    }

    private static void tally(SettlementSummaryDTO s, BetStatus outcome) {
        switch (outcome) {
            case WON: s.setWon(s.getWon() + 1); break;
            case LOST: s.setLost(s.getLost() + 1); break;
            case PUSH: s.setPush(s.getPush() + 1); break;
            case VOID: s.setVoided(s.getVoided() + 1); break;
            default: s.setStillOpen(s.getStillOpen() + 1);
        }
    }
}
