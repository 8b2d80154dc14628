package com.diamondline.ingest.service;

import com.diamondline.ingest.dto.LoadResult;
import com.diamondline.ingest.model.BoxScoreStat;
import com.diamondline.ingest.model.GameRecord;
import com.diamondline.ingest.model.LineMovement;
import com.diamondline.ingest.model.MarketQuote;
import com.diamondline.ingest.model.PitchEvent;
import com.diamondline.ingest.model.PlayerSeasonStat;
import com.diamondline.ingest.model.PropBet;
import com.diamondline.ingest.model.TeamSeasonRecord;
import com.diamondline.ingest.normalize.NormalizedGame;
import com.diamondline.ingest.normalize.NormalizedPitch;
import com.diamondline.ingest.normalize.NormalizedProp;
import com.diamondline.ingest.normalize.NormalizedQuote;
import com.diamondline.ingest.normalize.NormalizedRecord;
import com.diamondline.ingest.normalize.NormalizedSeasonStat;
import com.diamondline.ingest.normalize.NormalizedStat;
import com.diamondline.ingest.normalize.NormalizedTeamRecord;
import com.diamondline.ingest.repository.BoxScoreStatRepository;
import com.diamondline.ingest.repository.GameRecordRepository;
import com.diamondline.ingest.repository.LineMovementRepository;
import com.diamondline.ingest.repository.MarketQuoteRepository;
import com.diamondline.ingest.repository.PitchEventRepository;
import com.diamondline.ingest.repository.PlayerRepository;
import com.diamondline.ingest.repository.PlayerSeasonStatRepository;
import com.diamondline.ingest.repository.PropBetRepository;
import com.diamondline.ingest.repository.TeamSeasonRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Merges canonical records into the store. Each natural key has at most one logical effect:
 * repeating a record, or replaying an older observation of it, is counted as skipped and
 * changes nothing. One call is one transaction, so a unit's records commit or roll back together.
 * When a concurrent unit commits one of the same natural keys first, the unit is loaded once
 * more in a fresh transaction and the rows already present are skipped.
 * Season aggregates are taken only from Final games, and never from a game earlier than the
 * one the stored aggregate came from.
 */
@Service
public class LoadEngine {
    private static final Logger log = LoggerFactory.getLogger(LoadEngine.class);

    private final GameRecordRepository gameRepository;
    private final BoxScoreStatRepository statRepository;
    private final PitchEventRepository pitchRepository;
    private final MarketQuoteRepository quoteRepository;
    private final LineMovementRepository lineMovementRepository;
    private final PropBetRepository propBetRepository;
    private final PlayerRepository playerRepository;
    private final PlayerSeasonStatRepository seasonStatRepository;
    private final TeamSeasonRecordRepository teamRecordRepository;
    private final TransactionTemplate unitTransaction;

    public LoadEngine(GameRecordRepository gameRepository,
                      BoxScoreStatRepository statRepository,
                      PitchEventRepository pitchRepository,
                      MarketQuoteRepository quoteRepository,
                      LineMovementRepository lineMovementRepository,
                      PropBetRepository propBetRepository,
                      PlayerRepository playerRepository,
                      PlayerSeasonStatRepository seasonStatRepository,
                      TeamSeasonRecordRepository teamRecordRepository,
                      PlatformTransactionManager transactionManager) {
        this.gameRepository = gameRepository;
        this.statRepository = statRepository;
        this.pitchRepository = pitchRepository;
        this.quoteRepository = quoteRepository;
        this.lineMovementRepository = lineMovementRepository;
        this.propBetRepository = propBetRepository;
        this.playerRepository = playerRepository;
        this.seasonStatRepository = seasonStatRepository;
        this.teamRecordRepository = teamRecordRepository;
        this.unitTransaction = new TransactionTemplate(transactionManager);
    }

    public LoadResult upsert(List<? extends NormalizedRecord> records) {
        try {
            return unitTransaction.execute(status -> upsertOnce(records));
        } catch (DataIntegrityViolationException e) {
            log.info("[Load][Retry] natural key inserted concurrently, reloading unit of {} records: {}",
                    records.size(), e.getMostSpecificCause().getMessage());
            return unitTransaction.execute(status -> upsertOnce(records));
        }
    }

    private LoadResult upsertOnce(List<? extends NormalizedRecord> records) {
        List<NormalizedRecord> ordered = new ArrayList<>(records);
        // games before the facts that hang off them
        ordered.sort(Comparator.comparingInt(LoadEngine::loadOrder));

        int inserted = 0, updated = 0, skipped = 0;
        Set<Long> seenPlayers = new HashSet<>();
        Instant latestObservation = null;
        for (NormalizedRecord rec : ordered) {
            Effect effect;
            if (rec instanceof NormalizedGame) {
                effect = upsertGame((NormalizedGame) rec);
            } else if (rec instanceof NormalizedStat) {
                NormalizedStat stat = (NormalizedStat) rec;
                effect = upsertStat(stat);
                seenPlayers.add(stat.playerId());
                latestObservation = later(latestObservation, stat.observedAt());
            } else if (rec instanceof NormalizedPitch) {
                NormalizedPitch pitch = (NormalizedPitch) rec;
                effect = upsertPitch(pitch);
                seenPlayers.add(pitch.pitcherId());
                if (pitch.batterId() != null) seenPlayers.add(pitch.batterId());
                latestObservation = later(latestObservation, pitch.observedAt());
            } else if (rec instanceof NormalizedQuote) {
                effect = appendQuote((NormalizedQuote) rec);
            } else if (rec instanceof NormalizedProp) {
                effect = insertProp((NormalizedProp) rec);
            } else if (rec instanceof NormalizedSeasonStat) {
                effect = upsertSeasonStat((NormalizedSeasonStat) rec);
            } else if (rec instanceof NormalizedTeamRecord) {
                effect = upsertTeamRecord((NormalizedTeamRecord) rec);
            } else {
                throw new IllegalArgumentException("Unsupported record " + rec.getClass().getSimpleName());
            }
            switch (effect) {
                case INSERTED: inserted++; break;
                case UPDATED: updated++; break;
                default: skipped++;
            }
        }
        if (!seenPlayers.isEmpty() && latestObservation != null) {
            playerRepository.touchLastSeen(seenPlayers, latestObservation);
        }
        LoadResult result = new LoadResult(inserted, updated, skipped);
        log.debug("[Load] records={}, inserted={}, updated={}, skipped={}", ordered.size(), inserted, updated, skipped);
        return result;
    }

    private Effect upsertGame(NormalizedGame g) {
        GameRecord stored = gameRepository.findById(g.gameId())
                .orElseThrow(() -> new IllegalStateException("Game " + g.gameId() + " is not registered"));
        if (!Freshness.gameAccepts(stored, g)) {
            log.debug("[Load][Conflict] game={} stored={}@{} incoming={}@{}, keeping stored",
                    g.gameId(), stored.getStatus(), stored.getObservedAt(), g.status(), g.observedAt());
            return Effect.SKIPPED;
        }
        boolean firstLoad = stored.getObservedAt() == null;
        if (!firstLoad && stored.getStatus() == g.status()
                && Objects.equals(stored.getHomeScore(), g.homeScore())
                && Objects.equals(stored.getAwayScore(), g.awayScore())) {
            return Effect.SKIPPED;
        }
        stored.setStatus(g.status());
        stored.setHomeScore(g.homeScore());
        stored.setAwayScore(g.awayScore());
        stored.setObservedAt(g.observedAt());
        gameRepository.save(stored);
        return firstLoad ? Effect.INSERTED : Effect.UPDATED;
    }

    private Effect upsertStat(NormalizedStat s) {
        Optional<BoxScoreStat> existing = statRepository.findByGameIdAndPlayerIdAndMetric(s.gameId(), s.playerId(), s.metric());
        if (existing.isEmpty()) {
            BoxScoreStat row = new BoxScoreStat(s.gameId(), s.playerId(), s.metric());
            row.setValue(s.value());
            row.setSource(s.source());
            row.setObservedAt(s.observedAt());
            statRepository.save(row);
            return Effect.INSERTED;
        }
        BoxScoreStat row = existing.get();
        if (!Freshness.notOlder(s.observedAt(), row.getObservedAt()) || sameDecimal(row.getValue(), s.value())) {
            return Effect.SKIPPED;
        }
        row.setValue(s.value());
        row.setSource(s.source());
        row.setObservedAt(s.observedAt());
        statRepository.save(row);
        return Effect.UPDATED;
    }

    private Effect upsertPitch(NormalizedPitch p) {
        Optional<PitchEvent> existing = pitchRepository.findByGameIdAndPitchSequenceId(p.gameId(), p.pitchSequenceId());
        boolean isNew = existing.isEmpty();
        PitchEvent row = existing.orElseGet(() -> new PitchEvent(p.gameId(), p.pitchSequenceId()));
        if (!isNew && (!Freshness.notOlder(p.observedAt(), row.getObservedAt()) || samePitch(row, p))) {
            return Effect.SKIPPED;
        }
        row.setPitcherId(p.pitcherId());
        row.setBatterId(p.batterId());
        row.setInning(p.inning());
        row.setPitchType(p.pitchType());
        row.setReleaseSpeed(p.releaseSpeed());
        row.setSpinRate(p.spinRate());
        row.setPitchResult(p.pitchResult());
        row.setHitProbability(p.hitProbability());
        row.setSource(p.source());
        row.setObservedAt(p.observedAt());
        pitchRepository.save(row);
        return isNew ? Effect.INSERTED : Effect.UPDATED;
    }

    /** Quotes are append-only; a changed line or price against the previous observation is a movement. */
    private Effect appendQuote(NormalizedQuote q) {
        if (quoteRepository.existsBySourceAndMarketIdAndRunnerIdAndObservedAt(q.source(), q.marketId(), q.runnerId(), q.observedAt())) {
            return Effect.SKIPPED;
        }
        MarketQuote row = new MarketQuote();
        row.setSource(q.source());
        row.setMarketId(q.marketId());
        row.setRunnerId(q.runnerId());
        row.setGameId(q.gameId());
        row.setPlayerId(q.playerId());
        row.setLineValue(q.lineValue());
        row.setPrice(q.price());
        row.setObservedAt(q.observedAt());

        Optional<MarketQuote> previous = quoteRepository
                .findFirstBySourceAndMarketIdAndRunnerIdAndObservedAtLessThanOrderByObservedAtDesc(q.source(), q.marketId(), q.runnerId(), q.observedAt());
        quoteRepository.save(row);
        if (previous.isPresent()
                && (!sameDecimal(previous.get().getLineValue(), q.lineValue()) || !sameDecimal(previous.get().getPrice(), q.price()))) {
            lineMovementRepository.save(new LineMovement(previous.get(), row));
            log.debug("[Load][LineMovement] source={}, market={}, runner={}, line {}->{}, price {}->{}",
                    q.source(), q.marketId(), q.runnerId(), previous.get().getLineValue(), q.lineValue(), previous.get().getPrice(), q.price());
        }
        return Effect.INSERTED;
    }

    // bets belong to settlement once created; ingestion never overwrites them
    private Effect insertProp(NormalizedProp p) {
        if (propBetRepository.findByBetId(p.betId()).isPresent()) {
            return Effect.SKIPPED;
        }
        PropBet bet = new PropBet();
        bet.setBetId(p.betId());
        bet.setSource(p.source());
        bet.setGameId(p.gameId());
        bet.setPlayerId(p.playerId());
        bet.setMetric(p.metric());
        bet.setLineValue(p.lineValue());
        bet.setSide(p.side());
        bet.setStake(p.stake());
        bet.setPrice(p.price());
        bet.setCreatedAt(p.createdAt());
        propBetRepository.save(bet);
        return Effect.INSERTED;
    }

    private Effect upsertSeasonStat(NormalizedSeasonStat s) {
        GameRecord asOf = finalGame(s.gameId(), s.naturalKey());
        if (asOf == null) return Effect.SKIPPED;
        Optional<PlayerSeasonStat> existing = seasonStatRepository.findBySeasonAndPlayerIdAndStat(s.season(), s.playerId(), s.stat());
        boolean isNew = existing.isEmpty();
        PlayerSeasonStat row = existing.orElseGet(() -> new PlayerSeasonStat(s.season(), s.playerId(), s.stat()));
        if (!isNew && (!Freshness.seasonAccepts(row.getAsOfDate(), row.getAsOfGameNumber(), asOf)
                || (sameDecimal(row.getValue(), s.value()) && asOf.getId().equals(row.getAsOfGameId())))) {
            return Effect.SKIPPED;
        }
        row.setValue(s.value());
        row.setAsOfGameId(asOf.getId());
        row.setAsOfDate(asOf.getOfficialDate());
        row.setAsOfGameNumber(asOf.getGameNumber());
        row.setSource(s.source());
        seasonStatRepository.save(row);
        return isNew ? Effect.INSERTED : Effect.UPDATED;
    }

    private Effect upsertTeamRecord(NormalizedTeamRecord t) {
        GameRecord asOf = finalGame(t.gameId(), t.naturalKey());
        if (asOf == null) return Effect.SKIPPED;
        Optional<TeamSeasonRecord> existing = teamRecordRepository.findBySeasonAndTeamId(t.season(), t.teamId());
        boolean isNew = existing.isEmpty();
        TeamSeasonRecord row = existing.orElseGet(() -> new TeamSeasonRecord(t.season(), t.teamId()));
        if (!isNew && (!Freshness.seasonAccepts(row.getAsOfDate(), row.getAsOfGameNumber(), asOf)
                || (sameTeamRecord(row, t) && asOf.getId().equals(row.getAsOfGameId())))) {
            return Effect.SKIPPED;
        }
        row.setWins(t.wins());
        row.setLosses(t.losses());
        row.setTies(t.ties());
        row.setWinningPct(t.winningPct());
        row.setDivisionRank(t.divisionRank());
        row.setGamesBack(t.gamesBack());
        row.setAsOfGameId(asOf.getId());
        row.setAsOfDate(asOf.getOfficialDate());
        row.setAsOfGameNumber(asOf.getGameNumber());
        row.setSource(t.source());
        teamRecordRepository.save(row);
        return isNew ? Effect.INSERTED : Effect.UPDATED;
    }

    /** The game a season aggregate was reported with, or null while that game is not Final. */
    private GameRecord finalGame(Long gameId, String naturalKey) {
        GameRecord game = gameRepository.findById(gameId)
                .orElseThrow(() -> new IllegalStateException("Game " + gameId + " is not registered"));
        if (!game.isFinal()) {
            log.debug("[Load][SeasonStats] {} reported with game={} in status {}, waiting for Final",
                    naturalKey, gameId, game.getStatus());
            return null;
        }
        return game;
    }

    private static boolean sameTeamRecord(TeamSeasonRecord row, NormalizedTeamRecord t) {
        return Objects.equals(row.getWins(), t.wins())
                && Objects.equals(row.getLosses(), t.losses())
                && Objects.equals(row.getTies(), t.ties())
                && sameDecimal(row.getWinningPct(), t.winningPct())
                && Objects.equals(row.getDivisionRank(), t.divisionRank())
                && sameDecimal(row.getGamesBack(), t.gamesBack());
    }

    private static boolean samePitch(PitchEvent row, NormalizedPitch p) {
        return Objects.equals(row.getPitcherId(), p.pitcherId())
                && Objects.equals(row.getBatterId(), p.batterId())
                && Objects.equals(row.getInning(), p.inning())
                && Objects.equals(row.getPitchType(), p.pitchType())
                && sameDecimal(row.getReleaseSpeed(), p.releaseSpeed())
                && Objects.equals(row.getSpinRate(), p.spinRate())
                && Objects.equals(row.getPitchResult(), p.pitchResult())
                && sameDecimal(row.getHitProbability(), p.hitProbability());
    }

    private static boolean sameDecimal(BigDecimal a, BigDecimal b) {
        if (a == null || b == null) return a == b;
        return a.compareTo(b) == 0;
    }

    private static Instant later(Instant a, Instant b) {
        if (a == null) return b;
        if (b == null) return a;
        return b.isAfter(a) ? b : a;
    }

    private static int loadOrder(NormalizedRecord rec) {
        return rec instanceof NormalizedGame ? 0 : 1;
    }

    private enum Effect { INSERTED, UPDATED, SKIPPED }
}
