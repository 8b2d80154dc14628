package com.diamondline.ingest.normalize;

import com.diamondline.ingest.dto.RecordType;
import com.diamondline.ingest.dto.SourceRecord;
import com.diamondline.ingest.exception.UnresolvedAliasException;
import com.diamondline.ingest.model.BetSide;
import com.diamondline.ingest.model.EntityKind;
import com.diamondline.ingest.model.GameStatus;
import com.diamondline.ingest.model.Metric;
import com.diamondline.ingest.service.IdentityResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NormalizerRegistryTest {

    private static final Instant NOW = Instant.parse("2024-04-12T12:00:00Z");
    private static final LocalDate APR_11 = LocalDate.of(2024, 4, 11);

    @Mock private IdentityResolver resolver;

    private NormalizerRegistry registry;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        registry = new NormalizerRegistry(List.of(
                new GameNormalizer(resolver, clock),
                new BoxScoreNormalizer(resolver, clock),
                new PitchNormalizer(resolver, clock),
                new MarketQuoteNormalizer(resolver, clock),
                new PropNormalizer(resolver, clock),
                new SeasonStatsNormalizer(resolver, clock)));
        lenient().when(resolver.resolveOrRegisterTeam(eq("mlb"), eq("BOS"), any())).thenReturn(1L);
        lenient().when(resolver.resolveOrRegisterTeam(eq("mlb"), eq("NYY"), any())).thenReturn(2L);
        lenient().when(resolver.resolve("mlb", EntityKind.GAME, "745001")).thenReturn(100L);
    }

    private static Map<String, Object> game(String status) {
        Map<String, Object> p = new HashMap<>();
        p.put("gamePk", 745001);
        p.put("officialDate", "2024-04-11");
        p.put("homeTeam", "BOS");
        p.put("awayTeam", "NYY");
        p.put("status", status);
        return p;
    }

    @Test
    void gameRecordRegistersAndCarriesScores() {
        when(resolver.resolveOrRegisterGame("mlb", "745001", APR_11, 1L, 2L, null)).thenReturn(100L);
        Map<String, Object> payload = game("Final");
        payload.put("homeScore", "5");
        payload.put("awayScore", 3);

        NormalizationResult result = registry.normalizeAll(List.of(new SourceRecord("MLB", RecordType.GAME, payload)));

        assertThat(result.rejections()).isEmpty();
        NormalizedGame g = (NormalizedGame) result.records().get(0);
        assertThat(g.gameId()).isEqualTo(100L);
        assertThat(g.status()).isEqualTo(GameStatus.FINAL);
        assertThat(g.homeScore()).isEqualTo(5);
        assertThat(g.observedAt()).isEqualTo(NOW);
    }

    @Test
    void finalGameWithoutScoresIsRejected() {
        NormalizationResult result = registry.normalizeAll(List.of(new SourceRecord("mlb", RecordType.GAME, game("Game Over"))));

        assertThat(result.records()).isEmpty();
        assertThat(result.rejections()).singleElement()
                .satisfies(r -> assertThat(r.category()).isEqualTo(NormalizationResult.VALIDATION));
    }

    @Test
    void pitcherLineConvertsInningsPitchedToOuts() {
        when(resolver.resolveOrRegisterPlayer(eq("mlb"), eq("543037"), eq("Gerrit Cole"), isNull())).thenReturn(7L);
        Map<String, Object> pitching = new HashMap<>();
        pitching.put("inningsPitched", "6.1");
        pitching.put("strikeOuts", 9);
        pitching.put("battersFaced", 24);
        Map<String, Object> payload = new HashMap<>();
        payload.put("gamePk", "745001");
        payload.put("playerId", "ID543037");
        payload.put("playerName", "Gerrit Cole");
        payload.put("stats", Map.of("pitching", pitching));

        NormalizationResult result = registry.normalizeAll(List.of(new SourceRecord("mlb", RecordType.BOX_SCORE, payload)));

        assertThat(result.rejections()).isEmpty();
        Map<Metric, BigDecimal> byMetric = new HashMap<>();
        for (NormalizedRecord r : result.records()) {
            NormalizedStat s = (NormalizedStat) r;
            assertThat(s.playerId()).isEqualTo(7L);
            byMetric.put(s.metric(), s.value());
        }
        assertThat(byMetric.get(Metric.OUTS_RECORDED)).isEqualByComparingTo("19");
        assertThat(byMetric.get(Metric.PITCHER_STRIKEOUTS)).isEqualByComparingTo("9");
        assertThat(byMetric.get(Metric.EARNED_RUNS)).isEqualByComparingTo("0");
        assertThat(byMetric).doesNotContainKey(Metric.HITS);
    }

    @Test
    void benchPlayerProducesNoRows() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("gamePk", "745001");
        payload.put("playerId", "ID000001");
        payload.put("stats", Map.of("batting", Map.of("atBats", 0)));

        NormalizationResult result = registry.normalizeAll(List.of(new SourceRecord("mlb", RecordType.BOX_SCORE, payload)));

        assertThat(result.records()).isEmpty();
        assertThat(result.rejections()).isEmpty();
    }

    @Test
    void unknownPlayerIsRejectedAsUnresolvedAndOthersSurvive() {
        when(resolver.resolve("prizepicks", EntityKind.PLAYER, "Nobody Atall", null))
                .thenThrow(new UnresolvedAliasException("prizepicks", EntityKind.PLAYER, "Nobody Atall"));
        when(resolver.resolve("prizepicks", EntityKind.PLAYER, "Aaron Judge", null)).thenReturn(9L);
        when(resolver.resolve("prizepicks", EntityKind.GAME, "745001")).thenReturn(100L);

        SourceRecord bad = new SourceRecord("prizepicks", RecordType.PROP, prop("p-1", "Nobody Atall", "Hits"));
        SourceRecord good = new SourceRecord("prizepicks", RecordType.PROP, prop("p-2", "Aaron Judge", "Total Bases"));
        NormalizationResult result = registry.normalizeAll(List.of(bad, good));

        assertThat(result.rejections()).singleElement()
                .satisfies(r -> assertThat(r.category()).isEqualTo(NormalizationResult.UNRESOLVED_ALIAS));
        NormalizedProp p = (NormalizedProp) result.records().get(0);
        assertThat(p.metric()).isEqualTo(Metric.TOTAL_BASES);
        assertThat(p.side()).isEqualTo(BetSide.UNDER);
        assertThat(p.stake()).isEqualByComparingTo("1");
        assertThat(p.price()).isEqualByComparingTo("2.0");
    }

    @Test
    void unsupportedPropMetricIsAValidationError() {
        NormalizationResult result = registry.normalizeAll(List.of(
                new SourceRecord("prizepicks", RecordType.PROP, prop("p-3", "Aaron Judge", "Fantasy Score"))));

        assertThat(result.rejections()).singleElement().satisfies(r -> {
            assertThat(r.category()).isEqualTo(NormalizationResult.VALIDATION);
            assertThat(r.reason()).contains("Fantasy Score");
        });
    }

    @Test
    void americanOddsAreConvertedToDecimal() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("marketId", "1.234");
        payload.put("runnerId", "judge-over");
        payload.put("americanOdds", "+150");
        payload.put("line", 1.5);
        payload.put("observedAt", "2024-04-11T17:05:00.123456Z");

        NormalizationResult result = registry.normalizeAll(List.of(new SourceRecord("betfair", RecordType.MARKET_QUOTE, payload)));

        NormalizedQuote q = (NormalizedQuote) result.records().get(0);
        assertThat(q.price()).isEqualByComparingTo("2.5");
        assertThat(q.gameId()).isNull();
        assertThat(q.observedAt()).isEqualTo(Instant.parse("2024-04-11T17:05:00.123Z"));
    }

    @Test
    void quoteWithoutObservationTimeIsRejected() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("marketId", "1.234");
        payload.put("runnerId", "judge-over");
        payload.put("price", 1.8);

        NormalizationResult result = registry.normalizeAll(List.of(new SourceRecord("betfair", RecordType.MARKET_QUOTE, payload)));

        assertThat(result.records()).isEmpty();
        assertThat(result.rejections()).hasSize(1);
    }

    @Test
    void outOfRangePitchFieldsAreRejectedNotClamped() {
        when(resolver.resolveOrRegisterPlayer(eq("mlb"), eq("543037"), isNull(), isNull())).thenReturn(7L);
        Map<String, Object> tooFast = pitch("745001_1");
        tooFast.put("releaseSpeed", 150);
        Map<String, Object> impossibleHit = pitch("745001_2");
        impossibleHit.put("hitProbability", 1.2);
        Map<String, Object> fine = pitch("745001_3");
        fine.put("releaseSpeed", "97.34");
        fine.put("hitProbability", 0.25);

        NormalizationResult result = registry.normalizeAll(List.of(
                new SourceRecord("mlb", RecordType.PITCH, tooFast),
                new SourceRecord("mlb", RecordType.PITCH, impossibleHit),
                new SourceRecord("mlb", RecordType.PITCH, fine)));

        assertThat(result.rejections()).hasSize(2).allSatisfy(r -> assertThat(r.category()).isEqualTo(NormalizationResult.VALIDATION));
        assertThat(result.rejections()).extracting(NormalizationResult.Rejection::reason)
                .anySatisfy(reason -> assertThat(reason).startsWith("releaseSpeed"))
                .anySatisfy(reason -> assertThat(reason).startsWith("hitProbability"));
        NormalizedPitch kept = (NormalizedPitch) result.records().get(0);
        assertThat(kept.pitchSequenceId()).isEqualTo("745001_3");
        assertThat(kept.releaseSpeed()).isEqualByComparingTo("97.34");
    }

    @Test
    void negativeCountIsRejectedBeforeThePlayerIsRegistered() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("gamePk", "745001");
        payload.put("playerId", "ID592450");
        payload.put("playerName", "Aaron Judge");
        payload.put("stats", Map.of("batting", Map.of("atBats", 4, "hits", -1)));

        NormalizationResult result = registry.normalizeAll(List.of(new SourceRecord("mlb", RecordType.BOX_SCORE, payload)));

        assertThat(result.records()).isEmpty();
        assertThat(result.rejections()).singleElement().satisfies(r -> assertThat(r.reason()).startsWith("hits"));
        verify(resolver, never()).resolveOrRegisterPlayer(anyString(), anyString(), any(), any());
    }

    @Test
    void unexpectedErrorInOneRecordRejectsItAndTheGameSurvives() {
        when(resolver.resolveOrRegisterGame("mlb", "745001", APR_11, 1L, 2L, null)).thenReturn(100L);
        when(resolver.resolveOrRegisterPlayer(eq("mlb"), anyString(), any(), any()))
                .thenThrow(new DataIntegrityViolationException("value too long for column full_name"));
        Map<String, Object> line = new HashMap<>();
        line.put("gamePk", "745001");
        line.put("playerId", "592450");
        line.put("stats", Map.of("batting", Map.of("atBats", 4, "hits", 2)));

        NormalizationResult result = registry.normalizeAll(List.of(
                new SourceRecord("mlb", RecordType.BOX_SCORE, line),
                new SourceRecord("mlb", RecordType.GAME, game("Scheduled"))));

        assertThat(result.records()).singleElement().isInstanceOf(NormalizedGame.class);
        assertThat(result.rejections()).singleElement().satisfies(r -> {
            assertThat(r.record().recordType()).isEqualTo(RecordType.BOX_SCORE);
            assertThat(r.category()).isEqualTo(NormalizationResult.VALIDATION);
        });
    }

    @Test
    void losingTheStoreFailsTheWholeUnit() {
        when(resolver.resolveOrRegisterTeam(eq("mlb"), eq("BOS"), any()))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> registry.normalizeAll(List.of(new SourceRecord("mlb", RecordType.GAME, game("Scheduled")))))
                .isInstanceOf(DataAccessResourceFailureException.class);
    }

    @Test
    void oversizedPitchTypeIsRejected() {
        Map<String, Object> payload = pitch("745001_4");
        payload.put("pitchType", "FOUR_SEAM_FASTBALL");

        NormalizationResult result = registry.normalizeAll(List.of(new SourceRecord("mlb", RecordType.PITCH, payload)));

        assertThat(result.records()).isEmpty();
        assertThat(result.rejections()).singleElement().satisfies(r -> assertThat(r.reason()).startsWith("pitchType"));
    }

    @Test
    void seasonLineSkipsPlaceholdersAndCountsInningsAsOuts() {
        when(resolver.resolveOrRegisterPlayer("mlb", "592450", "Aaron Judge", 2L)).thenReturn(9L);
        Map<String, Object> batting = new HashMap<>();
        batting.put("homeRuns", 4);
        batting.put("avg", ".312");
        batting.put("ops", "-.--");
        Map<String, Object> pitching = new HashMap<>();
        pitching.put("inningsPitched", "12.2");
        pitching.put("era", "-.--");
        Map<String, Object> payload = new HashMap<>();
        payload.put("gamePk", "745001");
        payload.put("season", "2024");
        payload.put("team", "NYY");
        payload.put("playerId", "ID592450");
        payload.put("playerName", "Aaron Judge");
        payload.put("stats", Map.of("batting", batting, "pitching", pitching));

        NormalizationResult result = registry.normalizeAll(List.of(new SourceRecord("mlb", RecordType.SEASON_STATS, payload)));

        assertThat(result.rejections()).isEmpty();
        Map<String, BigDecimal> byStat = new HashMap<>();
        for (NormalizedRecord r : result.records()) {
            NormalizedSeasonStat s = (NormalizedSeasonStat) r;
            assertThat(s.season()).isEqualTo(2024);
            assertThat(s.playerId()).isEqualTo(9L);
            assertThat(s.gameId()).isEqualTo(100L);
            byStat.put(s.stat(), s.value());
        }
        assertThat(byStat).containsOnlyKeys("batting.homeRuns", "batting.avg", "pitching.outs");
        assertThat(byStat.get("batting.avg")).isEqualByComparingTo("0.312");
        assertThat(byStat.get("pitching.outs")).isEqualByComparingTo("38");
    }

    @Test
    void teamStandingTakesItsSeasonFromTheGameDate() {
        Map<String, Object> standing = new HashMap<>();
        standing.put("wins", 10);
        standing.put("losses", "4");
        standing.put("pct", ".714");
        standing.put("divisionRank", "1");
        standing.put("gamesBack", "-");
        Map<String, Object> payload = new HashMap<>();
        payload.put("gamePk", "745001");
        payload.put("officialDate", "2024-04-11");
        payload.put("team", "NYY");
        payload.put("record", standing);

        NormalizationResult result = registry.normalizeAll(List.of(new SourceRecord("mlb", RecordType.SEASON_STATS, payload)));

        assertThat(result.rejections()).isEmpty();
        NormalizedTeamRecord t = (NormalizedTeamRecord) result.records().get(0);
        assertThat(t.season()).isEqualTo(2024);
        assertThat(t.teamId()).isEqualTo(2L);
        assertThat(t.gameId()).isEqualTo(100L);
        assertThat(t.wins()).isEqualTo(10);
        assertThat(t.losses()).isEqualTo(4);
        assertThat(t.winningPct()).isEqualByComparingTo("0.714");
        assertThat(t.divisionRank()).isEqualTo(1);
        assertThat(t.gamesBack()).isNull();
    }

    @Test
    void negativeSeasonTotalIsRejectedBeforeThePlayerIsRegistered() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("gamePk", "745001");
        payload.put("season", 2024);
        payload.put("playerId", "ID592450");
        payload.put("stats", Map.of("batting", Map.of("homeRuns", -2)));

        NormalizationResult result = registry.normalizeAll(List.of(new SourceRecord("mlb", RecordType.SEASON_STATS, payload)));

        assertThat(result.records()).isEmpty();
        assertThat(result.rejections()).singleElement().satisfies(r -> assertThat(r.reason()).startsWith("homeRuns"));
        verify(resolver, never()).resolveOrRegisterPlayer(anyString(), anyString(), any(), any());
    }

    private static Map<String, Object> pitch(String sequenceId) {
        Map<String, Object> p = new HashMap<>();
        p.put("gamePk", "745001");
        p.put("pitchSequenceId", sequenceId);
        p.put("pitcher", "543037");
        p.put("inning", 1);
        return p;
    }

    private static Map<String, Object> prop(String betId, String player, String statType) {
        Map<String, Object> p = new HashMap<>();
        p.put("betId", betId);
        p.put("player", player);
        p.put("statType", statType);
        p.put("line", "1.5");
        p.put("side", "less");
        p.put("gamePk", "745001");
        return p;
    }
}
