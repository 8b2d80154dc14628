package com.diamondline.ingest.normalize;

import com.diamondline.ingest.dto.RecordType;
import com.diamondline.ingest.dto.SourceRecord;
import com.diamondline.ingest.exception.RecordValidationException;
import com.diamondline.ingest.service.IdentityResolver;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Season-to-date aggregates published alongside a game. A record carrying a player token is a
 * player's batting and pitching totals; otherwise it is the team's standing under {@code record}.
 * Placeholders such as {@code "-.--"} mean the aggregate is undefined and produce no row.
 */
@Component
public class SeasonStatsNormalizer extends AbstractRecordNormalizer {

    static final List<String> BATTING_STATS = List.of(
            "gamesPlayed", "plateAppearances", "atBats", "runs", "hits", "doubles", "triples", "homeRuns",
            "rbi", "baseOnBalls", "strikeOuts", "stolenBases", "caughtStealing", "totalBases",
            "avg", "obp", "slg", "ops");
    static final List<String> PITCHING_STATS = List.of(
            "gamesPlayed", "gamesStarted", "wins", "losses", "saves", "holds", "battersFaced",
            "hits", "runs", "earnedRuns", "homeRuns", "baseOnBalls", "strikeOuts", "era", "whip");

    private static final Set<String> UNDEFINED = Set.of("-", "--", "-.-", "-.--", "-.---", ".---", "*.**");

    public SeasonStatsNormalizer(IdentityResolver identityResolver, Clock clock) {
        super(identityResolver, clock);
    }

    @Override
    public RecordType supports() {
        return RecordType.SEASON_STATS;
    }

    @Override
    public List<NormalizedRecord> normalize(SourceRecord record) {
        PayloadReader r = PayloadReader.of(record.payload());
        Integer season = season(r);
        boolean playerLine = r.has("playerId", "player_id", "personId", "player", "playerName", "player_name", "fullName");
        return playerLine ? playerLine(record.source(), r, season) : teamLine(record.source(), r, season);
    }

    private List<NormalizedRecord> playerLine(String source, PayloadReader r, Integer season) {
        PayloadReader stats = r.child("stats");
        PayloadReader batting = stats.isEmpty() ? r.child("batting") : stats.child("batting");
        PayloadReader pitching = stats.isEmpty() ? r.child("pitching") : stats.child("pitching");

        Map<String, BigDecimal> values = new LinkedHashMap<>();
        for (String field : BATTING_STATS) {
            BigDecimal v = aggregate(batting, field);
            if (v != null) values.put("batting." + field, v);
        }
        for (String field : PITCHING_STATS) {
            BigDecimal v = aggregate(pitching, field);
            if (v != null) values.put("pitching." + field, v);
        }
        if (pitching.has("outs", "inningsPitched")) {
            values.put("pitching.outs", BoxScoreNormalizer.outsRecorded(pitching));
        }
        if (values.isEmpty()) return List.of();
        String token = BoxScoreNormalizer.playerToken(r);

        Long gameId = resolveGame(source, r);
        String team = r.string("team", "teamAbbreviation", "team_abbr");
        Long teamId = team == null ? null : resolveTeam(source, team, null);
        Long playerId = identityResolver.resolveOrRegisterPlayer(source, token,
                r.string("playerName", "player_name", "fullName"), teamId);

        List<NormalizedRecord> out = new ArrayList<>(values.size());
        for (Map.Entry<String, BigDecimal> v : values.entrySet()) {
            out.add(new NormalizedSeasonStat(season, playerId, v.getKey(), v.getValue(), gameId, source));
        }
        return out;
    }

    private List<NormalizedRecord> teamLine(String source, PayloadReader r, Integer season) {
        PayloadReader standing = r.child("record", "leagueRecord", "league_record");
        if (standing.isEmpty()) {
            throw new RecordValidationException("record", "a player line or a team record is required");
        }
        String team = r.requireString("team", "teamAbbreviation", "team_abbr");
        Integer wins = requireRange("wins", standing.requireInteger("wins"), 0, 200);
        Integer losses = requireRange("losses", standing.requireInteger("losses"), 0, 200);
        Integer ties = requireRange("ties", standing.integer("ties"), 0, 200);
        BigDecimal pct = requireRange("pct", aggregate(standing, "pct", "winningPercentage"), 0, 1);
        BigDecimal rank = aggregate(standing, "divisionRank", "division_rank");
        Integer divisionRank = rank == null ? null : requireRange("divisionRank", wholeNumber("divisionRank", rank), 1, 10);
        BigDecimal gamesBack = requireRange("gamesBack", aggregate(standing, "gamesBack", "games_back"), 0, 200);

        Long gameId = resolveGame(source, r);
        Long teamId = resolveTeam(source, team, r.string("teamName", "team_name"));
        return List.of(new NormalizedTeamRecord(season, teamId, wins, losses, ties, pct, divisionRank, gamesBack, gameId, source));
    }

    private static Integer season(PayloadReader r) {
        Integer season = r.integer("season");
        if (season == null) {
            LocalDate date = r.date(DATE_KEYS);
            if (date == null) throw new RecordValidationException("season", "a season, or the game's date, is required");
            season = date.getYear();
        }
        return requireRange("season", season, 1876, 2200);
    }

    // null when absent or published as a placeholder
    private static BigDecimal aggregate(PayloadReader block, String... keys) {
        String raw = block.string(keys);
        if (raw == null || UNDEFINED.contains(raw)) return null;
        BigDecimal v = block.decimal(keys);
        if (v.signum() < 0) throw new RecordValidationException(keys[0], "must not be negative: " + v.toPlainString());
        return v;
    }

    private static Integer wholeNumber(String field, BigDecimal v) {
        try {
            return v.stripTrailingZeros().intValueExact();
        } catch (ArithmeticException e) {
            throw new RecordValidationException(field, "is not a whole number: " + v.toPlainString());
        }
    }
}
