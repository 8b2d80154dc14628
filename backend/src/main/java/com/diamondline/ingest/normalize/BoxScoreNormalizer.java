package com.diamondline.ingest.normalize;

import com.diamondline.ingest.dto.RecordType;
import com.diamondline.ingest.dto.SourceRecord;
import com.diamondline.ingest.exception.RecordValidationException;
import com.diamondline.ingest.model.Metric;
import com.diamondline.ingest.service.IdentityResolver;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One player's line in one game. Batting and pitching blocks are read separately; a player
 * who neither batted nor pitched yields no rows.
 */
@Component
public class BoxScoreNormalizer extends AbstractRecordNormalizer {

    public BoxScoreNormalizer(IdentityResolver identityResolver, Clock clock) {
        super(identityResolver, clock);
    }

    @Override
    public RecordType supports() {
        return RecordType.BOX_SCORE;
    }

    @Override
    public List<NormalizedRecord> normalize(SourceRecord record) {
        PayloadReader r = PayloadReader.of(record.payload());
        PayloadReader stats = r.child("stats");
        PayloadReader batting = stats.isEmpty() ? r.child("batting") : stats.child("batting");
        PayloadReader pitching = stats.isEmpty() ? r.child("pitching") : stats.child("pitching");

        boolean batted = positive(batting, "atBats") || positive(batting, "plateAppearances");
        boolean pitched = pitching.has("inningsPitched") || positive(pitching, "battersFaced");
        if (!batted && !pitched) return List.of();

        // counts are validated before any id is resolved, so a rejected line registers nothing
        List<Map.Entry<Metric, BigDecimal>> values = new ArrayList<>();
        for (Metric m : Metric.values()) {
            if (batted && m.getBattingField() != null) {
                values.add(Map.entry(m, count(batting, m.getBattingField())));
            }
            if (pitched && m.getPitchingField() != null) {
                values.add(Map.entry(m, m == Metric.OUTS_RECORDED ? outsRecorded(pitching) : count(pitching, m.getPitchingField())));
            }
        }
        String token = playerToken(r);
        Instant observedAt = observedAt(r);

        String source = record.source();
        Long gameId = resolveGame(source, r);
        String team = r.string("team", "teamAbbreviation", "team_abbr");
        Long teamId = team == null ? null : resolveTeam(source, team, null);
        Long playerId = identityResolver.resolveOrRegisterPlayer(source, token,
                r.string("playerName", "player_name", "fullName"), teamId);

        List<NormalizedRecord> out = new ArrayList<>(values.size());
        for (Map.Entry<Metric, BigDecimal> v : values) {
            out.add(new NormalizedStat(gameId, playerId, v.getKey(), v.getValue(), source, observedAt));
        }
        return out;
    }

    static String playerToken(PayloadReader r) {
        String token = r.string("playerId", "player_id", "personId", "player");
        if (token == null) token = r.string("playerName", "player_name", "fullName");
        if (token == null) throw new RecordValidationException("playerId", "is required");
        // MLB box scores key players as "ID660271"
        if (token.startsWith("ID") && token.length() > 2 && Character.isDigit(token.charAt(2))) {
            token = token.substring(2);
        }
        return token;
    }

    private static boolean positive(PayloadReader block, String field) {
        Integer v = block.integer(field);
        return v != null && v > 0;
    }

    // missing counting stats of a participating player are zero
    private static BigDecimal count(PayloadReader block, String field) {
        Integer v = block.integer(field);
        if (v == null) return BigDecimal.ZERO;
        if (v < 0) throw new RecordValidationException(field, "must not be negative: " + v);
        return BigDecimal.valueOf(v);
    }

    /** Explicit outs, else innings pitched in baseball notation: "6.1" is six innings and one out. */
    static BigDecimal outsRecorded(PayloadReader pitching) {
        Integer outs = pitching.integer("outs");
        if (outs != null) {
            if (outs < 0) throw new RecordValidationException("outs", "must not be negative: " + outs);
            return BigDecimal.valueOf(outs);
        }
        String ip = pitching.string("inningsPitched");
        if (ip == null) return BigDecimal.ZERO;
        String[] parts = ip.split("\\.");
        try {
            int innings = Integer.parseInt(parts[0]);
            int thirds = parts.length > 1 ? Integer.parseInt(parts[1]) : 0;
            if (innings < 0 || thirds < 0 || thirds > 2 || parts.length > 2) {
                throw new RecordValidationException("inningsPitched", "invalid value '" + ip + "'");
            }
            return BigDecimal.valueOf(innings * 3L + thirds);
        } catch (NumberFormatException e) {
            throw new RecordValidationException("inningsPitched", "invalid value '" + ip + "'");
        }
    }
}
