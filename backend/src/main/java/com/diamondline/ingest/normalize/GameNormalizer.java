package com.diamondline.ingest.normalize;

import com.diamondline.ingest.dto.RecordType;
import com.diamondline.ingest.dto.SourceRecord;
import com.diamondline.ingest.exception.RecordValidationException;
import com.diamondline.ingest.model.GameStatus;
import com.diamondline.ingest.service.IdentityResolver;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Locale;

@Component
public class GameNormalizer extends AbstractRecordNormalizer {

    public GameNormalizer(IdentityResolver identityResolver, Clock clock) {
        super(identityResolver, clock);
    }

    @Override
    public RecordType supports() {
        return RecordType.GAME;
    }

    @Override
    public List<NormalizedRecord> normalize(SourceRecord record) {
        PayloadReader r = PayloadReader.of(record.payload());
        r.requireString(GAME_KEYS);
        r.requireDate(DATE_KEYS);
        r.requireString("homeTeam", "home_team", "home");
        r.requireString("awayTeam", "away_team", "away");
        GameStatus status = parseStatus(r.requireString("status", "detailedState", "abstractGameState"));
        Integer homeScore = requireRange("homeScore", r.integer("homeScore", "home_score"), 0, 99);
        Integer awayScore = requireRange("awayScore", r.integer("awayScore", "away_score"), 0, 99);
        if (status == GameStatus.FINAL && (homeScore == null || awayScore == null)) {
            throw new RecordValidationException("homeScore", "final games need both scores");
        }
        Long gameId = resolveGame(record.source(), r);
        return List.of(new NormalizedGame(gameId, status, homeScore, awayScore, record.source(), observedAt(r)));
    }

    /** Maps the status vocabularies of the feeds ("Final", "Game Over", "F", "Pre-Game", ...). */
    static GameStatus parseStatus(String raw) {
        String s = raw.trim().toLowerCase(Locale.ROOT);
        if (s.equals("f") || s.equals("o") || s.startsWith("final") || s.startsWith("game over")
                || s.startsWith("completed")) {
            return GameStatus.FINAL;
        }
        if (s.contains("postponed") || s.contains("suspended") || s.contains("cancel")) {
            return GameStatus.POSTPONED;
        }
        if (s.equals("i") || s.equals("l") || s.contains("progress") || s.contains("live")
                || s.contains("delayed") || s.contains("review") || s.contains("challenge")) {
            return GameStatus.IN_PROGRESS;
        }
        if (s.equals("s") || s.equals("p") || s.contains("schedule") || s.contains("pre-game")
                || s.contains("pregame") || s.contains("warmup")) {
            return GameStatus.SCHEDULED;
        }
        throw new RecordValidationException("status", "unknown game status '" + raw + "'");
    }
}
