package com.diamondline.ingest.normalize;

import com.diamondline.ingest.exception.RecordValidationException;
import com.diamondline.ingest.model.EntityKind;
import com.diamondline.ingest.service.IdentityResolver;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;

/** Identifier and range helpers shared by the per-type normalizers. */
public abstract class AbstractRecordNormalizer implements RecordNormalizer {

    static final String[] GAME_KEYS = {"gamePk", "game_pk", "gameId", "game_id", "eventId", "event_id"};
    static final String[] DATE_KEYS = {"officialDate", "official_date", "gameDate", "game_date", "date"};
    static final String[] OBSERVED_KEYS = {"observedAt", "observed_at", "timestamp", "lastUpdated", "updatedAt"};

    protected final IdentityResolver identityResolver;
    protected final Clock clock;

    protected AbstractRecordNormalizer(IdentityResolver identityResolver, Clock clock) {
        this.identityResolver = identityResolver;
        this.clock = clock;
    }

    /** Source observation time, or the receipt time when the source does not stamp records. */
    protected Instant observedAt(PayloadReader r) {
        Instant observed = r.instant(OBSERVED_KEYS);
        return observed != null ? observed : clock.instant();
    }

    protected Long resolveTeam(String source, String token, String displayName) {
        return identityResolver.resolveOrRegisterTeam(source, token, displayName);
    }

    /**
     * A game is referenced by the source's game token, optionally with its date and teams, or
     * only by date and one team when the source has no game ids.
     */
    protected Long resolveGame(String source, PayloadReader r) {
        String token = r.string(GAME_KEYS);
        LocalDate date = r.date(DATE_KEYS);
        Integer gameNumber = r.integer("gameNumber", "game_number");
        String home = r.string("homeTeam", "home_team", "home");
        String away = r.string("awayTeam", "away_team", "away");

        if (token != null && date != null && home != null && away != null) {
            Long homeId = resolveTeam(source, home, r.string("homeTeamName", "home_team_name"));
            Long awayId = resolveTeam(source, away, r.string("awayTeamName", "away_team_name"));
            if (homeId.equals(awayId)) throw new RecordValidationException("awayTeam", "is the same team as homeTeam");
            return identityResolver.resolveOrRegisterGame(source, token, date, homeId, awayId, gameNumber);
        }
        if (token != null) {
            return identityResolver.resolve(source, EntityKind.GAME, token);
        }
        String team = r.string("team", "teamAbbreviation", "team_abbr");
        if (date != null && team != null) {
            Long teamId = identityResolver.resolve(source, EntityKind.TEAM, team);
            return identityResolver.resolveGameByTeam(source, date, teamId, gameNumber);
        }
        throw new RecordValidationException(GAME_KEYS[0], "a game id, or a date and team, is required");
    }

    protected static String requireLength(String field, String value, int max) {
        if (value != null && value.length() > max) {
            throw new RecordValidationException(field, "longer than " + max + " characters");
        }
        return value;
    }

    protected static BigDecimal requireRange(String field, BigDecimal value, double min, double max) {
        if (value == null) return null;
        if (value.compareTo(BigDecimal.valueOf(min)) < 0 || value.compareTo(BigDecimal.valueOf(max)) > 0) {
            throw new RecordValidationException(field, "out of range [" + min + ", " + max + "]: " + value.toPlainString());
        }
        return value;
    }

    protected static Integer requireRange(String field, Integer value, int min, int max) {
        if (value == null) return null;
        if (value < min || value > max) {
            throw new RecordValidationException(field, "out of range [" + min + ", " + max + "]: " + value);
        }
        return value;
    }
}
