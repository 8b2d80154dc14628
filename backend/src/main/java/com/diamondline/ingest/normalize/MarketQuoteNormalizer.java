package com.diamondline.ingest.normalize;

import com.diamondline.ingest.dto.RecordType;
import com.diamondline.ingest.dto.SourceRecord;
import com.diamondline.ingest.exception.RecordValidationException;
import com.diamondline.ingest.model.EntityKind;
import com.diamondline.ingest.service.IdentityResolver;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * A price observation for one runner of one market. The observation time is mandatory
 * because it is part of the quote's identity.
 */
@Component
public class MarketQuoteNormalizer extends AbstractRecordNormalizer {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public MarketQuoteNormalizer(IdentityResolver identityResolver, Clock clock) {
        super(identityResolver, clock);
    }

    @Override
    public RecordType supports() {
        return RecordType.MARKET_QUOTE;
    }

    @Override
    public List<NormalizedRecord> normalize(SourceRecord record) {
        PayloadReader r = PayloadReader.of(record.payload());
        String marketId = requireLength("marketId", r.requireString("marketId", "market_id"), 128);
        String runnerId = requireLength("runnerId", r.requireString("runnerId", "runner_id", "selectionId", "selection_id"), 128);
        Instant observedAt = r.instant(OBSERVED_KEYS);
        if (observedAt == null) throw new RecordValidationException("observedAt", "is required");
        BigDecimal price = decimalPrice(r);
        BigDecimal line = r.decimal("line", "lineValue", "line_value", "handicap", "points");

        String source = record.source();
        boolean referencesGame = r.has(GAME_KEYS) || (r.has("team", "teamAbbreviation", "team_abbr") && r.has(DATE_KEYS));
        Long gameId = referencesGame ? resolveGame(source, r) : null;
        String player = r.string("player", "playerName", "player_name");
        Long playerId = player == null ? null : identityResolver.resolve(source, EntityKind.PLAYER, player);

        return List.of(new NormalizedQuote(source, marketId, runnerId, gameId, playerId, line, price,
                observedAt.truncatedTo(ChronoUnit.MILLIS)));
    }

    /** Decimal odds as given, or converted from American odds (+150 is 2.5, -200 is 1.5). */
    static BigDecimal decimalPrice(PayloadReader r) {
        BigDecimal decimal = r.decimal("price", "decimalOdds", "decimal_odds");
        if (decimal != null) {
            if (decimal.compareTo(BigDecimal.ONE) <= 0) {
                throw new RecordValidationException("price", "decimal odds must be greater than 1: " + decimal.toPlainString());
            }
            return decimal;
        }
        BigDecimal american = r.decimal("americanOdds", "american_odds", "odds");
        if (american == null) throw new RecordValidationException("price", "is required");
        if (american.abs().compareTo(HUNDRED) < 0) {
            throw new RecordValidationException("americanOdds", "must be at least 100 in magnitude: " + american.toPlainString());
        }
        if (american.signum() > 0) {
            return BigDecimal.ONE.add(american.divide(HUNDRED, 4, RoundingMode.HALF_UP));
        }
        return BigDecimal.ONE.add(HUNDRED.divide(american.abs(), 4, RoundingMode.HALF_UP));
    }
}
