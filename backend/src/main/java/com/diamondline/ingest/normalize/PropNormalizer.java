package com.diamondline.ingest.normalize;

import com.diamondline.ingest.dto.RecordType;
import com.diamondline.ingest.dto.SourceRecord;
import com.diamondline.ingest.exception.RecordValidationException;
import com.diamondline.ingest.model.BetSide;
import com.diamondline.ingest.model.EntityKind;
import com.diamondline.ingest.model.Metric;
import com.diamondline.ingest.service.IdentityResolver;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

@Component
public class PropNormalizer extends AbstractRecordNormalizer {

    public PropNormalizer(IdentityResolver identityResolver, Clock clock) {
        super(identityResolver, clock);
    }

    @Override
    public RecordType supports() {
        return RecordType.PROP;
    }

    @Override
    public List<NormalizedRecord> normalize(SourceRecord record) {
        PayloadReader r = PayloadReader.of(record.payload());
        String betId = requireLength("betId", r.requireString("betId", "bet_id", "projectionId", "projection_id"), 128);
        String statType = r.requireString("statType", "stat_type", "metric");
        Metric metric = Metric.fromPropName(statType)
                .orElseThrow(() -> new RecordValidationException("statType", "unsupported metric '" + statType + "'"));
        BigDecimal line = r.requireDecimal("line", "lineValue", "line_value", "lineScore", "line_score");
        if (line.signum() < 0) throw new RecordValidationException("line", "must not be negative: " + line.toPlainString());
        BetSide side = parseSide(r.requireString("side", "pick", "overUnder"));
        BigDecimal stake = r.decimal("stake");
        if (stake == null) stake = BigDecimal.ONE;
        if (stake.signum() <= 0) throw new RecordValidationException("stake", "must be positive: " + stake.toPlainString());
        BigDecimal price = r.has("price", "decimalOdds", "americanOdds", "odds")
                ? MarketQuoteNormalizer.decimalPrice(r)
                : new BigDecimal("2.0");
        String playerName = r.requireString("player", "playerName", "player_name");

        String source = record.source();
        String team = r.string("team", "teamAbbreviation", "team_abbr");
        Long teamId = team == null ? null : identityResolver.resolve(source, EntityKind.TEAM, team);
        Long playerId = identityResolver.resolve(source, EntityKind.PLAYER, playerName, teamId);
        Long gameId = resolveGame(source, r);
        Instant createdAt = r.instant("createdAt", "created_at", "startTime", "start_time");

        return List.of(new NormalizedProp(betId, source, gameId, playerId, metric, line, side, stake, price,
                createdAt != null ? createdAt : clock.instant()));
    }

    static BetSide parseSide(String raw) {
        String s = raw.trim().toLowerCase(Locale.ROOT);
        if (s.equals("over") || s.equals("o") || s.equals("more") || s.equals("higher")) return BetSide.OVER;
        if (s.equals("under") || s.equals("u") || s.equals("less") || s.equals("lower")) return BetSide.UNDER;
        throw new RecordValidationException("side", "unknown side '" + raw + "'");
    }
}
