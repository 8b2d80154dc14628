package com.diamondline.ingest.normalize;

import com.diamondline.ingest.model.BetSide;
import com.diamondline.ingest.model.Metric;

import java.math.BigDecimal;
import java.time.Instant;

public record NormalizedProp(String betId, String source, Long gameId, Long playerId, Metric metric,
                             BigDecimal lineValue, BetSide side, BigDecimal stake, BigDecimal price,
                             Instant createdAt) implements NormalizedRecord {
    @Override
    public String naturalKey() {
        return "prop:" + betId;
    }
}
