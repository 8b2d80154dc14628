package com.diamondline.ingest.normalize;

import java.math.BigDecimal;
import java.time.Instant;

public record NormalizedQuote(String source, String marketId, String runnerId, Long gameId, Long playerId,
                              BigDecimal lineValue, BigDecimal price, Instant observedAt) implements NormalizedRecord {
    @Override
    public String naturalKey() {
        return "quote:" + source + "/" + marketId + "/" + runnerId + "@" + observedAt;
    }
}
