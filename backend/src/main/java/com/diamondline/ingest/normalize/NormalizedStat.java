package com.diamondline.ingest.normalize;

import com.diamondline.ingest.model.Metric;

import java.math.BigDecimal;
import java.time.Instant;

public record NormalizedStat(Long gameId, Long playerId, Metric metric, BigDecimal value,
                             String source, Instant observedAt) implements NormalizedRecord {
    @Override
    public String naturalKey() {
        return "stat:" + gameId + "/" + playerId + "/" + metric;
    }
}
