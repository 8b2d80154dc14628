package com.diamondline.ingest.normalize;

import java.math.BigDecimal;

/** A player's season aggregate, reported with the game identified by {@code gameId}. */
public record NormalizedSeasonStat(Integer season, Long playerId, String stat, BigDecimal value,
                                   Long gameId, String source) implements NormalizedRecord {
    @Override
    public String naturalKey() {
        return "season-stat:" + season + "/" + playerId + "/" + stat;
    }
}
