package com.diamondline.ingest.normalize;

import java.math.BigDecimal;

public record NormalizedTeamRecord(Integer season, Long teamId, Integer wins, Integer losses, Integer ties,
                                   BigDecimal winningPct, Integer divisionRank, BigDecimal gamesBack,
                                   Long gameId, String source) implements NormalizedRecord {
    @Override
    public String naturalKey() {
        return "team-record:" + season + "/" + teamId;
    }
}
