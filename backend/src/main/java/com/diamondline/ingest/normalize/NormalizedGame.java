package com.diamondline.ingest.normalize;

import com.diamondline.ingest.model.GameStatus;

import java.time.Instant;

public record NormalizedGame(Long gameId, GameStatus status, Integer homeScore, Integer awayScore,
                             String source, Instant observedAt) implements NormalizedRecord {
    @Override
    public String naturalKey() {
        return "game:" + gameId;
    }
}
