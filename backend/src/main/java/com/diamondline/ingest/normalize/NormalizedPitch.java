package com.diamondline.ingest.normalize;

import java.math.BigDecimal;
import java.time.Instant;

public record NormalizedPitch(Long gameId, String pitchSequenceId, Long pitcherId, Long batterId,
                              Integer inning, String pitchType, BigDecimal releaseSpeed, Integer spinRate,
                              String pitchResult, BigDecimal hitProbability,
                              String source, Instant observedAt) implements NormalizedRecord {
    @Override
    public String naturalKey() {
        return "pitch:" + gameId + "/" + pitchSequenceId;
    }
}
