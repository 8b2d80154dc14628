package com.diamondline.ingest.repository;

import com.diamondline.ingest.model.BoxScoreStat;
import com.diamondline.ingest.model.Metric;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface BoxScoreStatRepository extends JpaRepository<BoxScoreStat, Long> {
    Optional<BoxScoreStat> findByGameIdAndPlayerIdAndMetric(Long gameId, Long playerId, Metric metric);
    List<BoxScoreStat> findAllByGameIdAndPlayerId(Long gameId, Long playerId);
    long countByGameId(Long gameId);
}
