package com.diamondline.ingest.repository;

import com.diamondline.ingest.model.PlayerSeasonStat;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface PlayerSeasonStatRepository extends JpaRepository<PlayerSeasonStat, Long> {
    Optional<PlayerSeasonStat> findBySeasonAndPlayerIdAndStat(Integer season, Long playerId, String stat);
    List<PlayerSeasonStat> findAllBySeasonAndPlayerId(Integer season, Long playerId);
}
