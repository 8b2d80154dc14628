package com.diamondline.ingest.repository;

import com.diamondline.ingest.model.TeamSeasonRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface TeamSeasonRecordRepository extends JpaRepository<TeamSeasonRecord, Long> {
    Optional<TeamSeasonRecord> findBySeasonAndTeamId(Integer season, Long teamId);
}
