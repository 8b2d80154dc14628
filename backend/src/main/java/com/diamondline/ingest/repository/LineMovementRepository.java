package com.diamondline.ingest.repository;

import com.diamondline.ingest.model.LineMovement;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface LineMovementRepository extends JpaRepository<LineMovement, Long> {
    List<LineMovement> findAllBySourceAndMarketIdAndRunnerIdOrderByMovedAtAsc(String source, String marketId, String runnerId);
}
