package com.diamondline.ingest.repository;

import com.diamondline.ingest.model.PitchEvent;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface PitchEventRepository extends JpaRepository<PitchEvent, Long> {
    Optional<PitchEvent> findByGameIdAndPitchSequenceId(Long gameId, String pitchSequenceId);
    long countByGameId(Long gameId);
}
