package com.diamondline.ingest.repository;

import com.diamondline.ingest.model.GameRecord;
import com.diamondline.ingest.model.GameStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

public interface GameRecordRepository extends JpaRepository<GameRecord, Long> {
    List<GameRecord> findAllByOfficialDateAndHomeTeamIdAndAwayTeamIdOrderByGameNumberAsc(LocalDate officialDate, Long homeTeamId, Long awayTeamId);
    List<GameRecord> findAllByOfficialDateAndHomeTeamIdOrOfficialDateAndAwayTeamId(LocalDate homeDate, Long homeTeamId, LocalDate awayDate, Long awayTeamId);
    List<GameRecord> findAllByOfficialDateBetweenOrderByOfficialDateAsc(LocalDate from, LocalDate to);
    long countByOfficialDateAndStatusIn(LocalDate officialDate, Collection<GameStatus> statuses);
}
