package com.diamondline.ingest.service;

import com.diamondline.ingest.dto.SourceRecord;

import java.time.LocalDate;
import java.util.List;

/**
 * Boundary to an external game feed. Implementations are thin fetchers returning raw
 * records; all cleaning happens in the normalizers.
 */
public interface GameFeedProvider {

    /** Source name the records are attributed to, e.g. "mlb". */
    String getSourceName();

    /**
     * GAME records for every game scheduled on the date, each carrying at least the game
     * token, the date and both teams.
     */
    List<SourceRecord> fetchSchedule(LocalDate date) throws Exception;

    /** Everything known about one game: its GAME record, box scores, pitches and the season aggregates reported with it. */
    List<SourceRecord> fetchGame(String gameToken, LocalDate officialDate) throws Exception;
}
