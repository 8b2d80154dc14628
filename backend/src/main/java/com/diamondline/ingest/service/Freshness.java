package com.diamondline.ingest.service;

import com.diamondline.ingest.model.GameRecord;
import com.diamondline.ingest.normalize.NormalizedGame;

import java.time.Instant;
import java.time.LocalDate;

/** Per-entity rules deciding whether an incoming observation may overwrite a stored one. */
final class Freshness {

    private Freshness() {}

    /**
     * Final games never change. Otherwise a status never moves back in rank, and within the
     * same rank the later observation wins.
     */
    static boolean gameAccepts(GameRecord stored, NormalizedGame incoming) {
        if (stored.isFinal()) return false;
        if (stored.getObservedAt() == null) return true;
        int byRank = Integer.compare(incoming.status().getRank(), stored.getStatus().getRank());
        if (byRank != 0) return byRank > 0;
        return notOlder(incoming.observedAt(), stored.getObservedAt());
    }

    /** Facts keyed by (game, player, metric) or (game, pitch): equal timestamps are accepted. */
    static boolean notOlder(Instant incoming, Instant stored) {
        if (stored == null) return true;
        if (incoming == null) return false;
        return !incoming.isBefore(stored);
    }

    /**
     * Season aggregates follow the game they were reported with: a later date wins, and on the
     * same date the later game of a doubleheader.
     */
    static boolean seasonAccepts(LocalDate storedDate, Integer storedGameNumber, GameRecord incoming) {
        if (storedDate == null) return true;
        int byDate = incoming.getOfficialDate().compareTo(storedDate);
        if (byDate != 0) return byDate > 0;
        return incoming.getGameNumber() >= (storedGameNumber == null ? 1 : storedGameNumber);
    }
}
