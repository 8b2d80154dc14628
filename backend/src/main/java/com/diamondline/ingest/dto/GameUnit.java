package com.diamondline.ingest.dto;

import java.time.LocalDate;

/**
 * One game of a provider's schedule: the unit of work of the daily game job.
 * Equality is by source and game token only.
 */
public final class GameUnit {
    private final String source;
    private final String gameToken;
    private final LocalDate officialDate;
    private final SourceRecord scheduleRecord;

    public GameUnit(String source, String gameToken, LocalDate officialDate, SourceRecord scheduleRecord) {
        this.source = source;
        this.gameToken = gameToken;
        this.officialDate = officialDate;
        this.scheduleRecord = scheduleRecord;
    }

    public String getSource() { return source; }
    public String getGameToken() { return gameToken; }
    public LocalDate getOfficialDate() { return officialDate; }
    public SourceRecord getScheduleRecord() { return scheduleRecord; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GameUnit)) return false;
        GameUnit other = (GameUnit) o;
        return source.equals(other.source) && gameToken.equals(other.gameToken);
    }

    @Override
    public int hashCode() {
        return 31 * source.hashCode() + gameToken.hashCode();
    }

    @Override
    public String toString() {
        return source + ":" + gameToken + "@" + officialDate;
    }
}
