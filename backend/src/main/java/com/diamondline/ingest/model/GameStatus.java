package com.diamondline.ingest.model;

/**
 * Lifecycle of a game as reported by the sources.
 * Postponed shares a rank with in-progress: either may follow the other when a game is suspended or resumed.
 */
public enum GameStatus {
    SCHEDULED(0),
    IN_PROGRESS(1),
    POSTPONED(1),
    FINAL(2);

    private final int rank;

    GameStatus(int rank) {
        this.rank = rank;
    }

    public int getRank() { return rank; }

    /** Final and postponed games no longer hold back the processing watermark. */
    public boolean isTerminalForScheduling() {
        return this == FINAL || this == POSTPONED;
    }
}
