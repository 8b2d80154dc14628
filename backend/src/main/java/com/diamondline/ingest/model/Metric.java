package com.diamondline.ingest.model;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Canonical box-score metrics. Base metrics are stored per (game, player); derived metrics are
 * computed from stored base metrics when a proposition is settled.
 */
public enum Metric {
    AT_BATS("atBats", null, false),
    PLATE_APPEARANCES("plateAppearances", null, false),
    HITS("hits", null, false, "Hits"),
    DOUBLES("doubles", null, false, "Doubles"),
    TRIPLES("triples", null, false, "Triples"),
    HOME_RUNS("homeRuns", null, false, "Home Runs", "HR"),
    RUNS("runs", null, false, "Runs"),
    RBI("rbi", null, false, "RBIs", "RBI"),
    WALKS("baseOnBalls", null, false, "Walks"),
    STRIKEOUTS("strikeOuts", null, false, "Hitter Strikeouts", "Batter Strikeouts"),
    STOLEN_BASES("stolenBases", null, false, "Stolen Bases"),
    BATTERS_FACED(null, "battersFaced", false),
    OUTS_RECORDED(null, "outs", false),
    PITCHER_STRIKEOUTS(null, "strikeOuts", false, "Pitcher Strikeouts"),
    HITS_ALLOWED(null, "hits", false, "Hits Allowed"),
    WALKS_ALLOWED(null, "baseOnBalls", false, "Walks Allowed"),
    EARNED_RUNS(null, "earnedRuns", false, "Earned Runs Allowed", "Earned Runs"),
    PITCHES_THROWN(null, "numberOfPitches", false, "Pitches Thrown", "Pitch Count"),
    SINGLES(null, null, true, "Singles"),
    TOTAL_BASES(null, null, true, "Total Bases"),
    HITS_RUNS_RBIS(null, null, true, "Hits+Runs+RBIs", "H+R+RBI"),
    PITCHING_OUTS(null, null, true, "Pitching Outs");

    private static final Map<String, Metric> BY_PROP_NAME = new HashMap<>();

    static {
        for (Metric m : values()) {
            BY_PROP_NAME.put(lookupKey(m.name()), m);
            for (String n : m.propNames) {
                BY_PROP_NAME.put(lookupKey(n), m);
            }
        }
    }

    private final String battingField;
    private final String pitchingField;
    private final boolean derived;
    private final List<String> propNames;

    Metric(String battingField, String pitchingField, boolean derived, String... propNames) {
        this.battingField = battingField;
        this.pitchingField = pitchingField;
        this.derived = derived;
        this.propNames = List.of(propNames);
    }

    public String getBattingField() { return battingField; }
    public String getPitchingField() { return pitchingField; }
    public boolean isDerived() { return derived; }

    /**
     * Value of this metric from one player's stored base metrics in one game. Empty when a
     * required base metric is missing.
     */
    public Optional<BigDecimal> valueFrom(Map<Metric, BigDecimal> stats) {
        switch (this) {
            case SINGLES:
                return singles(stats);
            case TOTAL_BASES:
                return singles(stats).flatMap(singles -> all(stats, DOUBLES, TRIPLES, HOME_RUNS)
                        ? Optional.of(singles
                            .add(stats.get(DOUBLES).multiply(BigDecimal.valueOf(2)))
                            .add(stats.get(TRIPLES).multiply(BigDecimal.valueOf(3)))
                            .add(stats.get(HOME_RUNS).multiply(BigDecimal.valueOf(4))))
                        : Optional.empty());
            case HITS_RUNS_RBIS:
                return all(stats, HITS, RUNS, RBI)
                        ? Optional.of(stats.get(HITS).add(stats.get(RUNS)).add(stats.get(RBI)))
                        : Optional.empty();
            case PITCHING_OUTS:
                return Optional.ofNullable(stats.get(OUTS_RECORDED));
            default:
                return Optional.ofNullable(stats.get(this));
        }
    }

    // hits minus extra-base hits, floored at zero
    private static Optional<BigDecimal> singles(Map<Metric, BigDecimal> stats) {
        if (!all(stats, HITS, DOUBLES, TRIPLES, HOME_RUNS)) return Optional.empty();
        BigDecimal singles = stats.get(HITS)
                .subtract(stats.get(DOUBLES))
                .subtract(stats.get(TRIPLES))
                .subtract(stats.get(HOME_RUNS));
        return Optional.of(singles.max(BigDecimal.ZERO));
    }

    private static boolean all(Map<Metric, BigDecimal> stats, Metric... required) {
        for (Metric m : required) {
            if (stats.get(m) == null) return false;
        }
        return true;
    }

    /** Resolves a sportsbook stat label ("Total Bases", "hitter_strikeouts", ...) to a metric. */
    public static Optional<Metric> fromPropName(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        return Optional.ofNullable(BY_PROP_NAME.get(lookupKey(name)));
    }

    private static String lookupKey(String s) {
        return s.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9+]", "");
    }
}
