package com.diamondline.ingest.model;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MetricTest {

    private static Map<Metric, BigDecimal> line(int hits, int doubles, int triples, int homeRuns, int runs, int rbi) {
        Map<Metric, BigDecimal> stats = new EnumMap<>(Metric.class);
        stats.put(Metric.HITS, BigDecimal.valueOf(hits));
        stats.put(Metric.DOUBLES, BigDecimal.valueOf(doubles));
        stats.put(Metric.TRIPLES, BigDecimal.valueOf(triples));
        stats.put(Metric.HOME_RUNS, BigDecimal.valueOf(homeRuns));
        stats.put(Metric.RUNS, BigDecimal.valueOf(runs));
        stats.put(Metric.RBI, BigDecimal.valueOf(rbi));
        return stats;
    }

    @Test
    void derivedMetricsComeFromBaseCounts() {
        Map<Metric, BigDecimal> stats = line(3, 1, 0, 1, 2, 3);

        assertThat(Metric.SINGLES.valueFrom(stats)).hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("1"));
        // 1 single + 1 double + 1 home run
        assertThat(Metric.TOTAL_BASES.valueFrom(stats)).hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("7"));
        assertThat(Metric.HITS_RUNS_RBIS.valueFrom(stats)).hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("8"));
    }

    @Test
    void singlesNeverGoNegative() {
        Map<Metric, BigDecimal> inconsistent = line(1, 1, 0, 1, 0, 0);
        assertThat(Metric.SINGLES.valueFrom(inconsistent)).hasValueSatisfying(v -> assertThat(v).isEqualByComparingTo("0"));
    }

    @Test
    void missingComponentLeavesValueEmpty() {
        Map<Metric, BigDecimal> stats = new EnumMap<>(Metric.class);
        stats.put(Metric.HITS, BigDecimal.ONE);

        assertThat(Metric.TOTAL_BASES.valueFrom(stats)).isEmpty();
        assertThat(Metric.PITCHING_OUTS.valueFrom(stats)).isEmpty();
        assertThat(Metric.HITS.valueFrom(stats)).contains(BigDecimal.ONE);
    }

    @Test
    void pitchingOutsReadsOutsRecorded() {
        Map<Metric, BigDecimal> stats = new EnumMap<>(Metric.class);
        stats.put(Metric.OUTS_RECORDED, BigDecimal.valueOf(19));
        assertThat(Metric.PITCHING_OUTS.valueFrom(stats)).contains(BigDecimal.valueOf(19));
    }

    @Test
    void propNamesResolveIgnoringCaseAndSeparators() {
        assertThat(Metric.fromPropName("Total Bases")).contains(Metric.TOTAL_BASES);
        assertThat(Metric.fromPropName("total_bases")).contains(Metric.TOTAL_BASES);
        assertThat(Metric.fromPropName("Hits+Runs+RBIs")).contains(Metric.HITS_RUNS_RBIS);
        assertThat(Metric.fromPropName("Hitter Strikeouts")).contains(Metric.STRIKEOUTS);
        assertThat(Metric.fromPropName("Pitcher Strikeouts")).contains(Metric.PITCHER_STRIKEOUTS);
        assertThat(Metric.fromPropName("Fantasy Score")).isEmpty();
        assertThat(Metric.fromPropName(" ")).isEmpty();
    }
}
