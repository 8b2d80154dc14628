package com.diamondline.ingest.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NameNormalizerTest {

    @Test
    void tokensFoldCasePunctuationAndDiacritics() {
        assertThat(NameNormalizer.normalizeToken(" cws ")).isEqualTo("CWS");
        assertThat(NameNormalizer.normalizeToken("Chicago White-Sox")).isEqualTo("CHICAGOWHITESOX");
        assertThat(NameNormalizer.normalizeToken("Peña")).isEqualTo("PENA");
    }

    @Test
    void playerNamesDropGenerationalSuffixesAndPeriods() {
        assertThat(NameNormalizer.normalizePlayerName("Vladimir Guerrero Jr.")).isEqualTo("vladimir guerrero");
        assertThat(NameNormalizer.normalizePlayerName("Ken Griffey, Sr.")).isEqualTo("ken griffey");
        assertThat(NameNormalizer.normalizePlayerName("J.D. Martinez")).isEqualTo("jd martinez");
        assertThat(NameNormalizer.normalizePlayerName("Ronald  Acuña   Jr")).isEqualTo("ronald acuna");
    }

    @Test
    void levenshteinCountsSingleEdits() {
        assertThat(NameNormalizer.levenshtein("guerrero", "guerero")).isEqualTo(1);
        assertThat(NameNormalizer.levenshtein("abc", "abc")).isZero();
        assertThat(NameNormalizer.levenshtein("", "abc")).isEqualTo(3);
    }
}
