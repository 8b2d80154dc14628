package com.diamondline.ingest.util;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Deterministic string folding shared by the identity resolver and the entities.
 * All methods are null-safe and return {@code null} for {@code null} input.
 */
public final class NameNormalizer {

    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}");
    private static final Pattern NON_ALNUM = Pattern.compile("[^\\p{Alnum}]+");
    private static final Pattern NON_ALNUM_OR_SPACE = Pattern.compile("[^\\p{Alnum} ]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern GENERATIONAL_SUFFIX = Pattern.compile("(?i)[ ,]+(jr|sr|ii|iii|iv)\\.?$");

    private NameNormalizer() {}

    /** "C.W.S." and "cws" both become "CWS"; "Chicago White Sox" becomes "CHICAGOWHITESOX". */
    public static String normalizeToken(String raw) {
        if (raw == null) return null;
        String s = stripDiacritics(raw.trim());
        return NON_ALNUM.matcher(s).replaceAll("").toUpperCase(Locale.ROOT);
    }

    /** Lower-cased, punctuation-free, single-spaced display name. */
    public static String normalizeName(String raw) {
        if (raw == null) return null;
        String s = stripDiacritics(raw.trim()).toLowerCase(Locale.ROOT);
        s = s.replace("-", " ");
        s = NON_ALNUM_OR_SPACE.matcher(s).replaceAll("");
        return WHITESPACE.matcher(s).replaceAll(" ").trim();
    }

    /**
     * Player names additionally drop generational suffixes, so "Ronald Acuña Jr." and
     * "Ronald Acuna" fold to the same key.
     */
    public static String normalizePlayerName(String raw) {
        if (raw == null) return null;
        String s = WHITESPACE.matcher(raw.trim()).replaceAll(" ");
        String previous;
        do {
            previous = s;
            s = GENERATIONAL_SUFFIX.matcher(s).replaceAll("");
        } while (!s.equals(previous));
        return normalizeName(s.replace(".", ""));
    }

    public static int levenshtein(String a, String b) {
        if (a == null) a = "";
        if (b == null) b = "";
        int n = a.length(); int m = b.length();
        if (n == 0) return m;
        if (m == 0) return n;
        int[] prev = new int[m + 1];
        int[] curr = new int[m + 1];
        for (int j = 0; j <= m; j++) prev[j] = j;
        for (int i = 1; i <= n; i++) {
            curr[0] = i;
            char ca = a.charAt(i - 1);
            for (int j = 1; j <= m; j++) {
                int cost = (ca == b.charAt(j - 1)) ? 0 : 1;
                curr[j] = Math.min(Math.min(curr[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
            }
            int[] tmp = prev; prev = curr; curr = tmp;
        }
        return prev[m];
    }

    private static String stripDiacritics(String s) {
        return DIACRITICS.matcher(Normalizer.normalize(s, Normalizer.Form.NFD)).replaceAll("");
    }
}
