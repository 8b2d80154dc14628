package com.diamondline.ingest.normalize;

import com.diamondline.ingest.exception.RecordValidationException;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Map;

/**
 * Lenient accessor over a raw payload map. Every getter takes alternative key spellings
 * ({@code "gamePk", "game_pk"}) and returns the first non-blank value. Numbers may arrive as
 * strings. Values that are present but unparsable are validation errors, never defaults.
 */
public final class PayloadReader {

    private static final PayloadReader EMPTY = new PayloadReader(Map.of());

    private final Map<String, Object> payload;

    private PayloadReader(Map<String, Object> payload) {
        this.payload = payload;
    }

    public static PayloadReader of(Map<String, Object> payload) {
        return payload == null ? EMPTY : new PayloadReader(payload);
    }

    public boolean isEmpty() {
        return payload.isEmpty();
    }

    public boolean has(String... keys) {
        return raw(keys) != null;
    }

    public String string(String... keys) {
        Object v = raw(keys);
        return v == null ? null : v.toString().trim();
    }

    public String requireString(String... keys) {
        String v = string(keys);
        if (v == null) throw missing(keys);
        return v;
    }

    public BigDecimal decimal(String... keys) {
        Object v = raw(keys);
        if (v == null) return null;
        if (v instanceof BigDecimal) return (BigDecimal) v;
        if (v instanceof Integer || v instanceof Long || v instanceof Short) return BigDecimal.valueOf(((Number) v).longValue());
        if (v instanceof Number) {
            double d = ((Number) v).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) throw new RecordValidationException(keys[0], "is not a finite number");
            return BigDecimal.valueOf(d);
        }
        try {
            return new BigDecimal(v.toString().trim().replace("+", ""));
        } catch (NumberFormatException e) {
            throw new RecordValidationException(keys[0], "is not a number: '" + v + "'");
        }
    }

    public BigDecimal requireDecimal(String... keys) {
        BigDecimal v = decimal(keys);
        if (v == null) throw missing(keys);
        return v;
    }

    public Integer integer(String... keys) {
        BigDecimal v = decimal(keys);
        if (v == null) return null;
        try {
            return v.stripTrailingZeros().intValueExact();
        } catch (ArithmeticException e) {
            throw new RecordValidationException(keys[0], "is not a whole number: " + v.toPlainString());
        }
    }

    public Integer requireInteger(String... keys) {
        Integer v = integer(keys);
        if (v == null) throw missing(keys);
        return v;
    }

    /** ISO date; a date-time value contributes its date part. */
    public LocalDate date(String... keys) {
        String v = string(keys);
        if (v == null) return null;
        try {
            return LocalDate.parse(v.length() > 10 ? v.substring(0, 10) : v);
        } catch (DateTimeParseException e) {
            throw new RecordValidationException(keys[0], "is not an ISO date: '" + v + "'");
        }
    }

    public LocalDate requireDate(String... keys) {
        LocalDate v = date(keys);
        if (v == null) throw missing(keys);
        return v;
    }

    /** ISO instant, offset date-time, UTC local date-time, or epoch milliseconds. */
    public Instant instant(String... keys) {
        Object v = raw(keys);
        if (v == null) return null;
        if (v instanceof Number) return Instant.ofEpochMilli(((Number) v).longValue());
        String s = v.toString().trim();
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(s, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime) return ((OffsetDateTime) parsed).toInstant();
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new RecordValidationException(keys[0], "is not a timestamp: '" + s + "'");
        }
    }

    /** Nested map under the first matching key, or an empty reader. */
    @SuppressWarnings("unchecked")
    public PayloadReader child(String... keys) {
        Object v = raw(keys);
        if (v instanceof Map) return new PayloadReader((Map<String, Object>) v);
        return EMPTY;
    }

    private Object raw(String... keys) {
        for (String k : keys) {
            Object v = payload.get(k);
            if (v == null) continue;
            if (v instanceof String && ((String) v).isBlank()) continue;
            return v;
        }
        return null;
    }

    private static RecordValidationException missing(String... keys) {
        return new RecordValidationException(keys[0], "is required");
    }
}
