package com.diamondline.ingest.dto;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/** Inclusive date range; empty when {@code start} is after {@code end}. */
public record DateRange(LocalDate start, LocalDate end) {

    public boolean isEmpty() {
        return start == null || end == null || start.isAfter(end);
    }

    public List<LocalDate> dates() {
        List<LocalDate> out = new ArrayList<>();
        if (isEmpty()) return out;
        for (LocalDate d = start; !d.isAfter(end); d = d.plusDays(1)) out.add(d);
        return out;
    }

    public boolean contains(LocalDate date) {
        return !isEmpty() && !date.isBefore(start) && !date.isAfter(end);
    }
}
