package com.diamondline.ingest.dto;

import java.time.LocalDate;

/**
 * Result of trying to move a watermark. {@code blockedAt} is the first date that was not
 * complete, or null when the whole window was covered.
 */
public record WatermarkAdvance(LocalDate previous, LocalDate current, LocalDate blockedAt) {
    public boolean advanced() {
        return current != null && previous != null && current.isAfter(previous);
    }
}
