package com.diamondline.ingest.service;

import com.diamondline.ingest.dto.DateRange;
import com.diamondline.ingest.dto.WatermarkAdvance;
import com.diamondline.ingest.model.ProcessingWatermark;
import com.diamondline.ingest.repository.ProcessingWatermarkRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;

/**
 * Computes which dates a job still has to process and moves the job's watermark once they
 * are complete. The watermark only ever moves forward and only across a contiguous run of
 * complete dates.
 */
@Service
public class WindowSelector {
    private static final Logger log = LoggerFactory.getLogger(WindowSelector.class);

    private final ProcessingWatermarkRepository watermarkRepository;
    private final LocalDate seasonStart;
    private final int maxDays;

    public WindowSelector(ProcessingWatermarkRepository watermarkRepository,
                          @Value("${diamondline.window.season-start:2025-03-27}") String seasonStart,
                          @Value("${diamondline.window.max-days:0}") int maxDays) {
        this.watermarkRepository = watermarkRepository;
        this.seasonStart = LocalDate.parse(seasonStart);
        this.maxDays = Math.max(0, maxDays);
    }

    /** {@code [watermark + 1, today - 1]}, capped to {@code max-days} dates when configured. */
    @Transactional(readOnly = true)
    public DateRange nextWindow(String jobName, LocalDate today) {
        LocalDate watermark = currentWatermark(jobName);
        LocalDate start = watermark.plusDays(1);
        LocalDate end = today.minusDays(1);
        if (maxDays > 0 && !start.isAfter(end)) {
            LocalDate capped = start.plusDays(maxDays - 1L);
            if (capped.isBefore(end)) end = capped;
        }
        DateRange range = new DateRange(start, end);
        log.info("[Window] jobName={}, watermark={}, today={}, window=[{}, {}], empty={}",
                jobName, watermark, today, start, end, range.isEmpty());
        return range;
    }

    /** Stored watermark, or the day before season start for a job that never ran. */
    @Transactional(readOnly = true)
    public LocalDate currentWatermark(String jobName) {
        return watermarkRepository.findById(jobName)
                .map(ProcessingWatermark::getLastCompletedDate)
                .orElse(seasonStart.minusDays(1));
    }

    /**
     * Advances across the dates of {@code window} that are complete, starting right after the
     * stored watermark and stopping at the first date that is missing or incomplete. Runs under
     * a row lock so two runs of the same job cannot interleave.
     */
    @Transactional
    public WatermarkAdvance advance(String jobName, DateRange window, Map<LocalDate, Boolean> completeByDate) {
        Optional<ProcessingWatermark> locked = watermarkRepository.findForUpdate(jobName);
        LocalDate previous = locked.map(ProcessingWatermark::getLastCompletedDate).orElse(seasonStart.minusDays(1));
        if (window == null || window.isEmpty()) {
            return new WatermarkAdvance(previous, previous, null);
        }

        LocalDate current = previous;
        LocalDate blockedAt = null;
        for (LocalDate d = previous.plusDays(1); !d.isAfter(window.end()); d = d.plusDays(1)) {
            if (!window.contains(d) || !Boolean.TRUE.equals(completeByDate.get(d))) {
                blockedAt = d;
                break;
            }
            current = d;
        }

        if (current.isAfter(previous)) {
            ProcessingWatermark wm = locked.orElseGet(() -> new ProcessingWatermark(jobName, null));
            wm.setLastCompletedDate(current);
            watermarkRepository.save(wm);
            log.info("[Window][Advance] jobName={}, from={}, to={}", jobName, previous, current);
        }
        if (blockedAt != null) {
            log.info("[Window][Blocked] jobName={}, watermark={}, blockedAt={}", jobName, current, blockedAt);
        }
        return new WatermarkAdvance(previous, current, blockedAt);
    }
}
