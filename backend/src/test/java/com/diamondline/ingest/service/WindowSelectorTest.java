package com.diamondline.ingest.service;

import com.diamondline.ingest.StoreReset;
import com.diamondline.ingest.dto.DateRange;
import com.diamondline.ingest.dto.WatermarkAdvance;
import com.diamondline.ingest.model.ProcessingWatermark;
import com.diamondline.ingest.repository.ProcessingWatermarkRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Import(StoreReset.class)
class WindowSelectorTest {

    private static final String JOB = "games-mlb";
    private static final LocalDate APR_10 = LocalDate.of(2024, 4, 10);
    private static final LocalDate APR_11 = LocalDate.of(2024, 4, 11);
    private static final LocalDate APR_12 = LocalDate.of(2024, 4, 12);
    private static final LocalDate APR_13 = LocalDate.of(2024, 4, 13);

    @Autowired private WindowSelector windowSelector;
    @Autowired private ProcessingWatermarkRepository watermarkRepository;
    @Autowired private StoreReset storeReset;

    @BeforeEach
    void setUp() {
        storeReset.clear();
        watermarkRepository.save(new ProcessingWatermark(JOB, APR_10));
    }

    @Test
    void windowRunsFromDayAfterWatermarkToYesterday() {
        DateRange window = windowSelector.nextWindow(JOB, APR_13);

        assertThat(window.start()).isEqualTo(APR_11);
        assertThat(window.end()).isEqualTo(APR_12);
        assertThat(window.dates()).containsExactly(APR_11, APR_12);
    }

    @Test
    void windowIsEmptyWhenWatermarkIsYesterday() {
        assertThat(windowSelector.nextWindow(JOB, APR_11).isEmpty()).isTrue();
    }

    @Test
    void neverRunJobStartsAtSeasonStart() {
        // test profile opens the season on 2024-03-28
        assertThat(windowSelector.currentWatermark("games-other")).isEqualTo(LocalDate.of(2024, 3, 27));
        assertThat(windowSelector.nextWindow("games-other", LocalDate.of(2024, 3, 30)).dates())
                .containsExactly(LocalDate.of(2024, 3, 28), LocalDate.of(2024, 3, 29));
    }

    @Test
    void failedEarlierDateHoldsWatermarkEvenWhenLaterDateSucceeds() {
        DateRange window = windowSelector.nextWindow(JOB, APR_13);
        Map<LocalDate, Boolean> complete = new LinkedHashMap<>();
        complete.put(APR_11, false);
        complete.put(APR_12, true);

        WatermarkAdvance advance = windowSelector.advance(JOB, window, complete);

        assertThat(advance.advanced()).isFalse();
        assertThat(advance.current()).isEqualTo(APR_10);
        assertThat(advance.blockedAt()).isEqualTo(APR_11);
        assertThat(windowSelector.currentWatermark(JOB)).isEqualTo(APR_10);
    }

    @Test
    void completeDatesAdvanceUpToTheFirstGap() {
        DateRange window = new DateRange(APR_11, LocalDate.of(2024, 4, 14));
        Map<LocalDate, Boolean> complete = new LinkedHashMap<>();
        complete.put(APR_11, true);
        complete.put(APR_12, true);
        complete.put(APR_13, false);
        complete.put(LocalDate.of(2024, 4, 14), true);

        WatermarkAdvance advance = windowSelector.advance(JOB, window, complete);

        assertThat(advance.previous()).isEqualTo(APR_10);
        assertThat(advance.current()).isEqualTo(APR_12);
        assertThat(advance.blockedAt()).isEqualTo(APR_13);
        assertThat(windowSelector.currentWatermark(JOB)).isEqualTo(APR_12);

        // the same result reported again changes nothing
        WatermarkAdvance again = windowSelector.advance(JOB, window, complete);
        assertThat(again.advanced()).isFalse();
        assertThat(windowSelector.currentWatermark(JOB)).isEqualTo(APR_12);
    }
}
