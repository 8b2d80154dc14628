package com.diamondline.ingest.controller;

import com.diamondline.ingest.batch.BatchModels;
import com.diamondline.ingest.dto.LoadResult;
import com.diamondline.ingest.dto.SourceRecord;
import com.diamondline.ingest.exception.StoreUnavailableException;
import com.diamondline.ingest.exception.UnitFailureException;
import com.diamondline.ingest.model.IngestionRun;
import com.diamondline.ingest.service.GameFeedProvider;
import com.diamondline.ingest.service.GameIngestionJob;
import com.diamondline.ingest.service.UnitIngestionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = IngestController.class)
@ActiveProfiles("test")
@Import(IngestControllerTest.Fixtures.class)
class IngestControllerTest {

    @TestConfiguration
    static class Fixtures {
        @Bean
        Clock clock() {
            return Clock.fixed(Instant.parse("2024-04-13T10:00:00Z"), ZoneOffset.UTC);
        }

        @Bean
        GameFeedProvider mlbFeed() {
            return new GameFeedProvider() {
                @Override public String getSourceName() { return "mlb"; }
                @Override public List<SourceRecord> fetchSchedule(LocalDate date) { return List.of(); }
                @Override public List<SourceRecord> fetchGame(String gameToken, LocalDate officialDate) { return List.of(); }
            };
        }
    }

    @Autowired private MockMvc mockMvc;
    @MockBean private UnitIngestionService unitIngestionService;
    @MockBean private GameIngestionJob gameIngestionJob;

    private static final String QUOTE_UNIT = "{\"source\":\"betfair\",\"unitKey\":\"betfair:1.234\",\"records\":["
            + "{\"recordType\":\"MARKET_QUOTE\",\"payload\":{\"marketId\":\"1.234\",\"runnerId\":\"r1\",\"price\":1.9,"
            + "\"observedAt\":\"2024-04-11T17:00:00Z\"}}]}";

    @Test
    void pushedUnitReportsLoadCounts() throws Exception {
        when(unitIngestionService.ingestUnit(isNull(), eq("betfair:1.234"), anyList()))
                .thenReturn(BatchModels.UnitOutcome.loaded("betfair:1.234", new LoadResult(1, 0, 0), 0));

        mockMvc.perform(post("/api/ingest/units").contentType(MediaType.APPLICATION_JSON).content(QUOTE_UNIT))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.unitKey").value("betfair:1.234"))
                .andExpect(jsonPath("$.inserted").value(1))
                .andExpect(jsonPath("$.rejected").value(0));
    }

    @Test
    void unitWithoutSourceIsABadRequest() throws Exception {
        mockMvc.perform(post("/api/ingest/units").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"records\":[{\"recordType\":\"PROP\",\"payload\":{}}]}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void failedLoadIsAServerError() throws Exception {
        when(unitIngestionService.ingestUnit(isNull(), eq("betfair:1.234"), anyList()))
                .thenThrow(new UnitFailureException("betfair:1.234", "Load failed"));

        mockMvc.perform(post("/api/ingest/units").contentType(MediaType.APPLICATION_JSON).content(QUOTE_UNIT))
                .andExpect(status().isInternalServerError());
    }

    @Test
    void jobRunsForARegisteredSourceWithYesterdayAsTheLastDate() throws Exception {
        IngestionRun run = new IngestionRun();
        run.setJobName("games-mlb");
        run.setStatus("COMPLETED");
        run.setWindowStart(LocalDate.of(2024, 4, 11));
        run.setWindowEnd(LocalDate.of(2024, 4, 12));
        when(gameIngestionJob.run(eq("games-mlb"), eq(LocalDate.of(2024, 4, 13)), any())).thenReturn(run);

        mockMvc.perform(post("/api/ingest/jobs/MLB"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.jobName").value("games-mlb"))
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.windowEnd").value("2024-04-12"));
    }

    @Test
    void unknownSourceIsNotFound() throws Exception {
        mockMvc.perform(post("/api/ingest/jobs/espn")).andExpect(status().isNotFound());
    }

    @Test
    void unreachableStoreIsServiceUnavailable() throws Exception {
        when(gameIngestionJob.run(eq("games-mlb"), any(), any()))
                .thenThrow(new StoreUnavailableException("Store unreachable", new RuntimeException("connection refused")));

        mockMvc.perform(post("/api/ingest/jobs/mlb")).andExpect(status().isServiceUnavailable());
    }
}
