package com.diamondline.ingest.controller;

import com.diamondline.ingest.batch.BatchModels;
import com.diamondline.ingest.config.GameIngestionScheduler;
import com.diamondline.ingest.dto.IngestionRunSummaryDTO;
import com.diamondline.ingest.dto.SourceRecord;
import com.diamondline.ingest.dto.UnitPushRequest;
import com.diamondline.ingest.dto.UnitPushResponse;
import com.diamondline.ingest.exception.StoreUnavailableException;
import com.diamondline.ingest.exception.UnitFailureException;
import com.diamondline.ingest.service.GameFeedProvider;
import com.diamondline.ingest.service.GameIngestionJob;
import com.diamondline.ingest.service.UnitIngestionService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

@RestController
@RequestMapping("/api/ingest")
public class IngestController {

    private final UnitIngestionService unitIngestionService;
    private final GameIngestionJob gameIngestionJob;
    private final List<GameFeedProvider> providers;
    private final Clock clock;

    public IngestController(UnitIngestionService unitIngestionService,
                            GameIngestionJob gameIngestionJob,
                            List<GameFeedProvider> providers,
                            Clock clock) {
        this.unitIngestionService = unitIngestionService;
        this.gameIngestionJob = gameIngestionJob;
        this.providers = providers;
        this.clock = clock;
    }

    @PostMapping("/units")
    public UnitPushResponse pushUnit(@RequestBody UnitPushRequest request) {
        if (request == null || request.getSource() == null || request.getSource().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "source is required");
        }
        if (request.getRecords() == null || request.getRecords().isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "records must not be empty");
        }
        List<SourceRecord> records = new ArrayList<>(request.getRecords().size());
        for (UnitPushRequest.Item item : request.getRecords()) {
            if (item == null || item.getRecordType() == null) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "every record needs a recordType");
            }
            records.add(new SourceRecord(request.getSource(), item.getRecordType(), item.getPayload()));
        }
        String unitKey = request.getUnitKey() == null || request.getUnitKey().isBlank()
                ? request.getSource().trim().toLowerCase(Locale.ROOT) + ":push:" + UUID.randomUUID()
                : request.getUnitKey();
        try {
            BatchModels.UnitOutcome outcome = unitIngestionService.ingestUnit(null, unitKey, records);
            return new UnitPushResponse(unitKey, outcome.load.inserted(), outcome.load.updated(), outcome.load.skipped(), outcome.rejected);
        } catch (UnitFailureException e) {
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage(), e);
        } catch (StoreUnavailableException e) {
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage(), e);
        }
    }

    @PostMapping("/jobs/{source}")
    public IngestionRunSummaryDTO runJob(@PathVariable("source") String source,
                                         @RequestParam(value = "today", required = false)
                                         @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate today) {
        GameFeedProvider provider = providers.stream()
                .filter(p -> p.getSourceName().equalsIgnoreCase(source.trim()))
                .findFirst()
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "No feed provider registered for source " + source));
        LocalDate runDate = today != null ? today : LocalDate.now(clock);
        try {
            return IngestionRunSummaryDTO.from(gameIngestionJob.run(GameIngestionScheduler.jobNameFor(provider), runDate, provider));
        } catch (StoreUnavailableException e) {
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
    }
}
