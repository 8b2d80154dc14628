package com.diamondline.ingest.service;

import com.diamondline.ingest.batch.BatchModels;
import com.diamondline.ingest.dto.DateRange;
import com.diamondline.ingest.dto.GameUnit;
import com.diamondline.ingest.dto.RecordType;
import com.diamondline.ingest.dto.SourceRecord;
import com.diamondline.ingest.dto.WatermarkAdvance;
import com.diamondline.ingest.exception.StoreUnavailableException;
import com.diamondline.ingest.model.EntityKind;
import com.diamondline.ingest.model.GameRecord;
import com.diamondline.ingest.model.IngestionRun;
import com.diamondline.ingest.normalize.NormalizationResult;
import com.diamondline.ingest.normalize.PayloadReader;
import com.diamondline.ingest.repository.GameRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Daily game job: selects the unprocessed date window, expands each date's schedule into
 * one unit per game, ingests the units in parallel and advances the watermark across the
 * dates that came out complete.
 *
 * <p>A date is complete when its schedule was fetched, none of its units failed and every
 * one of its games is final or postponed. A date without games is complete.
 */
@Service
public class GameIngestionJob {
    private static final Logger log = LoggerFactory.getLogger(GameIngestionJob.class);

    private static final String[] GAME_TOKEN_KEYS = {"gamePk", "game_pk", "gameId", "game_id"};

    private final WindowSelector windowSelector;
    private final BatchCoordinator batchCoordinator;
    private final UnitIngestionService unitIngestionService;
    private final IngestionRunService runService;
    private final IdentityResolver identityResolver;
    private final GameRecordRepository gameRepository;

    public GameIngestionJob(WindowSelector windowSelector,
                            BatchCoordinator batchCoordinator,
                            UnitIngestionService unitIngestionService,
                            IngestionRunService runService,
                            IdentityResolver identityResolver,
                            GameRecordRepository gameRepository) {
        this.windowSelector = windowSelector;
        this.batchCoordinator = batchCoordinator;
        this.unitIngestionService = unitIngestionService;
        this.runService = runService;
        this.identityResolver = identityResolver;
        this.gameRepository = gameRepository;
    }

    /**
     * @throws StoreUnavailableException when the store cannot be reached to start the run
     */
    public IngestionRun run(String jobName, LocalDate today, GameFeedProvider provider) {
        String source = provider.getSourceName().trim().toLowerCase(Locale.ROOT);
        IngestionRun run;
        DateRange window;
        try {
            run = runService.open(jobName, source);
            window = windowSelector.nextWindow(jobName, today);
        } catch (DataAccessResourceFailureException | CannotCreateTransactionException e) {
            log.error("[Ingest][Job] jobName={} cannot reach the store: {}", jobName, e.getMessage());
            throw new StoreUnavailableException("Store unreachable while starting job " + jobName, e);
        }
        if (window.isEmpty()) {
            log.info("[Ingest][Job] jobName={}, today={}: nothing to process", jobName, today);
            return runService.close(run.getId(), window, null, 0, 0, null);
        }

        try {
            Map<LocalDate, Boolean> scheduleComplete = new LinkedHashMap<>();
            List<GameUnit> units = new ArrayList<>();
            int scheduleRejected = 0;
            int scheduleFailures = 0;
            for (LocalDate date : window.dates()) {
                List<SourceRecord> schedule;
                try {
                    schedule = provider.fetchSchedule(date);
                } catch (Exception e) {
                    scheduleComplete.put(date, false);
                    scheduleFailures++;
                    log.warn("[Ingest][Schedule] jobName={}, date={} fetch failed: {}", jobName, date, e.toString());
                    continue;
                }
                boolean ok = true;
                List<NormalizationResult.Rejection> rejected = new ArrayList<>();
                for (SourceRecord raw : schedule) {
                    SourceRecord rec = new SourceRecord(source, RecordType.GAME, raw.payload());
                    String token = PayloadReader.of(rec.payload()).string(GAME_TOKEN_KEYS);
                    if (token == null) {
                        rejected.add(new NormalizationResult.Rejection(rec, NormalizationResult.VALIDATION, "schedule entry without game id"));
                        ok = false;
                        continue;
                    }
                    units.add(new GameUnit(source, token, date, rec));
                }
                if (!rejected.isEmpty()) {
                    runService.recordRejections(run.getId(), "schedule:" + date, rejected);
                    scheduleRejected += rejected.size();
                }
                scheduleComplete.put(date, ok);
                log.info("[Ingest][Schedule] jobName={}, date={}, games={}", jobName, date, schedule.size());
            }

            Long runId = run.getId();
            BatchModels.BatchResult<GameUnit> batch = batchCoordinator.run(jobName, units,
                    unit -> ingestGame(runId, provider, unit));

            Map<LocalDate, Boolean> complete = new LinkedHashMap<>();
            for (LocalDate date : window.dates()) {
                complete.put(date, Boolean.TRUE.equals(scheduleComplete.get(date)));
            }
            for (GameUnit unit : units) {
                LocalDate date = unit.getOfficialDate();
                if (!complete.get(date)) continue;
                if (batch.failed.containsKey(unit) || !isSettledForScheduling(unit)) {
                    complete.put(date, false);
                }
            }

            WatermarkAdvance advance = windowSelector.advance(jobName, window, complete);
            IngestionRun closed = runService.close(runId, window, batch, scheduleRejected, scheduleFailures, advance);
            log.info("[Ingest][Job] jobName={}, window=[{}, {}], units={}, succeeded={}, failed={}, skipped={}, watermark {}->{}, blockedAt={}",
                    jobName, window.start(), window.end(), units.size(), batch.succeeded.size(), batch.failed.size(),
                    batch.skippedCount(), advance.previous(), advance.current(), advance.blockedAt());
            return closed;
        } catch (RuntimeException e) {
            markFailed(run.getId(), e);
            if (e instanceof DataAccessResourceFailureException || e instanceof CannotCreateTransactionException) {
                throw new StoreUnavailableException("Store unreachable during job " + jobName, e);
            }
            throw e;
        }
    }

    private BatchModels.UnitOutcome ingestGame(Long runId, GameFeedProvider provider, GameUnit unit) throws Exception {
        Optional<GameRecord> known = identityResolver.lookup(unit.getSource(), EntityKind.GAME, unit.getGameToken())
                .flatMap(gameRepository::findById);
        if (known.isPresent() && known.get().isFinal()) {
            log.debug("[Ingest][Unit] unit={} already final, skipping", unit);
            return BatchModels.UnitOutcome.skipped(unit.toString());
        }
        List<SourceRecord> records = new ArrayList<>();
        records.add(unit.getScheduleRecord());
        for (SourceRecord raw : provider.fetchGame(unit.getGameToken(), unit.getOfficialDate())) {
            records.add(new SourceRecord(unit.getSource(), raw.recordType(), raw.payload()));
        }
        return unitIngestionService.ingestUnit(runId, unit.toString(), records);
    }

    private boolean isSettledForScheduling(GameUnit unit) {
        return identityResolver.lookup(unit.getSource(), EntityKind.GAME, unit.getGameToken())
                .flatMap(gameRepository::findById)
                .map(g -> g.getStatus().isTerminalForScheduling())
                .orElse(false);
    }

    private void markFailed(Long runId, RuntimeException cause) {
        try {
            runService.fail(runId, cause.getMessage());
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
        }
    }
}
