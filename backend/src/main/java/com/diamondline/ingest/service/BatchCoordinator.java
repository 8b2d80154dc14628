package com.diamondline.ingest.service;

import com.diamondline.ingest.batch.BatchModels;
import com.diamondline.ingest.dto.LoadResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fans independent units out over the shared ingest pool. The pool bounds concurrency no
 * matter how many units there are. A unit that throws, errors included, is recorded as
 * failed and the rest carry on; nothing is retried here. Only a VM error escapes.
 */
@Service
public class BatchCoordinator {
    private static final Logger log = LoggerFactory.getLogger(BatchCoordinator.class);

    private final Executor executor;
    private final int waveSize;

    public BatchCoordinator(@Qualifier("ingestExecutor") ThreadPoolTaskExecutor ingestExecutor,
                            @Value("${diamondline.batch.wave-size:500}") int waveSize) {
        this.executor = ingestExecutor;
        this.waveSize = Math.max(1, waveSize);
    }

    public <U> BatchModels.BatchResult<U> run(String batchName, Collection<U> units, BatchModels.UnitWorker<U> worker) {
        long t0 = System.currentTimeMillis();
        List<U> input = new ArrayList<>(new LinkedHashSet<>(units));
        Map<U, BatchModels.UnitOutcome> outcomes = new ConcurrentHashMap<>();
        Map<U, Throwable> failures = new ConcurrentHashMap<>();
        log.info("[Batch][Start] batch={}, units={}, waveSize={}", batchName, input.size(), waveSize);

        // waves keep the executor queue bounded for very large batches
        for (int i = 0; i < input.size(); i += waveSize) {
            List<U> wave = input.subList(i, Math.min(i + waveSize, input.size()));
            List<CompletableFuture<Void>> futures = new ArrayList<>(wave.size());
            for (U unit : wave) {
                try {
                    futures.add(CompletableFuture.runAsync(() -> runOne(batchName, unit, worker, outcomes, failures), executor));
                } catch (RejectedExecutionException e) {
                    failures.put(unit, e);
                    log.warn("[Batch][Rejected] batch={}, unit={}: executor saturated", batchName, unit);
                }
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        }

        List<U> succeeded = new ArrayList<>();
        Map<U, Throwable> failed = new LinkedHashMap<>();
        Map<U, BatchModels.UnitOutcome> orderedOutcomes = new LinkedHashMap<>();
        for (U unit : input) {
            Throwable error = failures.get(unit);
            if (error != null) {
                failed.put(unit, error);
            } else {
                succeeded.add(unit);
                orderedOutcomes.put(unit, outcomes.get(unit));
            }
        }
        BatchModels.BatchResult<U> result = new BatchModels.BatchResult<>(succeeded, failed, orderedOutcomes, System.currentTimeMillis() - t0);
        log.info("[Batch][End] batch={}, units={}, succeeded={}, failed={}, skipped={}, durationMs={}",
                batchName, input.size(), succeeded.size(), failed.size(), result.skippedCount(), result.durationMs);
        return result;
    }

    private <U> void runOne(String batchName, U unit, BatchModels.UnitWorker<U> worker,
                            Map<U, BatchModels.UnitOutcome> outcomes, Map<U, Throwable> failures) {
        long t0 = System.currentTimeMillis();
        try {
            BatchModels.UnitOutcome outcome = worker.process(unit);
            if (outcome == null) outcome = BatchModels.UnitOutcome.loaded(String.valueOf(unit), LoadResult.EMPTY, 0);
            outcome.durationMs = System.currentTimeMillis() - t0;
            outcomes.put(unit, outcome);
            log.debug("[Batch][Unit] batch={}, unit={}, skipped={}, durationMs={}", batchName, unit, outcome.skipped, outcome.durationMs);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            // assertion and linkage errors from a worker fail only that unit
            Throwable cause = (e instanceof CompletionException && e.getCause() != null) ? e.getCause() : e;
            failures.put(unit, cause);
            log.warn("[Batch][UnitFailed] batch={}, unit={}, durationMs={}, error={}",
                    batchName, unit, System.currentTimeMillis() - t0, cause.toString());
        }
    }
}
