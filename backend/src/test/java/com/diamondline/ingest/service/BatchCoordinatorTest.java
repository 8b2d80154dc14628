package com.diamondline.ingest.service;

import com.diamondline.ingest.batch.BatchModels;
import com.diamondline.ingest.dto.LoadResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class BatchCoordinatorTest {

    private static final int POOL_SIZE = 4;

    private ThreadPoolTaskExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(POOL_SIZE);
        executor.setMaxPoolSize(POOL_SIZE);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("BatchTest-");
        executor.initialize();
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void failingUnitsAreIsolatedAndConcurrencyStaysWithinThePool() {
        BatchCoordinator coordinator = new BatchCoordinator(executor, 500);
        List<Integer> units = IntStream.rangeClosed(1, 100).boxed().collect(Collectors.toList());
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();

        BatchModels.BatchResult<Integer> result = coordinator.run("test", units, unit -> {
            int now = running.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(5);
                if (unit == 7 || unit == 42) throw new IllegalStateException("unit " + unit + " broke");
                return BatchModels.UnitOutcome.loaded("u" + unit, new LoadResult(1, 0, 0), 0);
            } finally {
                running.decrementAndGet();
            }
        });

        assertThat(result.succeeded).hasSize(98);
        assertThat(result.failed).containsOnlyKeys(7, 42);
        assertThat(result.failed.get(42)).hasMessage("unit 42 broke");
        assertThat(result.succeeded).doesNotContain(7, 42).startsWith(1, 2, 3, 4, 5, 6, 8);
        assertThat(result.totalLoad().inserted()).isEqualTo(98);
        assertThat(peak.get()).isGreaterThan(1).isLessThanOrEqualTo(POOL_SIZE);
    }

    @Test
    void anErrorThrownByOneUnitDoesNotStopLaterWaves() {
        BatchCoordinator coordinator = new BatchCoordinator(executor, 10);
        List<Integer> units = IntStream.rangeClosed(1, 100).boxed().collect(Collectors.toList());
        AtomicInteger calls = new AtomicInteger();

        BatchModels.BatchResult<Integer> result = coordinator.run("errors", units, unit -> {
            calls.incrementAndGet();
            if (unit == 7) throw new AssertionError("unit 7 broke");
            return BatchModels.UnitOutcome.loaded("u" + unit, new LoadResult(1, 0, 0), 0);
        });

        assertThat(calls.get()).isEqualTo(100);
        assertThat(result.succeeded).hasSize(99);
        assertThat(result.failed).containsOnlyKeys(7);
        assertThat(result.failed.get(7)).isInstanceOf(AssertionError.class).hasMessage("unit 7 broke");
    }

    @Test
    void smallWavesStillCoverEveryUnitOnce() {
        BatchCoordinator coordinator = new BatchCoordinator(executor, 3);
        AtomicInteger calls = new AtomicInteger();

        BatchModels.BatchResult<String> result = coordinator.run("waves", List.of("a", "b", "c", "d", "b", "e"), unit -> {
            calls.incrementAndGet();
            return unit.equals("d") ? BatchModels.UnitOutcome.skipped(unit) : null;
        });

        assertThat(calls.get()).isEqualTo(5);
        assertThat(result.succeeded).containsExactly("a", "b", "c", "d", "e");
        assertThat(result.skippedCount()).isEqualTo(1);
        assertThat(result.failed).isEmpty();
    }
}
