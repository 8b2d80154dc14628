package com.diamondline.ingest.batch;

import com.diamondline.ingest.dto.LoadResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class BatchModels {

    /** Processes one independent unit of work. Anything it throws fails that unit only. */
    @FunctionalInterface
    public interface UnitWorker<U> {
        UnitOutcome process(U unit) throws Exception;
    }

    public static class UnitOutcome {
        public final String unitKey;
        public final boolean skipped; // nothing to do, e.g. the game was already final
        public final LoadResult load;
        public final int rejected;
        public long durationMs;

        public UnitOutcome(String unitKey, boolean skipped, LoadResult load, int rejected) {
            this.unitKey = unitKey;
            this.skipped = skipped;
            this.load = load == null ? LoadResult.EMPTY : load;
            this.rejected = rejected;
        }

        public static UnitOutcome skipped(String unitKey) {
            return new UnitOutcome(unitKey, true, LoadResult.EMPTY, 0);
        }

        public static UnitOutcome loaded(String unitKey, LoadResult load, int rejected) {
            return new UnitOutcome(unitKey, false, load, rejected);
        }
    }

    /**
     * Outcome of one batch. {@code succeeded} keeps the input order; {@code failed} maps each
     * failed unit to the error it raised.
     */
    public static class BatchResult<U> {
        public final List<U> succeeded;
        public final Map<U, Throwable> failed;
        public final Map<U, UnitOutcome> outcomes;
        public final long durationMs;

        public BatchResult(List<U> succeeded, Map<U, Throwable> failed, Map<U, UnitOutcome> outcomes, long durationMs) {
            this.succeeded = Collections.unmodifiableList(new ArrayList<>(succeeded));
            this.failed = Collections.unmodifiableMap(new LinkedHashMap<>(failed));
            this.outcomes = Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
            this.durationMs = durationMs;
        }

        public int skippedCount() {
            int n = 0;
            for (UnitOutcome o : outcomes.values()) {
                if (o != null && o.skipped) n++;
            }
            return n;
        }

        public LoadResult totalLoad() {
            LoadResult total = LoadResult.EMPTY;
            for (UnitOutcome o : outcomes.values()) {
                if (o != null) total = total.plus(o.load);
            }
            return total;
        }

        public int totalRejected() {
            int n = 0;
            for (UnitOutcome o : outcomes.values()) {
                if (o != null) n += o.rejected;
            }
            return n;
        }
    }
}
