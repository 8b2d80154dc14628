package com.diamondline.ingest.config;

import com.diamondline.ingest.model.IngestionRun;
import com.diamondline.ingest.service.GameFeedProvider;
import com.diamondline.ingest.service.GameIngestionJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;

/** Runs the daily game job once per registered feed provider. */
@Component
public class GameIngestionScheduler {
    private static final Logger log = LoggerFactory.getLogger(GameIngestionScheduler.class);

    private final GameIngestionJob job;
    private final List<GameFeedProvider> providers;
    private final Clock clock;

    public GameIngestionScheduler(GameIngestionJob job, List<GameFeedProvider> providers, Clock clock) {
        this.job = job;
        this.providers = providers;
        this.clock = clock;
    }

    public static String jobNameFor(GameFeedProvider provider) {
        return "games-" + provider.getSourceName().trim().toLowerCase(Locale.ROOT);
    }

    @Scheduled(cron = "${diamondline.ingest.cron:-}")
    public void ingestAll() {
        LocalDate today = LocalDate.now(clock);
        for (GameFeedProvider provider : providers) {
            try {
                IngestionRun run = job.run(jobNameFor(provider), today, provider);
                log.info("Background ingestion for {} finished with status {}.", provider.getSourceName(), run.getStatus());
            } catch (Exception e) {
                log.warn("Background ingestion for {} failed: {}", provider.getSourceName(), e.getMessage());
            }
        }
    }
}
