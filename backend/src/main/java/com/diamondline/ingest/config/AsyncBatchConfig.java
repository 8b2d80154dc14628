package com.diamondline.ingest.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
public class AsyncBatchConfig {

    /** Fixed-size pool shared by every batch; a full queue rejects instead of growing. */
    @Bean(name = "ingestExecutor")
    public ThreadPoolTaskExecutor ingestExecutor(@Value("${diamondline.batch.pool-size:8}") int poolSize,
                                                 @Value("${diamondline.batch.queue-capacity:10000}") int queueCapacity,
                                                 @Value("${diamondline.batch.thread-prefix:Diamondline-}") String threadPrefix) {
        ThreadPoolTaskExecutor exec = new ThreadPoolTaskExecutor();
        exec.setCorePoolSize(poolSize);
        exec.setMaxPoolSize(poolSize);
        exec.setQueueCapacity(queueCapacity);
        exec.setThreadNamePrefix(threadPrefix);
        exec.setWaitForTasksToCompleteOnShutdown(true);
        exec.setAwaitTerminationSeconds(30);
        exec.initialize();
        return exec;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
