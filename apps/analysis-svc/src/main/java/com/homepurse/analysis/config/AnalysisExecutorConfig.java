package com.homepurse.analysis.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Bounded pool for the two suspension points of an analysis run: the model call and the
 * scoped database round-trip. Pipelines block on their own futures with explicit timeouts.
 */
@Configuration
public class AnalysisExecutorConfig {

    @Bean(name = "analysisIoExecutor", destroyMethod = "shutdownNow")
    ExecutorService analysisIoExecutor(HomepurseProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "analysis-io-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(properties.analysis().ioThreads(), threadFactory);
    }
}
