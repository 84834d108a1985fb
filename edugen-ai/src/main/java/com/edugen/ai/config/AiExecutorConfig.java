package com.edugen.ai.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker pools. Provider attempts run on their own pool so a hung vendor call can
 * be abandoned at its time bound without blocking fan-out work.
 */
@Configuration
@Slf4j
public class AiExecutorConfig {

    @Value("${ai.executor.provider-threads:32}")
    private int providerThreads;

    @Value("${ai.executor.worker-threads:16}")
    private int workerThreads;

    @Bean(name = "providerExecutor", destroyMethod = "shutdownNow")
    public ExecutorService providerExecutor() {
        log.info("Provider executor created: threads={}", providerThreads);
        return Executors.newFixedThreadPool(providerThreads, namedThreads("ai-provider-"));
    }

    @Bean(name = "generationExecutor", destroyMethod = "shutdownNow")
    public ExecutorService generationExecutor() {
        log.info("Generation executor created: threads={}", workerThreads);
        return Executors.newFixedThreadPool(workerThreads, namedThreads("ai-worker-"));
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger(0);
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
