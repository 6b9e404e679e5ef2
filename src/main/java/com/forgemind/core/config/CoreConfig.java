package com.forgemind.core.config;

import com.forgemind.core.evolution.EvolutionProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared infrastructure beans: the clock and the two bounded worker pools.
 * <p>
 * Evolution jobs run on {@code evolutionJobExecutor}, never on the caller's thread.
 * Test cases run on {@code evaluationExecutor}, whose unbounded queue absorbs bursts
 * while the thread count bounds concurrent model calls.
 */
@Configuration
@EnableScheduling
public class CoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService evolutionJobExecutor(EvolutionProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getJobThreads()), namedThreads("evolution-job"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService evaluationExecutor(EvolutionProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getEvaluationThreads()),
                namedThreads("fitness-eval"));
    }

    static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
