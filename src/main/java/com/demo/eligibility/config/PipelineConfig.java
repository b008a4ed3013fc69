package com.demo.eligibility.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools and clock for the batch. Applications and documents use separate pools so an
 * application task can wait on its documents without starving them.
 */
@Configuration
public class PipelineConfig {

    @Value("${eligibility.pipeline.parallelism:4}")
    private int pipelineParallelism;

    @Value("${eligibility.extraction.parallelism:6}")
    private int extractionParallelism;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService pipelineExecutor() {
        return Executors.newFixedThreadPool(Math.max(1, pipelineParallelism), named("pipeline-"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService extractionExecutor() {
        return Executors.newFixedThreadPool(Math.max(1, extractionParallelism), named("extract-"));
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
