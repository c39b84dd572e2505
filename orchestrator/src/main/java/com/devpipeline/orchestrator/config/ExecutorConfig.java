package com.devpipeline.orchestrator.config;

import com.devpipeline.orchestrator.service.RetryPolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools and retry settings.
 *
 * One pool per level of nesting: a batch or workflow thread waits on
 * parallel-group members, and every member waits on its worker call. Sharing
 * a pool between levels could starve the level doing the work.
 */
@Configuration
public class ExecutorConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService workflowExecutor(@Value("${devpipeline.executor.workflows:4}") int threads) {
        return Executors.newFixedThreadPool(threads, named("workflow"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService stageExecutor(@Value("${devpipeline.executor.stages:8}") int threads) {
        return Executors.newFixedThreadPool(threads, named("stage"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService workerExecutor(@Value("${devpipeline.executor.workers:16}") int threads) {
        return Executors.newFixedThreadPool(threads, named("worker"));
    }

    // A batch thread runs its workflows inline, one at a time.
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService batchExecutor(@Value("${devpipeline.executor.batches:2}") int threads) {
        return Executors.newFixedThreadPool(threads, named("batch"));
    }

    @Bean
    public RetryPolicy retryPolicy(
            @Value("${devpipeline.retry.max-attempts:3}") int maxAttempts,
            @Value("${devpipeline.retry.initial-backoff:PT2S}") Duration initialBackoff,
            @Value("${devpipeline.retry.max-backoff:PT30S}") Duration maxBackoff) {
        return new RetryPolicy(maxAttempts, initialBackoff, maxBackoff);
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
