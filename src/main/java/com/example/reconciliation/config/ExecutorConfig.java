package com.example.reconciliation.config;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.Map;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executor for running independent reconciliations in parallel.
 *
 * Each run materializes two ledgers in memory, so the pool is bounded; the batch service adds
 * a semaphore on top to cap concurrent runs independently of the pool size.
 */
@Configuration
@Slf4j
public class ExecutorConfig {

    @Value("${app.executor.pool-size:4}")
    private int poolSize;

    @Bean(name = "reconciliationExecutor", destroyMethod = "shutdown")
    public ExecutorService reconciliationExecutor() {
        log.info("Creating reconciliation executor with {} threads and MDC propagation", poolSize);
        return mdcPropagating(Executors.newFixedThreadPool(poolSize, namedThreads("reconcile-")));
    }

    /**
     * Wraps an executor so every task runs with the submitting thread's MDC (traceId, runId).
     * submit/invokeAll/invokeAny all funnel through {@code execute}.
     */
    static ExecutorService mdcPropagating(ExecutorService delegate) {
        return new AbstractExecutorService() {

            @Override
            public void execute(Runnable command) {
                final Map<String, String> context = MDC.getCopyOfContextMap();
                delegate.execute(() -> {
                    if (context != null) {
                        MDC.setContextMap(context);
                    }
                    try {
                        command.run();
                    } finally {
                        MDC.clear();
                    }
                });
            }

            // Boilerplate delegate methods
            @Override
            public void shutdown() { delegate.shutdown(); }
            @Override
            public List<Runnable> shutdownNow() { return delegate.shutdownNow(); }
            @Override
            public boolean isShutdown() { return delegate.isShutdown(); }
            @Override
            public boolean isTerminated() { return delegate.isTerminated(); }
            @Override
            public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
                return delegate.awaitTermination(timeout, unit);
            }
        };
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
