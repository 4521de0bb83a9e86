package com.forecast.market.forecast_market.execution;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

import jakarta.annotation.PreDestroy;

import lombok.extern.slf4j.Slf4j;

/**
 * One {@link MarketExecutor} per market id. Different markets run in
 * parallel; one market never runs two units at once.
 */
@Slf4j
public class MarketExecutionRegistry {
    private final ConcurrentHashMap<String, MarketExecutor> executors = new ConcurrentHashMap<>();

    /**
     * Run {@code work} on the market's lane and wait for it.
     * Exceptions thrown by the work are rethrown unchanged.
     */
    public <T> T execute(String marketId, Supplier<T> work) {
        MarketExecutor executor = executors.computeIfAbsent(marketId, MarketExecutor::new);
        try {
            return executor.submit(work).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }

    public int size() {
        return executors.size();
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down {} market executors", executors.size());
        executors.values().forEach(MarketExecutor::shutdown);
        executors.clear();
    }
}
