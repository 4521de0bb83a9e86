package com.forecast.market.forecast_market.execution;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Serial lane for one market. Work runs one unit at a time in submission
 * order, so trades are priced in the order they were admitted and a
 * resolution never overlaps a trade.
 */
public class MarketExecutor {
    private final String marketId;
    private final ExecutorService executor;

    public MarketExecutor(String marketId) {
        this.marketId = marketId;
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "market-" + marketId);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Cancelling the returned future does not interrupt a unit that has
     * already started; it always runs to completion.
     */
    public <T> CompletableFuture<T> submit(Supplier<T> work) {
        return CompletableFuture.supplyAsync(work, executor);
    }

    public String getMarketId() {
        return marketId;
    }

    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
