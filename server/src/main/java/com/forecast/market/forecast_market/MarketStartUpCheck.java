package com.forecast.market.forecast_market;

import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import com.forecast.market.forecast_market.cache.MarketStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Loads every market into the store once the application is up, failing
 * startup if the database cannot be read.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MarketStartUpCheck {

    private final MarketStore marketStore;

    @EventListener(ApplicationReadyEvent.class)
    public void warmUpMarkets() {
        try {
            marketStore.warmUp();
            log.info("MongoDB connection successful, {} markets loaded", marketStore.allBooks().size());
        } catch (RuntimeException e) {
            throw new IllegalStateException("MongoDB connection failed", e);
        }
    }
}
