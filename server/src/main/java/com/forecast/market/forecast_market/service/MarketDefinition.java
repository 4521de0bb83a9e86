package com.forecast.market.forecast_market.service;

import java.util.List;

/**
 * Input for a new market.
 *
 * @param liquidity  liquidity parameter b, or null for the configured default
 * @param closeDate  epoch millis, optional
 */
public record MarketDefinition(
        String title,
        String description,
        String category,
        List<OutcomeDefinition> outcomes,
        Double liquidity,
        Long closeDate) {

    public MarketDefinition {
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }

    /**
     * @param initialProbability fraction, or percentage when greater than 1; null for uniform seeding
     */
    public record OutcomeDefinition(String title, Double initialProbability) {
    }
}
