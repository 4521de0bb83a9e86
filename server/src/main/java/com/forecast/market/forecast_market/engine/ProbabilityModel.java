package com.forecast.market.forecast_market.engine;

import java.util.List;
import java.util.Map;

import com.forecast.market.forecast_market.entity.MarketState;

/**
 * Market maker that turns per-outcome accumulators into implied probabilities.
 *
 * Probabilities are fractions in [0, 1] keyed by outcome id, in outcome order.
 */
public interface ProbabilityModel {

    /**
     * Reported (clamped) probability of every outcome.
     */
    Map<String, Double> currentProbabilities(MarketState state);

    /**
     * Deposit {@code stake} on {@code outcomeId}, mutating {@code state}.
     *
     * @return reported probabilities after the deposit
     */
    Map<String, Double> applyStake(MarketState state, String outcomeId, double stake);

    /**
     * Build the initial state of a market.
     *
     * @param initialProbabilities desired starting probabilities (fractions), or null for uniform
     */
    MarketState seed(String marketId, List<String> outcomeIds, Map<String, Double> initialProbabilities, double liquidityB);
}
