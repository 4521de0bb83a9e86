package com.forecast.market.forecast_market.service;

import java.util.List;

import com.forecast.market.forecast_market.entity.Money;
import com.forecast.market.forecast_market.entity.Position;

/**
 * @param settledPositions positions moved out of ACTIVE by this resolution
 * @param totalPaidOut     sum of win returns credited
 * @param totalRefunded    sum of loss refunds credited
 */
public record ResolutionResult(
        String marketId,
        String winningOutcomeId,
        int winners,
        int losers,
        Money totalPaidOut,
        Money totalRefunded,
        List<Position> settledPositions) {

    public ResolutionResult {
        settledPositions = List.copyOf(settledPositions);
    }
}
