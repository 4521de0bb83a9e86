package com.forecast.market.forecast_market.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.forecast.market.forecast_market.entity.Position;

/**
 * Outcome of a placed trade.
 *
 * @param probabilitiesBefore integer percentages per outcome before the stake
 * @param probabilitiesAfter  integer percentages per outcome after the stake
 * @param warnings            non-blocking risk control messages
 * @param replayed            true when the nonce matched an earlier trade and nothing was placed
 */
public record TradeResult(
        Position position,
        TradeBreakdown breakdown,
        Map<String, Integer> probabilitiesBefore,
        Map<String, Integer> probabilitiesAfter,
        List<String> warnings,
        boolean replayed) {

    public TradeResult {
        probabilitiesBefore = Collections.unmodifiableMap(new LinkedHashMap<>(probabilitiesBefore));
        probabilitiesAfter = Collections.unmodifiableMap(new LinkedHashMap<>(probabilitiesAfter));
        warnings = List.copyOf(warnings);
    }
}
