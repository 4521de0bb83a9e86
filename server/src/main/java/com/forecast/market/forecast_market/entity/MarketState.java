package com.forecast.market.forecast_market.entity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.MongoId;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Market maker state of one market: one accumulator per outcome, in outcome
 * order, plus the liquidity parameter.
 */
@Document(collection = "market_states")
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class MarketState {
    @MongoId
    private String marketId;

    @Builder.Default
    private LinkedHashMap<String, Double> accumulators = new LinkedHashMap<>();

    private double liquidityB;
    private long lastTradeTimestamp; // updated by MarketEngine

    public double accumulator(String outcomeId) {
        Double q = accumulators.get(outcomeId);
        if (q == null) {
            throw new IllegalArgumentException("No accumulator for outcome " + outcomeId + " in market " + marketId);
        }
        return q;
    }

    public Map<String, Double> accumulatorView() {
        return Collections.unmodifiableMap(accumulators);
    }

    public MarketState copy() {
        return new MarketState(marketId, new LinkedHashMap<>(accumulators), liquidityB, lastTradeTimestamp);
    }
}
