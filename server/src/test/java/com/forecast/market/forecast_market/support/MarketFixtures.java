package com.forecast.market.forecast_market.support;

import java.util.ArrayList;
import java.util.List;

import com.forecast.market.forecast_market.cache.MarketBook;
import com.forecast.market.forecast_market.engine.RiskWeightedLmsrModel;
import com.forecast.market.forecast_market.entity.Market;
import com.forecast.market.forecast_market.entity.MarketState;
import com.forecast.market.forecast_market.entity.Outcome;

public final class MarketFixtures {

    public static final String YES = "yes";
    public static final String NO = "no";

    private MarketFixtures() {
    }

    /**
     * Yes/No market seeded at 50/50 with no positions.
     */
    public static MarketBook binaryBook(String marketId, double liquidityB) {
        Market market = Market.builder()
                .id(marketId)
                .title("Will it rain tomorrow?")
                .category("weather")
                .outcomes(new ArrayList<>(List.of(
                        Outcome.builder().id(YES).title("Yes").probability(50).build(),
                        Outcome.builder().id(NO).title("No").probability(50).build())))
                .build();
        MarketState state = new RiskWeightedLmsrModel().seed(marketId, List.of(YES, NO), null, liquidityB);
        return new MarketBook(market, state, List.of());
    }
}
