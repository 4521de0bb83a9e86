package com.forecast.market.forecast_market.exception;

public class MarketNotFoundException extends MarketException {

    private final String marketId;

    public MarketNotFoundException(String marketId) {
        super(ErrorKind.VALIDATION, "Market not found: " + marketId);
        this.marketId = marketId;
    }

    public String getMarketId() {
        return marketId;
    }
}
