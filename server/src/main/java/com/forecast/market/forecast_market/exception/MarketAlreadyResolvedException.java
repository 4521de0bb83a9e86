package com.forecast.market.forecast_market.exception;

public class MarketAlreadyResolvedException extends MarketException {

    public MarketAlreadyResolvedException(String marketId, String winningOutcomeId) {
        super(ErrorKind.STATE_CONFLICT, String.format("Market %s is already resolved (winner=%s)", marketId, winningOutcomeId));
    }
}
