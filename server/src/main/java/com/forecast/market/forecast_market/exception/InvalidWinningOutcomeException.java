package com.forecast.market.forecast_market.exception;

public class InvalidWinningOutcomeException extends MarketException {

    public InvalidWinningOutcomeException(String marketId, String outcomeId) {
        super(ErrorKind.STATE_CONFLICT, String.format("Outcome %s is not a valid winner for market %s", outcomeId, marketId));
    }
}
