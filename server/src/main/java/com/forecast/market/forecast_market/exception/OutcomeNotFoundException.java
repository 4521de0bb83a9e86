package com.forecast.market.forecast_market.exception;

public class OutcomeNotFoundException extends MarketException {

    private final String outcomeId;

    public OutcomeNotFoundException(String marketId, String outcomeId) {
        super(ErrorKind.VALIDATION, String.format("Outcome %s does not belong to market %s", outcomeId, marketId));
        this.outcomeId = outcomeId;
    }

    public String getOutcomeId() {
        return outcomeId;
    }
}
