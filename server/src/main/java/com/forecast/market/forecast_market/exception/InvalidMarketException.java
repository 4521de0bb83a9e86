package com.forecast.market.forecast_market.exception;

public class InvalidMarketException extends MarketException {

    public InvalidMarketException(String reason) {
        super(ErrorKind.VALIDATION, "Invalid market: " + reason);
    }
}
