package com.forecast.market.forecast_market.exception;

public class ConsistencyViolationException extends MarketException {

    public ConsistencyViolationException(String message) {
        super(ErrorKind.CONSISTENCY_VIOLATION, message);
    }
}
