package com.forecast.market.forecast_market.exception;

import com.forecast.market.forecast_market.entity.MarketStatus;

public class MarketInactiveException extends MarketException {

    public MarketInactiveException(String marketId, MarketStatus status) {
        super(ErrorKind.STATE_CONFLICT, String.format("Market %s is not active (status=%s)", marketId, status));
    }
}
