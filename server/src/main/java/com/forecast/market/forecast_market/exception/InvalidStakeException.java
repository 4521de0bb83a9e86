package com.forecast.market.forecast_market.exception;

import com.forecast.market.forecast_market.entity.Money;

public class InvalidStakeException extends MarketException {

    public InvalidStakeException(Money stake) {
        super(ErrorKind.VALIDATION, "Stake must be positive, got " + stake);
    }
}
