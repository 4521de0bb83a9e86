package com.forecast.market.forecast_market.exception;

import com.forecast.market.forecast_market.entity.Money;

public class InsufficientBalanceException extends MarketException {

    private final Money balance;
    private final Money required;

    public InsufficientBalanceException(String userId, Money balance, Money required) {
        super(ErrorKind.VALIDATION,
                String.format("Insufficient balance for %s: have %s, need %s", userId, balance, required));
        this.balance = balance;
        this.required = required;
    }

    public Money getBalance() {
        return balance;
    }

    public Money getRequired() {
        return required;
    }
}
