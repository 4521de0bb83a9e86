package com.forecast.market.forecast_market.service;

import com.forecast.market.forecast_market.entity.Money;

/**
 * Wallet the market core settles against.
 */
public interface Ledger {

    Money getBalance(String userId);

    void credit(String userId, Money amount, LedgerReference reference);

    /**
     * @throws com.forecast.market.forecast_market.exception.InsufficientBalanceException
     *         if the balance does not cover {@code amount}
     */
    void debit(String userId, Money amount, LedgerReference reference);
}
