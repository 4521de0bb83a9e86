package com.forecast.market.forecast_market.entity;

/**
 * Market lifecycle.
 *
 * ACTIVE   → CLOSED    (trading halted, awaiting resolution)
 * ACTIVE   → RESOLVED  (winning outcome chosen)
 * CLOSED   → RESOLVED
 *
 * RESOLVED is terminal.
 */
public enum MarketStatus {
    ACTIVE,
    CLOSED,
    RESOLVED;

    public boolean acceptsTrades() {
        return this == ACTIVE;
    }

    public boolean isResolvable() {
        return this == ACTIVE || this == CLOSED;
    }
}
