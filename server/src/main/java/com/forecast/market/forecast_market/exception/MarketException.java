package com.forecast.market.forecast_market.exception;

/**
 * Base class for every failure the market core reports to its callers.
 * None of these are retried internally.
 */
public abstract class MarketException extends RuntimeException {

    private final ErrorKind kind;

    protected MarketException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected MarketException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
