package com.forecast.market.forecast_market.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/**
 * Request to stake on one outcome of a market. Fields arrive validated for
 * type; the engine still checks the stake and the outcome.
 */
@Getter
@AllArgsConstructor
@Builder
public class TradeRequest {

    private final String userId;
    private final String marketId;
    private final String outcomeId;
    private final Money stake;

    /**
     * Optional client-provided nonce for idempotency.
     */
    private final String nonce;
}
