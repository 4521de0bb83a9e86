package com.forecast.market.forecast_market.analytics;

import java.util.List;

import com.forecast.market.forecast_market.entity.InfoEvent;

/**
 * Read-only source of external signals.
 */
public interface InfoEventFeed {

    /**
     * Events mapped to {@code marketId}, newest first.
     */
    List<InfoEvent> eventsFor(String marketId);
}
