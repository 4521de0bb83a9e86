package com.forecast.market.forecast_market.entity;

import java.util.List;

import lombok.Builder;

/**
 * External signal (news-like event) mapped to one or more markets.
 *
 * @param type           event kind, e.g. "expert", "poll", "news", "social"
 * @param confidence     0-1
 * @param impactEstimate 0-1, estimated effect on the mapped markets
 */
@Builder
public record InfoEvent(
        String type,
        String title,
        String source,
        long timestamp,
        double confidence,
        List<String> mappedMarketIds,
        double impactEstimate) {

    public InfoEvent {
        mappedMarketIds = mappedMarketIds == null ? List.of() : List.copyOf(mappedMarketIds);
    }

    public boolean mapsTo(String marketId) {
        return mappedMarketIds.contains(marketId);
    }
}
