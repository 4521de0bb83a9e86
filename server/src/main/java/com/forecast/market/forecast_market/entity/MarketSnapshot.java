package com.forecast.market.forecast_market.entity;

import java.util.LinkedHashMap;

import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.MongoId;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Daily probability snapshot of a market, the baseline for 24h change.
 */
@Document(collection = "market_snapshots")
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class MarketSnapshot {
    @MongoId
    private String marketId; // latest daily snapshot only

    @Builder.Default
    private LinkedHashMap<String, Integer> probabilities = new LinkedHashMap<>();

    private long takenAt;
}
