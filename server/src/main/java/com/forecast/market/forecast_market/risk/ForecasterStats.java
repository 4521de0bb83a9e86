package com.forecast.market.forecast_market.risk;

import java.util.Map;

import com.forecast.market.forecast_market.entity.CalibrationBucket;

/**
 * @param accuracyScore    mean Brier complement, 0-100
 * @param calibrationScore 100 minus mean absolute calibration error of qualifying deciles, 0-100
 * @param calibration      decile lower bound to bucket
 */
public record ForecasterStats(
        long totalPredictions,
        double accuracyScore,
        double calibrationScore,
        Map<Integer, CalibrationBucket> calibration) {
}
