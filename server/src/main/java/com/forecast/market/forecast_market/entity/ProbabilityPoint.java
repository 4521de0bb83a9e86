package com.forecast.market.forecast_market.entity;

/**
 * One sparkline sample: implied probability (0-1) at an instant.
 */
public record ProbabilityPoint(long timestamp, double probability) {
}
