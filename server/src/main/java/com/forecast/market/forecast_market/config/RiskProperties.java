package com.forecast.market.forecast_market.config;

import java.time.Duration;
import java.time.ZoneId;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Positive;

@Validated
@ConfigurationProperties(prefix = "forecast.risk")
public record RiskProperties(
    /**
     * Stake above this share of balance (percent) is blocked.
     */
    @Positive Double maxPositionSizePercent,
    /**
     * Stake above this share of balance (percent) gets a warning.
     */
    @Positive Double warningPositionSizePercent,
    /**
     * Reflection period after a resolved loss.
     */
    Duration lossCooldown,
    /**
     * Window for rapid trade detection.
     */
    Duration rapidTradeWindow,
    /**
     * Trades inside the window that trigger the rapid trading warning.
     */
    @Positive Integer maxTradesInWindow,
    /**
     * Minimum resolved predictions in a decile before it counts towards calibration.
     */
    @Positive Integer minCalibrationSamples,
    /**
     * Zone in which day and week boundaries are evaluated.
     */
    ZoneId zone
) {
  public RiskProperties {
    if (maxPositionSizePercent == null) {
      maxPositionSizePercent = 10.0;
    }
    if (warningPositionSizePercent == null) {
      warningPositionSizePercent = 5.0;
    }
    if (lossCooldown == null) {
      lossCooldown = Duration.ofSeconds(30);
    }
    if (rapidTradeWindow == null) {
      rapidTradeWindow = Duration.ofSeconds(60);
    }
    if (maxTradesInWindow == null) {
      maxTradesInWindow = 3;
    }
    if (minCalibrationSamples == null) {
      minCalibrationSamples = 5;
    }
    if (zone == null) {
      zone = ZoneId.of("UTC");
    }
  }

  public static RiskProperties defaults() {
    return new RiskProperties(null, null, null, null, null, null, null);
  }
}
