package com.forecast.market.forecast_market.config;

import java.math.BigDecimal;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;

@Validated
@ConfigurationProperties(prefix = "forecast.market")
public record MarketProperties(
    /**
     * Platform fee taken from winning profit, as a fraction.
     */
    @DecimalMin("0") @DecimalMax("1") BigDecimal platformFee,
    /**
     * Liquidity parameter b for new markets. Larger values move prices less per unit stake.
     */
    @Positive Double defaultLiquidity,
    /**
     * A market untouched for this long is written back to the store.
     */
    @Positive Long idleFlushThresholdMillis
) {
  public MarketProperties {
    if (platformFee == null) {
      platformFee = new BigDecimal("0.01");
    }
    if (defaultLiquidity == null) {
      defaultLiquidity = 100.0;
    }
    if (idleFlushThresholdMillis == null) {
      idleFlushThresholdMillis = 1_000L;
    }
  }

  public static MarketProperties defaults() {
    return new MarketProperties(null, null, null);
  }
}
