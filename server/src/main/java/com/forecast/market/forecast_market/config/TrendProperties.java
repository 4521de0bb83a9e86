package com.forecast.market.forecast_market.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.PositiveOrZero;

@Validated
@ConfigurationProperties(prefix = "forecast.analytics")
public record TrendProperties(
    Weights weights,
    Caps caps,
    Sparkline sparkline
) {
  public TrendProperties {
    if (weights == null) {
      weights = new Weights(null, null, null, null);
    }
    if (caps == null) {
      caps = new Caps(null, null);
    }
    if (sparkline == null) {
      sparkline = new Sparkline(null, null);
    }
  }

  public static TrendProperties defaults() {
    return new TrendProperties(null, null, null);
  }

  public record Weights(
      @PositiveOrZero Double delta,
      @PositiveOrZero Double volume,
      @PositiveOrZero Double events,
      @PositiveOrZero Double sentiment
  ) {
    public Weights {
      if (delta == null) {
        delta = 0.4;
      }
      if (volume == null) {
        volume = 0.25;
      }
      if (events == null) {
        events = 0.25;
      }
      if (sentiment == null) {
        sentiment = 0.1;
      }
    }
  }

  public record Caps(
      /**
       * 24h probability change (fraction) that saturates the delta component.
       */
      @PositiveOrZero Double delta24h,
      /**
       * Informed 24h volume that saturates the volume component (log scale).
       */
      @PositiveOrZero Double volume24h
  ) {
    public Caps {
      if (delta24h == null) {
        delta24h = 0.2;
      }
      if (volume24h == null) {
        volume24h = 2000.0;
      }
    }
  }

  public record Sparkline(
      Integer points,
      Duration resolution
  ) {
    public Sparkline {
      if (points == null) {
        points = 60;
      }
      if (resolution == null) {
        resolution = Duration.ofMinutes(5);
      }
    }
  }
}
