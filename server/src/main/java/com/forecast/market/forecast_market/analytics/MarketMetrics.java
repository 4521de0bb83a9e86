package com.forecast.market.forecast_market.analytics;

import java.time.Duration;
import java.util.List;

import com.forecast.market.forecast_market.config.TrendProperties;
import com.forecast.market.forecast_market.entity.InfoEvent;
import com.forecast.market.forecast_market.entity.Money;
import com.forecast.market.forecast_market.entity.ProbabilityPoint;

/**
 * Derived view of a market, recomputed on demand. Never persisted.
 */
public record MarketMetrics(
        String marketId,
        Core core,
        InformedVolume informedVolume,
        Trend trend,
        Sentiment sentiment,
        List<InfoEvent> infoEvents,
        String catalystSummary,
        ScenarioBands scenarioBands,
        Sparkline sparkline,
        long computedAt) {

    /**
     * @param price               implied probability as an integer percentage
     * @param impliedProbability  0-1
     */
    public record Core(
            int price,
            double impliedProbability,
            String primaryOutcomeId,
            Money totalVolume,
            Money volume24h) {
    }

    /**
     * 24h stake weighted by 0.5 + 0.5 * accuracy of each trader.
     */
    public record InformedVolume(double volume24hWeighted) {
    }

    /**
     * @param score     0-100
     * @param change24h implied probability change since the daily snapshot, as a fraction
     */
    public record Trend(
            int score,
            Components components,
            TrendProperties.Weights weights,
            TrendProperties.Caps caps,
            double change24h) {
    }

    /**
     * Every component is normalised to [0, 1].
     */
    public record Components(
            double delta24hNorm,
            double informedVolume24hNorm,
            double infoEventImpactNorm,
            double sentimentConsensusNorm) {
    }

    /**
     * Layer scores are mean event confidence in [0, 1], 0 for a layer without events.
     */
    public record Sentiment(
            double expert,
            double institutional,
            double mass,
            double consensus,
            DecisionGrade decisionGrade,
            Uncertainty uncertainty) {
    }

    public record ScenarioBands(double p10, double p50, double p90) {
    }

    public record Sparkline(List<ProbabilityPoint> points, Duration resolution) {
        public Sparkline {
            points = List.copyOf(points);
        }
    }

    public enum DecisionGrade {
        SIGNAL, NOISE, OVERREACTION
    }

    public enum Uncertainty {
        HIGH_DISAGREEMENT, FRAGILE_CONSENSUS, LATE_STAGE_OPTIMISM
    }
}
