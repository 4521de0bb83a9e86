package com.forecast.market.forecast_market.analytics;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.forecast.market.forecast_market.cache.MarketBook;
import com.forecast.market.forecast_market.cache.MarketStore;
import com.forecast.market.forecast_market.config.TrendProperties;
import com.forecast.market.forecast_market.entity.InfoEvent;
import com.forecast.market.forecast_market.entity.Market;
import com.forecast.market.forecast_market.entity.Money;
import com.forecast.market.forecast_market.entity.Outcome;
import com.forecast.market.forecast_market.entity.Position;
import com.forecast.market.forecast_market.entity.ProbabilityPoint;
import com.forecast.market.forecast_market.risk.RiskControlService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Trend score and companion metrics of a market.
 *
 * score = 100 * (wD * delta + wV * volume + wE * events + wS * sentiment)
 *
 * - delta: |24h change of the primary outcome|, saturating at the delta cap
 * - volume: log-scaled informed 24h volume, saturating at the volume cap
 * - events: sum of confidence * impact of mapped info events, capped at 1
 * - sentiment: consensus across the expert, institutional and mass layers
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrendAnalyticsService {

    private static final Duration DAY = Duration.ofHours(24);
    private static final double SCENARIO_SPREAD = 0.1;

    private static final Set<String> EXPERT_TYPES = Set.of("expert", "analyst", "research");
    private static final Set<String> INSTITUTIONAL_TYPES = Set.of("institutional", "official", "filing", "poll", "news");

    private final MarketStore marketStore;
    private final MarketSnapshotService snapshotService;
    private final RiskControlService riskControlService;
    private final InfoEventFeed infoEventFeed;
    private final TrendProperties properties;
    private final Clock clock;

    public MarketMetrics computeMarketMetrics(String marketId) {
        MarketBook book = marketStore.requireBook(marketId);
        Market market = book.market();
        long now = clock.millis();

        Outcome primary = primaryOutcome(market);
        double implied = clamp01(primary.getProbability() / 100.0);

        double change24h = snapshotService.latestSnapshot(marketId)
                .map(s -> s.getProbabilities().get(primary.getId()))
                .map(p -> implied - p / 100.0)
                .orElse(0.0);

        long since = now - DAY.toMillis();
        List<Money> recentStakes = new ArrayList<>();
        double weightedVolume = 0;
        for (Position position : book.positions()) {
            if (position.getCreatedAt() >= since) {
                recentStakes.add(position.getStakeAmount());
                double weight = 0.5 + riskControlService.accuracyOf(position.getUserId()) * 0.5;
                weightedVolume += position.getStakeAmount().toDouble() * weight;
            }
        }

        List<InfoEvent> events = infoEventFeed.eventsFor(marketId);
        MarketMetrics.Sentiment sentiment = sentiment(events);
        double impact = clamp01(events.stream().mapToDouble(e -> e.confidence() * e.impactEstimate()).sum());

        TrendProperties.Weights weights = properties.weights();
        TrendProperties.Caps caps = properties.caps();
        MarketMetrics.Components components = new MarketMetrics.Components(
                clamp01(Math.abs(change24h) / caps.delta24h()),
                logNorm(weightedVolume, caps.volume24h()),
                impact,
                clamp01(sentiment.consensus()));
        int score = (int) Math.round(100 * (
                weights.delta() * components.delta24hNorm()
                + weights.volume() * components.informedVolume24hNorm()
                + weights.events() * components.infoEventImpactNorm()
                + weights.sentiment() * components.sentimentConsensusNorm()));

        MarketMetrics metrics = new MarketMetrics(
                marketId,
                new MarketMetrics.Core((int) Math.round(implied * 100), implied, primary.getId(),
                        market.getTotalVolume(), Money.sum(recentStakes)),
                new MarketMetrics.InformedVolume(weightedVolume),
                new MarketMetrics.Trend(Math.max(0, Math.min(100, score)), components, weights, caps, change24h),
                sentiment,
                events,
                catalystSummary(events),
                new MarketMetrics.ScenarioBands(
                        Math.max(0, implied - SCENARIO_SPREAD), implied, Math.min(1, implied + SCENARIO_SPREAD)),
                sparkline(marketId, primary.getId(), implied, now),
                now);

        log.debug("Metrics computed: market={}, score={}, change24h={}", marketId, score, change24h);
        return metrics;
    }

    /**
     * "Yes" of a yes/no market, otherwise the outcome with the most stake.
     */
    static Outcome primaryOutcome(Market market) {
        List<Outcome> outcomes = market.getOutcomes();
        if (outcomes.size() == 2) {
            for (Outcome o : outcomes) {
                if (o.isTitled("yes")) {
                    return o;
                }
            }
        }
        Outcome best = outcomes.get(0);
        for (Outcome o : outcomes) {
            if (o.getTotalStake().isGreaterThan(best.getTotalStake())) {
                best = o;
            }
        }
        return best;
    }

    static MarketMetrics.Sentiment sentiment(List<InfoEvent> events) {
        if (events.isEmpty()) {
            return new MarketMetrics.Sentiment(0, 0, 0, 0,
                    MarketMetrics.DecisionGrade.NOISE, MarketMetrics.Uncertainty.HIGH_DISAGREEMENT);
        }

        List<InfoEvent> expert = new ArrayList<>();
        List<InfoEvent> institutional = new ArrayList<>();
        List<InfoEvent> mass = new ArrayList<>();
        for (InfoEvent e : events) {
            String type = e.type() == null ? "" : e.type().toLowerCase(Locale.ROOT);
            if (EXPERT_TYPES.contains(type)) {
                expert.add(e);
            } else if (INSTITUTIONAL_TYPES.contains(type)) {
                institutional.add(e);
            } else {
                mass.add(e);
            }
        }

        List<Double> layers = new ArrayList<>();
        double expertScore = layerScore(expert, layers);
        double institutionalScore = layerScore(institutional, layers);
        double massScore = layerScore(mass, layers);

        double mean = layers.stream().mapToDouble(Double::doubleValue).average().orElse(0);
        double spread = layers.stream().mapToDouble(Double::doubleValue).max().orElse(0)
                - layers.stream().mapToDouble(Double::doubleValue).min().orElse(0);
        double consensus = clamp01(mean * (1 - spread));

        double averageConfidence = clamp01(events.stream().mapToDouble(InfoEvent::confidence).average().orElse(0));
        MarketMetrics.DecisionGrade grade = averageConfidence > 0.6 ? MarketMetrics.DecisionGrade.SIGNAL
                : averageConfidence < 0.3 ? MarketMetrics.DecisionGrade.NOISE
                : MarketMetrics.DecisionGrade.OVERREACTION;
        MarketMetrics.Uncertainty uncertainty = averageConfidence < 0.4 ? MarketMetrics.Uncertainty.HIGH_DISAGREEMENT
                : averageConfidence > 0.8 ? MarketMetrics.Uncertainty.LATE_STAGE_OPTIMISM
                : MarketMetrics.Uncertainty.FRAGILE_CONSENSUS;

        return new MarketMetrics.Sentiment(expertScore, institutionalScore, massScore, consensus, grade, uncertainty);
    }

    static String catalystSummary(List<InfoEvent> events) {
        List<String> titles = events.stream()
                .map(e -> e.title() != null && !e.title().isBlank() ? e.title() : e.type())
                .filter(t -> t != null && !t.isBlank())
                .limit(2)
                .toList();
        return titles.isEmpty() ? "No catalyst detected" : String.join(" • ", titles);
    }

    /**
     * Fixed number of points at fixed spacing ending at {@code now}. Each point
     * carries the last recorded probability at or before its timestamp; points
     * before the first record carry the first record, and with no records at
     * all the series is flat at the current probability.
     */
    MarketMetrics.Sparkline sparkline(String marketId, String outcomeId, double current, long now) {
        int count = properties.sparkline().points();
        Duration resolution = properties.sparkline().resolution();
        long step = resolution.toMillis();

        List<ProbabilityPoint> history = new ArrayList<>(snapshotService.history(marketId, outcomeId));
        history.sort(Comparator.comparingLong(ProbabilityPoint::timestamp));

        List<ProbabilityPoint> points = new ArrayList<>(count);
        int cursor = 0;
        double value = history.isEmpty() ? current : history.get(0).probability();
        for (int i = count - 1; i >= 0; i--) {
            long t = now - i * step;
            while (cursor < history.size() && history.get(cursor).timestamp() <= t) {
                value = history.get(cursor).probability();
                cursor++;
            }
            points.add(new ProbabilityPoint(t, value));
        }
        return new MarketMetrics.Sparkline(points, resolution);
    }

    private static double layerScore(List<InfoEvent> layer, List<Double> populated) {
        if (layer.isEmpty()) {
            return 0;
        }
        double score = clamp01(layer.stream().mapToDouble(InfoEvent::confidence).average().orElse(0));
        populated.add(score);
        return score;
    }

    static double logNorm(double x, double cap) {
        double v = Math.log1p(Math.max(0, x));
        double c = Math.log1p(Math.max(1, cap));
        return clamp01(v / c);
    }

    static double clamp01(double x) {
        if (Double.isNaN(x)) {
            return 0;
        }
        return Math.max(0, Math.min(1, x));
    }
}
