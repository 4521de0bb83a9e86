package com.forecast.market.forecast_market.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.forecast.market.forecast_market.cache.MarketBook;
import com.forecast.market.forecast_market.cache.MarketStore;
import com.forecast.market.forecast_market.config.RiskProperties;
import com.forecast.market.forecast_market.config.TrendProperties;
import com.forecast.market.forecast_market.engine.RiskWeightedLmsrModel;
import com.forecast.market.forecast_market.entity.InfoEvent;
import com.forecast.market.forecast_market.entity.Market;
import com.forecast.market.forecast_market.entity.MarketSnapshot;
import com.forecast.market.forecast_market.entity.Money;
import com.forecast.market.forecast_market.entity.Outcome;
import com.forecast.market.forecast_market.entity.Position;
import com.forecast.market.forecast_market.entity.ProbabilityPoint;
import com.forecast.market.forecast_market.repositories.MarketRepository;
import com.forecast.market.forecast_market.repositories.MarketSnapshotRepository;
import com.forecast.market.forecast_market.repositories.MarketStateRepository;
import com.forecast.market.forecast_market.repositories.PositionRepository;
import com.forecast.market.forecast_market.repositories.RiskControlStateRepository;
import com.forecast.market.forecast_market.risk.RiskControlService;
import com.forecast.market.forecast_market.support.InMemoryLedger;
import com.forecast.market.forecast_market.support.MutableClock;

class TrendAnalyticsServiceTest {

    private static final String MARKET = "mkt_test_1";

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-17T10:00:00Z"));
    private final MarketSnapshotRepository snapshotRepository = mock(MarketSnapshotRepository.class);
    private final InMemoryInfoEventFeed feed = new InMemoryInfoEventFeed(clock);

    private MarketStore store;
    private MarketSnapshotService snapshotService;
    private TrendAnalyticsService service;

    @BeforeEach
    void setUp() {
        store = new MarketStore(mock(MarketRepository.class), mock(MarketStateRepository.class),
                mock(PositionRepository.class), 1_000, clock);
        snapshotService = new MarketSnapshotService(snapshotRepository, store, clock);
        RiskControlService risk = new RiskControlService(mock(RiskControlStateRepository.class), new InMemoryLedger(),
                RiskProperties.defaults(), clock);
        service = new TrendAnalyticsService(store, snapshotService, risk, feed, TrendProperties.defaults(), clock);
    }

    @Test
    void computesCanonicalMetrics() {
        store.createMarket(book(
                List.of(outcome("yes", "Yes", 60, 200), outcome("no", "No", 40, 150)),
                List.of(position("p1", "u1", 100, clock.millis() - Duration.ofDays(2).toMillis()),
                        position("p2", "u2", 50, clock.millis()))));
        LinkedHashMap<String, Integer> yesterday = new LinkedHashMap<>(Map.of("yes", 55, "no", 45));
        when(snapshotRepository.findById(MARKET)).thenReturn(Optional.of(
                MarketSnapshot.builder().marketId(MARKET).probabilities(yesterday).build()));
        feed.publish(InfoEvent.builder().type("news").title("Earnings beat").source("provider")
                .timestamp(clock.millis()).confidence(0.8).mappedMarketIds(List.of(MARKET)).impactEstimate(0.6).build());
        feed.publish(InfoEvent.builder().type("news").title("Unrelated").confidence(1)
                .mappedMarketIds(List.of("other")).impactEstimate(1).build());

        MarketMetrics metrics = service.computeMarketMetrics(MARKET);

        assertThat(metrics.core().primaryOutcomeId()).isEqualTo("yes");
        assertThat(metrics.core().price()).isEqualTo(60);
        assertThat(metrics.core().impliedProbability()).isEqualTo(0.6);
        assertThat(metrics.core().totalVolume()).isEqualTo(Money.of(350));
        assertThat(metrics.core().volume24h()).isEqualTo(Money.of(50));
        assertThat(metrics.informedVolume().volume24hWeighted()).isCloseTo(25.0, within(1e-9));

        MarketMetrics.Trend trend = metrics.trend();
        assertThat(trend.change24h()).isCloseTo(0.05, within(1e-9));
        assertThat(trend.components().delta24hNorm()).isCloseTo(0.25, within(1e-9));
        assertThat(trend.components().informedVolume24hNorm())
                .isCloseTo(Math.log(26) / Math.log(2001), within(1e-9));
        assertThat(trend.components().infoEventImpactNorm()).isCloseTo(0.48, within(1e-9));
        assertThat(trend.components().sentimentConsensusNorm()).isCloseTo(0.8, within(1e-9));
        assertThat(trend.score()).isEqualTo(41);
        assertThat(trend.weights().delta()).isEqualTo(0.4);
        assertThat(trend.caps().volume24h()).isEqualTo(2000.0);

        assertThat(metrics.sentiment().institutional()).isEqualTo(0.8);
        assertThat(metrics.sentiment().decisionGrade()).isEqualTo(MarketMetrics.DecisionGrade.SIGNAL);
        assertThat(metrics.sentiment().uncertainty()).isEqualTo(MarketMetrics.Uncertainty.FRAGILE_CONSENSUS);
        assertThat(metrics.infoEvents()).extracting(InfoEvent::title).containsExactly("Earnings beat");
        assertThat(metrics.catalystSummary()).isEqualTo("Earnings beat");
        assertThat(metrics.scenarioBands().p10()).isCloseTo(0.5, within(1e-9));
        assertThat(metrics.scenarioBands().p90()).isCloseTo(0.7, within(1e-9));
    }

    @Test
    void quietMarketHasFlatSparklineAndNoSignal() {
        store.createMarket(book(List.of(outcome("yes", "Yes", 70, 0), outcome("no", "No", 30, 0)), List.of()));

        MarketMetrics metrics = service.computeMarketMetrics(MARKET);

        assertThat(metrics.sparkline().resolution()).isEqualTo(Duration.ofMinutes(5));
        assertThat(metrics.sparkline().points()).hasSize(60)
                .allSatisfy(p -> assertThat(p.probability()).isEqualTo(0.7));
        List<ProbabilityPoint> points = metrics.sparkline().points();
        assertThat(points.get(59).timestamp()).isEqualTo(clock.millis());
        assertThat(points.get(59).timestamp() - points.get(58).timestamp()).isEqualTo(Duration.ofMinutes(5).toMillis());
        assertThat(metrics.trend().change24h()).isZero();
        assertThat(metrics.trend().score()).isZero();
        assertThat(metrics.sentiment().decisionGrade()).isEqualTo(MarketMetrics.DecisionGrade.NOISE);
        assertThat(metrics.sentiment().uncertainty()).isEqualTo(MarketMetrics.Uncertainty.HIGH_DISAGREEMENT);
        assertThat(metrics.catalystSummary()).isEqualTo("No catalyst detected");
    }

    @Test
    void sparklineFollowsRecordedHistory() {
        store.createMarket(book(List.of(outcome("yes", "Yes", 60, 0), outcome("no", "No", 40, 0)), List.of()));
        Instant now = clock.instant();
        clock.set(now.minus(Duration.ofMinutes(30)));
        snapshotService.recordPoint(MARKET, Map.of("yes", 40, "no", 60));
        clock.set(now.minus(Duration.ofMinutes(10)));
        snapshotService.recordPoint(MARKET, Map.of("yes", 60, "no", 40));
        clock.set(now);

        List<ProbabilityPoint> points = service.computeMarketMetrics(MARKET).sparkline().points();

        assertThat(points.get(0).probability()).isEqualTo(0.4);
        assertThat(points.get(53).probability()).isEqualTo(0.4); // now - 30m
        assertThat(points.get(56).probability()).isEqualTo(0.4); // now - 15m
        assertThat(points.get(57).probability()).isEqualTo(0.6); // now - 10m
        assertThat(points.get(59).probability()).isEqualTo(0.6);
    }

    @Test
    void multiOutcomePrimaryIsLargestStake() {
        store.createMarket(book(List.of(outcome("a", "Red", 30, 10), outcome("b", "Green", 40, 90),
                outcome("c", "Blue", 30, 20)), List.of()));

        assertThat(service.computeMarketMetrics(MARKET).core().primaryOutcomeId()).isEqualTo("b");
    }

    @Test
    void sentimentLayersDisagreeingLowerConsensus() {
        MarketMetrics.Sentiment sentiment = TrendAnalyticsService.sentiment(List.of(
                InfoEvent.builder().type("expert").confidence(0.8).build(),
                InfoEvent.builder().type("social").confidence(0.2).build()));

        assertThat(sentiment.expert()).isEqualTo(0.8);
        assertThat(sentiment.mass()).isEqualTo(0.2);
        assertThat(sentiment.institutional()).isZero();
        // mean 0.5, spread 0.6
        assertThat(sentiment.consensus()).isCloseTo(0.2, within(1e-9));
        assertThat(sentiment.decisionGrade()).isEqualTo(MarketMetrics.DecisionGrade.OVERREACTION);
    }

    @Test
    void catalystSummaryTakesTwoNewestTitles() {
        assertThat(TrendAnalyticsService.catalystSummary(List.of(
                InfoEvent.builder().type("news").title("First").build(),
                InfoEvent.builder().type("poll").build(),
                InfoEvent.builder().type("news").title("Third").build())))
                .isEqualTo("First • poll");
    }

    private MarketBook book(List<Outcome> outcomes, List<Position> positions) {
        Market market = Market.builder()
                .id(MARKET)
                .title("Will test event occur?")
                .outcomes(new ArrayList<>(outcomes))
                .totalVolume(Money.sum(outcomes.stream().map(Outcome::getTotalStake).toList()))
                .build();
        List<String> ids = outcomes.stream().map(Outcome::getId).toList();
        return new MarketBook(market, new RiskWeightedLmsrModel().seed(MARKET, ids, null, 100), positions);
    }

    private static Outcome outcome(String id, String title, int probability, long stake) {
        return Outcome.builder().id(id).title(title).probability(probability).totalStake(Money.of(stake)).build();
    }

    private static Position position(String id, String userId, long stake, long createdAt) {
        return Position.builder().id(id).marketId(MARKET).outcomeId("yes").userId(userId)
                .stakeAmount(Money.of(stake)).oddsAtPrediction(60).createdAt(createdAt).build();
    }
}
