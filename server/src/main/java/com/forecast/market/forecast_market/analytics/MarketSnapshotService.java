package com.forecast.market.forecast_market.analytics;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import com.forecast.market.forecast_market.cache.MarketBook;
import com.forecast.market.forecast_market.cache.MarketStore;
import com.forecast.market.forecast_market.entity.MarketSnapshot;
import com.forecast.market.forecast_market.entity.Outcome;
import com.forecast.market.forecast_market.entity.ProbabilityPoint;
import com.forecast.market.forecast_market.repositories.MarketSnapshotRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Probability history for analytics.
 *
 * Intraday points are kept in memory for 24 hours and feed the sparkline.
 * A daily snapshot per market is persisted and is the baseline of the 24h
 * change.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MarketSnapshotService {

    static final Duration INTRADAY_RETENTION = Duration.ofHours(24);

    private final MarketSnapshotRepository snapshotRepository;
    private final MarketStore marketStore;
    private final Clock clock;

    private final ConcurrentHashMap<String, Deque<IntradayPoint>> intraday = new ConcurrentHashMap<>();

    /**
     * @param probabilities integer percentages per outcome
     */
    public void recordPoint(String marketId, Map<String, Integer> probabilities) {
        long now = clock.millis();
        Deque<IntradayPoint> points = intraday.computeIfAbsent(marketId, id -> new ArrayDeque<>());
        synchronized (points) {
            points.addLast(new IntradayPoint(now, Map.copyOf(probabilities)));
            trim(points, now);
        }
    }

    /**
     * Recorded points of one outcome, oldest first, as fractions.
     */
    public List<ProbabilityPoint> history(String marketId, String outcomeId) {
        Deque<IntradayPoint> points = intraday.get(marketId);
        if (points == null) {
            return List.of();
        }
        List<ProbabilityPoint> result = new ArrayList<>();
        synchronized (points) {
            trim(points, clock.millis());
            for (IntradayPoint point : points) {
                Integer percent = point.probabilities().get(outcomeId);
                if (percent != null) {
                    result.add(new ProbabilityPoint(point.timestamp(), percent / 100.0));
                }
            }
        }
        return result;
    }

    public Optional<MarketSnapshot> latestSnapshot(String marketId) {
        return snapshotRepository.findById(marketId);
    }

    @Scheduled(cron = "${forecast.analytics.daily-snapshot-cron:0 0 0 * * *}", zone = "${forecast.risk.zone:UTC}")
    public void takeDailySnapshots() {
        marketStore.warmUp();
        int taken = 0;
        for (MarketBook book : marketStore.allBooks()) {
            takeSnapshot(book);
            taken++;
        }
        log.info("Daily market snapshots taken: {}", taken);
    }

    public MarketSnapshot takeSnapshot(MarketBook book) {
        LinkedHashMap<String, Integer> probabilities = new LinkedHashMap<>();
        for (Outcome outcome : book.market().getOutcomes()) {
            probabilities.put(outcome.getId(), outcome.getProbability());
        }
        MarketSnapshot snapshot = MarketSnapshot.builder()
                .marketId(book.marketId())
                .probabilities(probabilities)
                .takenAt(clock.millis())
                .build();
        return snapshotRepository.save(snapshot);
    }

    private static void trim(Deque<IntradayPoint> points, long now) {
        long cutoff = now - INTRADAY_RETENTION.toMillis();
        while (!points.isEmpty() && points.peekFirst().timestamp() < cutoff) {
            points.removeFirst();
        }
    }

    private record IntradayPoint(long timestamp, Map<String, Integer> probabilities) {
    }
}
