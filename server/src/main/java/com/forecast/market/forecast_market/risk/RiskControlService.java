package com.forecast.market.forecast_market.risk;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

import org.springframework.stereotype.Service;

import com.forecast.market.forecast_market.config.RiskProperties;
import com.forecast.market.forecast_market.entity.CalibrationBucket;
import com.forecast.market.forecast_market.entity.Money;
import com.forecast.market.forecast_market.entity.RiskControlState;
import com.forecast.market.forecast_market.exception.TradeRejectedException;
import com.forecast.market.forecast_market.repositories.RiskControlStateRepository;
import com.forecast.market.forecast_market.service.Ledger;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Responsible trading controls.
 *
 * Evaluated before every trade:
 * - stake above 10% of balance is blocked, above 5% warned
 * - paused trading and observe-only mode block
 * - a trade within 30s of the last resolved loss is warned
 * - daily and weekly allocation caps block
 * - three or more trades within a minute are warned
 *
 * Also keeps each user's forecasting accuracy (Brier complement) and
 * calibration by probability decile.
 *
 * All reads and writes of one user's state happen under that user's lock.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RiskControlService {

    private final RiskControlStateRepository repository;
    private final Ledger ledger;
    private final RiskProperties properties;
    private final Clock clock;

    private final ConcurrentHashMap<String, RiskControlState> states = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public RiskAssessment evaluate(String userId, Money stake) {
        return withState(userId, state -> assess(userId, state, stake, clock.millis()));
    }

    /**
     * Evaluate, run {@code trade} if nothing blocks, then book the stake.
     * The user's state stays locked throughout, so two trades of one user
     * cannot both slip under a cap.
     *
     * @throws TradeRejectedException if a control blocks the trade
     */
    public <T> T admit(String userId, Money stake, Function<RiskAssessment, T> trade) {
        return withState(userId, state -> {
            long now = clock.millis();
            RiskAssessment assessment = assess(userId, state, stake, now);
            if (!assessment.allowed()) {
                log.warn("Trade blocked by risk controls: userId={}, stake={}, reasons={}",
                        userId, stake, assessment.blocked());
                throw new TradeRejectedException(userId, assessment);
            }
            T result = trade.apply(assessment);
            book(state, stake, now);
            persistApplied(state);
            return result;
        });
    }

    public void recordTrade(String userId, Money stake) {
        withState(userId, state -> {
            book(state, stake, clock.millis());
            return persistApplied(state);
        });
    }

    /**
     * Start the post-loss reflection period.
     */
    public void recordLoss(String userId) {
        withState(userId, state -> {
            state.setLastLossTime(clock.millis());
            return persistApplied(state);
        });
    }

    /**
     * Fold a resolved prediction into accuracy and calibration.
     *
     * @param oddsAtPrediction entry probability of the backed outcome, 0-100
     */
    public void recordResolution(String userId, double oddsAtPrediction, boolean wasCorrect) {
        withState(userId, state -> {
            double p = oddsAtPrediction / 100.0;
            double brier = Math.pow(p - (wasCorrect ? 1 : 0), 2);
            state.setTotalPredictions(state.getTotalPredictions() + 1);
            state.setTotalAccuracyScore(state.getTotalAccuracyScore() + (1 - brier));

            int bucket = Math.min(90, (int) Math.floor(oddsAtPrediction / 10) * 10);
            state.getCalibration().computeIfAbsent(bucket, b -> new CalibrationBucket()).record(wasCorrect);
            return persistApplied(state);
        });
    }

    public ForecasterStats forecasterStats(String userId) {
        return withState(userId, state -> {
            double accuracy = state.getTotalPredictions() > 0
                    ? state.getTotalAccuracyScore() / state.getTotalPredictions() * 100
                    : 0;

            double calibrationError = 0;
            int calibrationBuckets = 0;
            Map<Integer, CalibrationBucket> buckets = new LinkedHashMap<>();
            for (Map.Entry<Integer, CalibrationBucket> e : state.getCalibration().entrySet()) {
                CalibrationBucket data = e.getValue();
                buckets.put(e.getKey(), new CalibrationBucket(data.getTotal(), data.getCorrect()));
                if (data.getTotal() >= properties.minCalibrationSamples()) {
                    double expectedRate = (e.getKey() + 5) / 100.0; // bucket centre
                    calibrationError += Math.abs(expectedRate - data.winRate());
                    calibrationBuckets++;
                }
            }
            double calibration = calibrationBuckets > 0
                    ? 100 - (calibrationError / calibrationBuckets * 100)
                    : 0;

            return new ForecasterStats(state.getTotalPredictions(), accuracy, calibration, buckets);
        });
    }

    /**
     * Mean Brier complement in [0, 1]; 0 for a user with no resolved predictions.
     */
    public double accuracyOf(String userId) {
        return withState(userId, state -> state.getTotalPredictions() > 0
                ? state.getTotalAccuracyScore() / state.getTotalPredictions()
                : 0.0);
    }

    // ===== Self-control settings =====

    /**
     * @param limit null or non-positive clears the cap
     */
    public void setDailyLimit(String userId, Money limit) {
        withState(userId, state -> {
            state.setDailyLimit(limit != null && limit.isPositive() ? limit : null);
            return repository.save(state);
        });
    }

    public void setWeeklyLimit(String userId, Money limit) {
        withState(userId, state -> {
            state.setWeeklyLimit(limit != null && limit.isPositive() ? limit : null);
            return repository.save(state);
        });
    }

    public void setObserveOnly(String userId, boolean enabled) {
        withState(userId, state -> {
            state.setObserveOnly(enabled);
            return repository.save(state);
        });
    }

    public void pauseTrading(String userId) {
        withState(userId, state -> {
            state.setTradingPaused(true);
            return repository.save(state);
        });
        log.info("Trading paused: userId={}", userId);
    }

    public void resumeTrading(String userId) {
        withState(userId, state -> {
            state.setTradingPaused(false);
            return repository.save(state);
        });
        log.info("Trading resumed: userId={}", userId);
    }

    // ===== Internals =====

    private RiskAssessment assess(String userId, RiskControlState state, Money stake, long now) {
        Money balance = ledger.getBalance(userId);
        double capitalAtRisk = balance.isPositive() ? stake.ratioTo(balance) * 100 : 100;

        List<String> warnings = new ArrayList<>();
        List<String> blocked = new ArrayList<>();

        if (state.isTradingPaused()) {
            blocked.add("Trading is currently paused. Resume trading in your risk controls to continue.");
        }
        if (state.isObserveOnly()) {
            blocked.add("Observe-only mode is active. Disable it in your risk controls to trade.");
        }

        if (state.getLastLossTime() != null) {
            long sinceLoss = now - state.getLastLossTime();
            long cooldown = properties.lossCooldown().toMillis();
            if (sinceLoss < cooldown) {
                long remainingSeconds = (long) Math.ceil((cooldown - sinceLoss) / 1000.0);
                warnings.add(String.format(
                        "Reflection period: %ds remaining since your last resolved position.", remainingSeconds));
            }
        }

        if (capitalAtRisk > properties.maxPositionSizePercent()) {
            blocked.add(String.format("Position size exceeds %.0f%% of your capital. Consider a smaller position.",
                    properties.maxPositionSizePercent()));
        } else if (capitalAtRisk > properties.warningPositionSizePercent()) {
            warnings.add(String.format("This position represents %.1f%% of your capital.", capitalAtRisk));
        }

        Money dailyRemaining = remaining(state.getDailyLimit(), state.getDailySpent());
        if (state.getDailyLimit() != null && state.getDailySpent().add(stake).isGreaterThan(state.getDailyLimit())) {
            blocked.add("Daily allocation limit reached. Remaining: " + dailyRemaining);
        }
        Money weeklyRemaining = remaining(state.getWeeklyLimit(), state.getWeeklySpent());
        if (state.getWeeklyLimit() != null && state.getWeeklySpent().add(stake).isGreaterThan(state.getWeeklyLimit())) {
            blocked.add("Weekly allocation limit reached. Remaining: " + weeklyRemaining);
        }

        long window = properties.rapidTradeWindow().toMillis();
        long recent = state.getRecentTrades().stream().filter(t -> now - t < window).count();
        if (recent >= properties.maxTradesInWindow()) {
            warnings.add("Multiple trades detected in quick succession. Take a moment to review your strategy.");
        }

        return new RiskAssessment(blocked, warnings, capitalAtRisk, dailyRemaining, weeklyRemaining);
    }

    private void book(RiskControlState state, Money stake, long now) {
        state.setDailySpent(state.getDailySpent().add(stake));
        state.setWeeklySpent(state.getWeeklySpent().add(stake));
        long keep = properties.rapidTradeWindow().toMillis() * 2;
        List<Long> trades = new ArrayList<>(state.getRecentTrades());
        trades.add(now);
        trades.removeIf(t -> now - t >= keep);
        state.setRecentTrades(trades);
    }

    private <T> T withState(String userId, Function<RiskControlState, T> action) {
        ReentrantLock lock = locks.computeIfAbsent(userId, id -> new ReentrantLock());
        lock.lock();
        try {
            RiskControlState state = states.computeIfAbsent(userId, this::loadOrCreate);
            resetElapsedPeriods(state);
            return action.apply(state);
        } finally {
            lock.unlock();
        }
    }

    private RiskControlState loadOrCreate(String userId) {
        return repository.findById(userId)
                .orElseGet(() -> RiskControlState.fresh(userId, today(), weekStart(today())));
    }

    private void resetElapsedPeriods(RiskControlState state) {
        LocalDate today = today();
        LocalDate weekStart = weekStart(today);
        if (!today.equals(state.getLastDailyReset())) {
            state.setDailySpent(Money.ZERO);
            state.setLastDailyReset(today);
        }
        if (!weekStart.equals(state.getLastWeeklyReset())) {
            state.setWeeklySpent(Money.ZERO);
            state.setLastWeeklyReset(weekStart);
        }
    }

    /**
     * Write-behind for state changed by a trade or settlement that has already
     * been applied. The cached state stays authoritative if the write fails;
     * the next successful save of this user carries the change.
     */
    private RiskControlState persistApplied(RiskControlState state) {
        try {
            return repository.save(state);
        } catch (Exception e) {
            log.error("Failed to persist risk controls: userId={}", state.getUserId(), e);
            return state;
        }
    }

    private LocalDate today() {
        return clock.instant().atZone(properties.zone()).toLocalDate();
    }

    private static LocalDate weekStart(LocalDate day) {
        return day.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    }

    private static Money remaining(Money limit, Money spent) {
        return limit == null ? null : limit.subtract(spent).max(Money.ZERO);
    }
}
