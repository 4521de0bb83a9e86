package com.forecast.market.forecast_market.entity;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;

import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.MongoId;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Per-user responsible trading state: allocation caps and counters,
 * self-control flags, recent activity and forecasting accuracy history.
 *
 * Only {@code RiskControlService} mutates this, under the user's lock.
 */
@Document(collection = "risk_controls")
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class RiskControlState {
    @MongoId
    private String userId;

    private Money dailyLimit;    // null = no cap
    private Money weeklyLimit;   // null = no cap

    @Builder.Default
    private Money dailySpent = Money.ZERO;
    @Builder.Default
    private Money weeklySpent = Money.ZERO;

    private LocalDate lastDailyReset;
    private LocalDate lastWeeklyReset; // Monday of the tracked week

    private boolean observeOnly;
    private boolean tradingPaused;

    @Builder.Default
    private List<Long> recentTrades = new ArrayList<>(); // epoch millis

    private Long lastLossTime; // epoch millis

    private long totalPredictions;
    private double totalAccuracyScore;

    /**
     * Decile lower bound (0, 10, ... 90) to bucket.
     */
    @Builder.Default
    private TreeMap<Integer, CalibrationBucket> calibration = new TreeMap<>();

    public static RiskControlState fresh(String userId, LocalDate today, LocalDate weekStart) {
        return RiskControlState.builder()
                .userId(userId)
                .lastDailyReset(today)
                .lastWeeklyReset(weekStart)
                .build();
    }
}
