package com.forecast.market.forecast_market.risk;

import java.util.List;

import com.forecast.market.forecast_market.entity.Money;

/**
 * Outcome of a pre-trade risk check. A trade may go ahead iff nothing is
 * blocked; warnings are shown to the trader but do not stop the trade.
 *
 * @param capitalAtRisk   stake as a percentage of balance
 * @param dailyRemaining  null when no daily cap is set
 * @param weeklyRemaining null when no weekly cap is set
 */
public record RiskAssessment(
        List<String> blocked,
        List<String> warnings,
        double capitalAtRisk,
        Money dailyRemaining,
        Money weeklyRemaining) {

    public RiskAssessment {
        blocked = List.copyOf(blocked);
        warnings = List.copyOf(warnings);
    }

    public boolean allowed() {
        return blocked.isEmpty();
    }
}
