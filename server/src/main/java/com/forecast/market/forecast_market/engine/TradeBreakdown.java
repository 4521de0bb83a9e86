package com.forecast.market.forecast_market.engine;

import java.math.BigDecimal;

import com.forecast.market.forecast_market.entity.Money;

/**
 * Both settlement branches of a stake, fixed at the entry probability.
 *
 * @param probability entry probability as a fraction
 * @param riskReward  "1:x" where x = loss amount / win profit, "-" without profit
 */
public record TradeBreakdown(
        Money stake,
        double probability,
        BigDecimal fee,
        Money winProfit,
        Money winReturn,
        Money lossAmount,
        Money lossRefund,
        Money platformRevenue,
        String riskReward) {

    public double probabilityPercent() {
        return probability * 100.0;
    }

    public double winReturnPercent() {
        return stake.isPositive() ? winReturn.ratioTo(stake) * 100.0 : 0.0;
    }

    public double lossRefundPercent() {
        return stake.isPositive() ? lossRefund.ratioTo(stake) * 100.0 : 0.0;
    }
}
