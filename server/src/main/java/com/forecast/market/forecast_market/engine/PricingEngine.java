package com.forecast.market.forecast_market.engine;

import java.math.BigDecimal;
import java.math.RoundingMode;

import com.forecast.market.forecast_market.entity.Money;

/**
 * Rebated-risk pricing.
 *
 * With p the entry probability and f the platform fee:
 * - win:  profit = S(1-p)(1-f), return = S + profit, platform keeps S(1-p)f
 * - loss: the trader loses S(1-p) and gets S*p back, platform keeps nothing
 *
 * Reward is proportional to the risk taken: backing an unlikely outcome pays
 * more when it wins and forfeits less when it loses.
 */
public class PricingEngine {

    public static final BigDecimal DEFAULT_PLATFORM_FEE = new BigDecimal("0.01");

    private final BigDecimal platformFee;

    public PricingEngine() {
        this(DEFAULT_PLATFORM_FEE);
    }

    public PricingEngine(BigDecimal platformFee) {
        this.platformFee = requireFraction(platformFee, "Platform fee");
    }

    public BigDecimal getPlatformFee() {
        return platformFee;
    }

    public TradeBreakdown priceTrade(Money stake, double probability) {
        return priceTrade(stake, probability, platformFee);
    }

    /**
     * Price a stake at the given probability.
     *
     * @param probability fraction in [0, 1], or a percentage when greater than 1
     */
    public TradeBreakdown priceTrade(Money stake, double probability, BigDecimal fee) {
        if (stake == null || stake.isNegative()) {
            throw new IllegalArgumentException("Stake must not be negative: " + stake);
        }
        BigDecimal p = normalize(probability);
        BigDecimal f = requireFraction(fee, "Fee");
        BigDecimal risk = BigDecimal.ONE.subtract(p);

        Money lossAmount = stake.multiply(risk);
        Money winProfit = stake.multiply(risk.multiply(BigDecimal.ONE.subtract(f)));
        Money platformRevenue = stake.multiply(risk.multiply(f));

        return new TradeBreakdown(
                stake,
                p.doubleValue(),
                f,
                winProfit,
                stake.add(winProfit),
                lossAmount,
                stake.subtract(lossAmount),
                platformRevenue,
                riskReward(winProfit, lossAmount));
    }

    static BigDecimal normalize(double probability) {
        if (Double.isNaN(probability) || probability < 0 || probability > 100) {
            throw new IllegalArgumentException("Probability out of range: " + probability);
        }
        BigDecimal p = BigDecimal.valueOf(probability);
        return probability > 1 ? p.movePointLeft(2) : p;
    }

    private static String riskReward(Money winProfit, Money lossAmount) {
        if (!winProfit.isPositive()) {
            return "-";
        }
        BigDecimal ratio = lossAmount.toBigDecimal().divide(winProfit.toBigDecimal(), 2, RoundingMode.HALF_UP);
        return "1:" + ratio.toPlainString();
    }

    private static BigDecimal requireFraction(BigDecimal value, String name) {
        if (value == null || value.signum() < 0 || value.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException(name + " must be between 0 and 1: " + value);
        }
        return value;
    }
}
