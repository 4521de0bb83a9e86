package com.forecast.market.forecast_market.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.math.BigDecimal;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.forecast.market.forecast_market.entity.Money;

class PricingEngineTest {

    private final PricingEngine engine = new PricingEngine();

    @Test
    void pricesHundredAtSixtyPercent() {
        TradeBreakdown b = engine.priceTrade(Money.of(100), 0.6);

        assertThat(b.winProfit()).isEqualTo(Money.of("39.6"));
        assertThat(b.winReturn()).isEqualTo(Money.of("139.6"));
        assertThat(b.lossAmount()).isEqualTo(Money.of(40));
        assertThat(b.lossRefund()).isEqualTo(Money.of(60));
        assertThat(b.platformRevenue()).isEqualTo(Money.of("0.4"));
        assertThat(b.riskReward()).isEqualTo("1:1.01");
        assertThat(b.winReturnPercent()).isCloseTo(139.6, within(1e-9));
        assertThat(b.lossRefundPercent()).isCloseTo(60.0, within(1e-9));
    }

    @Test
    void acceptsPercentages() {
        assertThat(engine.priceTrade(Money.of(100), 60)).isEqualTo(engine.priceTrade(Money.of(100), 0.6));
    }

    @ParameterizedTest
    @CsvSource({
            "100, 0.6, 0.01",
            "0.33, 0.05, 0.01",
            "12345.67, 0.95, 0.25",
            "7, 0.5, 0",
            "7, 0.5, 1",
            "1000000, 0.123456, 0.03",
    })
    void settlementIdentitiesHoldExactly(String stake, double p, String fee) {
        Money s = Money.of(stake);
        TradeBreakdown b = engine.priceTrade(s, p, new BigDecimal(fee));

        assertThat(b.winReturn()).isEqualTo(s.add(b.winProfit()));
        assertThat(b.lossRefund()).isEqualTo(s.subtract(b.lossAmount()));
        assertThat(b.platformRevenue().compareTo(s.multiply(BigDecimal.ONE.subtract(BigDecimal.valueOf(p)))))
                .isLessThanOrEqualTo(0);
    }

    @Test
    void feeIsTakenFromTheWinningBranchOnly() {
        TradeBreakdown b = engine.priceTrade(Money.of(100), 0.3);

        assertThat(b.lossAmount()).isEqualTo(Money.of(70));
        assertThat(b.lossRefund()).isEqualTo(Money.of(30));
        assertThat(b.platformRevenue()).isEqualTo(Money.of("0.7"));
        assertThat(b.winReturn()).isEqualTo(Money.of("169.3"));
    }

    @Test
    void certainOutcomeHasNoReward() {
        assertThat(engine.priceTrade(Money.of(10), 1.0).riskReward()).isEqualTo("-");
    }

    @Test
    void rejectsOutOfRangeInput() {
        assertThatThrownBy(() -> engine.priceTrade(Money.of(-1), 0.5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> engine.priceTrade(Money.of(1), 101)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> engine.priceTrade(Money.of(1), 0.5, new BigDecimal("1.5")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PricingEngine(new BigDecimal("-0.01")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
