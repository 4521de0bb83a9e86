package com.forecast.market.forecast_market.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.forecast.market.forecast_market.entity.MarketState;

class RiskWeightedLmsrModelTest {

    private final RiskWeightedLmsrModel model = new RiskWeightedLmsrModel();

    @Test
    void uniformSeedQuotesEqualProbabilities() {
        MarketState state = model.seed("m1", List.of("a", "b", "c"), null, 100);

        Map<String, Double> p = model.currentProbabilities(state);

        assertThat(p.values()).allSatisfy(v -> assertThat(v).isCloseTo(1.0 / 3, within(1e-12)));
        assertThat(RiskWeightedLmsrModel.toPercentages(p)).containsExactly(
                Map.entry("a", 34), Map.entry("b", 33), Map.entry("c", 33));
    }

    @Test
    void seededProbabilitiesAreQuotedBack() {
        MarketState state = model.seed("m1", List.of("yes", "no"), Map.of("yes", 0.6, "no", 0.4), 100);

        assertThat(state.accumulator("yes")).isCloseTo(100 * Math.log(0.6 / 0.4), within(1e-9));
        assertThat(state.accumulator("no")).isZero();
        assertThat(model.currentProbabilities(state).get("yes")).isCloseTo(0.6, within(1e-9));
        assertThat(RiskWeightedLmsrModel.toPercentages(model.currentProbabilities(state)))
                .containsEntry("yes", 60).containsEntry("no", 40);
    }

    @Test
    void extremeSeedIsReportedWithinBounds() {
        MarketState state = model.seed("m1", List.of("yes", "no"), Map.of("yes", 0.999, "no", 0.001), 100);

        Map<String, Double> p = model.currentProbabilities(state);

        assertThat(p.get("yes")).isEqualTo(RiskWeightedLmsrModel.MAX_REPORTED);
        assertThat(p.get("no")).isEqualTo(RiskWeightedLmsrModel.MIN_REPORTED);
    }

    @Test
    void depositUsesRiskWeightedPressure() {
        MarketState state = model.seed("m1", List.of("yes", "no"), null, 100);

        Map<String, Double> after = model.applyStake(state, "yes", 100);

        // q_yes += 100 * (1 - 0.5)
        assertThat(state.accumulator("yes")).isCloseTo(50.0, within(1e-12));
        assertThat(after.get("yes")).isCloseTo(Math.exp(0.5) / (Math.exp(0.5) + 1), within(1e-12));
        assertThat(after.get("yes") + after.get("no")).isCloseTo(1.0, within(1e-12));
    }

    @ParameterizedTest
    @ValueSource(doubles = { 0.01, 1, 100, 10_000, 1e6, 1e12 })
    void quotesStayClampedForAnyStake(double stake) {
        MarketState binary = model.seed("m1", List.of("yes", "no"), null, 100);
        MarketState multi = model.seed("m2", List.of("a", "b", "c", "d"), null, 100);

        for (int i = 0; i < 5; i++) {
            assertWithinBounds(model.applyStake(binary, "yes", stake));
            assertWithinBounds(model.applyStake(multi, "a", stake));
        }
    }

    @Test
    void accumulatorSpreadIsBounded() {
        MarketState state = model.seed("m1", List.of("yes", "no"), null, 10);

        for (int i = 0; i < 100; i++) {
            model.applyStake(state, "yes", 1e9);
        }

        assertThat(state.accumulator("yes") - state.accumulator("no")).isLessThanOrEqualTo(10 * 50.0);
        assertThat(model.currentProbabilities(state).values()).allSatisfy(v -> assertThat(v).isFinite());
    }

    @Test
    void percentagesAlwaysSumToHundred() {
        Map<String, Double> p = Map.of("a", 0.155, "b", 0.155, "c", 0.69);

        assertThat(RiskWeightedLmsrModel.toPercentages(p).values().stream().mapToInt(Integer::intValue).sum())
                .isEqualTo(100);
    }

    @Test
    void rejectsBadInput() {
        MarketState state = model.seed("m1", List.of("yes", "no"), null, 100);

        assertThatThrownBy(() -> model.applyStake(state, "yes", 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> model.applyStake(state, "maybe", 10)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> model.seed("m1", List.of("only"), null, 100))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> model.seed("m1", List.of("yes", "no"), null, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static void assertWithinBounds(Map<String, Double> p) {
        assertThat(p.values()).allSatisfy(v -> assertThat(v)
                .isBetween(RiskWeightedLmsrModel.MIN_REPORTED, RiskWeightedLmsrModel.MAX_REPORTED));
        assertThat(p.values().stream().mapToDouble(Double::doubleValue).sum()).isCloseTo(1.0, within(1e-9));
    }
}
