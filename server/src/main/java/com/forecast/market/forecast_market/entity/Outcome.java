package com.forecast.market.forecast_market.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One answer of a market. Embedded in {@link Market}.
 *
 * {@code probability} is the probability model's quote and is the only
 * figure pricing uses. {@code stakeShare} is the outcome's share of all
 * stake placed on the market; it is kept for display and can diverge from
 * {@code probability} because deposits move the model by risk-weighted
 * pressure rather than by raw stake.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Outcome {
    private String id;
    private String title;
    private int probability;   // 0-100, derived
    private int stakeShare;    // 0-100, display only

    @Builder.Default
    private Money totalStake = Money.ZERO;

    public Outcome copy() {
        return new Outcome(id, title, probability, stakeShare, totalStake);
    }

    public boolean isTitled(String candidate) {
        return title != null && title.trim().equalsIgnoreCase(candidate);
    }
}
