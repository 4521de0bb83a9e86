package com.forecast.market.forecast_market.entity;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Resolved predictions whose entry probability fell in one decile.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class CalibrationBucket {
    private int total;
    private int correct;

    public void record(boolean wasCorrect) {
        total++;
        if (wasCorrect) {
            correct++;
        }
    }

    public double winRate() {
        return total == 0 ? 0.0 : (double) correct / total;
    }
}
