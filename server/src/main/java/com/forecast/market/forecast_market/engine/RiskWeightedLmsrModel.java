package com.forecast.market.forecast_market.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.forecast.market.forecast_market.entity.MarketState;

/**
 * Logarithmic market scoring rule with risk-weighted deposits.
 *
 * p_i = exp(q_i / b) / sum_j exp(q_j / b). A stake s on outcome i adds
 * s * (1 - p_i) to q_i, so the further an outcome is from certainty the more
 * a unit of stake moves it. Quotes are clamped to [0.05, 0.95].
 */
public class RiskWeightedLmsrModel implements ProbabilityModel {

    public static final double MIN_REPORTED = 0.05;
    public static final double MAX_REPORTED = 0.95;

    static final double MIN_SEED = 0.01;
    static final double MAX_SEED = 0.99;

    // q_i - min(q) is capped at b * MAX_SPREAD_RATIO; exp(50) is far from overflow
    static final double MAX_SPREAD_RATIO = 50.0;

    @Override
    public Map<String, Double> currentProbabilities(MarketState state) {
        return clamp(rawProbabilities(state));
    }

    @Override
    public Map<String, Double> applyStake(MarketState state, String outcomeId, double stake) {
        if (stake <= 0 || Double.isNaN(stake) || Double.isInfinite(stake)) {
            throw new IllegalArgumentException("Stake must be positive and finite: " + stake);
        }
        Map<String, Double> raw = rawProbabilities(state);
        Double p = raw.get(outcomeId);
        if (p == null) {
            throw new IllegalArgumentException("Unknown outcome " + outcomeId + " for market " + state.getMarketId());
        }

        double deltaQ = stake * (1.0 - p);
        LinkedHashMap<String, Double> q = state.getAccumulators();
        q.put(outcomeId, q.get(outcomeId) + deltaQ);
        boundSpread(q, state.getLiquidityB());

        return currentProbabilities(state);
    }

    @Override
    public MarketState seed(String marketId, List<String> outcomeIds, Map<String, Double> initialProbabilities,
            double liquidityB) {
        if (outcomeIds == null || outcomeIds.size() < 2) {
            throw new IllegalArgumentException("A market needs at least two outcomes");
        }
        if (liquidityB <= 0) {
            throw new IllegalArgumentException("Liquidity parameter must be positive");
        }

        LinkedHashMap<String, Double> q = new LinkedHashMap<>();
        if (initialProbabilities == null || initialProbabilities.isEmpty()) {
            outcomeIds.forEach(id -> q.put(id, 0.0));
        } else {
            double[] p = new double[outcomeIds.size()];
            double sum = 0;
            for (int i = 0; i < p.length; i++) {
                Double wanted = initialProbabilities.get(outcomeIds.get(i));
                if (wanted == null) {
                    throw new IllegalArgumentException("Missing initial probability for outcome " + outcomeIds.get(i));
                }
                p[i] = Math.max(MIN_SEED, Math.min(MAX_SEED, wanted));
                sum += p[i];
            }
            double last = p[p.length - 1] / sum;
            for (int i = 0; i < p.length; i++) {
                // q_i = b * ln(p_i / p_last); binary case is b * ln(p / (1 - p)) with q_no = 0
                q.put(outcomeIds.get(i), liquidityB * Math.log((p[i] / sum) / last));
            }
        }

        return MarketState.builder()
                .marketId(marketId)
                .accumulators(q)
                .liquidityB(liquidityB)
                .build();
    }

    /**
     * Unclamped softmax over the accumulators, shifted by the largest one.
     */
    Map<String, Double> rawProbabilities(MarketState state) {
        Map<String, Double> q = state.getAccumulators();
        double b = state.getLiquidityB();
        double maxQ = Collections.max(q.values()) / b;

        Map<String, Double> exp = new LinkedHashMap<>();
        double total = 0;
        for (Map.Entry<String, Double> e : q.entrySet()) {
            double v = Math.exp(e.getValue() / b - maxQ);
            exp.put(e.getKey(), v);
            total += v;
        }
        Map<String, Double> p = new LinkedHashMap<>();
        for (Map.Entry<String, Double> e : exp.entrySet()) {
            p.put(e.getKey(), e.getValue() / total);
        }
        return p;
    }

    /**
     * Clamp every probability to [MIN_REPORTED, MAX_REPORTED] and push the
     * excess or deficit onto the outcomes that are still inside the bounds,
     * so the vector keeps summing to 1.
     */
    static Map<String, Double> clamp(Map<String, Double> raw) {
        List<String> ids = new ArrayList<>(raw.keySet());
        int n = ids.size();
        double[] p = new double[n];
        for (int i = 0; i < n; i++) {
            p[i] = raw.get(ids.get(i));
        }

        for (int iteration = 0; iteration <= n; iteration++) {
            double sum = 0;
            for (int i = 0; i < n; i++) {
                p[i] = Math.max(MIN_REPORTED, Math.min(MAX_REPORTED, p[i]));
                sum += p[i];
            }
            double residual = 1.0 - sum;
            if (Math.abs(residual) < 1e-12) {
                break;
            }
            double freeMass = 0;
            int free = 0;
            for (int i = 0; i < n; i++) {
                if (residual > 0 ? p[i] < MAX_REPORTED : p[i] > MIN_REPORTED) {
                    freeMass += p[i];
                    free++;
                }
            }
            if (free == 0) {
                break;
            }
            for (int i = 0; i < n; i++) {
                if (residual > 0 ? p[i] < MAX_REPORTED : p[i] > MIN_REPORTED) {
                    p[i] += residual * (freeMass > 0 ? p[i] / freeMass : 1.0 / free);
                }
            }
        }

        Map<String, Double> clamped = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            clamped.put(ids.get(i), Math.max(MIN_REPORTED, Math.min(MAX_REPORTED, p[i])));
        }
        return clamped;
    }

    /**
     * Integer percentages that sum to exactly 100 (largest remainder).
     */
    public static Map<String, Integer> toPercentages(Map<String, Double> probabilities) {
        List<String> ids = new ArrayList<>(probabilities.keySet());
        int[] floors = new int[ids.size()];
        double[] remainders = new double[ids.size()];
        double total = probabilities.values().stream().mapToDouble(Double::doubleValue).sum();
        int assigned = 0;
        for (int i = 0; i < ids.size(); i++) {
            double scaled = probabilities.get(ids.get(i)) / total * 100.0;
            floors[i] = (int) Math.floor(scaled);
            remainders[i] = scaled - floors[i];
            assigned += floors[i];
        }

        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < ids.size(); i++) {
            order.add(i);
        }
        order.sort((a, b) -> Double.compare(remainders[b], remainders[a]));
        for (int k = 0; k < 100 - assigned && k < order.size(); k++) {
            floors[order.get(k)]++;
        }

        Map<String, Integer> percentages = new LinkedHashMap<>();
        for (int i = 0; i < ids.size(); i++) {
            percentages.put(ids.get(i), floors[i]);
        }
        return percentages;
    }

    private static void boundSpread(Map<String, Double> q, double b) {
        double minQ = Collections.min(q.values());
        double ceiling = minQ + b * MAX_SPREAD_RATIO;
        q.replaceAll((id, value) -> Math.min(value, ceiling));
    }
}
