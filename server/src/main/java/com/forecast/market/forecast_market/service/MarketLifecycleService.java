package com.forecast.market.forecast_market.service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import org.springframework.stereotype.Service;

import com.forecast.market.forecast_market.cache.MarketBook;
import com.forecast.market.forecast_market.cache.MarketStore;
import com.forecast.market.forecast_market.config.MarketProperties;
import com.forecast.market.forecast_market.engine.ProbabilityModel;
import com.forecast.market.forecast_market.engine.RiskWeightedLmsrModel;
import com.forecast.market.forecast_market.entity.Market;
import com.forecast.market.forecast_market.entity.MarketState;
import com.forecast.market.forecast_market.entity.MarketStatus;
import com.forecast.market.forecast_market.entity.Outcome;
import com.forecast.market.forecast_market.exception.InvalidMarketException;
import com.forecast.market.forecast_market.exception.MarketAlreadyResolvedException;
import com.forecast.market.forecast_market.exception.MarketInactiveException;
import com.forecast.market.forecast_market.execution.MarketExecutionRegistry;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Creating and closing markets.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MarketLifecycleService {

    private final MarketStore marketStore;
    private final MarketExecutionRegistry executionRegistry;
    private final ProbabilityModel probabilityModel;
    private final MarketProperties properties;
    private final Clock clock;

    /**
     * Create and persist a market, seeding the model from the initial
     * probabilities when every outcome has one.
     *
     * @throws InvalidMarketException on a blank title, fewer than two outcomes,
     *         blank or duplicate outcome titles, or partial/out of range initial probabilities
     */
    public Market createMarket(MarketDefinition definition) {
        validate(definition);

        String marketId = UUID.randomUUID().toString();
        List<Outcome> outcomes = new ArrayList<>();
        Map<String, Double> seeds = new LinkedHashMap<>();
        for (MarketDefinition.OutcomeDefinition o : definition.outcomes()) {
            String outcomeId = UUID.randomUUID().toString();
            outcomes.add(Outcome.builder().id(outcomeId).title(o.title().trim()).build());
            if (o.initialProbability() != null) {
                double p = o.initialProbability();
                seeds.put(outcomeId, p > 1 ? p / 100.0 : p);
            }
        }

        double liquidity = definition.liquidity() != null ? definition.liquidity() : properties.defaultLiquidity();
        List<String> outcomeIds = outcomes.stream().map(Outcome::getId).toList();
        MarketState state = probabilityModel.seed(marketId, outcomeIds, seeds.isEmpty() ? null : seeds, liquidity);

        Map<String, Integer> percentages = RiskWeightedLmsrModel.toPercentages(probabilityModel.currentProbabilities(state));
        outcomes.forEach(o -> o.setProbability(percentages.get(o.getId())));

        Market market = Market.builder()
                .id(marketId)
                .title(definition.title().trim())
                .description(definition.description())
                .category(definition.category())
                .outcomes(outcomes)
                .createdAt(clock.millis())
                .closeDate(definition.closeDate())
                .build();

        marketStore.createMarket(new MarketBook(market, state, List.of()));
        log.info("Market created: id={}, title={}, outcomes={}, b={}", marketId, market.getTitle(),
                outcomes.size(), liquidity);
        return market;
    }

    /**
     * Halt trading. A closed market can still be resolved.
     */
    public Market closeMarket(String marketId) {
        Market closed = executionRegistry.execute(marketId, () -> {
            MarketBook book = marketStore.requireBook(marketId);
            Market market = book.market();
            if (market.getStatus() == MarketStatus.RESOLVED) {
                throw new MarketAlreadyResolvedException(marketId, market.getWinningOutcomeId());
            }
            if (!market.getStatus().acceptsTrades()) {
                throw new MarketInactiveException(marketId, market.getStatus());
            }
            Market next = market.copy();
            next.setStatus(MarketStatus.CLOSED);
            next.setCloseDate(clock.millis());
            marketStore.commitAndPersist(book.withMarket(next), List.of());
            return next;
        });
        log.info("Market closed: id={}", marketId);
        return closed;
    }

    private static void validate(MarketDefinition definition) {
        if (definition.title() == null || definition.title().isBlank()) {
            throw new InvalidMarketException("title is required");
        }
        if (definition.outcomes().size() < 2) {
            throw new InvalidMarketException("at least two outcomes are required");
        }
        if (definition.liquidity() != null && !(definition.liquidity() > 0)) {
            throw new InvalidMarketException("liquidity must be positive");
        }

        Set<String> titles = new HashSet<>();
        int seeded = 0;
        for (MarketDefinition.OutcomeDefinition o : definition.outcomes()) {
            if (o.title() == null || o.title().isBlank()) {
                throw new InvalidMarketException("outcome titles must not be blank");
            }
            if (!titles.add(o.title().trim().toLowerCase(Locale.ROOT))) {
                throw new InvalidMarketException("duplicate outcome title " + o.title());
            }
            if (o.initialProbability() != null) {
                double p = o.initialProbability();
                if (Double.isNaN(p) || p <= 0 || p >= 100) {
                    throw new InvalidMarketException("initial probability out of range for " + o.title());
                }
                seeded++;
            }
        }
        if (seeded != 0 && seeded != definition.outcomes().size()) {
            throw new InvalidMarketException("initial probabilities must be given for every outcome or none");
        }
    }
}
