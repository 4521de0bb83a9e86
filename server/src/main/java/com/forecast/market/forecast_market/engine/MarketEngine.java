package com.forecast.market.forecast_market.engine;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.forecast.market.forecast_market.cache.MarketBook;
import com.forecast.market.forecast_market.cache.MarketStore;
import com.forecast.market.forecast_market.entity.Market;
import com.forecast.market.forecast_market.entity.MarketState;
import com.forecast.market.forecast_market.entity.Money;
import com.forecast.market.forecast_market.entity.Outcome;
import com.forecast.market.forecast_market.entity.Position;
import com.forecast.market.forecast_market.entity.TradeRequest;
import com.forecast.market.forecast_market.exception.ConsistencyViolationException;
import com.forecast.market.forecast_market.exception.InvalidStakeException;
import com.forecast.market.forecast_market.exception.MarketInactiveException;
import com.forecast.market.forecast_market.exception.OutcomeNotFoundException;
import com.forecast.market.forecast_market.risk.RiskControlService;
import com.forecast.market.forecast_market.service.Ledger;
import com.forecast.market.forecast_market.service.LedgerReference;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Places trades against the market book.
 *
 * Trade flow:
 * 1. Validate stake, market status and outcome
 * 2. Replay: a known nonce returns the original position
 * 3. Risk controls (user locked until the trade is booked)
 * 4. Price at the pre-trade probability
 * 5. Apply the stake to a copy of the model, outcome and market
 * 6. Debit the stake from the ledger
 * 7. Publish market, model and position as one book
 *
 * Nothing is published before step 7, so a failure at any earlier step
 * leaves the market exactly as it was.
 *
 * Not thread-safe per market: callers run it on the market's
 * {@link com.forecast.market.forecast_market.execution.MarketExecutor}.
 */
@Slf4j
@RequiredArgsConstructor
public class MarketEngine {

    private final MarketStore marketStore;
    private final ProbabilityModel probabilityModel;
    private final PricingEngine pricingEngine;
    private final Ledger ledger;
    private final RiskControlService riskControlService;
    private final Clock clock;

    public TradeResult executeTrade(TradeRequest request) {
        Money stake = request.getStake();
        if (stake == null || !stake.isPositive()) {
            throw new InvalidStakeException(stake);
        }

        MarketBook book = marketStore.requireBook(request.getMarketId());
        Market market = book.market();
        if (!market.getStatus().acceptsTrades()) {
            throw new MarketInactiveException(market.getId(), market.getStatus());
        }
        if (market.findOutcome(request.getOutcomeId()).isEmpty()) {
            throw new OutcomeNotFoundException(market.getId(), request.getOutcomeId());
        }

        Optional<Position> existing = book.findByNonce(request.getUserId(), request.getNonce());
        if (existing.isPresent()) {
            log.info("Duplicate trade request detected, returning existing position: nonce={}", request.getNonce());
            return replay(book, existing.get());
        }

        return riskControlService.admit(request.getUserId(), stake,
                assessment -> place(book, request, assessment.warnings()));
    }

    /**
     * Breakdown of a stake at the outcome's current probability. Nothing is placed.
     */
    public TradeBreakdown quote(String marketId, String outcomeId, Money stake) {
        if (stake == null || !stake.isPositive()) {
            throw new InvalidStakeException(stake);
        }
        MarketBook book = marketStore.requireBook(marketId);
        Double p = probabilityModel.currentProbabilities(book.state()).get(outcomeId);
        if (p == null) {
            throw new OutcomeNotFoundException(marketId, outcomeId);
        }
        return pricingEngine.priceTrade(stake, p);
    }

    private TradeResult place(MarketBook book, TradeRequest request, List<String> warnings) {
        String marketId = book.marketId();
        String outcomeId = request.getOutcomeId();
        Money stake = request.getStake();
        long now = clock.millis();

        Map<String, Double> before = probabilityModel.currentProbabilities(book.state());
        double entryProbability = before.get(outcomeId);
        TradeBreakdown breakdown = pricingEngine.priceTrade(stake, entryProbability);

        MarketState nextState = book.state().copy();
        Map<String, Double> after = probabilityModel.applyStake(nextState, outcomeId, stake.toDouble());
        nextState.setLastTradeTimestamp(now);

        Market nextMarket = book.market().copy();
        Outcome outcome = nextMarket.findOutcome(outcomeId).orElseThrow();
        outcome.setTotalStake(outcome.getTotalStake().add(stake));
        nextMarket.setTotalVolume(nextMarket.getTotalVolume().add(stake));

        Map<String, Integer> percentages = RiskWeightedLmsrModel.toPercentages(after);
        Map<String, Integer> shares = stakeShares(nextMarket);
        for (Outcome o : nextMarket.getOutcomes()) {
            o.setProbability(percentages.get(o.getId()));
            o.setStakeShare(shares.get(o.getId()));
        }
        verifyVolume(nextMarket);

        Position position = Position.builder()
                .id(UUID.randomUUID().toString())
                .marketId(marketId)
                .outcomeId(outcomeId)
                .userId(request.getUserId())
                .nonce(request.getNonce())
                .stakeAmount(stake)
                .oddsAtPrediction(Math.round(entryProbability * 10_000) / 100.0)
                .potentialReturn(breakdown.winReturn())
                .lossRefund(breakdown.lossRefund())
                .createdAt(now)
                .build();

        ledger.debit(request.getUserId(), stake, LedgerReference.stake(marketId, position.getId()));
        marketStore.commit(book.withTrade(nextMarket, nextState, position), position);

        log.info("Trade executed: positionId={}, userId={}, market={}, outcome={}, stake={}, odds={}",
                position.getId(), position.getUserId(), marketId, outcomeId, stake, position.getOddsAtPrediction());

        return new TradeResult(position, breakdown, RiskWeightedLmsrModel.toPercentages(before), percentages,
                warnings, false);
    }

    private TradeResult replay(MarketBook book, Position position) {
        Map<String, Integer> current = RiskWeightedLmsrModel.toPercentages(
                probabilityModel.currentProbabilities(book.state()));
        TradeBreakdown breakdown = pricingEngine.priceTrade(position.getStakeAmount(), position.getOddsAtPrediction());
        return new TradeResult(position, breakdown, current, current, List.of(), true);
    }

    /**
     * Display-only share of the total stake per outcome.
     */
    private static Map<String, Integer> stakeShares(Market market) {
        Map<String, Double> raw = new LinkedHashMap<>();
        for (Outcome o : market.getOutcomes()) {
            raw.put(o.getId(), o.getTotalStake().ratioTo(market.getTotalVolume()));
        }
        return RiskWeightedLmsrModel.toPercentages(raw);
    }

    private static void verifyVolume(Market market) {
        Money stakes = Money.sum(market.getOutcomes().stream().map(Outcome::getTotalStake).toList());
        if (!stakes.equals(market.getTotalVolume())) {
            throw new ConsistencyViolationException(String.format(
                    "Outcome stakes %s do not match total volume %s in market %s",
                    stakes, market.getTotalVolume(), market.getId()));
        }
    }
}
