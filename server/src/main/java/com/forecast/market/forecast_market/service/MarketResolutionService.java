package com.forecast.market.forecast_market.service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;

import com.forecast.market.forecast_market.cache.MarketBook;
import com.forecast.market.forecast_market.cache.MarketStore;
import com.forecast.market.forecast_market.entity.Market;
import com.forecast.market.forecast_market.entity.MarketStatus;
import com.forecast.market.forecast_market.entity.Money;
import com.forecast.market.forecast_market.entity.Position;
import com.forecast.market.forecast_market.entity.PositionStatus;
import com.forecast.market.forecast_market.exception.ConsistencyViolationException;
import com.forecast.market.forecast_market.exception.InvalidWinningOutcomeException;
import com.forecast.market.forecast_market.exception.MarketAlreadyResolvedException;
import com.forecast.market.forecast_market.execution.MarketExecutionRegistry;
import com.forecast.market.forecast_market.risk.RiskControlService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Settles a market on its winning outcome.
 *
 * Runs on the market's lane, so no trade can land between reading the
 * positions and publishing the settled book. Ledger credits are made before
 * the book is published and carry a per-position nonce: if resolution fails
 * half way the market stays unresolved and a retry credits nobody twice.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MarketResolutionService {

    private final MarketExecutionRegistry executionRegistry;
    private final MarketStore marketStore;
    private final Ledger ledger;
    private final RiskControlService riskControlService;
    private final Clock clock;

    public ResolutionResult resolve(String marketId, String winningOutcomeId) {
        ResolutionResult result = executionRegistry.execute(marketId, () -> settle(marketId, winningOutcomeId));

        for (Position position : result.settledPositions()) {
            boolean won = position.getStatus() == PositionStatus.WON;
            riskControlService.recordResolution(position.getUserId(), position.getOddsAtPrediction(), won);
            if (!won) {
                riskControlService.recordLoss(position.getUserId());
            }
        }

        log.info("Market resolved: market={}, winner={}, winners={}, losers={}, paidOut={}, refunded={}",
                marketId, winningOutcomeId, result.winners(), result.losers(),
                result.totalPaidOut(), result.totalRefunded());
        return result;
    }

    private ResolutionResult settle(String marketId, String winningOutcomeId) {
        MarketBook book = marketStore.requireBook(marketId);
        Market market = book.market();
        if (!market.getStatus().isResolvable()) {
            throw new MarketAlreadyResolvedException(marketId, market.getWinningOutcomeId());
        }
        if (market.findOutcome(winningOutcomeId).isEmpty()) {
            throw new InvalidWinningOutcomeException(marketId, winningOutcomeId);
        }

        long now = clock.millis();
        List<Position> positions = new ArrayList<>(book.positions().size());
        List<Position> settled = new ArrayList<>();
        Money expectedPayout = Money.ZERO;
        Money expectedRefund = Money.ZERO;
        Money paidOut = Money.ZERO;
        Money refunded = Money.ZERO;
        int winners = 0;

        for (Position original : book.positions()) {
            if (!original.isActive()) {
                positions.add(original);
                continue;
            }
            Position position = original.copy();
            if (winningOutcomeId.equals(position.getOutcomeId())) {
                position.settle(PositionStatus.WON, position.getPotentialReturn(), now);
                expectedPayout = expectedPayout.add(original.getPotentialReturn());
                paidOut = paidOut.add(position.getActualReturn());
                winners++;
            } else {
                position.settle(PositionStatus.LOST, position.getLossRefund(), now);
                expectedRefund = expectedRefund.add(original.getLossRefund());
                refunded = refunded.add(position.getActualReturn());
            }
            positions.add(position);
            settled.add(position);
        }

        if (!paidOut.equals(expectedPayout) || !refunded.equals(expectedRefund)) {
            throw new ConsistencyViolationException(String.format(
                    "Settlement of market %s does not match entry terms: paid %s of %s, refunded %s of %s",
                    marketId, paidOut, expectedPayout, refunded, expectedRefund));
        }

        for (Position position : settled) {
            if (position.getActualReturn().isPositive()) {
                LedgerReference reference = position.getStatus() == PositionStatus.WON
                        ? LedgerReference.payout(marketId, position.getId())
                        : LedgerReference.refund(marketId, position.getId());
                ledger.credit(position.getUserId(), position.getActualReturn(), reference);
            }
        }

        Market resolved = market.copy();
        resolved.setStatus(MarketStatus.RESOLVED);
        resolved.setWinningOutcomeId(winningOutcomeId);
        resolved.setResolutionDate(now);
        marketStore.commitAndPersist(book.withSettlement(resolved, positions), settled);

        return new ResolutionResult(marketId, winningOutcomeId, winners, settled.size() - winners,
                paidOut, refunded, settled);
    }
}
