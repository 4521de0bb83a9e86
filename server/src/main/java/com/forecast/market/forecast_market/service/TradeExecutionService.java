package com.forecast.market.forecast_market.service;

import org.springframework.stereotype.Service;

import com.forecast.market.forecast_market.analytics.MarketSnapshotService;
import com.forecast.market.forecast_market.engine.MarketEngine;
import com.forecast.market.forecast_market.engine.TradeBreakdown;
import com.forecast.market.forecast_market.engine.TradeResult;
import com.forecast.market.forecast_market.entity.Money;
import com.forecast.market.forecast_market.entity.TradeRequest;
import com.forecast.market.forecast_market.exception.MarketException;
import com.forecast.market.forecast_market.execution.MarketExecutionRegistry;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point for trades. Each trade runs to completion on its market's lane,
 * so trades of one market are applied in admission order and never overlap a
 * resolution.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradeExecutionService {

    private final MarketExecutionRegistry executionRegistry;
    private final MarketEngine marketEngine;
    private final MarketSnapshotService snapshotService;

    public TradeResult placeTrade(TradeRequest request) {
        try {
            return executionRegistry.execute(request.getMarketId(), () -> {
                TradeResult result = marketEngine.executeTrade(request);
                if (!result.replayed()) {
                    snapshotService.recordPoint(request.getMarketId(), result.probabilitiesAfter());
                }
                return result;
            });
        } catch (MarketException e) {
            log.warn("Trade rejected ({}): userId={}, market={}, reason={}",
                    e.getKind(), request.getUserId(), request.getMarketId(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Trade execution failed: userId={}, market={}", request.getUserId(), request.getMarketId(), e);
            throw e;
        }
    }

    /**
     * What a stake would pay at the current probability. Places nothing.
     */
    public TradeBreakdown previewTrade(String marketId, String outcomeId, Money stake) {
        return marketEngine.quote(marketId, outcomeId, stake);
    }
}
