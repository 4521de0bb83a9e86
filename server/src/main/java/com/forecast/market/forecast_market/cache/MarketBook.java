package com.forecast.market.forecast_market.cache;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.forecast.market.forecast_market.entity.Market;
import com.forecast.market.forecast_market.entity.MarketState;
import com.forecast.market.forecast_market.entity.Position;

/**
 * Everything owned by one market: the market with its outcomes, the
 * probability model state and every position placed on it.
 *
 * A published book is never mutated. Writers copy what they change and
 * publish a new book through {@link MarketStore}, so readers see either the
 * whole of a trade or settlement or none of it.
 */
public record MarketBook(Market market, MarketState state, List<Position> positions) {

    public MarketBook {
        positions = List.copyOf(positions);
    }

    public String marketId() {
        return market.getId();
    }

    public MarketBook withTrade(Market nextMarket, MarketState nextState, Position position) {
        List<Position> next = new ArrayList<>(positions.size() + 1);
        next.addAll(positions);
        next.add(position);
        return new MarketBook(nextMarket, nextState, next);
    }

    public MarketBook withMarket(Market nextMarket) {
        return new MarketBook(nextMarket, state, positions);
    }

    public MarketBook withSettlement(Market nextMarket, List<Position> settledPositions) {
        return new MarketBook(nextMarket, state, settledPositions);
    }

    public Optional<Position> findByNonce(String userId, String nonce) {
        if (nonce == null) {
            return Optional.empty();
        }
        return positions.stream()
                .filter(p -> nonce.equals(p.getNonce()) && p.getUserId().equals(userId))
                .findFirst();
    }

    public List<Position> positionsOf(String userId) {
        return positions.stream().filter(p -> userId.equals(p.getUserId())).toList();
    }
}
