package com.forecast.market.forecast_market.repositories;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.forecast.market.forecast_market.entity.MarketState;

/**
 * Probability model state, keyed by market id.
 */
@Repository
public interface MarketStateRepository extends MongoRepository<MarketState, String> {
}
