package com.forecast.market.forecast_market.repositories;

import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.forecast.market.forecast_market.entity.Market;
import com.forecast.market.forecast_market.entity.MarketStatus;

@Repository
public interface MarketRepository extends MongoRepository<Market, String> {
    List<Market> findByStatus(MarketStatus status);
}
