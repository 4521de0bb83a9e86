package com.forecast.market.forecast_market.repositories;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.forecast.market.forecast_market.entity.MarketSnapshot;

@Repository
public interface MarketSnapshotRepository extends MongoRepository<MarketSnapshot, String> {
}
