package com.forecast.market.forecast_market.repositories;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.forecast.market.forecast_market.entity.RiskControlState;

@Repository
public interface RiskControlStateRepository extends MongoRepository<RiskControlState, String> {
}
