package com.forecast.market.forecast_market.repositories;

import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.forecast.market.forecast_market.entity.Position;
import com.forecast.market.forecast_market.entity.PositionStatus;

@Repository
public interface PositionRepository extends MongoRepository<Position, String> {
    List<Position> findByMarketIdOrderByCreatedAtAsc(String marketId);

    List<Position> findByUserIdOrderByCreatedAtDesc(String userId);

    List<Position> findByMarketIdAndStatus(String marketId, PositionStatus status);
}
