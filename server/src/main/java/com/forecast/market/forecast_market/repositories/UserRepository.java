package com.forecast.market.forecast_market.repositories;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.forecast.market.forecast_market.entity.User;

/**
 * Cached balances. The transactions ledger is the source of truth; see
 * LedgerService for how the cache is refreshed.
 */
@Repository
public interface UserRepository extends MongoRepository<User, String> {
}
