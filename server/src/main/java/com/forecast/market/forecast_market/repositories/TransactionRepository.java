package com.forecast.market.forecast_market.repositories;

import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.stereotype.Repository;

import com.forecast.market.forecast_market.entity.Transaction;

@Repository
public interface TransactionRepository extends MongoRepository<Transaction, String> {
    List<Transaction> findByUserIdOrderByTimestampDesc(String userId);

    List<Transaction> findByMarketIdOrderByTimestampDesc(String marketId);

    boolean existsByNonce(String nonce);

    /**
     * All entries of a user, for full-scan reconciliation.
     */
    @Query("{ 'userId': ?0 }")
    List<Transaction> findAllByUserIdForBalanceCompute(String userId);

    /**
     * Latest entry of a user; its balanceAfter is the current balance.
     */
    Transaction findTopByUserIdOrderByTimestampDesc(String userId);
}
