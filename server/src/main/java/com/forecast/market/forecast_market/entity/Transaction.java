package com.forecast.market.forecast_market.entity;

import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.MongoId;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Ledger entry. The ledger is the source of truth for balances; the latest
 * entry of a user carries the running balance.
 */
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
@Document(collection = "transactions")
@CompoundIndex(name = "user_timestamp_idx", def = "{'userId':1,'timestamp':-1}")
public class Transaction {
    @MongoId
    private String id;

    @Indexed
    private String userId;

    private String marketId;      // null for deposits
    private String positionId;    // stake, payout and refund entries

    private LedgerEntryType type;
    private Money amount;         // positive for credit, negative for debit

    private long timestamp;

    /**
     * Idempotency key, {@code {positionId}:{type}} for market entries.
     */
    @Indexed(unique = true, sparse = true)
    private String nonce;

    private Money balanceAfter;
}
