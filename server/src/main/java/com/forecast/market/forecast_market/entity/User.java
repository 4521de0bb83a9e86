package com.forecast.market.forecast_market.entity;

import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.MongoId;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Cached view of a user's balance. Derived from the ledger, never authoritative.
 */
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
@Document(collection = "users")
public class User {
    @MongoId
    private String userId;

    @Builder.Default
    private Money balance = Money.ZERO;

    private long updatedAt;
}
