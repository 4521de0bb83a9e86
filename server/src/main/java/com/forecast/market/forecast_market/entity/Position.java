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
 * A user's stake on one outcome of one market.
 *
 * Both settlement figures are fixed at entry: {@code potentialReturn} is paid
 * if the outcome wins, {@code lossRefund} if it loses. Resolution only picks
 * one of them.
 */
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
@Document(collection = "positions")
@CompoundIndex(name = "market_status_idx", def = "{'marketId':1,'status':1}")
public class Position {

    @MongoId
    private String id;

    @Indexed
    private String marketId;

    private String outcomeId;

    @Indexed
    private String userId;

    /**
     * Client idempotency key; a repeated nonce returns the original position.
     */
    private String nonce;

    private Money stakeAmount;

    /**
     * Outcome probability at entry, 0-100 with two decimals.
     */
    private double oddsAtPrediction;

    private Money potentialReturn;
    private Money lossRefund;

    @Builder.Default
    private Money actualReturn = Money.ZERO;

    @Builder.Default
    private PositionStatus status = PositionStatus.ACTIVE;

    private long createdAt;
    private Long resolvedAt;

    /**
     * Move to a terminal status, recording the settled return.
     *
     * @throws IllegalStateException if the position has already been settled
     */
    public void settle(PositionStatus newStatus, Money settledReturn, long timestamp) {
        if (!this.status.canTransitionTo(newStatus)) {
            throw new IllegalStateException(
                String.format("Invalid position state transition: %s → %s (positionId=%s)",
                    this.status, newStatus, this.id));
        }
        this.status = newStatus;
        this.actualReturn = settledReturn;
        this.resolvedAt = timestamp;
    }

    public boolean isActive() {
        return status == PositionStatus.ACTIVE;
    }

    public Position copy() {
        return new Position(id, marketId, outcomeId, userId, nonce, stakeAmount, oddsAtPrediction,
                potentialReturn, lossRefund, actualReturn, status, createdAt, resolvedAt);
    }
}
