package com.forecast.market.forecast_market.service;

import java.util.UUID;

import com.forecast.market.forecast_market.entity.LedgerEntryType;

/**
 * What a ledger entry pays for. Market entries carry an idempotency nonce
 * derived from the position, so replaying one is a no-op.
 */
public record LedgerReference(LedgerEntryType type, String marketId, String positionId, String nonce) {

    public static LedgerReference deposit() {
        return new LedgerReference(LedgerEntryType.DEPOSIT, null, null, "deposit:" + UUID.randomUUID());
    }

    public static LedgerReference stake(String marketId, String positionId) {
        return forPosition(LedgerEntryType.TRADE_STAKE, marketId, positionId);
    }

    public static LedgerReference payout(String marketId, String positionId) {
        return forPosition(LedgerEntryType.WIN_PAYOUT, marketId, positionId);
    }

    public static LedgerReference refund(String marketId, String positionId) {
        return forPosition(LedgerEntryType.LOSS_REFUND, marketId, positionId);
    }

    private static LedgerReference forPosition(LedgerEntryType type, String marketId, String positionId) {
        return new LedgerReference(type, marketId, positionId, positionId + ":" + type.name().toLowerCase());
    }
}
