package com.forecast.market.forecast_market.entity;

public enum LedgerEntryType {
    DEPOSIT,
    TRADE_STAKE,
    WIN_PAYOUT,
    LOSS_REFUND
}
