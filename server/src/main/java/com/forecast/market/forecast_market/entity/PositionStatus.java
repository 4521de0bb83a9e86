package com.forecast.market.forecast_market.entity;

/**
 * Position state machine.
 *
 * ACTIVE → WON       (backed outcome won at resolution)
 * ACTIVE → LOST      (another outcome won)
 * ACTIVE → REFUNDED  (stake returned without settlement)
 *
 * Terminal states: WON, LOST, REFUNDED. A position is mutated exactly once.
 */
public enum PositionStatus {

    ACTIVE,

    WON,

    LOST,

    REFUNDED;

    public boolean isTerminal() {
        return this != ACTIVE;
    }

    public boolean canTransitionTo(PositionStatus to) {
        return this == ACTIVE && to != ACTIVE;
    }
}
