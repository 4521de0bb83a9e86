package com.forecast.market.forecast_market.exception;

/**
 * How a caller should react to a failed market operation.
 */
public enum ErrorKind {
    /** Bad input. Nothing was mutated; surface the message verbatim. */
    VALIDATION,
    /** Blocked by a risk control. Carries the violated policies. */
    POLICY_REJECTION,
    /** The market is not in a state that allows the operation. */
    STATE_CONFLICT,
    /** Internal invariant broken. Fatal to the operation. */
    CONSISTENCY_VIOLATION
}
