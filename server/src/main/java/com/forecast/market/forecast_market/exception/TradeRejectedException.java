package com.forecast.market.forecast_market.exception;

import java.util.List;

import com.forecast.market.forecast_market.risk.RiskAssessment;

/**
 * Trade blocked by one or more risk controls.
 */
public class TradeRejectedException extends MarketException {

    private final RiskAssessment assessment;

    public TradeRejectedException(String userId, RiskAssessment assessment) {
        super(ErrorKind.POLICY_REJECTION,
                String.format("Trade rejected for %s: %s", userId, String.join("; ", assessment.blocked())));
        this.assessment = assessment;
    }

    public RiskAssessment getAssessment() {
        return assessment;
    }

    public List<String> getBlockedReasons() {
        return assessment.blocked();
    }
}
