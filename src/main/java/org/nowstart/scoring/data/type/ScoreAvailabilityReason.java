package org.nowstart.scoring.data.type;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why a cached backtest record was left out of parameter scoring.
 */
public enum ScoreAvailabilityReason {
    MISSING_METRICS("missing_metrics"),
    MISSING_PARAMETERS("missing_parameters"),
    MISSING_TRADES("missing_trades"),
    INSUFFICIENT_TRADES("insufficient_trades");

    private final String code;

    ScoreAvailabilityReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
