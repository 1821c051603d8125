package org.nowstart.scoring.data.dto;

import lombok.Builder;

/**
 * Caller-supplied parameter scoring overrides; {@code null} fields keep the stored or default value.
 */
@Builder
public record ParamScoreOverrides(
        Double minTrades,
        Double drawdownLambda,
        Double neighborThreshold,
        Double pairwiseNeighborLimit,
        Double stabilityGamma
) {

    public static ParamScoreOverrides none() {
        return new ParamScoreOverrides(null, null, null, null, null);
    }
}
