package org.nowstart.scoring.data.dto;

import lombok.Builder;

/**
 * Caller-supplied template scoring overrides; {@code null} fields keep the stored or default value.
 */
@Builder
public record TemplateScoreOverrides(
        Double returnScale,
        Double validationNegativePenaltyStrength,
        Double drawdownLambda,
        Double tradeTarget,
        Double tradeWeight,
        Double recencyHalfLifeDays,
        Double verifySharpeScale,
        Double verifyCalmarScale,
        Double verifyCagrScale,
        Double verifyCagrNegScale,
        Double verifyDrawdownLambda,
        Double verifyMinMultiplier,
        Double verifyMaxMultiplier
) {

    public static TemplateScoreOverrides none() {
        return TemplateScoreOverrides.builder().build();
    }
}
