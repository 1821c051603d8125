package org.nowstart.scoring.service.settings;

public record TemplateScoreSettings(
        double returnScale,
        double validationNegativePenaltyStrength,
        double drawdownLambda,
        double tradeTarget,
        double tradeWeight,
        double recencyHalfLifeDays,
        double verifySharpeScale,
        double verifyCalmarScale,
        double verifyCagrScale,
        double verifyCagrNegScale,
        double verifyDrawdownLambda,
        double verifyMinMultiplier,
        double verifyMaxMultiplier
) {
}
