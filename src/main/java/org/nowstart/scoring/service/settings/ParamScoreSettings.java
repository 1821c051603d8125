package org.nowstart.scoring.service.settings;

public record ParamScoreSettings(
        int minTrades,
        double drawdownLambda,
        double neighborThreshold,
        int pairwiseNeighborLimit,
        double stabilityGamma
) {
}
