package org.nowstart.scoring.data.dto;

import java.util.List;

/**
 * Detail behind one template score: the best-scoring strategy of the template and its weighted periods.
 *
 * @param verificationMultiplier out-of-sample multiplier applied to the base score, {@code null} when
 *                               the template had no verification metrics
 */
public record TemplateScoreBreakdown(
        String templateId,
        String strategyId,
        double baseScore01,
        double finalScore01,
        int baseScore100,
        int finalScore100,
        ComponentAverages componentAverages,
        WeightSummary weights,
        List<TemplateScorePeriodBreakdown> periods,
        Double verificationMultiplier
) {

    public TemplateScoreBreakdown {
        periods = periods == null ? List.of() : List.copyOf(periods);
    }

    public TemplateScoreBreakdown withVerification(double multiplier, double verifiedScore01) {
        return new TemplateScoreBreakdown(
                templateId,
                strategyId,
                baseScore01,
                verifiedScore01,
                baseScore100,
                toScore100(verifiedScore01),
                componentAverages,
                weights,
                periods,
                multiplier
        );
    }

    public static int toScore100(double score01) {
        double bounded = Double.isFinite(score01) ? Math.min(Math.max(score01, 0.0), 1.0) : 0.0;
        return (int) Math.round(bounded * 100.0);
    }

    public record ComponentAverages(
            double returnScore,
            double consistencyScore,
            double riskScore,
            double liquidityScore
    ) {
    }

    public record WeightSummary(
            double totalWeight,
            int periodCount,
            double lengthWeightAvg,
            double recencyWeightAvg
    ) {
    }
}
