package org.nowstart.scoring.data.dto;

import java.time.Instant;

public record TemplateScorePeriodBreakdown(
        int periodMonths,
        Integer periodDays,
        Instant createdAt,
        double trainingCagr,
        double validationCagr,
        double validationDrawdown,
        double tradesPerYear,
        double returnScore,
        double consistencyScore,
        double riskScore,
        double liquidityScore,
        double periodScore01,
        double lengthWeight,
        double recencyWeight,
        double weight
) {
}
