package org.nowstart.scoring.service.template;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.nowstart.scoring.data.dto.StrategyPerformance;
import org.nowstart.scoring.data.dto.TemplateScorePeriodBreakdown;
import org.nowstart.scoring.service.settings.TemplateScoreSettings;
import org.springframework.stereotype.Component;

/**
 * Scores one training/validation period pair of a strategy.
 *
 * <p>{@code periodScore = return * consistency * risk * liquidity * negativePenalty}, clamped to [0, 1]. A
 * negative validation CAGR already zeroes the return score and is additionally damped by the negative
 * penalty, so losing periods stay at the bottom even when other components are high.
 */
@Component
public class TemplatePeriodScorer {

    private static final double MIN_SCALE = 1e-6;
    private static final double DAYS_PER_YEAR = 365.25;
    private static final double RECENCY_FLOOR = 0.6;
    private static final double RECENCY_SPAN = 0.4;

    public Optional<TemplateScorePeriodBreakdown> score(
            int periodMonths,
            Integer periodDays,
            StrategyPerformance training,
            StrategyPerformance validation,
            Instant validationCreatedAt,
            Instant now,
            TemplateScoreSettings settings
    ) {
        Double trainingCagr = finiteOrNull(training.cagr());
        Double validationCagr = finiteOrNull(validation.cagr());
        if (trainingCagr == null || validationCagr == null) {
            return Optional.empty();
        }
        Double drawdownPercent = finiteOrNull(validation.maxDrawdownPercent());
        if (drawdownPercent == null) {
            return Optional.empty();
        }
        double validationDrawdown = drawdownPercent / 100.0;
        Double tradesPerYear = validation.totalTrades() == null
                ? null
                : tradesPerYear(validation.totalTrades(), periodMonths, periodDays);
        if (tradesPerYear == null) {
            return Optional.empty();
        }

        double returnScore = scoreReturn(validationCagr, settings);
        double consistencyScore = scoreConsistency(trainingCagr, validationCagr);
        double riskScore = scoreRisk(validationDrawdown, settings);
        double liquidityScore = scoreLiquidity(tradesPerYear, settings);
        double periodScore = returnScore * consistencyScore * riskScore * liquidityScore
                * negativeValidationPenalty(validationCagr, settings);
        if (!Double.isFinite(periodScore)) {
            return Optional.empty();
        }

        double lengthWeight = Math.sqrt(Math.max(1, periodMonths));
        double recencyWeight = recencyWeight(validationCreatedAt, now, settings);
        return Optional.of(new TemplateScorePeriodBreakdown(
                periodMonths,
                periodDays,
                validationCreatedAt,
                trainingCagr,
                validationCagr,
                validationDrawdown,
                tradesPerYear,
                returnScore,
                consistencyScore,
                riskScore,
                liquidityScore,
                clamp01(periodScore),
                lengthWeight,
                recencyWeight,
                lengthWeight * recencyWeight
        ));
    }

    double scoreReturn(double validationCagr, TemplateScoreSettings settings) {
        if (!Double.isFinite(validationCagr) || validationCagr < 0) {
            return 0.0;
        }
        return 1.0 - Math.exp(-validationCagr / Math.max(settings.returnScale(), MIN_SCALE));
    }

    /**
     * Penalizes validation falling short of training, never the reverse.
     */
    double scoreConsistency(double trainingCagr, double validationCagr) {
        double denominator = Math.abs(trainingCagr) + Math.abs(validationCagr);
        if (denominator <= MIN_SCALE) {
            return 1.0;
        }
        double shortfall = Math.max(0.0, trainingCagr - validationCagr);
        return clamp01(1.0 - clamp01(shortfall / denominator));
    }

    double scoreRisk(double validationDrawdown, TemplateScoreSettings settings) {
        return Math.exp(-settings.drawdownLambda() * Math.max(0.0, validationDrawdown));
    }

    double scoreLiquidity(double tradesPerYear, TemplateScoreSettings settings) {
        double target = Math.max(MIN_SCALE, settings.tradeTarget());
        double confidence = 1.0 - Math.exp(-tradesPerYear / target);
        return (1.0 - settings.tradeWeight()) + settings.tradeWeight() * confidence;
    }

    double negativeValidationPenalty(double validationCagr, TemplateScoreSettings settings) {
        if (!Double.isFinite(validationCagr) || validationCagr >= 0) {
            return 1.0;
        }
        return Math.exp(-settings.validationNegativePenaltyStrength() * Math.abs(validationCagr));
    }

    Double tradesPerYear(int totalTrades, int periodMonths, Integer periodDays) {
        if (totalTrades <= 0) {
            return null;
        }
        double years;
        if (periodMonths > 0) {
            years = periodMonths / 12.0;
        } else if (periodDays != null && periodDays > 0) {
            years = periodDays / DAYS_PER_YEAR;
        } else {
            return null;
        }
        return totalTrades / years;
    }

    /**
     * {@code 0.6 + 0.4 * 2^(-ageDays / halfLife)}; an unknown timestamp counts as fresh.
     */
    double recencyWeight(Instant createdAt, Instant now, TemplateScoreSettings settings) {
        if (createdAt == null || now == null) {
            return 1.0;
        }
        double ageDays = Math.max(0.0, Duration.between(createdAt, now).toMillis() / (double) Duration.ofDays(1).toMillis());
        double halfLifeDays = Math.max(MIN_SCALE, settings.recencyHalfLifeDays());
        double decay = Math.exp(-Math.log(2) * ageDays / halfLifeDays);
        return RECENCY_FLOOR + RECENCY_SPAN * decay;
    }

    static double clamp01(double value) {
        if (!Double.isFinite(value)) {
            return 0.0;
        }
        return Math.min(Math.max(value, 0.0), 1.0);
    }

    private Double finiteOrNull(Double value) {
        return value != null && Double.isFinite(value) ? value : null;
    }
}
