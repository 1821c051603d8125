package org.nowstart.scoring.service.template;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.scoring.data.dto.StrategyPerformance;
import org.nowstart.scoring.data.dto.TemplateScoreBreakdown;
import org.nowstart.scoring.data.dto.TemplateScoreBreakdown.ComponentAverages;
import org.nowstart.scoring.data.dto.TemplateScoreBreakdown.WeightSummary;
import org.nowstart.scoring.data.dto.TemplateScoreOverrides;
import org.nowstart.scoring.data.dto.TemplateScorePeriodBreakdown;
import org.nowstart.scoring.data.dto.TemplateScoreResults;
import org.nowstart.scoring.data.dto.TemplateScoreSnapshot;
import org.nowstart.scoring.data.dto.TemplateVerificationMetrics;
import org.nowstart.scoring.data.type.BacktestScope;
import org.nowstart.scoring.service.settings.ScoreSettingsResolver;
import org.nowstart.scoring.service.settings.TemplateScoreSettings;
import org.springframework.stereotype.Service;

/**
 * Scores templates from the training/validation backtests of their strategies.
 *
 * <p>Each strategy's score is the length- and recency-weighted mean of its period scores; a template takes the
 * score of its best strategy. Templates with verification metrics then have that score scaled by the
 * verification multiplier.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TemplateScoreService {

    private final ScoreSettingsResolver scoreSettingsResolver;
    private final TemplatePeriodScorer templatePeriodScorer;
    private final VerificationMultiplierCalculator verificationMultiplierCalculator;
    private final Clock clock;

    public Map<String, Double> computeScores(
            List<TemplateScoreSnapshot> snapshots,
            Map<String, TemplateVerificationMetrics> verificationByTemplate,
            TemplateScoreOverrides overrides
    ) {
        return computeScoreResults(snapshots, verificationByTemplate, overrides).scores();
    }

    public TemplateScoreResults computeScoreResults(List<TemplateScoreSnapshot> snapshots) {
        return computeScoreResults(snapshots, Map.of(), TemplateScoreOverrides.none());
    }

    public TemplateScoreResults computeScoreResults(
            List<TemplateScoreSnapshot> snapshots,
            Map<String, TemplateVerificationMetrics> verificationByTemplate,
            TemplateScoreOverrides overrides
    ) {
        requireSnapshots(snapshots);
        TemplateScoreSettings settings = scoreSettingsResolver.resolveTemplateScoreSettings(overrides);
        Instant now = clock.instant();

        Map<String, StrategyPeriods> strategies = groupByStrategy(snapshots);
        Map<String, Double> scores = new LinkedHashMap<>();
        Map<String, TemplateScoreBreakdown> breakdowns = new LinkedHashMap<>();
        int strategiesScored = 0;

        for (Map.Entry<String, StrategyPeriods> entry : strategies.entrySet()) {
            String strategyId = entry.getKey();
            StrategyPeriods strategy = entry.getValue();
            List<TemplateScorePeriodBreakdown> periods = scorePeriods(strategy, now, settings);
            if (periods.isEmpty()) {
                continue;
            }
            double totalWeight = periods.stream().mapToDouble(TemplateScorePeriodBreakdown::weight).sum();
            if (!Double.isFinite(totalWeight) || totalWeight <= 0) {
                continue;
            }
            strategiesScored++;
            double baseScore01 = TemplatePeriodScorer.clamp01(
                    weightedAverage(periods, totalWeight, TemplateScorePeriodBreakdown::periodScore01));

            Double existing = scores.get(strategy.templateId());
            if (existing == null || baseScore01 > existing) {
                scores.put(strategy.templateId(), baseScore01);
                breakdowns.put(strategy.templateId(), buildBreakdown(strategy.templateId(), strategyId, baseScore01, periods, totalWeight));
            }
        }

        int verifiedTemplates = 0;
        if (verificationByTemplate != null && !verificationByTemplate.isEmpty()) {
            for (Map.Entry<String, Double> entry : scores.entrySet()) {
                Double multiplier = verificationMultiplierCalculator.compute(verificationByTemplate.get(entry.getKey()), settings);
                if (multiplier == null) {
                    continue;
                }
                double finalScore01 = TemplatePeriodScorer.clamp01(entry.getValue() * multiplier);
                entry.setValue(finalScore01);
                breakdowns.computeIfPresent(entry.getKey(), (templateId, breakdown) -> breakdown.withVerification(multiplier, finalScore01));
                verifiedTemplates++;
            }
        }

        log.info(
                "event=template_score snapshots={} strategies={} strategies_scored={} templates_scored={} verified_templates={}",
                snapshots.size(),
                strategies.size(),
                strategiesScored,
                scores.size(),
                verifiedTemplates
        );

        return new TemplateScoreResults(
                Collections.unmodifiableMap(scores),
                Collections.unmodifiableMap(breakdowns)
        );
    }

    private Map<String, StrategyPeriods> groupByStrategy(List<TemplateScoreSnapshot> snapshots) {
        Map<String, StrategyPeriods> strategies = new LinkedHashMap<>();
        for (TemplateScoreSnapshot snapshot : snapshots) {
            if (snapshot.performance() == null || snapshot.periodMonths() <= 0) {
                continue;
            }
            StrategyPeriods strategy = strategies.computeIfAbsent(
                    snapshot.strategyId(),
                    key -> new StrategyPeriods(snapshot.templateId(), new LinkedHashMap<>())
            );
            PeriodPair pair = strategy.periods().computeIfAbsent(snapshot.periodMonths(), key -> new PeriodPair());
            if (snapshot.scope() == BacktestScope.VALIDATION) {
                pair.validation = snapshot;
            } else {
                pair.training = snapshot;
            }
            if ((pair.periodDays == null || pair.periodDays == 0) && snapshot.periodDays() != null && snapshot.periodDays() != 0) {
                pair.periodDays = snapshot.periodDays();
            }
        }
        return strategies;
    }

    private List<TemplateScorePeriodBreakdown> scorePeriods(StrategyPeriods strategy, Instant now, TemplateScoreSettings settings) {
        List<TemplateScorePeriodBreakdown> periods = new ArrayList<>();
        strategy.periods().forEach((periodMonths, pair) -> {
            if (pair.training == null || pair.validation == null) {
                return;
            }
            StrategyPerformance training = pair.training.performance();
            StrategyPerformance validation = pair.validation.performance();
            templatePeriodScorer.score(
                    periodMonths,
                    pair.periodDays,
                    training,
                    validation,
                    pair.validation.createdAt(),
                    now,
                    settings
            ).ifPresent(periods::add);
        });
        return periods;
    }

    private TemplateScoreBreakdown buildBreakdown(
            String templateId,
            String strategyId,
            double baseScore01,
            List<TemplateScorePeriodBreakdown> periods,
            double totalWeight
    ) {
        ComponentAverages componentAverages = new ComponentAverages(
                weightedAverage(periods, totalWeight, TemplateScorePeriodBreakdown::returnScore),
                weightedAverage(periods, totalWeight, TemplateScorePeriodBreakdown::consistencyScore),
                weightedAverage(periods, totalWeight, TemplateScorePeriodBreakdown::riskScore),
                weightedAverage(periods, totalWeight, TemplateScorePeriodBreakdown::liquidityScore)
        );
        WeightSummary weights = new WeightSummary(
                totalWeight,
                periods.size(),
                weightedAverage(periods, totalWeight, TemplateScorePeriodBreakdown::lengthWeight),
                weightedAverage(periods, totalWeight, TemplateScorePeriodBreakdown::recencyWeight)
        );
        int score100 = TemplateScoreBreakdown.toScore100(baseScore01);
        return new TemplateScoreBreakdown(
                templateId,
                strategyId,
                baseScore01,
                baseScore01,
                score100,
                score100,
                componentAverages,
                weights,
                periods,
                null
        );
    }

    private double weightedAverage(
            List<TemplateScorePeriodBreakdown> periods,
            double totalWeight,
            ToDoubleFunction<TemplateScorePeriodBreakdown> selector
    ) {
        double sum = 0.0;
        for (TemplateScorePeriodBreakdown period : periods) {
            sum += selector.applyAsDouble(period) * period.weight();
        }
        return sum / totalWeight;
    }

    private void requireSnapshots(List<TemplateScoreSnapshot> snapshots) {
        if (snapshots == null) {
            throw new IllegalArgumentException("snapshots is required");
        }
        for (TemplateScoreSnapshot snapshot : snapshots) {
            if (snapshot == null) {
                throw new IllegalArgumentException("snapshots must not contain null entries");
            }
            if (snapshot.templateId() == null || snapshot.templateId().isBlank()) {
                throw new IllegalArgumentException("snapshot templateId is required");
            }
            if (snapshot.strategyId() == null || snapshot.strategyId().isBlank()) {
                throw new IllegalArgumentException("snapshot strategyId is required");
            }
        }
    }

    private record StrategyPeriods(
            String templateId,
            Map<Integer, PeriodPair> periods
    ) {
    }

    private static final class PeriodPair {

        private Integer periodDays;
        private TemplateScoreSnapshot training;
        private TemplateScoreSnapshot validation;
    }
}
