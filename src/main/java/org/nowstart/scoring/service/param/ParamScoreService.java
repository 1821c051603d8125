package org.nowstart.scoring.service.param;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.ToDoubleFunction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.scoring.data.dto.BacktestCacheRecord;
import org.nowstart.scoring.data.dto.ParamScoreOverrides;
import org.nowstart.scoring.data.dto.ParamScoreSummary;
import org.nowstart.scoring.data.dto.ScoreAvailability;
import org.nowstart.scoring.data.dto.ScoredParameterSet;
import org.nowstart.scoring.service.param.CandidateEvaluator.CandidateEvaluation;
import org.nowstart.scoring.service.param.StabilityScorer.StabilityResult;
import org.nowstart.scoring.service.settings.ParamScoreSettings;
import org.nowstart.scoring.service.settings.ScoreSettingsResolver;
import org.springframework.stereotype.Service;

/**
 * Ranks the cached parameter sets of one template.
 *
 * <p>{@code finalScore = coreScore * ddPenalty * stabilityScore^gamma} where
 * <ul>
 *   <li>{@code coreScore} is the geometric mean of the Sharpe, Calmar and total-return percentiles, blended
 *   with the same mean over the verify percentiles when all three are present</li>
 *   <li>{@code ddPenalty} is {@code exp(-lambda * maxDrawdownRatio)}, blended with the verify drawdown</li>
 *   <li>{@code stabilityScore} rates the parameter-space neighborhood, see {@link StabilityScorer}</li>
 * </ul>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ParamScoreService {

    static final double CORE_SCORE_EPSILON = 1e-9;

    private final ScoreSettingsResolver scoreSettingsResolver;
    private final CandidateEvaluator candidateEvaluator;
    private final StabilityScorer stabilityScorer;

    public ParamScoreSummary score(List<BacktestCacheRecord> records) {
        return score(records, ParamScoreOverrides.none());
    }

    public ParamScoreSummary score(List<BacktestCacheRecord> records, ParamScoreOverrides overrides) {
        requireRecords(records);
        return scoreWithSettings(records, scoreSettingsResolver.resolveParamScoreSettings(overrides));
    }

    public Map<String, ScoredParameterSet> bestByTemplate(List<BacktestCacheRecord> records) {
        return bestByTemplate(records, ParamScoreOverrides.none());
    }

    /**
     * Scores the records of every template separately and keeps each template's top-ranked parameter set.
     * Records without a template id are skipped; templates with no eligible record are absent.
     */
    public Map<String, ScoredParameterSet> bestByTemplate(
            List<BacktestCacheRecord> records,
            ParamScoreOverrides overrides
    ) {
        requireRecords(records);
        ParamScoreSettings settings = scoreSettingsResolver.resolveParamScoreSettings(overrides);
        Map<String, List<BacktestCacheRecord>> recordsByTemplate = new LinkedHashMap<>();
        for (BacktestCacheRecord record : records) {
            if (record.templateId() == null || record.templateId().isBlank()) {
                continue;
            }
            recordsByTemplate.computeIfAbsent(record.templateId(), key -> new ArrayList<>()).add(record);
        }

        Map<String, ScoredParameterSet> best = new LinkedHashMap<>();
        recordsByTemplate.forEach((templateId, templateRecords) ->
                scoreWithSettings(templateRecords, settings).best().ifPresent(item -> best.put(templateId, item)));
        return Collections.unmodifiableMap(best);
    }

    public ParamScoreSummary scoreWithSettings(List<BacktestCacheRecord> records, ParamScoreSettings settings) {
        requireRecords(records);
        if (records.isEmpty()) {
            return ParamScoreSummary.empty();
        }

        Map<Integer, ScoreAvailability> availabilityByIndex = new LinkedHashMap<>();
        Map<String, ScoreAvailability> availabilityById = new LinkedHashMap<>();
        List<NormalizedCandidate> candidates = new ArrayList<>();
        for (int i = 0; i < records.size(); i++) {
            BacktestCacheRecord record = records.get(i);
            CandidateEvaluation evaluation = candidateEvaluator.evaluate(i, record, settings);
            availabilityByIndex.put(i, evaluation.availability());
            if (record.id() != null && !record.id().isBlank()) {
                availabilityById.put(record.id(), evaluation.availability());
            }
            if (evaluation.eligible()) {
                candidates.add(evaluation.candidate());
            } else {
                log.debug(
                        "event=param_score_excluded record_index={} record_id={} reason={}",
                        i,
                        record.id(),
                        evaluation.availability().reasonCode().code()
                );
            }
        }

        RankedCandidates ranked = candidates.isEmpty()
                ? new RankedCandidates(List.of(), null)
                : rank(candidates, settings);

        log.info(
                "event=param_score records={} eligible={} excluded={} neighbor_mode={} best_final_score={}",
                records.size(),
                candidates.size(),
                records.size() - candidates.size(),
                ranked.mode() == null ? "none" : ranked.mode().code(),
                ranked.scored().isEmpty() ? 0.0 : ranked.scored().get(0).finalScore()
        );

        return new ParamScoreSummary(
                List.copyOf(records),
                ranked.scored(),
                Collections.unmodifiableMap(availabilityByIndex),
                Collections.unmodifiableMap(availabilityById)
        );
    }

    private RankedCandidates rank(List<NormalizedCandidate> candidates, ParamScoreSettings settings) {
        int n = candidates.size();
        double[] sharpePercentiles = PercentileRanker.rank(metric(candidates, NormalizedCandidate::sharpeRatio));
        double[] calmarPercentiles = PercentileRanker.rank(metric(candidates, NormalizedCandidate::calmarRatio));
        double[] returnPercentiles = PercentileRanker.rank(metric(candidates, NormalizedCandidate::totalReturn));
        Double[] verifySharpePercentiles = PercentileRanker.rankPresent(
                optionalMetric(candidates, NormalizedCandidate::verifySharpeRatio));
        Double[] verifyCalmarPercentiles = PercentileRanker.rankPresent(
                optionalMetric(candidates, NormalizedCandidate::verifyCalmarRatio));
        Double[] verifyReturnPercentiles = PercentileRanker.rankPresent(
                optionalMetric(candidates, NormalizedCandidate::verifyReturnLike));

        double[] coreScores = new double[n];
        double[] ddPenalties = new double[n];
        double[] quality = new double[n];
        List<Map<String, Object>> parameterSets = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            NormalizedCandidate candidate = candidates.get(i);
            double coreScore = geometricMean(sharpePercentiles[i], calmarPercentiles[i], returnPercentiles[i]);
            if (verifySharpePercentiles[i] != null && verifyCalmarPercentiles[i] != null && verifyReturnPercentiles[i] != null) {
                double coreVerify = geometricMean(verifySharpePercentiles[i], verifyCalmarPercentiles[i], verifyReturnPercentiles[i]);
                coreScore = Math.sqrt(coreScore * coreVerify);
            }

            double ddPenalty = drawdownPenalty(candidate.maxDrawdownRatio(), settings.drawdownLambda());
            if (candidate.verifyMaxDrawdownRatio() != null) {
                double ddPenaltyVerify = drawdownPenalty(candidate.verifyMaxDrawdownRatio(), settings.drawdownLambda());
                ddPenalty = Math.sqrt(ddPenalty * ddPenaltyVerify);
            }

            coreScores[i] = coreScore;
            ddPenalties[i] = ddPenalty;
            quality[i] = coreScore * ddPenalty;
            parameterSets.add(candidate.parameters());
        }

        StabilityResult stability = stabilityScorer.score(
                parameterSets,
                quality,
                settings.neighborThreshold(),
                settings.pairwiseNeighborLimit()
        );

        List<ScoredParameterSet> scored = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            NormalizedCandidate candidate = candidates.get(i);
            double stabilityScore = StabilityScorer.clamp01(stability.scores()[i]);
            double finalScore = coreScores[i] * ddPenalties[i] * Math.pow(stabilityScore, settings.stabilityGamma());
            scored.add(new ScoredParameterSet(
                    candidate.recordIndex(),
                    candidate.sourceRecord(),
                    candidate.parameters(),
                    candidate.sharpeRatio(),
                    candidate.calmarRatio(),
                    candidate.totalReturn(),
                    candidate.cagr(),
                    candidate.maxDrawdown(),
                    candidate.maxDrawdownRatio(),
                    candidate.winRate(),
                    candidate.totalTrades(),
                    coreScores[i],
                    ddPenalties[i],
                    stabilityScore,
                    finalScore
            ));
        }
        scored.sort(Comparator.comparingDouble(ScoredParameterSet::finalScore).reversed());
        return new RankedCandidates(List.copyOf(scored), stability.mode());
    }

    private double geometricMean(double sharpe, double calmar, double totalReturn) {
        return Math.cbrt((sharpe + CORE_SCORE_EPSILON) * (calmar + CORE_SCORE_EPSILON) * (totalReturn + CORE_SCORE_EPSILON));
    }

    private double drawdownPenalty(Double drawdownRatio, double lambda) {
        double ratio = drawdownRatio != null && Double.isFinite(drawdownRatio) ? Math.max(0.0, drawdownRatio) : 0.0;
        return Math.exp(-lambda * ratio);
    }

    private double[] metric(List<NormalizedCandidate> candidates, ToDoubleFunction<NormalizedCandidate> getter) {
        return candidates.stream().mapToDouble(getter).toArray();
    }

    private Double[] optionalMetric(List<NormalizedCandidate> candidates, Function<NormalizedCandidate, Double> getter) {
        return candidates.stream().map(getter).toArray(Double[]::new);
    }

    private void requireRecords(List<BacktestCacheRecord> records) {
        if (records == null) {
            throw new IllegalArgumentException("records is required");
        }
        for (BacktestCacheRecord record : records) {
            if (record == null) {
                throw new IllegalArgumentException("records must not contain null entries");
            }
        }
    }

    private record RankedCandidates(
            List<ScoredParameterSet> scored,
            NeighborSearchMode mode
    ) {
    }
}
