package org.nowstart.scoring.service.param;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.IntStream;
import org.springframework.stereotype.Component;

/**
 * Scores how well the parameter-space neighborhood of each candidate performs.
 *
 * <p>A candidate's stability is the mean quality of the other candidates within the neighbor threshold,
 * min-max normalized against the whole population. A candidate without neighbors scores 0; when every
 * candidate has the same quality, any candidate with a neighbor scores 1.
 */
@Component
public class StabilityScorer {

    private static final double QUALITY_RANGE_EPSILON = 1e-12;

    public StabilityResult score(
            List<Map<String, Object>> parameterSets,
            double[] quality,
            double neighborThreshold,
            int pairwiseNeighborLimit
    ) {
        ParameterSpace space = ParameterSpace.of(parameterSets);
        QualityRange range = QualityRange.of(quality);
        int n = parameterSets.size();
        double[] scores = new double[n];

        if (n <= pairwiseNeighborLimit) {
            for (int i = 0; i < n; i++) {
                scores[i] = neighborhoodScore(i, allIndexes(n), parameterSets, quality, space, neighborThreshold, range);
            }
            return new StabilityResult(scores, NeighborSearchMode.PAIRWISE);
        }

        double step = Math.max(neighborThreshold, 0.01);
        Map<String, List<Integer>> buckets = new HashMap<>();
        List<Set<String>> candidateKeys = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            Set<String> keys = space.bucketKeys(parameterSets.get(i), step);
            candidateKeys.add(keys);
            for (String key : keys) {
                buckets.computeIfAbsent(key, ignored -> new ArrayList<>()).add(i);
            }
        }

        for (int i = 0; i < n; i++) {
            Set<Integer> nearby = new LinkedHashSet<>();
            for (String key : candidateKeys.get(i)) {
                nearby.addAll(buckets.getOrDefault(key, List.of()));
            }
            scores[i] = neighborhoodScore(i, nearby, parameterSets, quality, space, neighborThreshold, range);
        }
        return new StabilityResult(scores, NeighborSearchMode.BUCKETED);
    }

    private double neighborhoodScore(
            int index,
            Iterable<Integer> candidates,
            List<Map<String, Object>> parameterSets,
            double[] quality,
            ParameterSpace space,
            double threshold,
            QualityRange range
    ) {
        int neighborCount = 0;
        double neighborQualitySum = 0.0;
        Map<String, Object> self = parameterSets.get(index);
        for (int other : candidates) {
            if (other == index) {
                continue;
            }
            if (space.distance(self, parameterSets.get(other)) <= threshold) {
                neighborCount++;
                neighborQualitySum += quality[other];
            }
        }
        if (neighborCount == 0) {
            return 0.0;
        }
        double neighborMean = neighborQualitySum / neighborCount;
        double normalized = range.hasSpread() ? (neighborMean - range.min()) / range.width() : 1.0;
        return clamp01(normalized);
    }

    private Iterable<Integer> allIndexes(int n) {
        return () -> IntStream.range(0, n).iterator();
    }

    static double clamp01(double value) {
        if (!Double.isFinite(value)) {
            return 0.0;
        }
        return Math.min(Math.max(value, 0.0), 1.0);
    }

    public record StabilityResult(
            double[] scores,
            NeighborSearchMode mode
    ) {
    }

    private record QualityRange(double min, double max) {

        static QualityRange of(double[] quality) {
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (double value : quality) {
                if (!Double.isFinite(value)) {
                    continue;
                }
                min = Math.min(min, value);
                max = Math.max(max, value);
            }
            if (!Double.isFinite(min) || !Double.isFinite(max)) {
                return new QualityRange(0.0, 0.0);
            }
            return new QualityRange(min, max);
        }

        double width() {
            return max - min;
        }

        boolean hasSpread() {
            return width() > QUALITY_RANGE_EPSILON;
        }
    }
}
