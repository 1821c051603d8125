package org.nowstart.scoring.data.dto;

import java.util.Map;

/**
 * A ranked parameter set.
 *
 * @param recordIndex    position of the source record in the scored input list
 * @param sourceRecord   the input record itself, for fields the scorer does not read
 * @param parameters     parsed parameter mapping
 * @param coreScore      percentile-based quality in (0, 1]
 * @param ddPenalty      drawdown survival multiplier in (0, 1]
 * @param stabilityScore normalized neighbor quality in [0, 1]
 * @param finalScore     {@code coreScore * ddPenalty * stabilityScore^gamma}
 */
public record ScoredParameterSet(
        int recordIndex,
        BacktestCacheRecord sourceRecord,
        Map<String, Object> parameters,
        double sharpeRatio,
        double calmarRatio,
        double totalReturn,
        double cagr,
        Double maxDrawdown,
        Double maxDrawdownRatio,
        Double winRate,
        int totalTrades,
        double coreScore,
        double ddPenalty,
        double stabilityScore,
        double finalScore
) {

    public int finalScore100() {
        double bounded = Double.isFinite(finalScore) ? Math.min(Math.max(finalScore, 0.0), 1.0) : 0.0;
        return (int) Math.round(bounded * 100.0);
    }
}
