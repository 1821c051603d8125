package org.nowstart.scoring.data.dto;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Outcome of scoring the cached backtests of one template.
 *
 * <p>Every input record gets an availability verdict keyed by its index in {@link #records()}; records
 * with a non-blank id are also keyed by id.
 */
public record ParamScoreSummary(
        List<BacktestCacheRecord> records,
        List<ScoredParameterSet> scored,
        Map<Integer, ScoreAvailability> availabilityByIndex,
        Map<String, ScoreAvailability> availabilityById
) {

    public static ParamScoreSummary empty() {
        return new ParamScoreSummary(List.of(), List.of(), Map.of(), Map.of());
    }

    public Optional<ScoredParameterSet> best() {
        return scored.isEmpty() ? Optional.empty() : Optional.of(scored.get(0));
    }

    public Optional<ScoreAvailability> availabilityOf(int recordIndex) {
        return Optional.ofNullable(availabilityByIndex.get(recordIndex));
    }

    public Optional<ScoreAvailability> availabilityOf(String recordId) {
        return recordId == null ? Optional.empty() : Optional.ofNullable(availabilityById.get(recordId));
    }

    /**
     * Scored records in rank order followed by the excluded ones in input order.
     */
    public List<BacktestCacheRecord> orderedRecords() {
        List<BacktestCacheRecord> ordered = new ArrayList<>(records.size());
        Set<Integer> scoredIndexes = new HashSet<>();
        for (ScoredParameterSet item : scored) {
            ordered.add(item.sourceRecord());
            scoredIndexes.add(item.recordIndex());
        }
        for (int i = 0; i < records.size(); i++) {
            if (!scoredIndexes.contains(i)) {
                ordered.add(records.get(i));
            }
        }
        return List.copyOf(ordered);
    }
}
