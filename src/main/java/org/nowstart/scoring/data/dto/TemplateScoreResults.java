package org.nowstart.scoring.data.dto;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public record TemplateScoreResults(
        Map<String, Double> scores,
        Map<String, TemplateScoreBreakdown> breakdowns
) {

    public Optional<TemplateScoreBreakdown> breakdownOf(String templateId) {
        return Optional.ofNullable(breakdowns.get(templateId));
    }

    /**
     * Template ids by descending final score, ties broken by id.
     */
    public List<String> rankedTemplateIds() {
        return scores.entrySet().stream()
                .sorted(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .map(Map.Entry::getKey)
                .toList();
    }
}
