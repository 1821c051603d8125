package org.nowstart.scoring.data.dto;

import java.util.List;
import java.util.Map;

/**
 * Gallery view of templates: best cached parameters per template plus the template scores those
 * parameters' verification runs adjust.
 */
public record TemplateRanking(
        Map<String, ScoredParameterSet> bestParamsByTemplate,
        Map<String, TemplateVerificationMetrics> verificationByTemplate,
        TemplateScoreResults templateScores,
        List<String> rankedTemplateIds
) {
}
