package org.nowstart.scoring.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.scoring.data.dto.BacktestCacheRecord;
import org.nowstart.scoring.data.dto.ParamScoreOverrides;
import org.nowstart.scoring.data.dto.ScoredParameterSet;
import org.nowstart.scoring.data.dto.TemplateRanking;
import org.nowstart.scoring.data.dto.TemplateScoreOverrides;
import org.nowstart.scoring.data.dto.TemplateScoreResults;
import org.nowstart.scoring.data.dto.TemplateScoreSnapshot;
import org.nowstart.scoring.data.dto.TemplateVerificationMetrics;
import org.nowstart.scoring.service.param.ParamScoreService;
import org.nowstart.scoring.service.template.TemplateScoreService;
import org.springframework.stereotype.Service;

/**
 * Builds the template gallery ranking: picks the best cached parameter set of every template and feeds its
 * verification metrics into the template scores.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TemplateRankingService {

    private final ParamScoreService paramScoreService;
    private final TemplateScoreService templateScoreService;

    public TemplateRanking rank(List<BacktestCacheRecord> cacheRecords, List<TemplateScoreSnapshot> snapshots) {
        return rank(cacheRecords, snapshots, ParamScoreOverrides.none(), TemplateScoreOverrides.none());
    }

    public TemplateRanking rank(
            List<BacktestCacheRecord> cacheRecords,
            List<TemplateScoreSnapshot> snapshots,
            ParamScoreOverrides paramOverrides,
            TemplateScoreOverrides templateOverrides
    ) {
        Map<String, ScoredParameterSet> bestParams = paramScoreService.bestByTemplate(cacheRecords, paramOverrides);

        Map<String, TemplateVerificationMetrics> verificationByTemplate = new LinkedHashMap<>();
        bestParams.forEach((templateId, best) -> {
            TemplateVerificationMetrics metrics = TemplateVerificationMetrics.from(best.sourceRecord());
            if (metrics != null) {
                verificationByTemplate.put(templateId, metrics);
            }
        });

        TemplateScoreResults templateScores = templateScoreService.computeScoreResults(
                snapshots,
                verificationByTemplate,
                templateOverrides
        );
        List<String> rankedTemplateIds = templateScores.rankedTemplateIds();
        log.debug(
                "event=template_ranking templates_with_params={} templates_scored={} top_template={}",
                bestParams.size(),
                rankedTemplateIds.size(),
                rankedTemplateIds.isEmpty() ? null : rankedTemplateIds.get(0)
        );

        return new TemplateRanking(
                bestParams,
                Collections.unmodifiableMap(verificationByTemplate),
                templateScores,
                rankedTemplateIds
        );
    }
}
