package org.nowstart.scoring.service.param;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.nowstart.scoring.data.dto.BacktestCacheRecord;
import org.nowstart.scoring.data.type.ScoreAvailabilityReason;
import org.nowstart.scoring.service.param.CandidateEvaluator.CandidateEvaluation;
import org.nowstart.scoring.service.settings.ParamScoreSettings;

class CandidateEvaluatorTest {

    private static final ParamScoreSettings SETTINGS = new ParamScoreSettings(20, 3.5, 0.15, 1500, 2.0);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final CandidateEvaluator evaluator = new CandidateEvaluator(new ParameterSetParser(objectMapper));

    @Test
    void evaluate_acceptsCompleteRecord() {
        CandidateEvaluation evaluation = evaluator.evaluate(3, record().build(), SETTINGS);

        assertThat(evaluation.eligible()).isTrue();
        assertThat(evaluation.availability().eligible()).isTrue();
        assertThat(evaluation.candidate().recordIndex()).isEqualTo(3);
        assertThat(evaluation.candidate().parameters()).containsEntry("fast", 10);
        assertThat(evaluation.candidate().cagr()).isEqualTo(0.12);
    }

    @Test
    void evaluate_defaultsMissingCagrToZero() {
        CandidateEvaluation evaluation = evaluator.evaluate(0, record().cagr(null).build(), SETTINGS);

        assertThat(evaluation.candidate().cagr()).isZero();
    }

    @Test
    void evaluate_reportsMissingMetricsBeforeOtherProblems() {
        BacktestCacheRecord record = record().calmarRatio(Double.NaN).parameters(null).totalTrades(null).build();

        CandidateEvaluation evaluation = evaluator.evaluate(0, record, SETTINGS);

        assertThat(evaluation.eligible()).isFalse();
        assertThat(evaluation.availability().reasonCode()).isEqualTo(ScoreAvailabilityReason.MISSING_METRICS);
    }

    @Test
    void evaluate_rejectsMalformedParameters() {
        CandidateEvaluation evaluation = evaluator.evaluate(0, record().parameters(TextNode.valueOf("{oops")).build(), SETTINGS);

        assertThat(evaluation.availability().reasonCode()).isEqualTo(ScoreAvailabilityReason.MISSING_PARAMETERS);
    }

    @Test
    void evaluate_rejectsEmptyParameters() {
        CandidateEvaluation evaluation = evaluator.evaluate(0, record().parameters(objectMapper.createObjectNode()).build(), SETTINGS);

        assertThat(evaluation.availability().reasonCode()).isEqualTo(ScoreAvailabilityReason.MISSING_PARAMETERS);
    }

    @Test
    void evaluate_rejectsMissingTradeCount() {
        CandidateEvaluation evaluation = evaluator.evaluate(0, record().totalTrades(null).build(), SETTINGS);

        assertThat(evaluation.availability().reasonCode()).isEqualTo(ScoreAvailabilityReason.MISSING_TRADES);
    }

    @Test
    void evaluate_rejectsTooFewTradesWithCountsInReason() {
        CandidateEvaluation evaluation = evaluator.evaluate(0, record().totalTrades(19).build(), SETTINGS);

        assertThat(evaluation.availability().reasonCode()).isEqualTo(ScoreAvailabilityReason.INSUFFICIENT_TRADES);
        assertThat(evaluation.availability().reason()).isEqualTo("Requires at least 20 trades (only 19 recorded).");
    }

    @Test
    void evaluate_zeroMinTradesDisablesTradeFloor() {
        ParamScoreSettings noFloor = new ParamScoreSettings(0, 3.5, 0.15, 1500, 2.0);

        assertThat(evaluator.evaluate(0, record().totalTrades(0).build(), noFloor).eligible()).isTrue();
    }

    private BacktestCacheRecord.BacktestCacheRecordBuilder record() {
        return BacktestCacheRecord.builder()
                .id("r1")
                .templateId("t1")
                .parameters(objectMapper.valueToTree(Map.of("fast", 10)))
                .sharpeRatio(1.1)
                .calmarRatio(0.9)
                .totalReturn(0.3)
                .cagr(0.12)
                .maxDrawdownRatio(0.1)
                .totalTrades(40);
    }
}
