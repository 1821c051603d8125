package org.nowstart.scoring.service.param;

import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.nowstart.scoring.data.dto.BacktestCacheRecord;
import org.nowstart.scoring.data.dto.ScoreAvailability;
import org.nowstart.scoring.data.type.ScoreAvailabilityReason;
import org.nowstart.scoring.service.settings.ParamScoreSettings;
import org.springframework.stereotype.Component;

/**
 * Decides whether a cache record can be scored, independently of the other records.
 */
@Component
@RequiredArgsConstructor
public class CandidateEvaluator {

    private final ParameterSetParser parameterSetParser;

    public CandidateEvaluation evaluate(int recordIndex, BacktestCacheRecord record, ParamScoreSettings settings) {
        Double sharpe = finiteOrNull(record.sharpeRatio());
        Double calmar = finiteOrNull(record.calmarRatio());
        Double totalReturn = finiteOrNull(record.totalReturn());
        if (sharpe == null || calmar == null || totalReturn == null) {
            return CandidateEvaluation.rejected(
                    ScoreAvailabilityReason.MISSING_METRICS,
                    "Missing Sharpe, Calmar, or total return metrics."
            );
        }

        Map<String, Object> parameters = parameterSetParser.parse(record.parameters());
        if (parameters == null || parameters.isEmpty()) {
            return CandidateEvaluation.rejected(
                    ScoreAvailabilityReason.MISSING_PARAMETERS,
                    "Parameter set is empty or invalid."
            );
        }

        if (record.totalTrades() == null) {
            return CandidateEvaluation.rejected(
                    ScoreAvailabilityReason.MISSING_TRADES,
                    "Total trade count is missing."
            );
        }
        int totalTrades = Math.max(0, record.totalTrades());
        if (settings.minTrades() > 0 && totalTrades < settings.minTrades()) {
            return CandidateEvaluation.rejected(
                    ScoreAvailabilityReason.INSUFFICIENT_TRADES,
                    "Requires at least %d trades (only %d recorded).".formatted(settings.minTrades(), totalTrades)
            );
        }

        Double cagr = finiteOrNull(record.cagr());
        NormalizedCandidate candidate = new NormalizedCandidate(
                recordIndex,
                record,
                parameters,
                sharpe,
                calmar,
                totalReturn,
                cagr == null ? 0.0 : cagr,
                record.maxDrawdown(),
                record.maxDrawdownRatio(),
                record.winRate(),
                totalTrades,
                finiteOrNull(record.verifySharpeRatio()),
                finiteOrNull(record.verifyCalmarRatio()),
                finiteOrNull(record.verifyTotalReturn()),
                finiteOrNull(record.verifyCagr()),
                finiteOrNull(record.verifyMaxDrawdownRatio())
        );
        return new CandidateEvaluation(candidate, ScoreAvailability.eligibleRecord());
    }

    private Double finiteOrNull(Double value) {
        return value != null && Double.isFinite(value) ? value : null;
    }

    public record CandidateEvaluation(
            NormalizedCandidate candidate,
            ScoreAvailability availability
    ) {

        static CandidateEvaluation rejected(ScoreAvailabilityReason reasonCode, String reason) {
            return new CandidateEvaluation(null, ScoreAvailability.ineligible(reasonCode, reason));
        }

        public boolean eligible() {
            return candidate != null;
        }
    }
}
