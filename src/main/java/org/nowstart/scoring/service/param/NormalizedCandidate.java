package org.nowstart.scoring.service.param;

import java.util.Map;
import org.nowstart.scoring.data.dto.BacktestCacheRecord;

/**
 * An eligible cache record with parsed parameters and finite core metrics.
 */
public record NormalizedCandidate(
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
        Double verifySharpeRatio,
        Double verifyCalmarRatio,
        Double verifyTotalReturn,
        Double verifyCagr,
        Double verifyMaxDrawdownRatio
) {

    /**
     * Verify total return, or verify CAGR when the re-run stored no total return.
     */
    public Double verifyReturnLike() {
        return verifyTotalReturn != null ? verifyTotalReturn : verifyCagr;
    }
}
