package org.nowstart.scoring.data.dto;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;

/**
 * One cached backtest outcome for a parameter set of a strategy template, as read from storage.
 *
 * <p>{@code parameters} is the stored parameter payload: normally a JSON object, occasionally a JSON
 * string holding the object text. Metric fields are nullable because older cache rows predate some
 * columns; the {@code verify*} fields describe an out-of-sample re-run and are absent when none ran.
 */
@Builder(toBuilder = true)
public record BacktestCacheRecord(
        String id,
        String templateId,
        JsonNode parameters,
        Double sharpeRatio,
        Double calmarRatio,
        Double totalReturn,
        Double cagr,
        Double maxDrawdown,
        Double maxDrawdownRatio,
        Double winRate,
        Integer totalTrades,
        Double verifySharpeRatio,
        Double verifyCalmarRatio,
        Double verifyTotalReturn,
        Double verifyCagr,
        Double verifyMaxDrawdownRatio,
        String topAbsGainTicker,
        String topRelGainTicker
) {
}
