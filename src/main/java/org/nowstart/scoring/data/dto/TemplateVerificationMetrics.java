package org.nowstart.scoring.data.dto;

import lombok.Builder;

@Builder
public record TemplateVerificationMetrics(
        Double verifySharpeRatio,
        Double verifyCalmarRatio,
        Double verifyCagr,
        Double verifyMaxDrawdownRatio
) {

    public static TemplateVerificationMetrics from(BacktestCacheRecord record) {
        if (record == null) {
            return null;
        }
        return new TemplateVerificationMetrics(
                record.verifySharpeRatio(),
                record.verifyCalmarRatio(),
                record.verifyCagr(),
                record.verifyMaxDrawdownRatio()
        );
    }
}
