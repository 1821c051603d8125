package org.nowstart.scoring.data.property;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "scoring.template-score")
public record TemplateScoreProperties(
        // 검증 CAGR 수익 점수 스케일
        @DecimalMin("0.000001") @DefaultValue("0.20") double returnScale,
        // 음수 검증 CAGR 추가 감점 강도
        @DecimalMin("0") @DefaultValue("2.0") double validationNegativePenaltyStrength,
        // 검증 낙폭 위험 점수 감쇠 계수
        @DecimalMin("0") @DefaultValue("2.5") double drawdownLambda,
        // 연간 목표 거래 수
        @DecimalMin("0.000001") @DefaultValue("200") double tradeTarget,
        // 유동성 점수에서 거래 빈도 비중(0~1)
        @DecimalMin("0") @DecimalMax("1") @DefaultValue("0.25") double tradeWeight,
        // 최신성 가중치 반감기(일)
        @DecimalMin("0.000001") @DefaultValue("365") double recencyHalfLifeDays,
        @DecimalMin("0.000001") @DefaultValue("2") double verifySharpeScale,
        @DecimalMin("0.000001") @DefaultValue("2") double verifyCalmarScale,
        @DecimalMin("0.000001") @DefaultValue("0.25") double verifyCagrScale,
        @DecimalMin("0.000001") @DefaultValue("0.10") double verifyCagrNegScale,
        @DecimalMin("0") @DefaultValue("2.5") double verifyDrawdownLambda,
        // 검증 배수 하한/상한
        @DecimalMin("0") @DefaultValue("0.8") double verifyMinMultiplier,
        @DecimalMin("0") @DefaultValue("1.2") double verifyMaxMultiplier
) {

    public static TemplateScoreProperties defaults() {
        return new TemplateScoreProperties(
                0.20,
                2.0,
                2.5,
                200,
                0.25,
                365,
                2,
                2,
                0.25,
                0.10,
                2.5,
                0.8,
                1.2
        );
    }
}
