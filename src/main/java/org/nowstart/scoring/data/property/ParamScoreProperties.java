package org.nowstart.scoring.data.property;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "scoring.param-score")
public record ParamScoreProperties(
        // 점수 산정에 필요한 최소 거래 수
        @PositiveOrZero @DefaultValue("20") int minTrades,
        // 낙폭 패널티 감쇠 계수 exp(-lambda * ddRatio)
        @DecimalMin("0") @DefaultValue("3.5") double drawdownLambda,
        // 이웃으로 인정할 정규화 파라미터 거리
        @DecimalMin("0") @DefaultValue("0.15") double neighborThreshold,
        // 이 수를 넘으면 버킷 기반 이웃 탐색으로 전환
        @Positive @DefaultValue("1500") int pairwiseNeighborLimit,
        // 안정성 점수 지수
        @DecimalMin("0") @DefaultValue("2") double stabilityGamma
) {

    public static ParamScoreProperties defaults() {
        return new ParamScoreProperties(20, 3.5, 0.15, 1500, 2.0);
    }
}
