package org.nowstart.scoring.data.dto;

import lombok.Builder;

@Builder(toBuilder = true)
public record StrategyPerformance(
        Integer totalTrades,
        Double winRate,
        Double totalReturn,
        Double cagr,
        Double sharpeRatio,
        Double calmarRatio,
        Double maxDrawdown,
        Double maxDrawdownPercent
) {
}
