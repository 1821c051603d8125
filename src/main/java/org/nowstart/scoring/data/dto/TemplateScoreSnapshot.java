package org.nowstart.scoring.data.dto;

import java.time.Instant;
import lombok.Builder;
import org.nowstart.scoring.data.type.BacktestScope;

/**
 * Stored backtest performance of one strategy over one period and ticker scope.
 *
 * @param templateId  template the strategy was created from
 * @param strategyId  strategy instance the backtest ran for
 * @param periodMonths backtest window length in months; non-positive windows are ignored
 * @param periodDays  backtest window length in days, used when months cannot yield a duration
 * @param scope       training or validation ticker set; {@code null} counts as training
 * @param performance aggregated metrics, {@code null} when the backtest produced none
 * @param createdAt   when the backtest ran, {@code null} when unknown
 */
@Builder(toBuilder = true)
public record TemplateScoreSnapshot(
        String templateId,
        String strategyId,
        int periodMonths,
        Integer periodDays,
        BacktestScope scope,
        StrategyPerformance performance,
        Instant createdAt
) {
}
