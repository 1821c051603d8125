package org.nowstart.scoring.data.type;

import java.util.List;

/**
 * Stored setting keys that can override scoring defaults at runtime.
 */
public enum SettingKey {
    PARAM_SCORE_MIN_TRADES,
    PARAM_SCORE_DRAWDOWN_LAMBDA,
    PARAM_SCORE_NEIGHBOR_THRESHOLD,
    PARAM_SCORE_PAIRWISE_NEIGHBOR_LIMIT,
    PARAM_SCORE_STABILITY_GAMMA,
    TEMPLATE_SCORE_RETURN_SCALE,
    TEMPLATE_SCORE_VALIDATION_NEGATIVE_PENALTY_STRENGTH,
    TEMPLATE_SCORE_DRAWDOWN_LAMBDA,
    TEMPLATE_SCORE_TRADE_TARGET,
    TEMPLATE_SCORE_TRADE_WEIGHT,
    TEMPLATE_SCORE_RECENCY_HALF_LIFE_DAYS,
    TEMPLATE_SCORE_VERIFY_SHARPE_SCALE,
    TEMPLATE_SCORE_VERIFY_CALMAR_SCALE,
    TEMPLATE_SCORE_VERIFY_CAGR_SCALE,
    TEMPLATE_SCORE_VERIFY_CAGR_NEG_SCALE,
    TEMPLATE_SCORE_VERIFY_DRAWDOWN_LAMBDA,
    TEMPLATE_SCORE_VERIFY_MIN_MULTIPLIER,
    TEMPLATE_SCORE_VERIFY_MAX_MULTIPLIER;

    public static final List<SettingKey> PARAM_SCORE_KEYS = List.of(
            PARAM_SCORE_MIN_TRADES,
            PARAM_SCORE_DRAWDOWN_LAMBDA,
            PARAM_SCORE_NEIGHBOR_THRESHOLD,
            PARAM_SCORE_PAIRWISE_NEIGHBOR_LIMIT,
            PARAM_SCORE_STABILITY_GAMMA
    );

    public static final List<SettingKey> TEMPLATE_SCORE_KEYS = List.of(
            TEMPLATE_SCORE_RETURN_SCALE,
            TEMPLATE_SCORE_VALIDATION_NEGATIVE_PENALTY_STRENGTH,
            TEMPLATE_SCORE_DRAWDOWN_LAMBDA,
            TEMPLATE_SCORE_TRADE_TARGET,
            TEMPLATE_SCORE_TRADE_WEIGHT,
            TEMPLATE_SCORE_RECENCY_HALF_LIFE_DAYS,
            TEMPLATE_SCORE_VERIFY_SHARPE_SCALE,
            TEMPLATE_SCORE_VERIFY_CALMAR_SCALE,
            TEMPLATE_SCORE_VERIFY_CAGR_SCALE,
            TEMPLATE_SCORE_VERIFY_CAGR_NEG_SCALE,
            TEMPLATE_SCORE_VERIFY_DRAWDOWN_LAMBDA,
            TEMPLATE_SCORE_VERIFY_MIN_MULTIPLIER,
            TEMPLATE_SCORE_VERIFY_MAX_MULTIPLIER
    );
}
