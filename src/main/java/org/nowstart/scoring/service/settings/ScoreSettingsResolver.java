package org.nowstart.scoring.service.settings;

import static org.nowstart.scoring.data.type.SettingKey.PARAM_SCORE_DRAWDOWN_LAMBDA;
import static org.nowstart.scoring.data.type.SettingKey.PARAM_SCORE_MIN_TRADES;
import static org.nowstart.scoring.data.type.SettingKey.PARAM_SCORE_NEIGHBOR_THRESHOLD;
import static org.nowstart.scoring.data.type.SettingKey.PARAM_SCORE_PAIRWISE_NEIGHBOR_LIMIT;
import static org.nowstart.scoring.data.type.SettingKey.PARAM_SCORE_STABILITY_GAMMA;
import static org.nowstart.scoring.data.type.SettingKey.TEMPLATE_SCORE_DRAWDOWN_LAMBDA;
import static org.nowstart.scoring.data.type.SettingKey.TEMPLATE_SCORE_RECENCY_HALF_LIFE_DAYS;
import static org.nowstart.scoring.data.type.SettingKey.TEMPLATE_SCORE_RETURN_SCALE;
import static org.nowstart.scoring.data.type.SettingKey.TEMPLATE_SCORE_TRADE_TARGET;
import static org.nowstart.scoring.data.type.SettingKey.TEMPLATE_SCORE_TRADE_WEIGHT;
import static org.nowstart.scoring.data.type.SettingKey.TEMPLATE_SCORE_VALIDATION_NEGATIVE_PENALTY_STRENGTH;
import static org.nowstart.scoring.data.type.SettingKey.TEMPLATE_SCORE_VERIFY_CAGR_NEG_SCALE;
import static org.nowstart.scoring.data.type.SettingKey.TEMPLATE_SCORE_VERIFY_CAGR_SCALE;
import static org.nowstart.scoring.data.type.SettingKey.TEMPLATE_SCORE_VERIFY_CALMAR_SCALE;
import static org.nowstart.scoring.data.type.SettingKey.TEMPLATE_SCORE_VERIFY_DRAWDOWN_LAMBDA;
import static org.nowstart.scoring.data.type.SettingKey.TEMPLATE_SCORE_VERIFY_MAX_MULTIPLIER;
import static org.nowstart.scoring.data.type.SettingKey.TEMPLATE_SCORE_VERIFY_MIN_MULTIPLIER;
import static org.nowstart.scoring.data.type.SettingKey.TEMPLATE_SCORE_VERIFY_SHARPE_SCALE;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.scoring.data.dto.ParamScoreOverrides;
import org.nowstart.scoring.data.dto.TemplateScoreOverrides;
import org.nowstart.scoring.data.property.ParamScoreProperties;
import org.nowstart.scoring.data.property.TemplateScoreProperties;
import org.nowstart.scoring.data.type.SettingKey;
import org.nowstart.scoring.repository.SettingsLookup;
import org.springframework.stereotype.Service;

/**
 * Resolves the settings bundle for one scoring call.
 *
 * <p>Each field is taken from the first non-null of: caller override, stored setting, configured default.
 * The merged value is then checked once against the field's domain; a rejected value falls back to the
 * configured default.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScoreSettingsResolver {

    private static final double MIN_SCALE = 1e-6;

    private final ParamScoreProperties paramScoreProperties;
    private final TemplateScoreProperties templateScoreProperties;
    private final SettingsLookup settingsLookup;

    public ParamScoreSettings resolveParamScoreSettings(ParamScoreOverrides overrides) {
        ParamScoreOverrides caller = overrides == null ? ParamScoreOverrides.none() : overrides;
        Map<SettingKey, Double> stored = loadStoredValues(SettingKey.PARAM_SCORE_KEYS);
        ParamScoreProperties defaults = paramScoreProperties;

        ParamScoreSettings settings = new ParamScoreSettings(
                (int) normalize(PARAM_SCORE_MIN_TRADES, merge(caller.minTrades(), stored, PARAM_SCORE_MIN_TRADES),
                        defaults.minTrades(), NumberConstraint.integerAtLeast(0)),
                normalize(PARAM_SCORE_DRAWDOWN_LAMBDA, merge(caller.drawdownLambda(), stored, PARAM_SCORE_DRAWDOWN_LAMBDA),
                        defaults.drawdownLambda(), NumberConstraint.atLeast(0)),
                normalize(PARAM_SCORE_NEIGHBOR_THRESHOLD, merge(caller.neighborThreshold(), stored, PARAM_SCORE_NEIGHBOR_THRESHOLD),
                        defaults.neighborThreshold(), NumberConstraint.atLeast(0)),
                (int) normalize(PARAM_SCORE_PAIRWISE_NEIGHBOR_LIMIT,
                        merge(caller.pairwiseNeighborLimit(), stored, PARAM_SCORE_PAIRWISE_NEIGHBOR_LIMIT),
                        defaults.pairwiseNeighborLimit(), NumberConstraint.integerAtLeast(1)),
                normalize(PARAM_SCORE_STABILITY_GAMMA, merge(caller.stabilityGamma(), stored, PARAM_SCORE_STABILITY_GAMMA),
                        defaults.stabilityGamma(), NumberConstraint.atLeast(0))
        );
        log.debug("event=score_settings_resolved scorer=param settings={}", settings);
        return settings;
    }

    public TemplateScoreSettings resolveTemplateScoreSettings(TemplateScoreOverrides overrides) {
        TemplateScoreOverrides caller = overrides == null ? TemplateScoreOverrides.none() : overrides;
        Map<SettingKey, Double> stored = loadStoredValues(SettingKey.TEMPLATE_SCORE_KEYS);
        TemplateScoreProperties defaults = templateScoreProperties;

        double verifyMinMultiplier = normalize(TEMPLATE_SCORE_VERIFY_MIN_MULTIPLIER,
                merge(caller.verifyMinMultiplier(), stored, TEMPLATE_SCORE_VERIFY_MIN_MULTIPLIER),
                defaults.verifyMinMultiplier(), NumberConstraint.atLeast(0));
        double verifyMaxMultiplier = Math.max(verifyMinMultiplier, normalize(TEMPLATE_SCORE_VERIFY_MAX_MULTIPLIER,
                merge(caller.verifyMaxMultiplier(), stored, TEMPLATE_SCORE_VERIFY_MAX_MULTIPLIER),
                defaults.verifyMaxMultiplier(), NumberConstraint.atLeast(0)));

        TemplateScoreSettings settings = new TemplateScoreSettings(
                normalize(TEMPLATE_SCORE_RETURN_SCALE, merge(caller.returnScale(), stored, TEMPLATE_SCORE_RETURN_SCALE),
                        defaults.returnScale(), NumberConstraint.atLeast(MIN_SCALE)),
                normalize(TEMPLATE_SCORE_VALIDATION_NEGATIVE_PENALTY_STRENGTH,
                        merge(caller.validationNegativePenaltyStrength(), stored, TEMPLATE_SCORE_VALIDATION_NEGATIVE_PENALTY_STRENGTH),
                        defaults.validationNegativePenaltyStrength(), NumberConstraint.atLeast(0)),
                normalize(TEMPLATE_SCORE_DRAWDOWN_LAMBDA, merge(caller.drawdownLambda(), stored, TEMPLATE_SCORE_DRAWDOWN_LAMBDA),
                        defaults.drawdownLambda(), NumberConstraint.atLeast(0)),
                normalize(TEMPLATE_SCORE_TRADE_TARGET, merge(caller.tradeTarget(), stored, TEMPLATE_SCORE_TRADE_TARGET),
                        defaults.tradeTarget(), NumberConstraint.atLeast(MIN_SCALE)),
                normalize(TEMPLATE_SCORE_TRADE_WEIGHT, merge(caller.tradeWeight(), stored, TEMPLATE_SCORE_TRADE_WEIGHT),
                        defaults.tradeWeight(), NumberConstraint.between(0, 1)),
                normalize(TEMPLATE_SCORE_RECENCY_HALF_LIFE_DAYS,
                        merge(caller.recencyHalfLifeDays(), stored, TEMPLATE_SCORE_RECENCY_HALF_LIFE_DAYS),
                        defaults.recencyHalfLifeDays(), NumberConstraint.atLeast(MIN_SCALE)),
                normalize(TEMPLATE_SCORE_VERIFY_SHARPE_SCALE,
                        merge(caller.verifySharpeScale(), stored, TEMPLATE_SCORE_VERIFY_SHARPE_SCALE),
                        defaults.verifySharpeScale(), NumberConstraint.atLeast(MIN_SCALE)),
                normalize(TEMPLATE_SCORE_VERIFY_CALMAR_SCALE,
                        merge(caller.verifyCalmarScale(), stored, TEMPLATE_SCORE_VERIFY_CALMAR_SCALE),
                        defaults.verifyCalmarScale(), NumberConstraint.atLeast(MIN_SCALE)),
                normalize(TEMPLATE_SCORE_VERIFY_CAGR_SCALE,
                        merge(caller.verifyCagrScale(), stored, TEMPLATE_SCORE_VERIFY_CAGR_SCALE),
                        defaults.verifyCagrScale(), NumberConstraint.atLeast(MIN_SCALE)),
                normalize(TEMPLATE_SCORE_VERIFY_CAGR_NEG_SCALE,
                        merge(caller.verifyCagrNegScale(), stored, TEMPLATE_SCORE_VERIFY_CAGR_NEG_SCALE),
                        defaults.verifyCagrNegScale(), NumberConstraint.atLeast(MIN_SCALE)),
                normalize(TEMPLATE_SCORE_VERIFY_DRAWDOWN_LAMBDA,
                        merge(caller.verifyDrawdownLambda(), stored, TEMPLATE_SCORE_VERIFY_DRAWDOWN_LAMBDA),
                        defaults.verifyDrawdownLambda(), NumberConstraint.atLeast(0)),
                verifyMinMultiplier,
                verifyMaxMultiplier
        );
        log.debug("event=score_settings_resolved scorer=template settings={}", settings);
        return settings;
    }

    /**
     * Parses a stored setting value. Blank, missing and non-numeric text yields {@code null}.
     */
    static Double parseOptionalNumber(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        try {
            double parsed = Double.parseDouble(trimmed);
            return Double.isFinite(parsed) ? parsed : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private Map<SettingKey, Double> loadStoredValues(List<SettingKey> requested) {
        Map<SettingKey, String> raw = settingsLookup.getSettingsByKeys(requested);
        Map<SettingKey, Double> parsed = new EnumMap<>(SettingKey.class);
        if (raw == null) {
            return parsed;
        }
        for (SettingKey key : requested) {
            Double value = parseOptionalNumber(raw.get(key));
            if (value != null) {
                parsed.put(key, value);
            }
        }
        return parsed;
    }

    private Double merge(Double override, Map<SettingKey, Double> stored, SettingKey key) {
        return override != null ? override : stored.get(key);
    }

    private double normalize(SettingKey key, Double value, double fallback, NumberConstraint constraint) {
        if (value == null) {
            return fallback;
        }
        if (!constraint.accepts(value)) {
            log.warn("event=score_setting_ignored key={} value={} fallback={}", key, value, fallback);
            return fallback;
        }
        return value;
    }
}
