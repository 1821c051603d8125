package org.nowstart.scoring.service.template;

import java.util.ArrayList;
import java.util.List;
import org.nowstart.scoring.data.dto.TemplateVerificationMetrics;
import org.nowstart.scoring.service.settings.TemplateScoreSettings;
import org.springframework.stereotype.Component;

/**
 * Maps out-of-sample verification metrics to a score multiplier in
 * [{@code verifyMinMultiplier}, {@code verifyMaxMultiplier}].
 *
 * <p>Each present metric becomes a component in [0, 1]; the multiplier is linear in their geometric mean.
 * Verify CAGR is signed: 0 maps to 0.5, gains rise toward 1 on {@code verifyCagrScale} and losses fall toward 0
 * on the steeper {@code verifyCagrNegScale}.
 */
@Component
public class VerificationMultiplierCalculator {

    private static final double MIN_SCALE = 1e-6;

    /**
     * @return the multiplier, or {@code null} when no usable metric was supplied
     */
    public Double compute(TemplateVerificationMetrics metrics, TemplateScoreSettings settings) {
        if (metrics == null) {
            return null;
        }
        List<Double> components = new ArrayList<>(4);
        addIfPresent(components, scorePositive(metrics.verifySharpeRatio(), settings.verifySharpeScale()));
        addIfPresent(components, scorePositive(metrics.verifyCalmarRatio(), settings.verifyCalmarScale()));
        addIfPresent(components, scoreSigned(metrics.verifyCagr(), settings.verifyCagrScale(), settings.verifyCagrNegScale()));
        Double drawdown = finiteOrNull(metrics.verifyMaxDrawdownRatio());
        if (drawdown != null) {
            components.add(Math.exp(-settings.verifyDrawdownLambda() * Math.max(0.0, drawdown)));
        }
        if (components.isEmpty()) {
            return null;
        }

        double product = 1.0;
        for (double component : components) {
            product *= Math.max(0.0, component);
        }
        double verificationScore = Math.pow(product, 1.0 / components.size());
        if (!Double.isFinite(verificationScore)) {
            return null;
        }
        return settings.verifyMinMultiplier()
                + (settings.verifyMaxMultiplier() - settings.verifyMinMultiplier()) * verificationScore;
    }

    Double scorePositive(Double value, double scale) {
        Double finite = finiteOrNull(value);
        if (finite == null) {
            return null;
        }
        if (finite <= 0) {
            return 0.0;
        }
        return 1.0 - Math.exp(-finite / Math.max(scale, MIN_SCALE));
    }

    Double scoreSigned(Double value, double positiveScale, double negativeScale) {
        Double finite = finiteOrNull(value);
        if (finite == null) {
            return null;
        }
        if (finite >= 0) {
            double score = 1.0 - Math.exp(-finite / Math.max(positiveScale, MIN_SCALE));
            return 0.5 + 0.5 * score;
        }
        double score = 1.0 - Math.exp(-Math.abs(finite) / Math.max(negativeScale, MIN_SCALE));
        return 0.5 - 0.5 * score;
    }

    private void addIfPresent(List<Double> components, Double component) {
        if (component != null) {
            components.add(component);
        }
    }

    private Double finiteOrNull(Double value) {
        return value != null && Double.isFinite(value) ? value : null;
    }
}
