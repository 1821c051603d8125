package org.nowstart.scoring.service.param;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Normalized distance between parameter sets of one template.
 *
 * <p>Every numeric parameter is scaled by its p10-p90 spread across the population. Parameters whose spread
 * is effectively zero do not discriminate and are left out, as are the sizing parameters in
 * {@link #IGNORED_PARAMETERS}.
 */
public final class ParameterSpace {

    public static final Set<String> IGNORED_PARAMETERS = Set.of("initialCapital", "maxLeverage", "ticker");

    private static final double MIN_SPREAD = 1e-8;
    private static final double MIN_SCALE = 1e-6;
    private static final double SCALE_GUARD = 1e-9;
    private static final double MIN_BUCKET_STEP = 0.01;
    private static final double MISSING_VALUE_PENALTY = 1.0;

    private final Map<String, Double> scales;

    private ParameterSpace(Map<String, Double> scales) {
        this.scales = Map.copyOf(scales);
    }

    public static ParameterSpace of(List<Map<String, Object>> parameterSets) {
        Map<String, List<Double>> valuesByKey = new HashMap<>();
        for (Map<String, Object> parameters : parameterSets) {
            for (Map.Entry<String, Object> entry : parameters.entrySet()) {
                if (IGNORED_PARAMETERS.contains(entry.getKey())) {
                    continue;
                }
                Double value = numericValue(entry.getValue());
                if (value != null) {
                    valuesByKey.computeIfAbsent(entry.getKey(), key -> new ArrayList<>()).add(value);
                }
            }
        }

        Map<String, Double> scales = new HashMap<>();
        valuesByKey.forEach((key, values) -> {
            values.sort(Double::compare);
            int last = values.size() - 1;
            double p90 = values.get((int) Math.floor(last * 0.9));
            double p10 = values.get((int) Math.floor(last * 0.1));
            double spread = p90 - p10;
            if (spread < MIN_SPREAD) {
                return;
            }
            scales.put(key, Math.max(spread, MIN_SCALE));
        });
        return new ParameterSpace(scales);
    }

    public Map<String, Double> scales() {
        return scales;
    }

    /**
     * Root-mean-square of scaled per-parameter differences. A parameter numeric on only one side adds a fixed
     * penalty of 1 to its squared term. Two sets sharing no scaled parameter are at distance 0.
     */
    public double distance(Map<String, Object> a, Map<String, Object> b) {
        Set<String> keys = new LinkedHashSet<>();
        collectScaledKeys(a, keys);
        collectScaledKeys(b, keys);
        if (keys.isEmpty()) {
            return 0.0;
        }

        double sumSq = 0.0;
        for (String key : keys) {
            Double valueA = numericValue(a.get(key));
            Double valueB = numericValue(b.get(key));
            if (valueA != null && valueB != null) {
                double scale = Math.max(scales.get(key), SCALE_GUARD);
                double z = Math.abs(valueA - valueB) / scale;
                sumSq += z * z;
            } else {
                sumSq += MISSING_VALUE_PENALTY;
            }
        }
        return Math.sqrt(sumSq / keys.size());
    }

    /**
     * Bucket keys for approximate neighbor search: per parameter the quantized bucket and both adjacent ones,
     * plus one key for the whole quantized vector. Pairs straddling bucket edges in two or more parameters at
     * once can share no key and are then never compared.
     */
    public Set<String> bucketKeys(Map<String, Object> parameters, double step) {
        double safeStep = Math.max(step, MIN_BUCKET_STEP);
        Set<String> keys = new LinkedHashSet<>();
        List<String> vectorParts = new ArrayList<>();

        for (String key : new TreeSet<>(parameters.keySet())) {
            if (IGNORED_PARAMETERS.contains(key) || !scales.containsKey(key)) {
                continue;
            }
            Double value = numericValue(parameters.get(key));
            if (value == null) {
                continue;
            }
            double normalized = value / Math.max(scales.get(key), SCALE_GUARD);
            long quantized = Math.round(normalized / safeStep);
            vectorParts.add(key + "=" + quantized);
            keys.add(key + ":" + quantized);
            keys.add(key + ":" + (quantized - 1));
            keys.add(key + ":" + (quantized + 1));
        }

        if (vectorParts.isEmpty()) {
            keys.add("vector:__empty__");
        } else {
            keys.add("vector:" + String.join("|", vectorParts));
        }
        return keys;
    }

    private void collectScaledKeys(Map<String, Object> parameters, Set<String> keys) {
        for (String key : parameters.keySet()) {
            if (!IGNORED_PARAMETERS.contains(key) && scales.containsKey(key)) {
                keys.add(key);
            }
        }
    }

    static Double numericValue(Object value) {
        if (value instanceof Number number) {
            double asDouble = number.doubleValue();
            return Double.isFinite(asDouble) ? asDouble : null;
        }
        return null;
    }
}
