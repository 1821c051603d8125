package org.nowstart.scoring.service.param;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Average-rank percentiles in [0, 1]. Values within {@link #TOLERANCE} of each other share the mean of
 * their rank positions; a single value ranks 1.
 */
public final class PercentileRanker {

    static final double TOLERANCE = 1e-12;

    private PercentileRanker() {
    }

    public static double[] rank(double[] values) {
        int n = values.length;
        double[] percentiles = new double[n];
        if (n == 0) {
            return percentiles;
        }
        if (n == 1) {
            percentiles[0] = 1.0;
            return percentiles;
        }

        Integer[] order = new Integer[n];
        for (int i = 0; i < n; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.comparingDouble(i -> values[i]));

        double denominator = n - 1;
        int i = 0;
        while (i < n) {
            int j = i + 1;
            while (j < n && Math.abs(values[order[j]] - values[order[i]]) <= TOLERANCE) {
                j++;
            }
            double averageRank = (i + (j - 1)) / 2.0;
            double percentile = averageRank / denominator;
            for (int k = i; k < j; k++) {
                percentiles[order[k]] = percentile;
            }
            i = j;
        }
        return percentiles;
    }

    /**
     * Ranks only the present values; absent entries stay {@code null} rather than ranking last.
     */
    public static Double[] rankPresent(Double[] values) {
        Double[] aligned = new Double[values.length];
        List<Integer> presentIndexes = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            if (values[i] != null) {
                presentIndexes.add(i);
            }
        }
        if (presentIndexes.isEmpty()) {
            return aligned;
        }

        double[] present = new double[presentIndexes.size()];
        for (int i = 0; i < present.length; i++) {
            present[i] = values[presentIndexes.get(i)];
        }
        double[] ranks = rank(present);
        for (int i = 0; i < ranks.length; i++) {
            aligned[presentIndexes.get(i)] = ranks[i];
        }
        return aligned;
    }
}
