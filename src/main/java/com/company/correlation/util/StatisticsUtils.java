package com.company.correlation.util;

import java.util.Arrays;
import java.util.Collection;

public class StatisticsUtils {

    private StatisticsUtils() {
    }

    public static double median(Collection<Double> values) {
        return percentile(values, 50.0);
    }

    /**
     * Percentile with linear interpolation between the closest ranks.
     *
     * @param values non-empty collection
     * @param percentile value in [0, 100]
     */
    public static double percentile(Collection<Double> values, double percentile) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("Cannot compute percentile of empty collection");
        }
        double[] sorted = values.stream().mapToDouble(Double::doubleValue).toArray();
        Arrays.sort(sorted);

        double rank = (percentile / 100.0) * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        if (lower == upper) {
            return sorted[lower];
        }
        return sorted[lower] + (rank - lower) * (sorted[upper] - sorted[lower]);
    }

    public static double mean(Collection<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(Double.NaN);
    }

    /**
     * Sample standard deviation (n - 1). NaN for fewer than two values.
     */
    public static double stdDev(Collection<Double> values) {
        if (values.size() < 2) {
            return Double.NaN;
        }
        double mean = mean(values);
        double sumSquares = 0.0;
        for (double v : values) {
            sumSquares += (v - mean) * (v - mean);
        }
        return Math.sqrt(sumSquares / (values.size() - 1));
    }
}
