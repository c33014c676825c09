package com.marketengine.common.stats;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Descriptive statistics over page-one signals. Null entries are skipped;
 * an empty input yields 0.
 */
public final class PageStats {

    private PageStats() {}

    public static double mean(Collection<? extends Number> values) {
        return values.stream()
            .filter(Objects::nonNull)
            .mapToDouble(Number::doubleValue)
            .average()
            .orElse(0.0);
    }

    /** Population standard deviation. */
    public static double stdDev(Collection<? extends Number> values) {
        double mean = mean(values);
        return Math.sqrt(values.stream()
            .filter(Objects::nonNull)
            .mapToDouble(v -> (v.doubleValue() - mean) * (v.doubleValue() - mean))
            .average()
            .orElse(0.0));
    }

    /** Median; the mean of the two middle values for even sizes. */
    public static double median(Collection<? extends Number> values) {
        List<Double> sorted = values.stream()
            .filter(Objects::nonNull)
            .map(Number::doubleValue)
            .sorted()
            .toList();
        int n = sorted.size();
        if (n == 0) {
            return 0.0;
        }
        int mid = n / 2;
        return n % 2 == 0 ? (sorted.get(mid - 1) + sorted.get(mid)) / 2.0 : sorted.get(mid);
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
