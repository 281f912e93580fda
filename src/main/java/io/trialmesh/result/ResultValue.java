package io.trialmesh.result;

import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Either a scalar or a per-year series.
 */
public record ResultValue(Double scalar, SortedMap<Integer, Double> series) {
    public ResultValue {
        series = series == null ? Collections.emptySortedMap() : Collections.unmodifiableSortedMap(new TreeMap<>(series));
    }

    public static ResultValue scalar(double value) {
        return new ResultValue(value, null);
    }

    public static ResultValue series(SortedMap<Integer, Double> values) {
        return new ResultValue(null, values);
    }

    public boolean isSeries() {
        return scalar == null;
    }

    public double total() {
        if (!isSeries()) {
            return scalar;
        }
        double sum = 0.0;
        for (double v : series.values()) {
            sum += v;
        }
        return sum;
    }
}
