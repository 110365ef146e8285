package io.tabprofile.stats;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.tabprofile.config.ProfilerConfig;
import io.tabprofile.infer.BooleanLiterals;
import io.tabprofile.infer.CellValues;
import io.tabprofile.model.CategoricalStats;
import io.tabprofile.model.DatetimeStats;
import io.tabprofile.model.FieldStats;
import io.tabprofile.model.FieldType;
import io.tabprofile.model.NumericalStats;
import io.tabprofile.model.Quartiles;
import io.tabprofile.model.StringStats;
import io.tabprofile.model.TopValue;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Computes the statistics block for a column of a known type.
 *
 * <p>Only usable values feed the aggregates: present values that parse under the column's type.
 * Every other row, absent or unparseable, counts as missing, so for any result
 * {@code missingCount + presentCount(totalRows) == totalRows}.
 *
 * <table>
 *   <caption>Statistics per field type</caption>
 *   <tr><th>Field type</th><th>Block</th><th>Usable values</th></tr>
 *   <tr><td>integer, float</td><td>{@link NumericalStats}</td><td>finite numbers</td></tr>
 *   <tr><td>categorical, identifier</td><td>{@link CategoricalStats}</td><td>all present values</td></tr>
 *   <tr><td>boolean</td><td>{@link CategoricalStats}</td><td>boolean literals</td></tr>
 *   <tr><td>string</td><td>{@link StringStats}</td><td>all present values</td></tr>
 *   <tr><td>datetime</td><td>{@link DatetimeStats}</td><td>values that place on the time line</td></tr>
 * </table>
 *
 * <p>Results carry full precision; rounding is left to whoever renders them.
 */
public final class StatisticsComputer {

    private static final Comparator<Map.Entry<String, Long>> BY_COUNT_THEN_VALUE =
        Map.Entry.<String, Long>comparingByValue().reversed().thenComparing(Map.Entry.comparingByKey());

    private final ProfilerConfig config;
    private final CellValues cells;

    public StatisticsComputer(ProfilerConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.cells = new CellValues(config);
    }

    /// Computes the statistics for a column.
    ///
    /// @param fieldType the column's inferred type
    /// @param rawValues the column's values in row order
    /// @return the statistics variant that belongs to the field type
    public FieldStats compute(FieldType fieldType, List<?> rawValues) {
        Objects.requireNonNull(fieldType, "fieldType cannot be null");
        List<Object> present = cells.present(rawValues);
        long totalRows = rawValues.size();
        return switch (fieldType) {
            case INTEGER, FLOAT -> numerical(present, totalRows);
            case CATEGORICAL, IDENTIFIER -> categorical(present, totalRows, CellValues::text);
            case BOOLEAN -> categorical(present, totalRows, BooleanLiterals::display);
            case STRING -> string(present, totalRows);
            case DATETIME -> datetime(present, totalRows);
        };
    }

    private NumericalStats numerical(List<Object> present, long totalRows) {
        double[] values = new double[present.size()];
        int n = 0;
        for (Object value : present) {
            Double d = CellValues.toNumber(value);
            if (d != null) {
                values[n++] = d;
            }
        }
        long missing = totalRows - n;
        if (n == 0) {
            return NumericalStats.empty(missing, totalRows);
        }
        double[] sorted = Arrays.copyOf(values, n);
        Arrays.sort(sorted);

        double mean = mean(sorted);
        Double stdDev = n > 1 ? sampleStdDev(sorted, mean) : null;

        Quartiles quartiles = new Quartiles(percentile(sorted, 25), percentile(sorted, 50), percentile(sorted, 75));
        return new NumericalStats(sorted[0], sorted[n - 1], mean, quartiles.q50(), stdDev, quartiles,
            missing, FieldStats.percentOf(missing, totalRows));
    }

    private CategoricalStats categorical(List<Object> present, long totalRows, KeyFunction keyOf) {
        Map<String, Long> counts = new HashMap<>();
        long usable = 0;
        for (Object value : present) {
            String key = keyOf.key(value);
            if (key != null) {
                counts.merge(key, 1L, Long::sum);
                usable++;
            }
        }
        long missing = totalRows - usable;

        List<Map.Entry<String, Long>> ranked = new ArrayList<>(counts.entrySet());
        ranked.sort(BY_COUNT_THEN_VALUE);
        List<TopValue> top = new ArrayList<>(Math.min(config.topK(), ranked.size()));
        for (Map.Entry<String, Long> entry : ranked.subList(0, Math.min(config.topK(), ranked.size()))) {
            top.add(new TopValue(entry.getKey(), entry.getValue(), FieldStats.percentOf(entry.getValue(), totalRows)));
        }
        return new CategoricalStats(counts.size(), top, missing, FieldStats.percentOf(missing, totalRows));
    }

    private static StringStats string(List<Object> present, long totalRows) {
        long missing = totalRows - present.size();
        if (present.isEmpty()) {
            return StringStats.empty(missing, totalRows);
        }
        int min = Integer.MAX_VALUE;
        int max = 0;
        long total = 0;
        Set<String> distinct = new HashSet<>();
        for (Object value : present) {
            String text = CellValues.text(value);
            distinct.add(text);
            int length = text.codePointCount(0, text.length());
            min = Math.min(min, length);
            max = Math.max(max, length);
            total += length;
        }
        return new StringStats(min, max, (double) total / present.size(), distinct.size(),
            missing, FieldStats.percentOf(missing, totalRows));
    }

    private DatetimeStats datetime(List<Object> present, long totalRows) {
        Set<Instant> distinct = new HashSet<>();
        Instant min = null;
        Instant max = null;
        long usable = 0;
        for (Object value : present) {
            Instant instant = cells.toInstant(value);
            if (instant == null) {
                continue;
            }
            usable++;
            distinct.add(instant);
            if (min == null || instant.isBefore(min)) {
                min = instant;
            }
            if (max == null || instant.isAfter(max)) {
                max = instant;
            }
        }
        long missing = totalRows - usable;
        if (usable == 0) {
            return DatetimeStats.empty(missing, totalRows);
        }
        return new DatetimeStats(min, max, distinct.size(), missing, FieldStats.percentOf(missing, totalRows));
    }

    /// Linear interpolation between the closest ranks at position `p / 100 * (n - 1)`.
    ///
    /// @param sorted ascending values, not empty
    /// @param p the percentile, within [0, 100]
    /// @return the interpolated value
    static double percentile(double[] sorted, double p) {
        double index = (p / 100.0) * (sorted.length - 1);
        int lower = (int) Math.floor(index);
        int upper = (int) Math.ceil(index);
        if (lower == upper) {
            return sorted[lower];
        }
        double frac = index - lower;
        // weighted form stays finite where upper - lower would overflow; the clamp keeps
        // q25 <= q50 <= q75 after rounding
        double interpolated = sorted[lower] * (1 - frac) + sorted[upper] * frac;
        return Math.max(sorted[lower], Math.min(interpolated, sorted[upper]));
    }

    /// Arithmetic mean, dividing each term first when the plain sum leaves the double range.
    static double mean(double[] values) {
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        if (Double.isFinite(sum)) {
            return sum / values.length;
        }
        double mean = 0.0;
        for (double v : values) {
            mean += v / values.length;
        }
        return mean;
    }

    /// Sample standard deviation around a precomputed mean. Deviations are scaled by the
    /// largest one before squaring so that large finite inputs do not overflow.
    static double sampleStdDev(double[] values, double mean) {
        double scale = 0.0;
        for (double v : values) {
            scale = Math.max(scale, Math.abs(v - mean));
        }
        if (scale == 0.0 || !Double.isFinite(scale)) {
            return scale;
        }
        double sumSq = 0.0;
        for (double v : values) {
            double diff = (v - mean) / scale;
            sumSq += diff * diff;
        }
        return scale * Math.sqrt(sumSq / (values.length - 1));
    }

    @FunctionalInterface
    private interface KeyFunction {
        String key(Object value);
    }
}
