package io.tabprofile.model;

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

import com.google.gson.annotations.SerializedName;

/**
 * Descriptive statistics for an integer or float column.
 *
 * <p>All aggregates are {@code null} when the column has no usable values. The standard
 * deviation is the sample (Bessel-corrected) deviation and is {@code null} below two values.
 *
 * @param minValue smallest value
 * @param maxValue largest value
 * @param mean arithmetic mean
 * @param median middle value, or the average of the two middle values
 * @param stdDev sample standard deviation
 * @param quartiles linear-interpolation quartiles
 * @param missingCount rows absent or not numeric
 * @param missingPercentage missing rows as a percentage of all rows
 */
public record NumericalStats(
    @SerializedName("min_value") Double minValue,
    @SerializedName("max_value") Double maxValue,
    @SerializedName("mean") Double mean,
    @SerializedName("median") Double median,
    @SerializedName("std_dev") Double stdDev,
    @SerializedName("quartiles") Quartiles quartiles,
    @SerializedName("missing_count") long missingCount,
    @SerializedName("missing_percentage") double missingPercentage
) implements FieldStats {

    public NumericalStats {
        FieldStats.checkCounts(0, missingCount, missingPercentage);
        if (minValue != null && maxValue != null && minValue > maxValue) {
            throw new IllegalArgumentException("min_value " + minValue + " exceeds max_value " + maxValue);
        }
    }

    /// Stats for a column with no usable numeric values.
    public static NumericalStats empty(long missingCount, long totalRows) {
        return new NumericalStats(null, null, null, null, null, null,
            missingCount, FieldStats.percentOf(missingCount, totalRows));
    }

    /// @return `max - min`, or null when there are no values
    public Double range() {
        return minValue == null || maxValue == null ? null : maxValue - minValue;
    }
}
