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

/// Length statistics for free-text columns. Lengths count Unicode code points.
/// The length aggregates are null when the column has no present values.
///
/// @param minLength shortest value
/// @param maxLength longest value
/// @param avgLength mean length
/// @param uniqueCount number of distinct values
/// @param missingCount absent rows
/// @param missingPercentage absent rows as a percentage of all rows
public record StringStats(
    @SerializedName("min_length") Integer minLength,
    @SerializedName("max_length") Integer maxLength,
    @SerializedName("avg_length") Double avgLength,
    @SerializedName("unique_count") long uniqueCount,
    @SerializedName("missing_count") long missingCount,
    @SerializedName("missing_percentage") double missingPercentage
) implements FieldStats {

    public StringStats {
        FieldStats.checkCounts(uniqueCount, missingCount, missingPercentage);
    }

    public static StringStats empty(long missingCount, long totalRows) {
        return new StringStats(null, null, null, 0, missingCount, FieldStats.percentOf(missingCount, totalRows));
    }
}
