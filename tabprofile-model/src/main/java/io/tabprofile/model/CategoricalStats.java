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

import java.util.List;
import java.util.Objects;

/// Frequency statistics for categorical, boolean and identifier columns.
///
/// `topValues` holds at most the configured number of entries, most frequent first;
/// the remainder of the distribution is omitted.
///
/// @param uniqueCount number of distinct present values
/// @param topValues the most frequent values
/// @param missingCount absent rows
/// @param missingPercentage absent rows as a percentage of all rows
public record CategoricalStats(
    @SerializedName("unique_count") long uniqueCount,
    @SerializedName("top_values") List<TopValue> topValues,
    @SerializedName("missing_count") long missingCount,
    @SerializedName("missing_percentage") double missingPercentage
) implements FieldStats {

    public CategoricalStats {
        FieldStats.checkCounts(uniqueCount, missingCount, missingPercentage);
        topValues = List.copyOf(Objects.requireNonNull(topValues, "top_values cannot be null"));
        if (topValues.size() > uniqueCount) {
            throw new IllegalArgumentException(
                "top_values has " + topValues.size() + " entries but unique_count is " + uniqueCount);
        }
    }
}
