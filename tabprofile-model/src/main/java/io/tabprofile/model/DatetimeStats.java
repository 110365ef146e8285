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

import java.time.Duration;
import java.time.Instant;

/// Range statistics for date and time columns, over values resolved to instants.
///
/// @param minDate earliest instant, null when nothing parsed
/// @param maxDate latest instant, null when nothing parsed
/// @param uniqueCount number of distinct instants
/// @param missingCount rows absent or not parseable as a date
/// @param missingPercentage missing rows as a percentage of all rows
public record DatetimeStats(
    @SerializedName("min_date") Instant minDate,
    @SerializedName("max_date") Instant maxDate,
    @SerializedName("unique_count") long uniqueCount,
    @SerializedName("missing_count") long missingCount,
    @SerializedName("missing_percentage") double missingPercentage
) implements FieldStats {

    public DatetimeStats {
        FieldStats.checkCounts(uniqueCount, missingCount, missingPercentage);
        if (minDate != null && maxDate != null && minDate.isAfter(maxDate)) {
            throw new IllegalArgumentException("min_date " + minDate + " is after max_date " + maxDate);
        }
    }

    public static DatetimeStats empty(long missingCount, long totalRows) {
        return new DatetimeStats(null, null, 0, missingCount, FieldStats.percentOf(missingCount, totalRows));
    }

    /// @return the time between the earliest and latest value, or null when there are none
    public Duration span() {
        return minDate == null || maxDate == null ? null : Duration.between(minDate, maxDate);
    }
}
