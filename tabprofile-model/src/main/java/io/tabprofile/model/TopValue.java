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

import java.util.Objects;

/// One entry of a frequency table.
///
/// @param value the value in its display form
/// @param count how many rows hold the value
/// @param percentage `count / totalRows * 100`
public record TopValue(
    @SerializedName("value") String value,
    @SerializedName("count") long count,
    @SerializedName("percentage") double percentage
) {
    public TopValue {
        Objects.requireNonNull(value, "value cannot be null");
        if (count < 1) {
            throw new IllegalArgumentException("count must be positive, got " + count);
        }
    }
}
