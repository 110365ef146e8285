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

/// The 25th, 50th and 75th percentiles of a numeric column.
///
/// @param q25 first quartile
/// @param q50 second quartile (the median)
/// @param q75 third quartile
public record Quartiles(double q25, double q50, double q75) {

    public Quartiles {
        if (!(q25 <= q50 && q50 <= q75)) {
            throw new IllegalArgumentException("quartiles must be ordered, got " + q25 + ", " + q50 + ", " + q75);
        }
    }

    /// @return the interquartile range, `q75 - q25`
    public double iqr() {
        return q75 - q25;
    }
}
