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

/**
 * Type-appropriate statistics for one column.
 *
 * <p>Exactly one variant describes a column, chosen by its {@link FieldType}:
 *
 * <ul>
 *   <li>{@link NumericalStats} for {@code INTEGER} and {@code FLOAT}</li>
 *   <li>{@link CategoricalStats} for {@code CATEGORICAL}, {@code BOOLEAN} and {@code IDENTIFIER}</li>
 *   <li>{@link StringStats} for {@code STRING}</li>
 *   <li>{@link DatetimeStats} for {@code DATETIME}</li>
 * </ul>
 *
 * <p>Every variant carries missingness. A value counts as missing when it was absent in the
 * source or could not be read as the column's inferred type, so for any column
 * {@code missingCount() + presentCount(totalRows) == totalRows}.
 */
public sealed interface FieldStats permits NumericalStats, CategoricalStats, StringStats, DatetimeStats {

    /// @return the number of rows not usable for this column's statistics
    long missingCount();

    /// @return `missingCount / totalRows * 100`, or 0 for an empty dataset
    double missingPercentage();

    /// @param totalRows the number of rows in the dataset
    /// @return the number of values that contributed to these statistics
    default long presentCount(long totalRows) {
        return totalRows - missingCount();
    }

    /// Computes the missing percentage the same way for every variant.
    static double percentOf(long count, long totalRows) {
        return totalRows == 0 ? 0.0 : (double) count / totalRows * 100.0;
    }

    /// Shared argument checks for the variant constructors.
    static void checkCounts(long uniqueCount, long missingCount, double missingPercentage) {
        if (uniqueCount < 0) {
            throw new IllegalArgumentException("unique_count must be non-negative, got " + uniqueCount);
        }
        if (missingCount < 0) {
            throw new IllegalArgumentException("missing_count must be non-negative, got " + missingCount);
        }
        if (missingPercentage < 0.0 || missingPercentage > 100.0) {
            throw new IllegalArgumentException("missing_percentage must be within [0, 100], got " + missingPercentage);
        }
    }
}
