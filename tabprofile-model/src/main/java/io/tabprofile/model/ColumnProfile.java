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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.List;
import java.util.Objects;

/**
 * The profile of one column: its inferred type, its statistics and a few example values.
 *
 * <p>The stats variant must be the one {@link FieldType#statsType()} names for the field type;
 * construction fails otherwise, so a profile can never carry numeric stats for a string column.
 *
 * <p>Sample values are stored in a JSON-safe form so that a profile survives a trip through the
 * report codec unchanged: integral numbers become {@link Long}, other numbers {@link Double},
 * booleans stay {@link Boolean}, temporal values become their ISO text and anything else its
 * string form.
 *
 * @param name the column name
 * @param fieldType the inferred type
 * @param totalCount number of cells that were present in the source
 * @param stats statistics for the column
 * @param sampleValues the first few present values, in row order
 */
public record ColumnProfile(
    String name,
    FieldType fieldType,
    long totalCount,
    FieldStats stats,
    List<Object> sampleValues
) {

    public ColumnProfile {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(fieldType, "fieldType cannot be null");
        Objects.requireNonNull(stats, "stats cannot be null");
        Objects.requireNonNull(sampleValues, "sampleValues cannot be null");
        if (totalCount < 0) {
            throw new IllegalArgumentException("totalCount must be non-negative, got " + totalCount);
        }
        if (!fieldType.statsType().isInstance(stats)) {
            throw new IllegalArgumentException("Field '" + name + "' of type " + fieldType.wireName()
                + " requires " + fieldType.statsType().getSimpleName()
                + " but got " + stats.getClass().getSimpleName());
        }
        List<Object> normalized = new ArrayList<>(sampleValues.size());
        for (Object value : sampleValues) {
            normalized.add(jsonSafe(value));
        }
        sampleValues = Collections.unmodifiableList(normalized);
    }

    /// @return the stats as [NumericalStats], or null for other field types
    public NumericalStats numericalStats() {
        return stats instanceof NumericalStats n ? n : null;
    }

    /// @return the stats as [CategoricalStats], or null for other field types
    public CategoricalStats categoricalStats() {
        return stats instanceof CategoricalStats c ? c : null;
    }

    /// @return the stats as [StringStats], or null for other field types
    public StringStats stringStats() {
        return stats instanceof StringStats s ? s : null;
    }

    /// @return the stats as [DatetimeStats], or null for other field types
    public DatetimeStats datetimeStats() {
        return stats instanceof DatetimeStats d ? d : null;
    }

    /// Converts a raw cell value to the scalar form kept in sample lists.
    ///
    /// @param value a present raw value
    /// @return a [String], [Long], [Double] or [Boolean]
    public static Object jsonSafe(Object value) {
        Objects.requireNonNull(value, "sample values cannot be null");
        if (value instanceof Boolean || value instanceof String || value instanceof Long) {
            return value;
        }
        if (value instanceof Double d) {
            return finiteOrText(d);
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float f) {
            // keep the decimal text of the float, not its binary widening
            return finiteOrText(Double.parseDouble(Float.toString(f)));
        }
        if (value instanceof BigInteger big) {
            return big.bitLength() < 64 ? (Object) big.longValue() : finiteOrText(big.doubleValue());
        }
        if (value instanceof BigDecimal dec) {
            BigDecimal stripped = dec.stripTrailingZeros();
            if (stripped.scale() <= 0 && stripped.precision() - stripped.scale() < 19) {
                return stripped.longValueExact();
            }
            return finiteOrText(dec.doubleValue());
        }
        if (value instanceof Number number) {
            return finiteOrText(number.doubleValue());
        }
        if (value instanceof Date date) {
            return Instant.ofEpochMilli(date.getTime()).toString();
        }
        if (value instanceof TemporalAccessor) {
            return value.toString();
        }
        return value.toString();
    }

    // JSON has no literal for infinity or NaN
    private static Object finiteOrText(double d) {
        return Double.isFinite(d) ? (Object) d : (Object) Double.toString(d);
    }
}
