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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/// A named, ordered sequence of raw cell values.
///
/// Cells hold whatever scalar the reader produced: a [String], a [Number], a [Boolean],
/// a `java.time` temporal or a [java.util.Date]. A `null` cell is absent. Whether other
/// values (blank strings, NaN, marker strings such as `NA`) count as absent is decided by
/// the profiler configuration, not by the column.
public final class Column {

    private final String name;
    private final List<Object> values;

    /// Creates a column holding a copy of the given values.
    ///
    /// @param name the column name
    /// @param values the raw values, in row order; may contain nulls
    public Column(String name, List<?> values) {
        this.name = Objects.requireNonNull(name, "column name cannot be null");
        Objects.requireNonNull(values, "values cannot be null");
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    /// Convenience factory for tests and small in-memory tables.
    public static Column of(String name, Object... values) {
        return new Column(name, Arrays.asList(values));
    }

    public String name() {
        return name;
    }

    /// @return the raw values in row order, unmodifiable
    public List<Object> values() {
        return values;
    }

    public int size() {
        return values.size();
    }

    public Object value(int row) {
        return values.get(row);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Column)) return false;
        Column other = (Column) o;
        return name.equals(other.name) && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, values);
    }

    @Override
    public String toString() {
        return "Column[" + name + ", " + values.size() + " values]";
    }
}
