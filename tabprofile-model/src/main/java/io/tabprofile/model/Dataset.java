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

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An in-memory table: an ordered list of equally sized {@link Column}s.
 *
 * <p>Datasets are produced by readers outside this library and are only read by the
 * profiler. Every column must hold exactly {@link #rowCount()} values; construction
 * fails otherwise.
 *
 * <pre>{@code
 * Dataset ds = Dataset.fromRows(SourceDescriptor.of("people.csv"),
 *     List.of("id", "name"),
 *     List.of(List.of(1, "ada"), List.of(2, "grace")));
 * }</pre>
 */
public final class Dataset {

    private final SourceDescriptor source;
    private final List<Column> columns;
    private final int rowCount;
    private final Instant createdAt;

    public Dataset(SourceDescriptor source, List<Column> columns, int rowCount, Instant createdAt) {
        this.source = Objects.requireNonNull(source, "source cannot be null");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt cannot be null");
        Objects.requireNonNull(columns, "columns cannot be null");
        if (rowCount < 0) {
            throw new IllegalArgumentException("rowCount must be non-negative, got " + rowCount);
        }
        for (Column column : columns) {
            Objects.requireNonNull(column, "columns cannot contain null");
            if (column.size() != rowCount) {
                throw new IllegalArgumentException("Column '" + column.name() + "' has " + column.size()
                    + " values but the dataset has " + rowCount + " rows");
            }
        }
        this.columns = List.copyOf(columns);
        this.rowCount = rowCount;
    }

    /// Creates a dataset stamped with the current time, taking the row count from the first column.
    public static Dataset of(SourceDescriptor source, List<Column> columns) {
        int rows = columns.isEmpty() ? 0 : columns.get(0).size();
        return new Dataset(source, columns, rows, Instant.now());
    }

    /// Creates a dataset from row-major data.
    ///
    /// @param source where the rows came from
    /// @param columnNames the column names, in order
    /// @param rows the rows; each must have one value per column
    /// @return the column-major dataset
    public static Dataset fromRows(SourceDescriptor source, List<String> columnNames, List<? extends List<?>> rows) {
        Objects.requireNonNull(columnNames, "columnNames cannot be null");
        Objects.requireNonNull(rows, "rows cannot be null");
        List<List<Object>> cells = new ArrayList<>(columnNames.size());
        for (int c = 0; c < columnNames.size(); c++) {
            cells.add(new ArrayList<>(rows.size()));
        }
        for (int r = 0; r < rows.size(); r++) {
            List<?> row = rows.get(r);
            if (row.size() != columnNames.size()) {
                throw new IllegalArgumentException("Row " + r + " has " + row.size()
                    + " values but there are " + columnNames.size() + " columns");
            }
            for (int c = 0; c < row.size(); c++) {
                cells.get(c).add(row.get(c));
            }
        }
        List<Column> columns = new ArrayList<>(columnNames.size());
        for (int c = 0; c < columnNames.size(); c++) {
            columns.add(new Column(columnNames.get(c), cells.get(c)));
        }
        return new Dataset(source, columns, rows.size(), Instant.now());
    }

    public SourceDescriptor source() {
        return source;
    }

    public List<Column> columns() {
        return columns;
    }

    public int rowCount() {
        return rowCount;
    }

    public int columnCount() {
        return columns.size();
    }

    public Instant createdAt() {
        return createdAt;
    }

    public List<String> columnNames() {
        List<String> names = new ArrayList<>(columns.size());
        for (Column column : columns) {
            names.add(column.name());
        }
        return Collections.unmodifiableList(names);
    }

    /// Returns the raw values of one row, in column order.
    ///
    /// @param index the zero-based row index
    /// @return the row values, unmodifiable; absent cells are returned as stored
    public List<Object> row(int index) {
        Objects.checkIndex(index, rowCount);
        Object[] values = new Object[columns.size()];
        for (int c = 0; c < values.length; c++) {
            values[c] = columns.get(c).value(index);
        }
        return Collections.unmodifiableList(Arrays.asList(values));
    }

    @Override
    public String toString() {
        return "Dataset[" + source.path() + ", " + columns.size() + " columns x " + rowCount + " rows]";
    }
}
