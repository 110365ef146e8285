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

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;

/**
 * The profile of a whole dataset.
 *
 * <h2>JSON Schema</h2>
 *
 * <pre>{@code
 * {
 *   "file_path": "people.csv",
 *   "file_type": "csv",
 *   "total_rows": 50,
 *   "total_columns": 2,
 *   "fields": [ { "name": "age", "field_type": "integer", ... } ],
 *   "analysis_timestamp": "2024-03-01 10:15:30.123456",
 *   "processing_time_seconds": 0.012
 * }
 * }</pre>
 *
 * <p>The completeness percentage is derived from the field profiles and is therefore not
 * part of the serialized form. The timestamp is kept at microsecond precision.
 *
 * @param filePath source path
 * @param fileType source format
 * @param totalRows rows in the dataset
 * @param totalColumns columns in the dataset
 * @param fields one profile per column, in source column order
 * @param analysisTimestamp local time the analysis started
 * @param processingTimeSeconds wall time the analysis took
 */
public record AnalysisReport(
    @SerializedName("file_path") String filePath,
    @SerializedName("file_type") String fileType,
    @SerializedName("total_rows") long totalRows,
    @SerializedName("total_columns") int totalColumns,
    @SerializedName("fields") List<ColumnProfile> fields,
    @SerializedName("analysis_timestamp") LocalDateTime analysisTimestamp,
    @SerializedName("processing_time_seconds") double processingTimeSeconds
) {

    public AnalysisReport {
        Objects.requireNonNull(filePath, "file_path cannot be null");
        Objects.requireNonNull(fileType, "file_type cannot be null");
        Objects.requireNonNull(analysisTimestamp, "analysis_timestamp cannot be null");
        fields = List.copyOf(Objects.requireNonNull(fields, "fields cannot be null"));
        if (totalRows < 0 || totalColumns < 0) {
            throw new IllegalArgumentException("row and column counts must be non-negative");
        }
        if (fields.size() != totalColumns) {
            throw new IllegalArgumentException(
                "total_columns is " + totalColumns + " but there are " + fields.size() + " field profiles");
        }
        analysisTimestamp = analysisTimestamp.truncatedTo(ChronoUnit.MICROS);
    }

    /// Percentage of the dataset that is not missing: 100 minus the average per-column missing
    /// percentage, rounded to two decimals. A report without columns has 0 completeness.
    ///
    /// @return the completeness percentage
    public double completenessPercentage() {
        if (fields.isEmpty()) {
            return 0.0;
        }
        double missing = 0.0;
        for (ColumnProfile field : fields) {
            missing += field.stats().missingPercentage();
        }
        double completeness = 100.0 - missing / fields.size();
        return Math.round(completeness * 100.0) / 100.0;
    }

    /// Looks up a field profile by column name.
    ///
    /// @param name the column name
    /// @return the first profile with that name, or null
    public ColumnProfile field(String name) {
        for (ColumnProfile field : fields) {
            if (field.name().equals(name)) {
                return field;
            }
        }
        return null;
    }

    /// @return the summary view of this report
    public ReportSummary summary() {
        return ReportSummary.of(this);
    }
}
