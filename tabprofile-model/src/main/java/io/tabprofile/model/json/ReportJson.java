package io.tabprofile.model.json;

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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonIOException;
import com.google.gson.JsonParseException;
import io.tabprofile.model.AnalysisReport;

import java.io.Reader;
import java.io.StringReader;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Objects;

/// Centralized Gson configuration for the report format.
///
/// ## Usage
///
/// ```java
/// String json = ReportJson.toJson(report);
/// AnalysisReport restored = ReportJson.fromJson(json);
/// assert restored.equals(report);
/// ```
///
/// ## Configuration
///
/// | Feature | Setting | Purpose |
/// |---------|---------|---------|
/// | Serialize nulls | Enabled | Unused stats blocks and undefined aggregates appear as `null` |
/// | HTML escaping | Disabled | Values are written verbatim |
/// | Special floats | Enabled | Infinite sample values do not fail serialization |
/// | Field profile adapter | Registered | Maps the stats union to the four nullable blocks |
/// | java.time adapters | Registered | `yyyy-MM-dd HH:mm:ss[.ffffff]` timestamps |
///
/// ## Thread Safety
///
/// The [Gson] instances are thread-safe and shared.
public final class ReportJson {

    private static final Gson INSTANCE = builder().setPrettyPrinting().create();
    private static final Gson COMPACT = builder().create();

    private ReportJson() {
        // Utility class
    }

    /// @return the shared pretty-printing Gson instance
    public static Gson gson() {
        return INSTANCE;
    }

    /// @return the shared single-line Gson instance, for NDJSON style output
    public static Gson compactGson() {
        return COMPACT;
    }

    /// Creates a new GsonBuilder with the report adapters registered, for callers that
    /// need to customize the configuration further.
    ///
    /// @return a new builder
    public static GsonBuilder builder() {
        return new GsonBuilder()
            .serializeNulls()
            .disableHtmlEscaping()
            .serializeSpecialFloatingPointValues()
            .registerTypeAdapter(Instant.class, TimeAdapters.instant())
            .registerTypeAdapter(LocalDateTime.class, TimeAdapters.localDateTime())
            .registerTypeAdapterFactory(ColumnProfileTypeAdapterFactory.create());
    }

    /// Serializes a report with the pretty-printing instance.
    public static String toJson(AnalysisReport report) {
        Objects.requireNonNull(report, "report cannot be null");
        return INSTANCE.toJson(report, AnalysisReport.class);
    }

    /// Serializes a report to a writer. The writer is not closed.
    ///
    /// @throws JsonIOException if writing fails
    public static void toJson(AnalysisReport report, Appendable writer) {
        Objects.requireNonNull(report, "report cannot be null");
        INSTANCE.toJson(report, AnalysisReport.class, writer);
    }

    /// Parses a report.
    ///
    /// @param json the report JSON
    /// @return the report
    /// @throws JsonParseException if the text is not a valid report
    public static AnalysisReport fromJson(String json) {
        Objects.requireNonNull(json, "json cannot be null");
        return fromJson(new StringReader(json));
    }

    /// Parses a report from a reader. The reader is not closed.
    ///
    /// @throws JsonParseException if the content is not a valid report
    public static AnalysisReport fromJson(Reader reader) {
        Objects.requireNonNull(reader, "reader cannot be null");
        AnalysisReport report;
        try {
            report = INSTANCE.fromJson(reader, AnalysisReport.class);
        } catch (JsonParseException e) {
            throw e;
        } catch (RuntimeException e) {
            // record constructors reject inconsistent values; Gson wraps those failures
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new JsonParseException("Invalid analysis report: " + cause.getMessage(), e);
        }
        if (report == null) {
            throw new JsonParseException("Empty analysis report document");
        }
        return report;
    }
}
