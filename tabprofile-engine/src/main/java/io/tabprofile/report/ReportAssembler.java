package io.tabprofile.report;

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

import io.tabprofile.config.ProfilerConfig;
import io.tabprofile.infer.CellValues;
import io.tabprofile.infer.TypeInferenceEngine;
import io.tabprofile.model.AnalysisReport;
import io.tabprofile.model.Column;
import io.tabprofile.model.ColumnProfile;
import io.tabprofile.model.Dataset;
import io.tabprofile.model.FieldStats;
import io.tabprofile.model.FieldType;
import io.tabprofile.stats.StatisticsComputer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.Future;

/**
 * Profiles every column of a dataset and assembles the {@link AnalysisReport}.
 *
 * <h2>Pipeline</h2>
 *
 * <pre>
 * ┌─────────────────────────────────────────────────────────────────────────┐
 * │ for each column (sequential, or one ForkJoinPool task per column)        │
 * │   1. infer the field type          TypeInferenceEngine                  │
 * │   2. compute the stats block       StatisticsComputer                   │
 * │   3. count present cells, take the first present values as samples      │
 * ├─────────────────────────────────────────────────────────────────────────┤
 * │ join profiles by column index, stamp time and elapsed seconds           │
 * └─────────────────────────────────────────────────────────────────────────┘
 * </pre>
 *
 * <p>Columns are independent, so with {@code parallelism > 1} each column is profiled on its own
 * task. Results are collected by index, so the report lists fields in source order no matter
 * which task finishes first. The pool lives only for the duration of one {@link #assemble} call.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * ReportAssembler assembler = new ReportAssembler(ProfilerConfig.builder().parallelism(4).build());
 * AnalysisReport report = assembler.assemble(dataset);
 * String json = ReportJson.toJson(report);
 * }</pre>
 */
public final class ReportAssembler {

    private static final Logger logger = LogManager.getLogger(ReportAssembler.class);

    private final ProfilerConfig config;
    private final TypeInferenceEngine inference;
    private final StatisticsComputer statistics;
    private final CellValues cells;
    private final Clock clock;

    public ReportAssembler() {
        this(ProfilerConfig.defaults());
    }

    public ReportAssembler(ProfilerConfig config) {
        this(config, Clock.systemDefaultZone());
    }

    /// @param config thresholds and limits shared by inference and statistics
    /// @param clock source of the analysis timestamp
    public ReportAssembler(ProfilerConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.inference = new TypeInferenceEngine(config);
        this.statistics = new StatisticsComputer(config);
        this.cells = new CellValues(config);
    }

    /// Profiles a dataset.
    ///
    /// @param dataset the dataset to profile
    /// @return the report, with one field profile per column in column order
    public AnalysisReport assemble(Dataset dataset) {
        Objects.requireNonNull(dataset, "dataset cannot be null");
        LocalDateTime startedAt = LocalDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);
        long startNanos = System.nanoTime();

        List<ColumnProfile> fields = config.parallelism() > 1 && dataset.columnCount() > 1
            ? profileParallel(dataset)
            : profileSequential(dataset);

        double elapsedSeconds = (System.nanoTime() - startNanos) / 1_000_000_000.0;
        AnalysisReport report = new AnalysisReport(dataset.source().path(), dataset.source().format(),
            dataset.rowCount(), dataset.columnCount(), fields, startedAt, elapsedSeconds);

        logger.info("Profiled {}: {} rows, {} columns, {}% complete in {}s",
            report.filePath(), report.totalRows(), report.totalColumns(),
            String.format("%.2f", report.completenessPercentage()),
            String.format("%.3f", elapsedSeconds));
        return report;
    }

    /// Profiles a single column.
    ///
    /// @param column the column
    /// @return the column's profile
    public ColumnProfile profile(Column column) {
        List<Object> values = column.values();
        FieldType fieldType = inference.infer(column.name(), values);
        FieldStats stats = statistics.compute(fieldType, values);

        long presentCount = 0;
        List<Object> samples = new ArrayList<>(config.sampleValueCount());
        for (Object value : values) {
            if (cells.isAbsent(value)) {
                continue;
            }
            presentCount++;
            if (samples.size() < config.sampleValueCount()) {
                samples.add(value);
            }
        }

        logger.debug("Column '{}': type={}, present={}, missing={} ({}%)", column.name(), fieldType.wireName(),
            presentCount, stats.missingCount(), String.format("%.2f", stats.missingPercentage()));
        return new ColumnProfile(column.name(), fieldType, presentCount, stats, samples);
    }

    private List<ColumnProfile> profileSequential(Dataset dataset) {
        List<ColumnProfile> fields = new ArrayList<>(dataset.columnCount());
        for (Column column : dataset.columns()) {
            fields.add(profile(column));
        }
        return fields;
    }

    private List<ColumnProfile> profileParallel(Dataset dataset) {
        List<Column> columns = dataset.columns();
        ForkJoinPool pool = new ForkJoinPool(Math.min(config.parallelism(), columns.size()));
        try {
            List<Future<ColumnProfile>> futures = new ArrayList<>(columns.size());
            for (Column column : columns) {
                futures.add(pool.submit(() -> profile(column)));
            }
            List<ColumnProfile> fields = new ArrayList<>(columns.size());
            for (int i = 0; i < futures.size(); i++) {
                fields.add(await(futures.get(i), columns.get(i).name()));
            }
            return fields;
        } finally {
            pool.shutdownNow();
        }
    }

    private static ColumnProfile await(Future<ColumnProfile> future, String columnName) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while profiling column '" + columnName + "'", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Failed to profile column '" + columnName + "'", cause);
        }
    }
}
