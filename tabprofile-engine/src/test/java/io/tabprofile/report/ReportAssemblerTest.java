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
import io.tabprofile.model.AnalysisReport;
import io.tabprofile.model.CategoricalStats;
import io.tabprofile.model.Column;
import io.tabprofile.model.ColumnProfile;
import io.tabprofile.model.Dataset;
import io.tabprofile.model.FieldType;
import io.tabprofile.model.NumericalStats;
import io.tabprofile.model.SourceDescriptor;
import io.tabprofile.model.StringStats;
import io.tabprofile.model.TopValue;
import io.tabprofile.model.json.ReportJson;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ReportAssembler")
class ReportAssemblerTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2024-03-01T10:15:30.123456789Z"), ZoneOffset.UTC);

    private static List<Object> range(int from, int to) {
        return IntStream.rangeClosed(from, to).boxed().collect(Collectors.toList());
    }

    private static List<Object> repeat(Object value, int times) {
        return new ArrayList<>(Collections.nCopies(times, value));
    }

    /// Fifty rows with one column for each profiled type.
    private static Dataset people() {
        List<Object> departments = repeat("Engineering", 17);
        departments.addAll(repeat("Marketing", 17));
        departments.addAll(repeat("Sales", 16));
        List<Object> active = repeat(true, 38);
        active.addAll(repeat(false, 12));
        List<Object> joined = IntStream.range(0, 50).mapToObj(i -> LocalDate.of(2020, 1, 1).plusDays(i * 7L))
            .collect(Collectors.toList());
        return Dataset.of(SourceDescriptor.of("/data/people.csv"), List.of(
            new Column("age", range(1, 50)),
            new Column("department", departments),
            new Column("active", active),
            new Column("notes", repeat(null, 50)),
            new Column("id", range(1, 50)),
            new Column("joined", joined)));
    }

    private final ReportAssembler assembler = new ReportAssembler(ProfilerConfig.defaults(), FIXED);

    @Nested
    @DisplayName("column types")
    class ColumnTypes {

        @Test
        @DisplayName("integers 1..50 should profile as integer with the expected moments")
        void integerColumn() {
            ColumnProfile age = assembler.assemble(people()).field("age");

            assertThat(age.fieldType()).isEqualTo(FieldType.INTEGER);
            NumericalStats stats = age.numericalStats();
            assertThat(stats.mean()).isEqualTo(25.5);
            assertThat(stats.median()).isEqualTo(25.5);
            assertThat(stats.stdDev()).isCloseTo(14.5774, within(1e-4));
            assertThat(stats.quartiles().q25()).isEqualTo(13.25);
            assertThat(stats.quartiles().q75()).isEqualTo(37.75);
            assertThat(stats.missingPercentage()).isZero();
        }

        @Test
        @DisplayName("departments should profile as categorical with alphabetical ties")
        void categoricalColumn() {
            ColumnProfile department = assembler.assemble(people()).field("department");

            assertThat(department.fieldType()).isEqualTo(FieldType.CATEGORICAL);
            assertThat(department.categoricalStats().uniqueCount()).isEqualTo(3);
            assertThat(department.categoricalStats().topValues()).containsExactly(
                new TopValue("Engineering", 17, 34.0),
                new TopValue("Marketing", 17, 34.0),
                new TopValue("Sales", 16, 32.0));
        }

        @Test
        @DisplayName("38 true and 12 false should profile as boolean")
        void booleanColumn() {
            ColumnProfile active = assembler.assemble(people()).field("active");

            assertThat(active.fieldType()).isEqualTo(FieldType.BOOLEAN);
            assertThat(active.categoricalStats().topValues())
                .containsExactly(new TopValue("True", 38, 76.0), new TopValue("False", 12, 24.0));
        }

        @Test
        @DisplayName("an all-absent column should profile as string, fully missing")
        void allAbsentColumn() {
            ColumnProfile notes = assembler.assemble(people()).field("notes");

            assertThat(notes.fieldType()).isEqualTo(FieldType.STRING);
            StringStats stats = notes.stringStats();
            assertThat(stats.missingPercentage()).isEqualTo(100.0);
            assertThat(stats.uniqueCount()).isZero();
            assertThat(stats.avgLength()).isNull();
            assertThat(notes.totalCount()).isZero();
            assertThat(notes.sampleValues()).isEmpty();
        }

        @Test
        @DisplayName("a column named id with distinct integers should profile as identifier")
        void identifierColumn() {
            ColumnProfile id = assembler.assemble(people()).field("id");

            assertThat(id.fieldType()).isEqualTo(FieldType.IDENTIFIER);
            assertThat(id.categoricalStats().uniqueCount()).isEqualTo(50);
        }
    }

    @Nested
    @DisplayName("report")
    class Report {

        @Test
        @DisplayName("should describe the source and keep fields in column order")
        void reportHeader() {
            AnalysisReport report = assembler.assemble(people());

            assertThat(report.filePath()).isEqualTo("/data/people.csv");
            assertThat(report.fileType()).isEqualTo("csv");
            assertThat(report.totalRows()).isEqualTo(50);
            assertThat(report.totalColumns()).isEqualTo(6);
            assertThat(report.fields()).extracting(ColumnProfile::name)
                .containsExactly("age", "department", "active", "notes", "id", "joined");
            assertThat(report.field("joined").fieldType()).isEqualTo(FieldType.DATETIME);
            assertThat(report.analysisTimestamp()).isEqualTo(LocalDateTime.of(2024, 3, 1, 10, 15, 30, 123_456_000));
            assertThat(report.processingTimeSeconds()).isGreaterThanOrEqualTo(0.0);
        }

        @Test
        @DisplayName("completeness should be 100 minus the mean missing percentage")
        void completeness() {
            // one of six columns is fully missing
            assertThat(assembler.assemble(people()).completenessPercentage()).isEqualTo(83.33);
        }

        @Test
        @DisplayName("every stats block should balance missing and present counts against the row count")
        void countsBalance() {
            AnalysisReport report = assembler.assemble(people());

            for (ColumnProfile field : report.fields()) {
                long present = field.stats().presentCount(report.totalRows());
                assertThat(present + field.stats().missingCount()).as(field.name()).isEqualTo(report.totalRows());
                if (field.stats() instanceof CategoricalStats c) {
                    assertThat(c.uniqueCount()).as(field.name()).isLessThanOrEqualTo(present);
                    assertThat(c.topValues().stream().mapToDouble(TopValue::percentage).sum())
                        .as(field.name()).isLessThanOrEqualTo(100.0);
                }
            }
        }

        @Test
        @DisplayName("samples should be the first present values in row order")
        void samples() {
            Dataset dataset = Dataset.of(SourceDescriptor.inMemory(),
                List.of(Column.of("v", null, "a", "NA", "b", "c", "", "d", "e", "f")));

            ColumnProfile field = assembler.assemble(dataset).fields().get(0);

            assertThat(field.sampleValues()).containsExactly("a", "b", "c", "d", "e");
            assertThat(field.totalCount()).isEqualTo(6);
        }

        @Test
        @DisplayName("a dataset without columns should give an empty, zero-complete report")
        void noColumns() {
            AnalysisReport report = assembler.assemble(Dataset.of(SourceDescriptor.inMemory(), List.of()));

            assertThat(report.fields()).isEmpty();
            assertThat(report.completenessPercentage()).isZero();
            assertThat(report.fileType()).isEqualTo("memory");
        }

        @Test
        @DisplayName("profiling should be repeatable")
        void idempotent() {
            Dataset dataset = people();

            AnalysisReport first = assembler.assemble(dataset);
            AnalysisReport second = assembler.assemble(dataset);

            assertThat(second.fields()).isEqualTo(first.fields());
            assertThat(second.analysisTimestamp()).isEqualTo(first.analysisTimestamp());
        }
    }

    @Nested
    @DisplayName("parallel profiling")
    class Parallel {

        @Test
        @DisplayName("should produce the same fields in the same order as sequential profiling")
        void matchesSequential() {
            ReportAssembler parallel = new ReportAssembler(ProfilerConfig.builder().parallelism(4).build(), FIXED);
            Dataset dataset = people();

            assertThat(parallel.assemble(dataset).fields()).isEqualTo(assembler.assemble(dataset).fields());
        }

        @Test
        @DisplayName("should rethrow a worker failure unchanged")
        void propagatesFailure() {
            Object poison = new Object() {
                @Override
                public String toString() {
                    throw new IllegalStateException("unprintable cell");
                }
            };
            Dataset dataset = Dataset.of(SourceDescriptor.inMemory(),
                List.of(Column.of("a", 1, 2), Column.of("b", poison, poison)));
            ReportAssembler parallel = new ReportAssembler(ProfilerConfig.builder().parallelism(2).build(), FIXED);

            assertThatThrownBy(() -> parallel.assemble(dataset))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("unprintable cell");
        }
    }

    @Test
    @DisplayName("an assembled report should survive a JSON round trip")
    void jsonRoundTrip() {
        AnalysisReport report = assembler.assemble(people());

        assertThat(ReportJson.fromJson(ReportJson.toJson(report))).isEqualTo(report);
    }

    @Test
    @DisplayName("wide integers and infinite cells should survive a JSON round trip")
    void jsonRoundTripOfWideValues() {
        Dataset dataset = Dataset.of(SourceDescriptor.inMemory(), List.of(
            Column.of("n", 1234567890123456789L, 1234567890123456780L),
            Column.of("reading", 1.5, Double.POSITIVE_INFINITY)));

        AnalysisReport report = assembler.assemble(dataset);
        AnalysisReport restored = ReportJson.fromJson(ReportJson.toJson(report));

        assertThat(restored).isEqualTo(report);
        assertThat(restored.field("n").sampleValues()).containsExactly(1234567890123456789L, 1234567890123456780L);
        assertThat(restored.field("reading").sampleValues()).containsExactly(1.5, "Infinity");
    }
}
