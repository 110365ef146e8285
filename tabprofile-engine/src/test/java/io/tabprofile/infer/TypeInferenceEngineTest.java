package io.tabprofile.infer;

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
import io.tabprofile.infer.TypeInferenceEngine.Rule;
import io.tabprofile.model.FieldType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;

@DisplayName("TypeInferenceEngine")
class TypeInferenceEngineTest {

    private final TypeInferenceEngine engine = new TypeInferenceEngine(ProfilerConfig.defaults());

    private static List<Object> range(int from, int to) {
        return IntStream.rangeClosed(from, to).boxed().collect(Collectors.toList());
    }

    private static List<Object> repeat(Object value, int times) {
        return new ArrayList<>(Collections.nCopies(times, value));
    }

    @Nested
    @DisplayName("identifier rule")
    class Identifier {

        @Test
        @DisplayName("a column named id holding distinct integers should be an identifier")
        void namedIdColumn() {
            TypeInferenceEngine.Inference inference = engine.classify("id", range(1, 50));

            assertThat(inference.fieldType()).isEqualTo(FieldType.IDENTIFIER);
            assertThat(inference.rule()).isEqualTo(Rule.IDENTIFIER_NAME);
        }

        @ParameterizedTest
        @CsvSource({"userId, user_id", "User ID, user_id", "user-id, user_id", "HTTPStatusCode, http_status_code",
            "PK, pk"})
        @DisplayName("should normalize column names to lower snake case")
        void normalizesNames(String name, String expected) {
            assertThat(TypeInferenceEngine.normalizeName(name)).isEqualTo(expected);
        }

        @Test
        @DisplayName("an identifier-like name with repeated values should not be an identifier")
        void namedButNotUnique() {
            List<Object> values = new ArrayList<>(range(1, 40));
            values.addAll(range(1, 10));

            assertThat(engine.infer("customer_id", values)).isEqualTo(FieldType.INTEGER);
        }

        @Test
        @DisplayName("UUID values should make an identifier regardless of the name")
        void uuidColumn() {
            List<Object> values = IntStream.range(0, 20).mapToObj(i -> UUID.randomUUID().toString())
                .collect(Collectors.toList());

            assertThat(engine.classify("token", values).rule()).isEqualTo(Rule.IDENTIFIER_UUID);
        }

        @Test
        @DisplayName("unnamed distinct integers should stay integer unless numeric identifiers are enabled")
        void numericIdentifiersAreOptIn() {
            assertThat(engine.infer("amount", range(1, 50))).isEqualTo(FieldType.INTEGER);

            TypeInferenceEngine enabled = new TypeInferenceEngine(
                ProfilerConfig.builder().inferNumericIdentifiers(true).build());
            assertThat(enabled.classify("amount", range(1, 50)).rule()).isEqualTo(Rule.IDENTIFIER_NUMERIC);
            assertThat(enabled.infer("amount", range(-1, 48))).isEqualTo(FieldType.INTEGER);
        }

        @Test
        @DisplayName("identifier should win over categorical for a small unique column")
        void identifierBeatsCategorical() {
            assertThat(engine.infer("code", List.of("a", "b", "c"))).isEqualTo(FieldType.IDENTIFIER);
        }
    }

    @Nested
    @DisplayName("value rules")
    class ValueRules {

        @Test
        @DisplayName("38 true and 12 false should be boolean")
        void booleanColumn() {
            List<Object> values = repeat(true, 38);
            values.addAll(repeat(false, 12));

            assertThat(engine.infer("active", values)).isEqualTo(FieldType.BOOLEAN);
        }

        @Test
        @DisplayName("yes/no text and 0/1 numbers should be boolean, three literals should not")
        void booleanLiterals() {
            assertThat(engine.infer("flag", List.of("Yes", "no", " YES "))).isEqualTo(FieldType.BOOLEAN);
            assertThat(engine.infer("flag", List.of(0, 1, 1, 0))).isEqualTo(FieldType.BOOLEAN);
            assertThat(engine.infer("flag", List.of("yes", "no", "true"))).isEqualTo(FieldType.CATEGORICAL);
        }

        @Test
        @DisplayName("date text and temporal objects should be datetime")
        void datetimeColumn() {
            assertThat(engine.infer("joined", List.of("2024-01-05", "2024-02-10 08:30:00", "2023-12-31T23:59:59Z")))
                .isEqualTo(FieldType.DATETIME);
            assertThat(engine.infer("joined", List.of(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 2))))
                .isEqualTo(FieldType.DATETIME);
        }

        @Test
        @DisplayName("one unparseable date should fall below the default datetime threshold")
        void datetimeThreshold() {
            List<Object> values = List.of("2024-01-05", "2024-01-06", "soon");
            assertThat(engine.infer("joined", values)).isEqualTo(FieldType.CATEGORICAL);

            TypeInferenceEngine lenient = new TypeInferenceEngine(
                ProfilerConfig.builder().datetimeParseThreshold(0.6).build());
            assertThat(lenient.infer("joined", values)).isEqualTo(FieldType.DATETIME);
        }

        @Test
        @DisplayName("integers 1..50 should be integer and any fraction should make float")
        void numericColumns() {
            assertThat(engine.infer("age", range(1, 50))).isEqualTo(FieldType.INTEGER);
            assertThat(engine.infer("price", List.of("1.5", "2", "3.25"))).isEqualTo(FieldType.FLOAT);
            assertThat(engine.infer("count", List.of(1.0, 2.0, 3.0))).isEqualTo(FieldType.INTEGER);
        }

        @Test
        @DisplayName("numeric text with a few stray values should still be numeric")
        void numericThreshold() {
            List<Object> values = new ArrayList<>();
            for (int i = 0; i < 19; i++) {
                values.add(Integer.toString(i * 7));
            }
            values.add("n/k");

            assertThat(engine.infer("reading", values)).isEqualTo(FieldType.INTEGER);
        }

        @Test
        @DisplayName("low cardinality text should be categorical")
        void categoricalColumn() {
            List<Object> values = repeat("Engineering", 17);
            values.addAll(repeat("Marketing", 17));
            values.addAll(repeat("Sales", 16));

            assertThat(engine.classify("department", values).rule()).isEqualTo(Rule.CATEGORICAL_CARDINALITY);
        }

        @Test
        @DisplayName("high cardinality text should fall back to string")
        void stringColumn() {
            List<Object> values = IntStream.range(0, 30).mapToObj(i -> "note number " + i)
                .collect(Collectors.toList());

            assertThat(engine.classify("comment", values).rule()).isEqualTo(Rule.STRING_FALLBACK);
        }
    }

    @Nested
    @DisplayName("degenerate columns")
    class Degenerate {

        @Test
        @DisplayName("an all-absent column should be string")
        void allAbsent() {
            List<Object> values = Arrays.asList(null, "", "NA", Double.NaN);

            assertThat(engine.classify("empty", values).rule()).isEqualTo(Rule.NO_PRESENT_VALUES);
            assertThat(engine.infer("empty", List.of())).isEqualTo(FieldType.STRING);
        }

        @Test
        @DisplayName("a single repeated text value should be categorical")
        void singleValue() {
            assertThat(engine.infer("status", repeat("open", 10))).isEqualTo(FieldType.CATEGORICAL);
        }

        @Test
        @DisplayName("classification should ignore absent cells and be repeatable")
        void deterministic() {
            List<Object> values = Arrays.asList(1, null, 2, "NA", 3);

            assertThat(engine.infer("n", values)).isEqualTo(FieldType.INTEGER);
            assertThat(engine.infer("n", values)).isEqualTo(engine.infer("n", values));
        }
    }
}
