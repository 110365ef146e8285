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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

@DisplayName("CellValues")
class CellValuesTest {

    private final CellValues cells = new CellValues(ProfilerConfig.defaults());

    @Nested
    @DisplayName("absence")
    class Absence {

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "NA", "N/A", "null", "None", " NaN ", "#N/A"})
        @DisplayName("should treat blanks and markers as absent")
        void markersAreAbsent(String text) {
            assertThat(cells.isAbsent(text)).isTrue();
        }

        @Test
        @DisplayName("should treat null and NaN as absent but keep zero and false")
        void nullAndNaN() {
            assertThat(cells.isAbsent(null)).isTrue();
            assertThat(cells.isAbsent(Double.NaN)).isTrue();
            assertThat(cells.isAbsent(Float.NaN)).isTrue();
            assertThat(cells.isAbsent(0)).isFalse();
            assertThat(cells.isAbsent(false)).isFalse();
            assertThat(cells.isAbsent("none")).isFalse();
        }
    }

    @Nested
    @DisplayName("canonical text")
    class CanonicalText {

        @Test
        @DisplayName("should write whole floating point values as integer digits")
        void wholeFloats() {
            assertThat(CellValues.text(3.0)).isEqualTo("3");
            assertThat(CellValues.text(3.0f)).isEqualTo("3");
            assertThat(CellValues.text(3)).isEqualTo("3");
            assertThat(CellValues.text(2.5)).isEqualTo("2.5");
        }

        @Test
        @DisplayName("should write booleans, big decimals and temporals in their plain forms")
        void plainForms() {
            assertThat(CellValues.text(Boolean.TRUE)).isEqualTo("true");
            assertThat(CellValues.text(new BigDecimal("1E+3"))).isEqualTo("1000");
            assertThat(CellValues.text(LocalDate.of(2024, 1, 5))).isEqualTo("2024-01-05");
        }
    }

    @Nested
    @DisplayName("parsing")
    class Parsing {

        @Test
        @DisplayName("should parse numeric literals and reject everything else")
        void numbers() {
            assertThat(CellValues.toNumber(" 42 ")).isEqualTo(42.0);
            assertThat(CellValues.toNumber("-1.5e3")).isEqualTo(-1500.0);
            assertThat(CellValues.toNumber(".5")).isEqualTo(0.5);
            assertThat(CellValues.toNumber(7L)).isEqualTo(7.0);
            assertThat(CellValues.toNumber("1,000")).isNull();
            assertThat(CellValues.toNumber("0x1F")).isNull();
            assertThat(CellValues.toNumber("Infinity")).isNull();
            assertThat(CellValues.toNumber(Double.POSITIVE_INFINITY)).isNull();
            assertThat(CellValues.toNumber(true)).isNull();
        }

        @Test
        @DisplayName("should place supported date texts on the time line in the configured zone")
        void dates() {
            assertThat(cells.toInstant("2024-01-05")).isEqualTo(Instant.parse("2024-01-05T00:00:00Z"));
            assertThat(cells.toInstant("2024-01-05T10:15:30")).isEqualTo(Instant.parse("2024-01-05T10:15:30Z"));
            assertThat(cells.toInstant("2024-01-05T10:15:30+02:00")).isEqualTo(Instant.parse("2024-01-05T08:15:30Z"));
            assertThat(cells.toInstant("2024-01-05 10:15:30.123456"))
                .isEqualTo(Instant.parse("2024-01-05T10:15:30.123456Z"));
            assertThat(cells.toInstant("2024/01/05")).isEqualTo(Instant.parse("2024-01-05T00:00:00Z"));
            assertThat(cells.toInstant("01/05/2024")).isEqualTo(Instant.parse("2024-01-05T00:00:00Z"));

            CellValues berlin = new CellValues(ProfilerConfig.builder().zone(ZoneId.of("Europe/Berlin")).build());
            assertThat(berlin.toInstant(LocalDateTime.of(2024, 1, 5, 12, 0)))
                .isEqualTo(Instant.parse("2024-01-05T11:00:00Z"));
        }

        @Test
        @DisplayName("should never parse numbers, booleans or free text as dates")
        void nonDates() {
            assertThat(cells.toInstant(20240105)).isNull();
            assertThat(cells.toInstant(true)).isNull();
            assertThat(cells.toInstant("next tuesday")).isNull();
            assertThat(cells.toInstant("2024")).isNull();
        }

        @Test
        @DisplayName("should recognize UUID text in either case")
        void uuids() {
            assertThat(CellValues.isUuid(UUID.randomUUID())).isTrue();
            assertThat(CellValues.isUuid("123E4567-E89B-12D3-A456-426614174000")).isTrue();
            assertThat(CellValues.isUuid("123e4567-e89b-12d3-a456")).isFalse();
        }
    }

    @Test
    @DisplayName("boolean literals should map to their display form")
    void booleanLiterals() {
        assertThat(BooleanLiterals.display(" YES ")).isEqualTo("True");
        assertThat(BooleanLiterals.display(0)).isEqualTo("False");
        assertThat(BooleanLiterals.display(false)).isEqualTo("False");
        assertThat(BooleanLiterals.display("maybe")).isNull();
        assertThat(BooleanLiterals.normalize(1.0)).isEqualTo("1");
    }
}
