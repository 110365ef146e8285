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

import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;

/// Gson adapters for the `java.time` values in a report.
///
/// Both use the space-separated `yyyy-MM-dd HH:mm:ss` layout that report consumers expect.
/// Instants are written in UTC with only as many fraction digits as they need; the analysis
/// timestamp is always written with six.
final class TimeAdapters {

    /// Reads a date-time with an optional fraction of 0 to 9 digits; writes the minimum digits.
    static final DateTimeFormatter FLEXIBLE = new DateTimeFormatterBuilder()
        .appendPattern("yyyy-MM-dd HH:mm:ss")
        .optionalStart()
        .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
        .optionalEnd()
        .toFormatter();

    static final DateTimeFormatter MICROS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSS");

    private TimeAdapters() {
    }

    static TypeAdapter<Instant> instant() {
        return new TypeAdapter<Instant>() {
            @Override
            public void write(JsonWriter out, Instant value) throws IOException {
                if (value == null) {
                    out.nullValue();
                    return;
                }
                out.value(FLEXIBLE.format(LocalDateTime.ofInstant(value, ZoneOffset.UTC)));
            }

            @Override
            public Instant read(JsonReader in) throws IOException {
                if (in.peek() == JsonToken.NULL) {
                    in.nextNull();
                    return null;
                }
                return parse(in.nextString()).toInstant(ZoneOffset.UTC);
            }
        };
    }

    static TypeAdapter<LocalDateTime> localDateTime() {
        return new TypeAdapter<LocalDateTime>() {
            @Override
            public void write(JsonWriter out, LocalDateTime value) throws IOException {
                if (value == null) {
                    out.nullValue();
                    return;
                }
                out.value(MICROS.format(value));
            }

            @Override
            public LocalDateTime read(JsonReader in) throws IOException {
                if (in.peek() == JsonToken.NULL) {
                    in.nextNull();
                    return null;
                }
                return parse(in.nextString());
            }
        };
    }

    private static LocalDateTime parse(String text) {
        try {
            return LocalDateTime.parse(text, FLEXIBLE);
        } catch (DateTimeParseException e) {
            throw new JsonParseException("Invalid timestamp '" + text + "', expected yyyy-MM-dd HH:mm:ss[.ffffff]", e);
        }
    }
}
