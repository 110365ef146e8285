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

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Interprets raw cell values: absence, canonical text, and parsing as numbers, dates and UUIDs.
 *
 * <p>Raw values arrive as whatever the upstream reader produced, so every method accepts any object
 * and answers {@code null} or {@code false} instead of throwing when a value does not fit.
 * Instances hold the configured absent markers, date patterns and zone; the text helpers are static.
 */
public final class CellValues {

    private static final Pattern NUMERIC_LITERAL =
        Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern UUID_TEXT = Pattern.compile(
        "[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");

    private final Set<String> absentMarkers;
    private final List<DateTimeFormatter> formatters;
    private final ZoneId zone;

    public CellValues(ProfilerConfig config) {
        this.absentMarkers = config.absentMarkers();
        this.formatters = config.datetimeFormatters();
        this.zone = config.zone();
    }

    /// A cell is absent when it is null, a NaN floating point value, a blank string, or one of the
    /// configured absent markers.
    public boolean isAbsent(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof Double d) {
            return d.isNaN();
        }
        if (value instanceof Float f) {
            return f.isNaN();
        }
        if (value instanceof CharSequence cs) {
            String s = cs.toString().trim();
            return s.isEmpty() || absentMarkers.contains(s);
        }
        return false;
    }

    /// @return the present values in row order
    public List<Object> present(List<?> values) {
        List<Object> present = new ArrayList<>(values.size());
        for (Object value : values) {
            if (!isAbsent(value)) {
                present.add(value);
            }
        }
        return present;
    }

    /**
     * Canonical text of a value, used for distinctness, frequency keys and string lengths.
     *
     * @param value a present value
     * @return the canonical text
     */
    public static String text(Object value) {
        if (value instanceof String s) {
            return s;
        }
        if (value instanceof Boolean b) {
            return b ? "true" : "false";
        }
        if (value instanceof Double d) {
            return isWhole(d) ? BigDecimal.valueOf(d).setScale(0).toPlainString() : d.toString();
        }
        if (value instanceof Float f) {
            return isWhole(f) ? new BigDecimal(Float.toString(f)).setScale(0).toPlainString() : f.toString();
        }
        if (value instanceof BigDecimal dec) {
            return dec.toPlainString();
        }
        if (value instanceof Date date) {
            return Instant.ofEpochMilli(date.getTime()).toString();
        }
        return String.valueOf(value);
    }

    /**
     * Parses a value as a finite number.
     *
     * @param value a present value
     * @return the numeric value, or null when the value is not a number
     */
    public static Double toNumber(Object value) {
        if (value instanceof Boolean) {
            return null;
        }
        double d;
        if (value instanceof Number n) {
            d = n.doubleValue();
        } else if (value instanceof CharSequence cs) {
            String s = cs.toString().trim();
            if (!NUMERIC_LITERAL.matcher(s).matches()) {
                return null;
            }
            d = Double.parseDouble(s);
        } else {
            return null;
        }
        return Double.isFinite(d) ? d : null;
    }

    /// @return true for a number with no fractional part
    public static boolean isWhole(double d) {
        return Double.isFinite(d) && d == Math.rint(d);
    }

    /// @return true when the value's text is an 8-4-4-4-12 hexadecimal UUID
    public static boolean isUuid(Object value) {
        return value != null && UUID_TEXT.matcher(text(value).trim()).matches();
    }

    /**
     * Places a value on the time line.
     *
     * <p>Temporal objects convert directly. Strings are tried against each configured pattern in order;
     * local date-times are resolved in the configured zone and dates at the start of their day.
     * Numbers and booleans never parse.
     *
     * @param value a present value
     * @return the instant, or null when the value is not a date or date-time
     */
    public Instant toInstant(Object value) {
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof ZonedDateTime zdt) {
            return zdt.toInstant();
        }
        if (value instanceof OffsetDateTime odt) {
            return odt.toInstant();
        }
        if (value instanceof LocalDateTime ldt) {
            return ldt.atZone(zone).toInstant();
        }
        if (value instanceof LocalDate ld) {
            return ld.atStartOfDay(zone).toInstant();
        }
        if (value instanceof Date date) {
            return Instant.ofEpochMilli(date.getTime());
        }
        if (value instanceof TemporalAccessor temporal) {
            try {
                return Instant.from(temporal);
            } catch (DateTimeException e) {
                return null;
            }
        }
        if (value instanceof CharSequence cs) {
            return parseText(cs.toString().trim());
        }
        return null;
    }

    private Instant parseText(String text) {
        if (text.isEmpty()) {
            return null;
        }
        for (DateTimeFormatter formatter : formatters) {
            TemporalAccessor parsed;
            try {
                parsed = formatter.parseBest(text, ZonedDateTime::from, LocalDateTime::from, LocalDate::from);
            } catch (DateTimeParseException e) {
                continue;
            }
            if (parsed instanceof ZonedDateTime zdt) {
                return zdt.toInstant();
            }
            if (parsed instanceof LocalDateTime ldt) {
                return ldt.atZone(zone).toInstant();
            }
            if (parsed instanceof LocalDate ld) {
                return ld.atStartOfDay(zone).toInstant();
            }
        }
        return null;
    }
}
