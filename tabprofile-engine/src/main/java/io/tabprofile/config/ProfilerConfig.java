package io.tabprofile.config;

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

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Immutable thresholds and limits for type inference, statistics and report assembly.
 *
 * <h2>Defaults</h2>
 *
 * <table>
 *   <caption>Default settings</caption>
 *   <tr><th>Setting</th><th>Default</th></tr>
 *   <tr><td>idUniquenessThreshold</td><td>0.9</td></tr>
 *   <tr><td>identifierNamePatterns</td><td>id, .*_id, id_.*, .*identifier.*, .*key, .*code, .*uuid.*, pk, .*_pk</td></tr>
 *   <tr><td>inferNumericIdentifiers</td><td>false</td></tr>
 *   <tr><td>maxIdentifierValue</td><td>999,999,999,999</td></tr>
 *   <tr><td>datetimeParseThreshold</td><td>1.0</td></tr>
 *   <tr><td>numericParseThreshold</td><td>0.9</td></tr>
 *   <tr><td>categoricalMaxUniqueCount</td><td>20</td></tr>
 *   <tr><td>categoricalRatioThreshold</td><td>0.5</td></tr>
 *   <tr><td>topK</td><td>3</td></tr>
 *   <tr><td>sampleValueCount</td><td>5</td></tr>
 *   <tr><td>parallelism</td><td>1 (sequential)</td></tr>
 * </table>
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * ProfilerConfig config = ProfilerConfig.builder()
 *     .categoricalMaxUniqueCount(50)
 *     .topK(10)
 *     .build();
 * }</pre>
 *
 * <p>All validation happens in {@link Builder#build()}; a built config is always usable.
 *
 * @see ProfilerConfigLoader
 */
public final class ProfilerConfig {

    public static final double DEFAULT_ID_UNIQUENESS_THRESHOLD = 0.9;
    public static final long DEFAULT_MAX_IDENTIFIER_VALUE = 999_999_999_999L;
    public static final double DEFAULT_DATETIME_PARSE_THRESHOLD = 1.0;
    public static final double DEFAULT_NUMERIC_PARSE_THRESHOLD = 0.9;
    public static final int DEFAULT_CATEGORICAL_MAX_UNIQUE_COUNT = 20;
    public static final double DEFAULT_CATEGORICAL_RATIO_THRESHOLD = 0.5;
    public static final int DEFAULT_TOP_K = 3;
    public static final int DEFAULT_SAMPLE_VALUE_COUNT = 5;

    /// Full-match patterns, applied to the normalized (snake_case, lower-case) column name.
    public static final List<String> DEFAULT_IDENTIFIER_NAME_PATTERNS = List.of(
        "id", ".*_id", "id_.*", ".*identifier.*", ".*key", ".*code", ".*uuid.*", "pk", ".*_pk");

    public static final List<String> DEFAULT_DATETIME_FORMATS = List.of(
        "yyyy-MM-dd",
        "yyyy-MM-dd'T'HH:mm[:ss][.SSSSSSSSS][.SSSSSS][.SSS][XXX]",
        "yyyy-MM-dd HH:mm[:ss][.SSSSSSSSS][.SSSSSS][.SSS][XXX]",
        "yyyy/MM/dd",
        "yyyy/MM/dd HH:mm[:ss]",
        "MM/dd/yyyy",
        "MM/dd/yyyy HH:mm[:ss]");

    public static final Set<String> DEFAULT_ABSENT_MARKERS = Collections.unmodifiableSet(new LinkedHashSet<>(List.of(
        "NA", "N/A", "n/a", "NaN", "nan", "null", "NULL", "None", "#N/A")));

    private static final ProfilerConfig DEFAULTS = builder().build();

    private final double idUniquenessThreshold;
    private final List<Pattern> identifierNamePatterns;
    private final boolean inferNumericIdentifiers;
    private final long maxIdentifierValue;
    private final List<String> datetimeFormats;
    private final List<DateTimeFormatter> datetimeFormatters;
    private final double datetimeParseThreshold;
    private final ZoneId zone;
    private final double numericParseThreshold;
    private final int categoricalMaxUniqueCount;
    private final double categoricalRatioThreshold;
    private final int topK;
    private final int sampleValueCount;
    private final Set<String> absentMarkers;
    private final int parallelism;
    private final Long sampleSeed;

    private ProfilerConfig(Builder b, List<Pattern> namePatterns, List<DateTimeFormatter> formatters) {
        this.idUniquenessThreshold = b.idUniquenessThreshold;
        this.identifierNamePatterns = namePatterns;
        this.inferNumericIdentifiers = b.inferNumericIdentifiers;
        this.maxIdentifierValue = b.maxIdentifierValue;
        this.datetimeFormats = List.copyOf(b.datetimeFormats);
        this.datetimeFormatters = formatters;
        this.datetimeParseThreshold = b.datetimeParseThreshold;
        this.zone = b.zone;
        this.numericParseThreshold = b.numericParseThreshold;
        this.categoricalMaxUniqueCount = b.categoricalMaxUniqueCount;
        this.categoricalRatioThreshold = b.categoricalRatioThreshold;
        this.topK = b.topK;
        this.sampleValueCount = b.sampleValueCount;
        this.absentMarkers = Collections.unmodifiableSet(new LinkedHashSet<>(b.absentMarkers));
        this.parallelism = b.parallelism;
        this.sampleSeed = b.sampleSeed;
    }

    /// @return the shared default configuration
    public static ProfilerConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// @return a builder pre-populated with this configuration's settings
    public Builder toBuilder() {
        Builder b = new Builder();
        b.idUniquenessThreshold = idUniquenessThreshold;
        b.identifierNamePatterns = new ArrayList<>();
        identifierNamePatterns.forEach(p -> b.identifierNamePatterns.add(p.pattern()));
        b.inferNumericIdentifiers = inferNumericIdentifiers;
        b.maxIdentifierValue = maxIdentifierValue;
        b.datetimeFormats = new ArrayList<>(datetimeFormats);
        b.datetimeParseThreshold = datetimeParseThreshold;
        b.zone = zone;
        b.numericParseThreshold = numericParseThreshold;
        b.categoricalMaxUniqueCount = categoricalMaxUniqueCount;
        b.categoricalRatioThreshold = categoricalRatioThreshold;
        b.topK = topK;
        b.sampleValueCount = sampleValueCount;
        b.absentMarkers = new LinkedHashSet<>(absentMarkers);
        b.parallelism = parallelism;
        b.sampleSeed = sampleSeed;
        return b;
    }

    public double idUniquenessThreshold() {
        return idUniquenessThreshold;
    }

    /// @return compiled, case-insensitive name patterns
    public List<Pattern> identifierNamePatterns() {
        return identifierNamePatterns;
    }

    public boolean inferNumericIdentifiers() {
        return inferNumericIdentifiers;
    }

    public long maxIdentifierValue() {
        return maxIdentifierValue;
    }

    public List<String> datetimeFormats() {
        return datetimeFormats;
    }

    /// @return one formatter per entry of [#datetimeFormats()], in the same order
    public List<DateTimeFormatter> datetimeFormatters() {
        return datetimeFormatters;
    }

    public double datetimeParseThreshold() {
        return datetimeParseThreshold;
    }

    /// @return the zone used to place local date-times on the time line
    public ZoneId zone() {
        return zone;
    }

    public double numericParseThreshold() {
        return numericParseThreshold;
    }

    public int categoricalMaxUniqueCount() {
        return categoricalMaxUniqueCount;
    }

    public double categoricalRatioThreshold() {
        return categoricalRatioThreshold;
    }

    public int topK() {
        return topK;
    }

    public int sampleValueCount() {
        return sampleValueCount;
    }

    public Set<String> absentMarkers() {
        return absentMarkers;
    }

    public int parallelism() {
        return parallelism;
    }

    /// @return the seed for random row sampling, or null to seed from the environment
    public Long sampleSeed() {
        return sampleSeed;
    }

    @Override
    public String toString() {
        return "ProfilerConfig{idUniqueness=" + idUniquenessThreshold
            + ", numericIds=" + inferNumericIdentifiers
            + ", datetimeParse=" + datetimeParseThreshold
            + ", numericParse=" + numericParseThreshold
            + ", categoricalMaxUnique=" + categoricalMaxUniqueCount
            + ", categoricalRatio=" + categoricalRatioThreshold
            + ", topK=" + topK
            + ", samples=" + sampleValueCount
            + ", parallelism=" + parallelism
            + ", zone=" + zone + "}";
    }

    /**
     * Builder for {@link ProfilerConfig}.
     */
    public static final class Builder {
        private double idUniquenessThreshold = DEFAULT_ID_UNIQUENESS_THRESHOLD;
        private List<String> identifierNamePatterns = new ArrayList<>(DEFAULT_IDENTIFIER_NAME_PATTERNS);
        private boolean inferNumericIdentifiers = false;
        private long maxIdentifierValue = DEFAULT_MAX_IDENTIFIER_VALUE;
        private List<String> datetimeFormats = new ArrayList<>(DEFAULT_DATETIME_FORMATS);
        private double datetimeParseThreshold = DEFAULT_DATETIME_PARSE_THRESHOLD;
        private ZoneId zone = ZoneOffset.UTC;
        private double numericParseThreshold = DEFAULT_NUMERIC_PARSE_THRESHOLD;
        private int categoricalMaxUniqueCount = DEFAULT_CATEGORICAL_MAX_UNIQUE_COUNT;
        private double categoricalRatioThreshold = DEFAULT_CATEGORICAL_RATIO_THRESHOLD;
        private int topK = DEFAULT_TOP_K;
        private int sampleValueCount = DEFAULT_SAMPLE_VALUE_COUNT;
        private Set<String> absentMarkers = new LinkedHashSet<>(DEFAULT_ABSENT_MARKERS);
        private int parallelism = 1;
        private Long sampleSeed = null;

        private Builder() {
        }

        /// Minimum share of distinct present values for a column to count as an identifier.
        public Builder idUniquenessThreshold(double threshold) {
            this.idUniquenessThreshold = threshold;
            return this;
        }

        /// Replaces the identifier name patterns (regular expressions, full match, case-insensitive).
        public Builder identifierNamePatterns(List<String> patterns) {
            this.identifierNamePatterns = patterns == null ? null : new ArrayList<>(patterns);
            return this;
        }

        /// Whether unnamed columns of distinct positive integers are identifiers.
        public Builder inferNumericIdentifiers(boolean enabled) {
            this.inferNumericIdentifiers = enabled;
            return this;
        }

        public Builder maxIdentifierValue(long max) {
            this.maxIdentifierValue = max;
            return this;
        }

        /// Replaces the date-time patterns, in [DateTimeFormatter] pattern syntax.
        public Builder datetimeFormats(List<String> formats) {
            this.datetimeFormats = formats == null ? null : new ArrayList<>(formats);
            return this;
        }

        public Builder datetimeParseThreshold(double threshold) {
            this.datetimeParseThreshold = threshold;
            return this;
        }

        public Builder zone(ZoneId zone) {
            this.zone = zone;
            return this;
        }

        public Builder numericParseThreshold(double threshold) {
            this.numericParseThreshold = threshold;
            return this;
        }

        public Builder categoricalMaxUniqueCount(int count) {
            this.categoricalMaxUniqueCount = count;
            return this;
        }

        public Builder categoricalRatioThreshold(double threshold) {
            this.categoricalRatioThreshold = threshold;
            return this;
        }

        /// Number of entries kept in categorical frequency tables.
        public Builder topK(int topK) {
            this.topK = topK;
            return this;
        }

        /// Number of present values kept as samples on each column profile.
        public Builder sampleValueCount(int count) {
            this.sampleValueCount = count;
            return this;
        }

        /// Replaces the strings that mark a cell as absent. Blank strings are always absent.
        public Builder absentMarkers(Set<String> markers) {
            this.absentMarkers = markers == null ? null : new LinkedHashSet<>(markers);
            return this;
        }

        /// Number of columns profiled concurrently; 1 profiles on the calling thread.
        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        /// Seed for random row sampling, or null for a fresh seed on every selection.
        public Builder sampleSeed(Long seed) {
            this.sampleSeed = seed;
            return this;
        }

        /// Validates the settings and builds the configuration.
        ///
        /// @return the configuration
        /// @throws IllegalArgumentException if any setting is out of range or malformed
        public ProfilerConfig build() {
            requireFraction("id_uniqueness_threshold", idUniquenessThreshold);
            requireFraction("datetime_parse_threshold", datetimeParseThreshold);
            requireFraction("numeric_parse_threshold", numericParseThreshold);
            requireFraction("categorical_ratio_threshold", categoricalRatioThreshold);
            if (maxIdentifierValue < 1) {
                throw new IllegalArgumentException("max_identifier_value must be positive, got " + maxIdentifierValue);
            }
            if (categoricalMaxUniqueCount < 0) {
                throw new IllegalArgumentException(
                    "categorical_max_unique_count must be non-negative, got " + categoricalMaxUniqueCount);
            }
            if (topK < 1) {
                throw new IllegalArgumentException("top_k must be at least 1, got " + topK);
            }
            if (sampleValueCount < 0) {
                throw new IllegalArgumentException("sample_value_count must be non-negative, got " + sampleValueCount);
            }
            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be positive, got " + parallelism);
            }
            if (zone == null) {
                throw new IllegalArgumentException("zone cannot be null");
            }
            if (absentMarkers == null || absentMarkers.contains(null)) {
                throw new IllegalArgumentException("absent_markers cannot be null or contain null");
            }
            return new ProfilerConfig(this, compilePatterns(), compileFormats());
        }

        private List<Pattern> compilePatterns() {
            if (identifierNamePatterns == null) {
                throw new IllegalArgumentException("identifier_name_patterns cannot be null");
            }
            List<Pattern> compiled = new ArrayList<>(identifierNamePatterns.size());
            for (String pattern : identifierNamePatterns) {
                Objects.requireNonNull(pattern, "identifier_name_patterns cannot contain null");
                try {
                    compiled.add(Pattern.compile(pattern, Pattern.CASE_INSENSITIVE));
                } catch (PatternSyntaxException e) {
                    throw new IllegalArgumentException("Invalid identifier name pattern '" + pattern + "': "
                        + e.getDescription(), e);
                }
            }
            return List.copyOf(compiled);
        }

        private List<DateTimeFormatter> compileFormats() {
            if (datetimeFormats == null) {
                throw new IllegalArgumentException("datetime_formats cannot be null");
            }
            List<DateTimeFormatter> formatters = new ArrayList<>(datetimeFormats.size());
            for (String format : datetimeFormats) {
                Objects.requireNonNull(format, "datetime_formats cannot contain null");
                try {
                    formatters.add(DateTimeFormatter.ofPattern(format));
                } catch (IllegalArgumentException | DateTimeException e) {
                    throw new IllegalArgumentException("Invalid datetime format '" + format + "': " + e.getMessage(), e);
                }
            }
            return List.copyOf(formatters);
        }

        private static void requireFraction(String name, double value) {
            if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be within [0, 1], got " + value);
            }
        }
    }
}
