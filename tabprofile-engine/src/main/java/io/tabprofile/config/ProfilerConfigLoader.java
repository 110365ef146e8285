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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Reads a [ProfilerConfig] from YAML.
///
/// The document is a single mapping with snake_case keys; every key is optional and
/// falls back to the [ProfilerConfig] default:
///
/// ```yaml
/// id_uniqueness_threshold: 0.95
/// identifier_name_patterns: [ "id", ".*_id", "sku" ]
/// infer_numeric_identifiers: false
/// max_identifier_value: 999999999999
/// datetime_formats: [ "yyyy-MM-dd", "dd.MM.yyyy" ]
/// datetime_parse_threshold: 1.0
/// zone: Europe/Berlin
/// numeric_parse_threshold: 0.9
/// categorical_max_unique_count: 20
/// categorical_ratio_threshold: 0.5
/// top_k: 3
/// sample_value_count: 5
/// absent_markers: [ "NA", "-" ]
/// parallelism: 4
/// sample_seed: 42
/// ```
///
/// Unknown keys are rejected so that a misspelt setting never silently reverts to its default.
public final class ProfilerConfigLoader {

    private static final Logger logger = LogManager.getLogger(ProfilerConfigLoader.class);

    public static final Set<String> KEYS = Set.of(
        "id_uniqueness_threshold", "identifier_name_patterns", "infer_numeric_identifiers", "max_identifier_value",
        "datetime_formats", "datetime_parse_threshold", "zone", "numeric_parse_threshold",
        "categorical_max_unique_count", "categorical_ratio_threshold", "top_k", "sample_value_count",
        "absent_markers", "parallelism", "sample_seed");

    private ProfilerConfigLoader() {
    }

    /// Loads a configuration file.
    ///
    /// @param path the YAML file
    /// @return the configuration
    /// @throws UncheckedIOException if the file cannot be read
    /// @throws IllegalArgumentException if the document or any setting is invalid
    public static ProfilerConfig load(Path path) {
        String text;
        try {
            text = Files.readString(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read profiler config " + path, e);
        }
        logger.debug("Loading profiler config from {}", path);
        return fromYaml(text);
    }

    /// Parses a configuration document. An empty document yields the defaults.
    ///
    /// @param yamlText the YAML text
    /// @return the configuration
    /// @throws IllegalArgumentException if the document or any setting is invalid
    public static ProfilerConfig fromYaml(String yamlText) {
        LoadSettings loadSettings = LoadSettings.builder().build();
        Load yaml = new Load(loadSettings);
        Object document;
        try {
            document = yaml.loadFromString(yamlText);
        } catch (YamlEngineException e) {
            throw new IllegalArgumentException("Malformed profiler config: " + e.getMessage(), e);
        }
        if (document == null) {
            return ProfilerConfig.defaults();
        }
        if (!(document instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("Profiler config must be a mapping, got "
                + document.getClass().getSimpleName());
        }
        return fromMap(map);
    }

    /// Applies a parsed mapping over the defaults.
    ///
    /// @param settings snake_case keys to values
    /// @return the configuration
    /// @throws IllegalArgumentException on unknown keys or values of the wrong kind
    public static ProfilerConfig fromMap(Map<?, ?> settings) {
        ProfilerConfig.Builder builder = ProfilerConfig.builder();
        for (Map.Entry<?, ?> entry : settings.entrySet()) {
            String key = String.valueOf(entry.getKey());
            Object value = entry.getValue();
            if (!KEYS.contains(key)) {
                throw new IllegalArgumentException("Unknown profiler config key '" + key + "'");
            }
            if (value == null) {
                if (key.equals("sample_seed")) {
                    builder.sampleSeed(null);
                    continue;
                }
                throw new IllegalArgumentException("Config key '" + key + "' has no value");
            }
            switch (key) {
                case "id_uniqueness_threshold" -> builder.idUniquenessThreshold(asDouble(key, value));
                case "identifier_name_patterns" -> builder.identifierNamePatterns(asStrings(key, value));
                case "infer_numeric_identifiers" -> builder.inferNumericIdentifiers(asBoolean(key, value));
                case "max_identifier_value" -> builder.maxIdentifierValue(asLong(key, value));
                case "datetime_formats" -> builder.datetimeFormats(asStrings(key, value));
                case "datetime_parse_threshold" -> builder.datetimeParseThreshold(asDouble(key, value));
                case "zone" -> builder.zone(asZone(key, value));
                case "numeric_parse_threshold" -> builder.numericParseThreshold(asDouble(key, value));
                case "categorical_max_unique_count" -> builder.categoricalMaxUniqueCount(asInt(key, value));
                case "categorical_ratio_threshold" -> builder.categoricalRatioThreshold(asDouble(key, value));
                case "top_k" -> builder.topK(asInt(key, value));
                case "sample_value_count" -> builder.sampleValueCount(asInt(key, value));
                case "absent_markers" -> builder.absentMarkers(new LinkedHashSet<>(asStrings(key, value)));
                case "parallelism" -> builder.parallelism(asInt(key, value));
                case "sample_seed" -> builder.sampleSeed(asLong(key, value));
                default -> throw new IllegalStateException("unhandled config key " + key);
            }
        }
        return builder.build();
    }

    private static double asDouble(String key, Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        throw wrongKind(key, "a number", value);
    }

    private static long asLong(String key, Object value) {
        if (value instanceof Integer || value instanceof Long) {
            return ((Number) value).longValue();
        }
        throw wrongKind(key, "an integer", value);
    }

    private static int asInt(String key, Object value) {
        long v = asLong(key, value);
        if (v < Integer.MIN_VALUE || v > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Config key '" + key + "' is out of range: " + v);
        }
        return (int) v;
    }

    private static boolean asBoolean(String key, Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        throw wrongKind(key, "true or false", value);
    }

    private static ZoneId asZone(String key, Object value) {
        if (!(value instanceof String s)) {
            throw wrongKind(key, "a zone id", value);
        }
        try {
            return ZoneId.of(s);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Config key '" + key + "' has an invalid zone id '" + s + "'", e);
        }
    }

    private static List<String> asStrings(String key, Object value) {
        if (!(value instanceof List<?> list)) {
            throw wrongKind(key, "a list of strings", value);
        }
        List<String> strings = new ArrayList<>(list.size());
        for (Object item : list) {
            if (item == null) {
                throw new IllegalArgumentException("Config key '" + key + "' contains an empty entry");
            }
            strings.add(String.valueOf(item));
        }
        return strings;
    }

    private static IllegalArgumentException wrongKind(String key, String expected, Object value) {
        return new IllegalArgumentException("Config key '" + key + "' must be " + expected + ", got "
            + value.getClass().getSimpleName() + " '" + value + "'");
    }
}
