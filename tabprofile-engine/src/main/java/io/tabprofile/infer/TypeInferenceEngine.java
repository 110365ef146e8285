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
import io.tabprofile.model.FieldType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Classifies a column into a {@link FieldType} from its name and raw values.
 *
 * <h2>Rule cascade</h2>
 *
 * <p>Rules are tried in order and the first match wins:
 *
 * <pre>
 * ┌──────────────────────────────────────────────────────────────────────┐
 * │ 0. no present values                                   → STRING      │
 * │ 1. identifier name + unique, UUID text, numeric keys*  → IDENTIFIER  │
 * │ 2. boolean literals, at most two distinct              → BOOLEAN     │
 * │ 3. date / date-time parse ratio                        → DATETIME    │
 * │ 4. numeric parse ratio                                 → INTEGER or  │
 * │                                                          FLOAT       │
 * │ 5. low cardinality                                     → CATEGORICAL │
 * │ 6. anything else                                       → STRING      │
 * └──────────────────────────────────────────────────────────────────────┘
 *   * only when numeric identifier inference is enabled
 * </pre>
 *
 * <p>Classification is total: it never throws for any combination of values, and the same
 * input always yields the same type. Instances are immutable and safe to share across threads.
 *
 * @see ProfilerConfig
 */
public final class TypeInferenceEngine {

    private static final Logger logger = LogManager.getLogger(TypeInferenceEngine.class);

    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("([a-z0-9])([A-Z])");
    private static final Pattern ACRONYM_BOUNDARY = Pattern.compile("([A-Z]+)([A-Z][a-z])");
    private static final Pattern SEPARATORS = Pattern.compile("[\\s\\-]+");

    /// The rule that decided a classification.
    public enum Rule {
        NO_PRESENT_VALUES,
        IDENTIFIER_NAME,
        IDENTIFIER_UUID,
        IDENTIFIER_NUMERIC,
        BOOLEAN_LITERALS,
        DATETIME_PARSE,
        NUMERIC_PARSE,
        CATEGORICAL_CARDINALITY,
        STRING_FALLBACK
    }

    /// A classification together with the rule that produced it.
    ///
    /// @param fieldType the inferred type
    /// @param rule the rule that fired
    public record Inference(FieldType fieldType, Rule rule) {
    }

    private final ProfilerConfig config;
    private final CellValues cells;

    public TypeInferenceEngine(ProfilerConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.cells = new CellValues(config);
    }

    /// Infers the type of a column.
    ///
    /// @param columnName the column name, used by the identifier name rule
    /// @param rawValues the column's values in row order
    /// @return the inferred type
    public FieldType infer(String columnName, List<?> rawValues) {
        return classify(columnName, rawValues).fieldType();
    }

    /// Infers the type of a column and reports which rule decided it.
    ///
    /// @param columnName the column name, used by the identifier name rule
    /// @param rawValues the column's values in row order
    /// @return the inference
    public Inference classify(String columnName, List<?> rawValues) {
        Inference inference = decide(columnName == null ? "" : columnName, cells.present(rawValues));
        logger.debug("Column '{}' classified as {} by {}", columnName, inference.fieldType().wireName(),
            inference.rule());
        return inference;
    }

    private Inference decide(String columnName, List<Object> present) {
        int n = present.size();
        if (n == 0) {
            return new Inference(FieldType.STRING, Rule.NO_PRESENT_VALUES);
        }

        Set<String> distinct = new HashSet<>();
        for (Object value : present) {
            distinct.add(CellValues.text(value));
        }
        double uniqueness = (double) distinct.size() / n;

        if (uniqueness > config.idUniquenessThreshold() && nameLooksLikeIdentifier(columnName)) {
            return new Inference(FieldType.IDENTIFIER, Rule.IDENTIFIER_NAME);
        }
        if (ratio(present, CellValues::isUuid) >= config.idUniquenessThreshold()) {
            return new Inference(FieldType.IDENTIFIER, Rule.IDENTIFIER_UUID);
        }
        if (config.inferNumericIdentifiers() && uniqueness > config.idUniquenessThreshold()
            && allPositiveIntegers(present)) {
            return new Inference(FieldType.IDENTIFIER, Rule.IDENTIFIER_NUMERIC);
        }

        if (isBooleanColumn(present)) {
            return new Inference(FieldType.BOOLEAN, Rule.BOOLEAN_LITERALS);
        }

        if (ratio(present, v -> cells.toInstant(v) != null) >= config.datetimeParseThreshold()) {
            return new Inference(FieldType.DATETIME, Rule.DATETIME_PARSE);
        }

        int parsed = 0;
        boolean whole = true;
        for (Object value : present) {
            Double d = CellValues.toNumber(value);
            if (d != null) {
                parsed++;
                whole &= CellValues.isWhole(d);
            }
        }
        if (parsed > 0 && (double) parsed / n >= config.numericParseThreshold()) {
            return new Inference(whole ? FieldType.INTEGER : FieldType.FLOAT, Rule.NUMERIC_PARSE);
        }

        if (distinct.size() <= config.categoricalMaxUniqueCount()
            || uniqueness < config.categoricalRatioThreshold()) {
            return new Inference(FieldType.CATEGORICAL, Rule.CATEGORICAL_CARDINALITY);
        }
        return new Inference(FieldType.STRING, Rule.STRING_FALLBACK);
    }

    /// Brings a column name to lower snake case: `userId`, `User ID` and `user-id` all become `user_id`.
    public static String normalizeName(String columnName) {
        String s = ACRONYM_BOUNDARY.matcher(columnName.trim()).replaceAll("$1_$2");
        s = CAMEL_BOUNDARY.matcher(s).replaceAll("$1_$2");
        s = SEPARATORS.matcher(s).replaceAll("_");
        return s.toLowerCase(Locale.ROOT);
    }

    private boolean nameLooksLikeIdentifier(String columnName) {
        String normalized = normalizeName(columnName);
        for (Pattern pattern : config.identifierNamePatterns()) {
            if (pattern.matcher(normalized).matches()) {
                return true;
            }
        }
        return false;
    }

    private boolean allPositiveIntegers(List<Object> present) {
        for (Object value : present) {
            Double d = CellValues.toNumber(value);
            if (d == null || !CellValues.isWhole(d) || d < 1 || d > config.maxIdentifierValue()) {
                return false;
            }
        }
        return true;
    }

    private static boolean isBooleanColumn(List<Object> present) {
        Set<String> literals = new HashSet<>();
        for (Object value : present) {
            String literal = BooleanLiterals.normalize(value);
            if (literal == null) {
                return false;
            }
            literals.add(literal);
            if (literals.size() > 2) {
                return false;
            }
        }
        return true;
    }

    private static double ratio(List<Object> present, Predicate<Object> test) {
        int hits = 0;
        for (Object value : present) {
            if (test.test(value)) {
                hits++;
            }
        }
        return (double) hits / present.size();
    }
}
