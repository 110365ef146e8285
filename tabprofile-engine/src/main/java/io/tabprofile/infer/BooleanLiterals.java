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

import java.util.Locale;
import java.util.Set;

/// The fixed vocabulary of boolean cell values and their display form.
public final class BooleanLiterals {

    public static final String TRUE_DISPLAY = "True";
    public static final String FALSE_DISPLAY = "False";

    public static final Set<String> TRUTHY = Set.of("true", "yes", "1", "t", "y", "on");
    public static final Set<String> FALSY = Set.of("false", "no", "0", "f", "n", "off");

    private BooleanLiterals() {
    }

    /// @return the trimmed, lower-cased literal, or null when the value is not a boolean literal
    public static String normalize(Object value) {
        if (value == null) {
            return null;
        }
        String literal = CellValues.text(value).trim().toLowerCase(Locale.ROOT);
        return TRUTHY.contains(literal) || FALSY.contains(literal) ? literal : null;
    }

    /// @return `"True"` or `"False"`, or null when the value is not a boolean literal
    public static String display(Object value) {
        String literal = normalize(value);
        if (literal == null) {
            return null;
        }
        return TRUTHY.contains(literal) ? TRUE_DISPLAY : FALSE_DISPLAY;
    }
}
