package io.tabprofile.model;

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

import com.google.gson.annotations.SerializedName;

/// The semantic type inferred for a column.
///
/// Each type selects exactly one [FieldStats] variant. [#BOOLEAN] and [#IDENTIFIER] keep their
/// own tag for display but are summarized with [CategoricalStats].
public enum FieldType {

    @SerializedName("integer")
    INTEGER("integer", NumericalStats.class),

    @SerializedName("float")
    FLOAT("float", NumericalStats.class),

    @SerializedName("boolean")
    BOOLEAN("boolean", CategoricalStats.class),

    @SerializedName("datetime")
    DATETIME("datetime", DatetimeStats.class),

    @SerializedName("categorical")
    CATEGORICAL("categorical", CategoricalStats.class),

    @SerializedName("identifier")
    IDENTIFIER("identifier", CategoricalStats.class),

    @SerializedName("string")
    STRING("string", StringStats.class);

    private final String wireName;
    private final Class<? extends FieldStats> statsType;

    FieldType(String wireName, Class<? extends FieldStats> statsType) {
        this.wireName = wireName;
        this.statsType = statsType;
    }

    /// @return the lower-case name used in the report JSON
    public String wireName() {
        return wireName;
    }

    /// @return the stats variant that summarizes columns of this type
    public Class<? extends FieldStats> statsType() {
        return statsType;
    }

    public boolean isNumeric() {
        return statsType == NumericalStats.class;
    }

    /// Looks up a type by its JSON name.
    ///
    /// @param wireName the name as written in a report
    /// @return the matching type
    /// @throws IllegalArgumentException if no type has that name
    public static FieldType fromWireName(String wireName) {
        for (FieldType type : values()) {
            if (type.wireName.equals(wireName)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown field type: '" + wireName + "'");
    }
}
