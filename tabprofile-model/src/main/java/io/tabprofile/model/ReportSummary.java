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

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/// Dataset-level roll-up of a report, as shown at the top of a rendered profile.
///
/// Maps only contain the field types that occur in the report and iterate in [FieldType] order.
///
/// @param totalFields number of field profiles
/// @param typeCounts how many fields were inferred as each type
/// @param fieldsByType field names per type, in column order
/// @param totalMissing sum of the missing counts of all fields
/// @param completenessPercentage see [AnalysisReport#completenessPercentage()]
public record ReportSummary(
    int totalFields,
    Map<FieldType, Integer> typeCounts,
    Map<FieldType, List<String>> fieldsByType,
    long totalMissing,
    double completenessPercentage
) {

    public ReportSummary {
        Map<FieldType, Integer> counts = new EnumMap<>(FieldType.class);
        counts.putAll(typeCounts);
        typeCounts = Collections.unmodifiableMap(counts);
        Map<FieldType, List<String>> names = new EnumMap<>(FieldType.class);
        fieldsByType.forEach((type, list) -> names.put(type, List.copyOf(list)));
        fieldsByType = Collections.unmodifiableMap(names);
    }

    /// Builds the summary of a report.
    public static ReportSummary of(AnalysisReport report) {
        Map<FieldType, Integer> counts = new EnumMap<>(FieldType.class);
        Map<FieldType, List<String>> byType = new EnumMap<>(FieldType.class);
        long missing = 0;
        for (ColumnProfile field : report.fields()) {
            counts.merge(field.fieldType(), 1, Integer::sum);
            byType.computeIfAbsent(field.fieldType(), t -> new ArrayList<>()).add(field.name());
            missing += field.stats().missingCount();
        }
        return new ReportSummary(report.fields().size(), counts, byType, missing, report.completenessPercentage());
    }

    /// @return the number of fields of the given type, 0 if none
    public int count(FieldType type) {
        return typeCounts.getOrDefault(type, 0);
    }
}
