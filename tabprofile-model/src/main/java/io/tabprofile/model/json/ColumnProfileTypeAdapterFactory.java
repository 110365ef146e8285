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

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;
import io.tabprofile.model.CategoricalStats;
import io.tabprofile.model.ColumnProfile;
import io.tabprofile.model.DatetimeStats;
import io.tabprofile.model.FieldStats;
import io.tabprofile.model.FieldType;
import io.tabprofile.model.NumericalStats;
import io.tabprofile.model.StringStats;

import java.io.IOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Gson TypeAdapterFactory that maps the {@link FieldStats} union of a {@link ColumnProfile}
 * onto the four nullable stats blocks of the report format.
 *
 * <h2>Wire Shape</h2>
 *
 * <pre>{@code
 *  ColumnProfile(type=BOOLEAN,           {
 *    stats=CategoricalStats)               "name": "active",
 *        │                                 "field_type": "boolean",
 *        ▼                                 "total_count": 50,
 *  1. Write fixed header fields            "categorical_stats": { ... },
 *  2. Write every stats key, in order;     "numerical_stats": null,
 *     only the variant's key gets a        "string_stats": null,
 *     value, the others are null           "datetime_stats": null,
 *  3. Write sample values                  "sample_values": [true, false]
 *                                        }
 * }</pre>
 *
 * <p>On read, exactly one stats block must be non-null and it must be the block that the
 * {@code field_type} selects. Anything else is rejected with a {@link JsonParseException}.
 */
final class ColumnProfileTypeAdapterFactory implements TypeAdapterFactory {

    static final String NAME = "name";
    static final String FIELD_TYPE = "field_type";
    static final String TOTAL_COUNT = "total_count";
    static final String SAMPLE_VALUES = "sample_values";

    private static final Pattern INTEGRAL = Pattern.compile("-?\\d+");

    /// Stats keys in output order, with the variant each one holds.
    private final Map<String, Class<? extends FieldStats>> statsKeys = new LinkedHashMap<>();

    private ColumnProfileTypeAdapterFactory() {
    }

    static ColumnProfileTypeAdapterFactory create() {
        ColumnProfileTypeAdapterFactory factory = new ColumnProfileTypeAdapterFactory();
        factory.statsKeys.put("categorical_stats", CategoricalStats.class);
        factory.statsKeys.put("numerical_stats", NumericalStats.class);
        factory.statsKeys.put("string_stats", StringStats.class);
        factory.statsKeys.put("datetime_stats", DatetimeStats.class);
        return factory;
    }

    /// @return the JSON key that holds the given stats variant
    String keyFor(Class<? extends FieldStats> statsType) {
        for (Map.Entry<String, Class<? extends FieldStats>> entry : statsKeys.entrySet()) {
            if (entry.getValue() == statsType) {
                return entry.getKey();
            }
        }
        throw new IllegalArgumentException("No stats key for " + statsType.getName());
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
        if (type.getRawType() != ColumnProfile.class) {
            return null;
        }
        return (TypeAdapter<T>) new ColumnProfileAdapter(gson);
    }

    private final class ColumnProfileAdapter extends TypeAdapter<ColumnProfile> {

        private final Gson gson;

        private ColumnProfileAdapter(Gson gson) {
            this.gson = gson;
        }

        @Override
        @SuppressWarnings("unchecked")
        public void write(JsonWriter out, ColumnProfile profile) throws IOException {
            if (profile == null) {
                out.nullValue();
                return;
            }
            boolean wasSerializingNulls = out.getSerializeNulls();
            boolean wasLenient = out.isLenient();
            out.setSerializeNulls(true);
            // a standard deviation can overflow to infinity
            out.setLenient(true);
            try {
                out.beginObject();
                out.name(NAME).value(profile.name());
                out.name(FIELD_TYPE).value(profile.fieldType().wireName());
                out.name(TOTAL_COUNT).value(profile.totalCount());
                for (Map.Entry<String, Class<? extends FieldStats>> entry : statsKeys.entrySet()) {
                    out.name(entry.getKey());
                    if (entry.getValue().isInstance(profile.stats())) {
                        TypeAdapter<FieldStats> adapter =
                            (TypeAdapter<FieldStats>) gson.getAdapter(entry.getValue());
                        adapter.write(out, profile.stats());
                    } else {
                        out.nullValue();
                    }
                }
                out.name(SAMPLE_VALUES);
                out.beginArray();
                for (Object value : profile.sampleValues()) {
                    writeSample(out, value);
                }
                out.endArray();
                out.endObject();
            } finally {
                out.setSerializeNulls(wasSerializingNulls);
                out.setLenient(wasLenient);
            }
        }

        private void writeSample(JsonWriter out, Object value) throws IOException {
            if (value instanceof Boolean b) {
                out.value(b);
            } else if (value instanceof Long l) {
                out.value(l);
            } else if (value instanceof Double d) {
                out.value(d);
            } else {
                out.value(String.valueOf(value));
            }
        }

        @Override
        public ColumnProfile read(JsonReader in) throws IOException {
            JsonElement element = JsonParser.parseReader(in);
            if (element.isJsonNull()) {
                return null;
            }
            if (!element.isJsonObject()) {
                throw new JsonParseException("Expected a field profile object but found: " + element);
            }
            JsonObject obj = element.getAsJsonObject();
            String name = required(obj, NAME).getAsString();
            String typeName = required(obj, FIELD_TYPE).getAsString();
            FieldType fieldType;
            try {
                fieldType = FieldType.fromWireName(typeName);
            } catch (IllegalArgumentException e) {
                throw new JsonParseException("Field '" + name + "': " + e.getMessage(), e);
            }
            long totalCount = required(obj, TOTAL_COUNT).getAsLong();

            String populatedKey = null;
            for (String key : statsKeys.keySet()) {
                JsonElement block = obj.get(key);
                if (block != null && !block.isJsonNull()) {
                    if (populatedKey != null) {
                        throw new JsonParseException("Field '" + name + "' has both " + populatedKey
                            + " and " + key + "; exactly one stats block may be set");
                    }
                    populatedKey = key;
                }
            }
            String expectedKey = keyFor(fieldType.statsType());
            if (populatedKey == null) {
                throw new JsonParseException("Field '" + name + "' has no stats block; expected " + expectedKey);
            }
            if (!populatedKey.equals(expectedKey)) {
                throw new JsonParseException("Field '" + name + "' of type " + typeName
                    + " must populate " + expectedKey + " but populates " + populatedKey);
            }
            FieldStats stats = gson.fromJson(obj.get(populatedKey), statsKeys.get(populatedKey));

            List<Object> samples = new ArrayList<>();
            JsonElement sampleElement = obj.get(SAMPLE_VALUES);
            if (sampleElement != null && !sampleElement.isJsonNull()) {
                JsonArray array = sampleElement.getAsJsonArray();
                for (JsonElement sample : array) {
                    samples.add(readSample(name, sample));
                }
            }
            try {
                return new ColumnProfile(name, fieldType, totalCount, stats, samples);
            } catch (IllegalArgumentException | NullPointerException e) {
                throw new JsonParseException("Invalid field profile '" + name + "': " + e.getMessage(), e);
            }
        }

        private Object readSample(String field, JsonElement sample) {
            if (!sample.isJsonPrimitive()) {
                throw new JsonParseException("Field '" + field + "' has a non-scalar sample value: " + sample);
            }
            JsonPrimitive primitive = sample.getAsJsonPrimitive();
            if (primitive.isBoolean()) {
                return primitive.getAsBoolean();
            }
            if (primitive.isNumber()) {
                String text = primitive.getAsString();
                if (INTEGRAL.matcher(text).matches()) {
                    BigInteger integral = new BigInteger(text);
                    // integral text beyond the long range was a double on the way out
                    return integral.bitLength() < 64 ? (Object) integral.longValue() : (Object) integral.doubleValue();
                }
                return primitive.getAsDouble();
            }
            return primitive.getAsString();
        }

        private JsonElement required(JsonObject obj, String key) {
            JsonElement value = obj.get(key);
            if (value == null || value.isJsonNull()) {
                throw new JsonParseException("Missing '" + key + "' in field profile: " + obj);
            }
            return value;
        }
    }
}
