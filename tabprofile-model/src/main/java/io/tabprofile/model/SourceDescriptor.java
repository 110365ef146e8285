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

import java.util.Locale;
import java.util.Objects;

/// Describes where a dataset came from.
///
/// @param path the path or locator of the source, as given by the reader that produced the dataset
/// @param format the short format name, such as `csv` or `parquet`
public record SourceDescriptor(String path, String format) {

    /// Path used for datasets that were built directly in memory.
    public static final String IN_MEMORY_PATH = "<memory>";

    public SourceDescriptor {
        Objects.requireNonNull(path, "path cannot be null");
        Objects.requireNonNull(format, "format cannot be null");
    }

    /// Creates a descriptor whose format is the lower-cased file extension of the path,
    /// or an empty string when the path has none.
    ///
    /// @param path the source path
    /// @return a descriptor for the path
    public static SourceDescriptor of(String path) {
        Objects.requireNonNull(path, "path cannot be null");
        String fileName = path.substring(Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\')) + 1);
        int dot = fileName.lastIndexOf('.');
        String format = dot >= 0 ? fileName.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
        return new SourceDescriptor(path, format);
    }

    /// @return a descriptor for a dataset that has no backing file
    public static SourceDescriptor inMemory() {
        return new SourceDescriptor(IN_MEMORY_PATH, "memory");
    }
}
