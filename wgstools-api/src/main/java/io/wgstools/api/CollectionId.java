package io.wgstools.api;

/*
 * Copyright (c) wgstools
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

import java.util.Objects;

/// Identifier of one remote WGS project, as published by the discovery service.
///
/// The identifier determines where the project lives on the archive: the first two
/// characters, then the next two characters, then the identifier itself, all under
/// a common base directory.
///
/// @param value
///     the raw identifier text, for example `AAAA01`
public record CollectionId(String value) implements Comparable<CollectionId> {

    public CollectionId {
        Objects.requireNonNull(value, "collection id");
        value = value.trim();
        if (value.isEmpty()) {
            throw new IllegalArgumentException("Collection id cannot be empty");
        }
    }

    /// @param value the raw identifier text
    /// @return a new collection id
    public static CollectionId of(String value) {
        return new CollectionId(value);
    }

    /// The sharded path of this project relative to the archive base directory,
    /// for example `AA/AA/AAAA01`.
    ///
    /// Identifiers shorter than four characters are sliced leniently.
    /// @return the relative remote path
    public String shardedPath() {
        return slice(0, 2) + "/" + slice(2, 4) + "/" + value;
    }

    /// @param baseDirectory the archive base directory, with or without a trailing slash
    /// @return the absolute remote directory of this project
    public String remoteDirectory(String baseDirectory) {
        String base = baseDirectory.endsWith("/") ? baseDirectory : baseDirectory + "/";
        return base + shardedPath();
    }

    /// @param filename a local or remote file name
    /// @return true if the file name belongs to this project
    public boolean owns(String filename) {
        return filename.startsWith(value);
    }

    private String slice(int from, int to) {
        int start = Math.min(from, value.length());
        int end = Math.min(to, value.length());
        return value.substring(start, end);
    }

    @Override
    public int compareTo(CollectionId other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
