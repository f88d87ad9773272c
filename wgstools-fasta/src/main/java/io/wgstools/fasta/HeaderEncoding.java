package io.wgstools.fasta;

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

import io.wgstools.api.CollectionId;

/// The two header encodings found in WGS project FASTA files.
public enum HeaderEncoding {
    /// Headers are already `>accession description`; the file is copied as is
    CANONICAL,
    /// Headers carry the accession followed by `|` and the description, and are rewritten
    LEGACY_PIPE;

    /// Width of the prefix of the first line that is searched for the collection id.
    public static final int DETECTION_WIDTH = 7;

    /// Detect the encoding of a file from its first line.
    ///
    /// @param collection the collection the file belongs to
    /// @param firstLine the first line of the decompressed file
    /// @return [#CANONICAL] if the collection id occurs within the first seven characters
    public static HeaderEncoding detect(CollectionId collection, String firstLine) {
        String prefix = firstLine.substring(0, Math.min(DETECTION_WIDTH, firstLine.length()));
        return prefix.contains(collection.value()) ? CANONICAL : LEGACY_PIPE;
    }
}
