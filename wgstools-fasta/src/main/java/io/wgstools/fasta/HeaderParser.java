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
import io.wgstools.api.CorruptRecordException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Parses legacy pipe-delimited headers of one collection.
///
/// The accession is the collection id followed by five to eight digits, a dot and a single
/// version digit; the description is everything after the `|` that follows it. The pattern
/// is compiled once per collection.
public final class HeaderParser {

    private final CollectionId collection;
    private final Pattern pattern;

    private HeaderParser(CollectionId collection) {
        this.collection = collection;
        this.pattern = Pattern.compile("(" + Pattern.quote(collection.value()) + "\\d{5,8}\\.\\d)\\|(.*)$", Pattern.DOTALL);
    }

    /// @param collection the collection whose accessions are expected
    /// @return a parser for that collection
    public static HeaderParser forCollection(CollectionId collection) {
        return new HeaderParser(collection);
    }

    /// Parse one header line.
    ///
    /// @param line the header line, with or without its terminator
    /// @param source the file the line came from, for error messages
    /// @return the accession and trimmed description
    /// @throws CorruptRecordException if the line does not contain an accession of this collection
    public SequenceHeader parse(String line, String source) {
        Matcher matcher = pattern.matcher(line);
        if (!matcher.find()) {
            throw new CorruptRecordException("Header does not match collection " + collection
                + " in file " + source + ": " + abbreviate(line.strip()));
        }
        return new SequenceHeader(matcher.group(1), matcher.group(2).strip());
    }

    private static String abbreviate(String line) {
        return line.length() <= 80 ? line : line.substring(0, 77) + "...";
    }
}
