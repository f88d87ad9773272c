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

import java.util.Objects;

/// The accession and description of one sequence record.
///
/// @param accession the versioned accession, for example `AAAA01000001.1`
/// @param description free text describing the record, already trimmed
public record SequenceHeader(String accession, String description) {

    public SequenceHeader {
        Objects.requireNonNull(accession, "accession");
        Objects.requireNonNull(description, "description");
    }

    /// @return the canonical header line `>accession description`, without a line terminator;
    /// the separating space is kept when the description is empty
    public String canonical() {
        return ">" + accession + " " + description;
    }
}
