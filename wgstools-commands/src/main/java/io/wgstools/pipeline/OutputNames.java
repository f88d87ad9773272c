package io.wgstools.pipeline;

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

import java.nio.file.Path;
import java.util.Objects;

/// File names derived from a taxonomy selection.
///
/// The merged FASTA file is `WGS4taxid<include>.fa`, or `WGS4taxid<include>-<exclude>.fa`
/// when an exclusion is given; the ledger has the same stem with a `.tmp` extension and the
/// in-flight markers a `.partial` extension.
///
/// @param include the taxonomy id to include
/// @param exclude the taxonomy id to exclude, empty for none
public record OutputNames(String include, String exclude) {

    public OutputNames {
        Objects.requireNonNull(include, "include");
        exclude = exclude == null ? "" : exclude;
    }

    /// @return the common file name stem
    public String stem() {
        return exclude.isEmpty() ? "WGS4taxid" + include : "WGS4taxid" + include + "-" + exclude;
    }

    /// @return the merged FASTA file name
    public String fasta() {
        return stem() + ".fa";
    }

    /// @return the ledger file name
    public String ledger() {
        return stem() + ".tmp";
    }

    /// @return the in-flight markers file name
    public String partial() {
        return stem() + ".partial";
    }

    public Path fastaIn(Path dir) {
        return dir.resolve(fasta());
    }

    public Path ledgerIn(Path dir) {
        return dir.resolve(ledger());
    }

    public Path partialIn(Path dir) {
        return dir.resolve(partial());
    }
}
