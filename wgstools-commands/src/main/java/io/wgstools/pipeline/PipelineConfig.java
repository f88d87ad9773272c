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

/// The options of one fetch run.
///
/// @param taxid the taxonomy id whose projects are collected
/// @param exclude a taxonomy id whose projects are left out, empty for none
/// @param downloadOnly retrieve files without merging them into the output
/// @param reverse process projects in descending order
/// @param force discard previous state and retrieve files again
/// @param resume continue from the ledger of an earlier run
/// @param workdir directory holding the output, the ledger and downloaded files
public record PipelineConfig(
    String taxid,
    String exclude,
    boolean downloadOnly,
    boolean reverse,
    boolean force,
    boolean resume,
    Path workdir
) {

    public PipelineConfig {
        Objects.requireNonNull(taxid, "taxid");
        Objects.requireNonNull(workdir, "workdir");
        taxid = taxid.strip();
        exclude = exclude == null ? "" : exclude.strip();
        if (taxid.isEmpty()) {
            throw new IllegalArgumentException("A taxonomy id is required");
        }
        if (force && resume) {
            throw new IllegalArgumentException("force and resume cannot be combined");
        }
    }

    /// @return the output and ledger names of this selection
    public OutputNames names() {
        return new OutputNames(taxid, exclude);
    }
}
