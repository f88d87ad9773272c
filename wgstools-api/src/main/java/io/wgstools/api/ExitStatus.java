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

import java.util.LinkedHashMap;
import java.util.Map;

/// Process exit codes of a fetch run.
///
/// The numeric values are part of the command line contract and are relied upon by
/// scripts wrapping the tool, so they never change meaning.
public enum ExitStatus {
    /// All pending projects were processed
    SUCCESS(0, "success"),
    /// A ledger with completed projects exists but the output FASTA file is missing
    LEDGER_WITHOUT_OUTPUT(1, "ledger exists without the output FASTA file"),
    /// A ledger exists but no mode says what to do with it
    AMBIGUOUS_MODE(2, "ledger exists but neither resume, download nor force was requested"),
    /// The output FASTA file exists without a ledger
    OUTPUT_WITHOUT_LEDGER(3, "output FASTA file exists without a ledger"),
    /// A retrieved file is empty, truncated or has unparseable headers
    CORRUPT_DATA(4, "unexpected end of file or malformed content in a retrieved file"),
    /// An operation kept failing through the whole retry schedule
    RETRIES_EXHAUSTED(5, "exceeded the number of attempts"),
    /// The run completed but the ledger could not be removed afterwards
    LEDGER_CLEANUP_FAILED(6, "failed to remove the ledger after a successful run"),
    /// A local file could not be read or written
    LOCAL_IO_FAILURE(7, "local file could not be read or written"),
    /// The user interrupted the run
    INTERRUPTED(9, "interrupted by the user");

    private final int code;
    private final String description;

    ExitStatus(int code, String description) {
        this.code = code;
        this.description = description;
    }

    /// @return the process exit code
    public int code() {
        return code;
    }

    /// @return a short human readable description
    public String description() {
        return description;
    }

    /// @return exit codes mapped to their descriptions, in code order, as shown in usage help
    public static Map<String, String> exitCodeList() {
        Map<String, String> list = new LinkedHashMap<>();
        for (ExitStatus status : values()) {
            list.put(String.valueOf(status.code), status.description);
        }
        return list;
    }
}
