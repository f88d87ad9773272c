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

import io.wgstools.api.CollectionId;
import io.wgstools.api.ExitStatus;
import io.wgstools.api.StateConflictException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.LinkedHashSet;
import java.util.Set;

/// Decides how a run starts from the ledger and output left by earlier runs.
///
/// | ledger | output | mode | outcome |
/// |---|---|---|---|
/// | no | no | any | fresh run |
/// | no | yes | force | output deleted, fresh run |
/// | no | yes | other | [ExitStatus#OUTPUT_WITHOUT_LEDGER] |
/// | yes | any | force | ledger and output deleted, fresh run |
/// | yes | any | download only | ledger loaded |
/// | non-empty | no | resume | [ExitStatus#LEDGER_WITHOUT_OUTPUT] |
/// | yes | any | resume | ledger loaded |
/// | yes | any | none | [ExitStatus#AMBIGUOUS_MODE] |
///
/// Runs entirely on local state, before any network activity.
public class StartupReconciler {
    private static final Logger logger = LogManager.getLogger(StartupReconciler.class);

    /// @param config the run options
    /// @param ledger the ledger of this selection
    /// @param output the output of this selection
    /// @return the projects already completed, empty for a fresh run
    /// @throws StateConflictException if the local state contradicts the requested mode
    /// @throws IOException if a file cannot be read or deleted
    public Set<CollectionId> reconcile(PipelineConfig config, ProgressLedger ledger, FastaOutput output)
        throws IOException {
        boolean ledgerExists = ledger.exists();
        boolean outputExists = output.exists();
        logger.debug("ledger exists: {}, output exists: {}", ledgerExists, outputExists);

        if (ledgerExists) {
            if (config.force()) {
                ledger.clear();
                output.delete();
                return new LinkedHashSet<>();
            }
            if (config.downloadOnly()) {
                return ledger.load();
            }
            if (config.resume()) {
                Set<CollectionId> completed = ledger.load();
                if (!completed.isEmpty() && !outputExists) {
                    throw new StateConflictException(ExitStatus.LEDGER_WITHOUT_OUTPUT,
                        "Temp file " + ledger.file().getFileName() + " exists but not the corresponding FASTA file "
                            + output.file().getFileName() + ". Please correct this or run with --force.");
                }
                return completed;
            }
            throw new StateConflictException(ExitStatus.AMBIGUOUS_MODE,
                "Temp file " + ledger.file().getFileName() + " exists but resume flag not set. "
                    + "Please correct this or run with --download, --resume or --force.");
        }
        if (outputExists) {
            if (config.force()) {
                output.delete();
                return new LinkedHashSet<>();
            }
            throw new StateConflictException(ExitStatus.OUTPUT_WITHOUT_LEDGER,
                "FASTA file " + output.file().getFileName() + " exists but temp file missing. "
                    + "Please correct this or run with --force.");
        }
        return new LinkedHashSet<>();
    }
}
