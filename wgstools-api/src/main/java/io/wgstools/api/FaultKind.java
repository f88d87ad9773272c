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

/// Classification of the failures a fetch run can run into.
public enum FaultKind {
    /// Network or protocol faults that may succeed when tried again
    TRANSIENT(true),
    /// Local data that retrying cannot repair
    CORRUPTION(true),
    /// Conflicting local state or options, detected before any network activity
    CONFIGURATION(false),
    /// The user cancelled the run
    CANCELLATION(true),
    /// The ledger, output or a downloaded file could not be read or written locally
    LOCAL_IO(true);

    private final boolean resumable;

    FaultKind(boolean resumable) {
        this.resumable = resumable;
    }

    /// @return true if a later run with the resume flag can pick up where this one stopped
    public boolean isResumable() {
        return resumable;
    }
}
