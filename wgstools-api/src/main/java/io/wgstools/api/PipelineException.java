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

/// A classified, fatal outcome of a fetch run.
///
/// Each exception carries the [FaultKind] used for reporting and the [ExitStatus] the
/// process terminates with.
public class PipelineException extends RuntimeException {
    private final FaultKind kind;
    private final ExitStatus status;

    public PipelineException(FaultKind kind, ExitStatus status, String message) {
        this(kind, status, message, null);
    }

    public PipelineException(FaultKind kind, ExitStatus status, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.status = Objects.requireNonNull(status, "status");
    }

    /// @return the fault classification
    public FaultKind kind() {
        return kind;
    }

    /// @return the exit status for this failure
    public ExitStatus status() {
        return status;
    }
}
