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

/// An operation failed on every attempt of the retry schedule.
public class RetryExhaustedException extends PipelineException {
    private final int attempts;

    public RetryExhaustedException(String operation, int attempts, Throwable lastError) {
        super(FaultKind.TRANSIENT, ExitStatus.RETRIES_EXHAUSTED,
            "Exceeded number of attempts (" + attempts + ") for " + operation
            + (lastError == null ? "" : ": " + lastError.getMessage()), lastError);
        this.attempts = attempts;
    }

    /// @return how many attempts were made
    public int attempts() {
        return attempts;
    }
}
