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

/// A retrieved file is empty, truncated, or contains a header that cannot be parsed.
///
/// The file content is local, so retrying cannot change the outcome.
public class CorruptRecordException extends PipelineException {

    public CorruptRecordException(String message) {
        super(FaultKind.CORRUPTION, ExitStatus.CORRUPT_DATA, message);
    }

    public CorruptRecordException(String message, Throwable cause) {
        super(FaultKind.CORRUPTION, ExitStatus.CORRUPT_DATA, message, cause);
    }
}
