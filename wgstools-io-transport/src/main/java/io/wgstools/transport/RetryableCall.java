package io.wgstools.transport;

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

import java.io.IOException;

/// One attempt of an operation run under a [RetryPolicy].
///
/// @param <T> the result type
@FunctionalInterface
public interface RetryableCall<T> {

    /// @param attempt the zero based attempt number
    /// @return the result of the operation
    /// @throws IOException on a transient failure, which makes the policy try again
    T call(int attempt) throws IOException;
}
