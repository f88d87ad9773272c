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
import java.time.Duration;

/// Observer of the attempts made by a [RetryPolicy].
public interface RetryListener {

    /// A listener that ignores everything
    RetryListener NONE = new RetryListener() {
    };

    /// Called before waiting ahead of a non-first attempt with a positive delay.
    default void waiting(String operation, int attempt, Duration delay) {
    }

    /// Called after an attempt failed with a transient error.
    default void attemptFailed(String operation, int attempt, int maxAttempts, IOException error) {
    }
}
