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

import io.wgstools.api.CancellationToken;
import io.wgstools.api.RetryExhaustedException;
import io.wgstools.api.Sleeper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/// Runs an operation according to a fixed schedule of delays.
///
/// Attempt `i` is preceded by a wait of `schedule[i]`, so a schedule of `n` entries makes
/// exactly `n` attempts. An [IOException] from an attempt is transient and leads to the
/// next attempt; any other exception propagates at once. When every attempt has failed a
/// [RetryExhaustedException] carrying the last error is thrown.
///
/// Cancellation of the run is checked before every attempt and interrupts the waits; it
/// surfaces as a [io.wgstools.api.RunInterruptedException] and is never retried.
public final class RetryPolicy {
    private static final Logger logger = LogManager.getLogger(RetryPolicy.class);

    /// Delays before each attempt: 0, 5, 15, 30, 60 and 120 seconds
    public static final List<Duration> DEFAULT_SCHEDULE = List.of(
        Duration.ZERO,
        Duration.ofSeconds(5),
        Duration.ofSeconds(15),
        Duration.ofSeconds(30),
        Duration.ofSeconds(60),
        Duration.ofSeconds(120)
    );

    private final List<Duration> schedule;
    private final Sleeper sleeper;
    private final CancellationToken token;
    private final RetryListener listener;

    /// @param schedule delay before each attempt, at least one entry
    /// @param sleeper used for the waits between attempts
    /// @param token the run cancellation token
    /// @param listener notified of waits and failed attempts
    public RetryPolicy(List<Duration> schedule, Sleeper sleeper, CancellationToken token, RetryListener listener) {
        Objects.requireNonNull(schedule, "schedule");
        if (schedule.isEmpty()) {
            throw new IllegalArgumentException("Retry schedule must have at least one entry");
        }
        for (Duration delay : schedule) {
            if (delay == null || delay.isNegative()) {
                throw new IllegalArgumentException("Retry delays must be zero or positive: " + schedule);
            }
        }
        this.schedule = List.copyOf(schedule);
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.token = Objects.requireNonNull(token, "token");
        this.listener = listener == null ? RetryListener.NONE : listener;
    }

    /// Run the call until it succeeds or the schedule is exhausted.
    ///
    /// @param operation a short description, used in messages
    /// @param call the operation
    /// @param <T> the result type
    /// @return the result of the first successful attempt
    /// @throws RetryExhaustedException if every attempt failed
    public <T> T execute(String operation, RetryableCall<T> call) {
        IOException lastError = null;
        for (int attempt = 0; attempt < schedule.size(); attempt++) {
            token.throwIfCancelled(operation);
            Duration delay = schedule.get(attempt);
            if (!delay.isZero()) {
                listener.waiting(operation, attempt, delay);
                sleeper.sleep(delay);
                token.throwIfCancelled(operation);
            }
            try {
                return call.call(attempt);
            } catch (IOException e) {
                lastError = e;
                logger.debug("{}: attempt {}/{} failed", operation, attempt + 1, schedule.size(), e);
                listener.attemptFailed(operation, attempt, schedule.size(), e);
            }
        }
        token.throwIfCancelled(operation);
        throw new RetryExhaustedException(operation, schedule.size(), lastError);
    }
}
