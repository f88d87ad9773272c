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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/// Run-wide cancellation flag, set once when the user interrupts the process.
///
/// The pipeline checks the token at attempt boundaries, between transfer chunks and
/// while waiting between retries. Waiting through [#sleep(Duration)] returns as soon as
/// the token is cancelled.
public final class CancellationToken implements Sleeper {
    private static final Logger logger = LogManager.getLogger(CancellationToken.class);

    private final CountDownLatch cancelled = new CountDownLatch(1);

    /// Mark the run as cancelled. Idempotent.
    public void cancel() {
        if (cancelled.getCount() > 0) {
            logger.debug("cancellation requested");
        }
        cancelled.countDown();
    }

    /// @return true once [#cancel()] has been called
    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /// @param where a short description of the current activity, used in the exception message
    /// @throws RunInterruptedException if the run has been cancelled
    public void throwIfCancelled(String where) {
        if (isCancelled()) {
            throw new RunInterruptedException("Interrupted during " + where);
        }
    }

    @Override
    public void sleep(Duration duration) {
        throwIfCancelled("retry wait");
        if (duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            if (cancelled.await(duration.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new RunInterruptedException("Interrupted while waiting " + duration.toSeconds() + "s to retry");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            throw new RunInterruptedException("Interrupted while waiting to retry");
        }
    }
}
