package io.wgstools.command.taxid2wgs;

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
import io.wgstools.api.ExitStatus;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/// Turns Ctrl-C into an orderly stop of a running fetch.
///
/// The shutdown hook cancels the run token, gives the worker a bounded time to remove
/// partial files and truncate the output, and then halts with
/// [ExitStatus#INTERRUPTED]. Once the worker has finished normally the hook is removed.
final class InterruptHandler {
    private static final Logger logger = LogManager.getLogger(InterruptHandler.class);

    private final CancellationToken token;
    private final Duration grace;
    private final CountDownLatch finished = new CountDownLatch(1);
    private final Thread hook;

    private InterruptHandler(CancellationToken token, Duration grace) {
        this.token = token;
        this.grace = grace;
        this.hook = new Thread(this::onShutdown, "taxid2wgs-interrupt");
    }

    static InterruptHandler install(CancellationToken token, Duration grace) {
        InterruptHandler handler = new InterruptHandler(token, grace);
        Runtime.getRuntime().addShutdownHook(handler.hook);
        return handler;
    }

    /// Called by the worker when the run is over, whatever its outcome.
    void finished() {
        finished.countDown();
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            logger.debug("shutdown in progress, the interrupt hook will exit");
        }
    }

    private void onShutdown() {
        if (finished.getCount() == 0) {
            return;
        }
        token.cancel();
        try {
            if (!finished.await(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn("run did not stop within {}s, exiting anyway", grace.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        LogManager.shutdown();
        Runtime.getRuntime().halt(ExitStatus.INTERRUPTED.code());
    }
}
