package io.wgstools.transport.ftp;

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

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/// Periodically probes the control connection while a data transfer is in progress.
///
/// The timer belongs to a single transfer. [#stop()] raises the done signal and waits for
/// a probe in flight to finish, after which the control connection may be used again.
/// The first failed probe is kept and reported by [#throwIfFailed()]; no further probes
/// are sent after a failure.
public final class KeepAliveTimer implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(KeepAliveTimer.class);

    /// One keepalive probe.
    @FunctionalInterface
    public interface Probe {
        /// @return true if the server answered positively
        /// @throws IOException if the control connection failed
        boolean ping() throws IOException;
    }

    private final ScheduledExecutorService executor;
    private final Probe probe;
    private final String label;
    private final AtomicBoolean done = new AtomicBoolean(false);
    private final AtomicInteger pings = new AtomicInteger();
    private final AtomicReference<IOException> failure = new AtomicReference<>();

    private KeepAliveTimer(Duration interval, Probe probe, String label) {
        this.probe = probe;
        this.label = label;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "keepalive-" + label);
            thread.setDaemon(true);
            return thread;
        });
        long millis = interval.toMillis();
        executor.scheduleWithFixedDelay(this::tick, millis, millis, TimeUnit.MILLISECONDS);
    }

    /// Start probing after the first interval has elapsed.
    ///
    /// @param interval time between probes
    /// @param probe the probe to send
    /// @param label names the transfer, used for the thread name and messages
    /// @return the running timer
    public static KeepAliveTimer start(Duration interval, Probe probe, String label) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Keepalive interval must be positive: " + interval);
        }
        return new KeepAliveTimer(interval, probe, label);
    }

    private void tick() {
        if (done.get() || failure.get() != null) {
            return;
        }
        try {
            boolean positive = probe.ping();
            pings.incrementAndGet();
            if (!positive) {
                failure.compareAndSet(null, new IOException("Negative keepalive reply during transfer of " + label));
            }
        } catch (IOException e) {
            failure.compareAndSet(null, new IOException("Keepalive failed during transfer of " + label, e));
        }
    }

    /// Raise the done signal and wait for the timer thread to finish.
    public void stop() {
        if (!done.compareAndSet(false, true)) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
                logger.warn("keepalive for {} did not stop in time", label);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    /// @throws IOException the first probe failure, if any
    public void throwIfFailed() throws IOException {
        IOException error = failure.get();
        if (error != null) {
            throw error;
        }
    }

    /// @return the number of probes that received a reply
    public int pings() {
        return pings.get();
    }

    @Override
    public void close() {
        stop();
    }
}
