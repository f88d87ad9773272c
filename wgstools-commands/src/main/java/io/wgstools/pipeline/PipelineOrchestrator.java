package io.wgstools.pipeline;

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
import io.wgstools.api.CollectionId;
import io.wgstools.api.ExitStatus;
import io.wgstools.api.FaultKind;
import io.wgstools.api.IdentifierSource;
import io.wgstools.api.PipelineException;
import io.wgstools.api.Sleeper;
import io.wgstools.api.TransferSession;
import io.wgstools.api.TransferSessionFactory;
import io.wgstools.fasta.RecordNormalizer;
import io.wgstools.status.EventSink;
import io.wgstools.transport.RetryListener;
import io.wgstools.transport.RetryPolicy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Collects every WGS project of a taxonomy selection into one FASTA file.
///
/// A run reconciles the local state, asks the discovery service for the projects of the
/// selection, and processes the projects not yet in the ledger one at a time: list the
/// project files, retrieve the missing ones, merge them into the output and record the
/// project in the ledger. Network operations run under a [RetryPolicy].
///
/// Every failure ends the run with an [ExitStatus]; the output then holds only complete
/// projects, all of them listed in the ledger, so a run with the resume flag can pick up
/// where this one stopped. Projects whose files were being retrieved stay marked in the
/// [InFlightMarkers] and are listed on the archive again when resuming.
///
/// A download only run retrieves files without touching the output. It never writes the
/// ledger, so a later run without flags merges the retrieved files.
public class PipelineOrchestrator {
    private static final Logger logger = LogManager.getLogger(PipelineOrchestrator.class);

    /// Suffix of the per-project nucleotide FASTA files
    public static final String WGS_FILE_SUFFIX = ".fsa_nt.gz";

    /// Suffix of files being retrieved
    public static final String PART_SUFFIX = ".part";

    private final PipelineConfig config;
    private final IdentifierSource discovery;
    private final TransferSessionFactory sessions;
    private final RetryPolicy retry;
    private final CancellationToken token;
    private final EventSink events;
    private final RecordNormalizer normalizer = new RecordNormalizer();
    private final StartupReconciler reconciler = new StartupReconciler();

    /// @param config the run options
    /// @param discovery lists the projects of a selection
    /// @param sessions opens connections to the archive
    /// @param retrySchedule delay before each attempt of a network operation
    /// @param sleeper waits between attempts
    /// @param token the run cancellation token
    /// @param events receives progress events
    public PipelineOrchestrator(PipelineConfig config, IdentifierSource discovery, TransferSessionFactory sessions,
                                List<Duration> retrySchedule, Sleeper sleeper, CancellationToken token,
                                EventSink events) {
        this.config = Objects.requireNonNull(config, "config");
        this.discovery = Objects.requireNonNull(discovery, "discovery");
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        this.token = Objects.requireNonNull(token, "token");
        this.events = Objects.requireNonNull(events, "events");
        this.retry = new RetryPolicy(retrySchedule, sleeper, token, new EventRetryListener());
    }

    /// Run the pipeline to completion.
    /// @return the exit status of the run
    public ExitStatus run() {
        OutputNames names = config.names();
        ProgressLedger ledger = new ProgressLedger(names.ledgerIn(config.workdir()));
        FastaOutput output = new FastaOutput(names.fastaIn(config.workdir()));
        InFlightMarkers markers = new InFlightMarkers(names.partialIn(config.workdir()));
        try {
            Set<CollectionId> completed = reconciler.reconcile(config, ledger, output);
            markers.load();
            List<String> localFiles = localWgsFiles();
            reportModes(localFiles, completed);

            List<CollectionId> discovered = retry.execute("discovery of taxid " + config.taxid(),
                attempt -> discovery.fetch(config.taxid(), config.exclude()));
            events.log(PipelineEvent.DISCOVERY_RESPONSE, params("ids", discovered.size()));

            List<CollectionId> pending = pending(discovered, completed, config.reverse());
            if (pending.isEmpty()) {
                events.log(PipelineEvent.NOTHING_PENDING);
                markers.clear();
                return ExitStatus.SUCCESS;
            }
            events.log(PipelineEvent.PENDING,
                params("count", pending.size(), "taxid", config.taxid(), "exclude", config.exclude()));

            collect(pending, localFiles, discovered.size(), completed.size(), ledger, output, markers);
            markers.clear();
            events.log(PipelineEvent.RUN_DONE, params("downloadOnly", config.downloadOnly()));
            return finish(ledger);
        } catch (PipelineException e) {
            return fatal(e.kind(), e.status(), e.getMessage(), e);
        } catch (IOException e) {
            return fatal(FaultKind.LOCAL_IO, ExitStatus.LOCAL_IO_FAILURE, e.toString(), e);
        } catch (UncheckedIOException e) {
            return fatal(FaultKind.LOCAL_IO, ExitStatus.LOCAL_IO_FAILURE, e.getCause().toString(), e);
        } finally {
            closeQuietly(ledger);
            closeQuietly(output);
        }
    }

    /// Distinct discovered ids not in the ledger, ascending or descending.
    static List<CollectionId> pending(List<CollectionId> discovered, Set<CollectionId> completed, boolean reverse) {
        Set<CollectionId> distinct = new LinkedHashSet<>(discovered);
        distinct.removeAll(completed);
        List<CollectionId> pending = new ArrayList<>(distinct);
        pending.sort(reverse ? Comparator.reverseOrder() : Comparator.naturalOrder());
        return pending;
    }

    private void reportModes(List<String> localFiles, Set<CollectionId> completed) {
        if (config.force()) {
            events.log(PipelineEvent.MODE_FORCE);
        }
        if (config.downloadOnly()) {
            events.log(PipelineEvent.MODE_DOWNLOAD_ONLY);
        }
        if (config.reverse()) {
            events.log(PipelineEvent.MODE_REVERSE);
        }
        if (config.resume() || (config.downloadOnly() && !config.force())) {
            events.log(PipelineEvent.LOCAL_STATE, params("localFiles", localFiles.size(), "completed", completed.size()));
        }
    }

    private void collect(List<CollectionId> pending, List<String> localFiles, int discoveredCount, int alreadyDone,
                         ProgressLedger ledger, FastaOutput output, InFlightMarkers markers) throws IOException {
        if (!config.downloadOnly()) {
            ledger.open();
            output.open();
        }
        int processed = alreadyDone;
        int index = 0;
        for (CollectionId collection : pending) {
            index++;
            token.throwIfCancelled("processing of " + collection);
            long mark = config.downloadOnly() ? 0 : output.mark();
            boolean skipped;
            try {
                skipped = processCollection(collection, index, pending.size(), localFiles, output, markers);
                if (!config.downloadOnly()) {
                    output.commit();
                }
            } catch (Throwable e) {
                if (!config.downloadOnly()) {
                    output.rollback(mark);
                }
                throw e;
            }
            if (!config.downloadOnly()) {
                ledger.record(collection);
            }
            processed++;
            events.log(PipelineEvent.COLLECTION_DONE, params(
                "collection", collection.value(),
                "processed", processed,
                "ratio", (double) processed / discoveredCount,
                "skipped", skipped,
                "downloadOnly", config.downloadOnly()));
        }
    }

    /// @return true if no file of the collection had to be retrieved
    private boolean processCollection(CollectionId collection, int index, int total, List<String> localFiles,
                                      FastaOutput output, InFlightMarkers markers) throws IOException {
        try (Connection connection = new Connection(collection)) {
            List<String> files = List.of();
            if (config.resume() && !markers.isMarked(collection)) {
                files = owned(collection, localFiles);
                if (!files.isEmpty()) {
                    events.log(PipelineEvent.COLLECTION_IN_DISK, params("collection", collection.value()));
                }
            }
            if (files.isEmpty()) {
                events.log(PipelineEvent.COLLECTION_START,
                    params("index", index, "total", total, "collection", collection.value()));
                List<String> listing = retry.execute("listing of " + collection, attempt -> connection.connect());
                files = wgsFiles(listing);
            }

            boolean skipped = true;
            for (String file : files) {
                token.throwIfCancelled("processing of " + file);
                Path target = config.workdir().resolve(file);
                if (!config.force() && Files.isRegularFile(target)) {
                    events.log(PipelineEvent.FILE_PRESENT, params("file", file));
                } else {
                    markers.mark(collection);
                    retrieve(connection, file, target);
                    skipped = false;
                }
                if (!config.downloadOnly()) {
                    RecordNormalizer.Result result = normalizer.normalize(collection, target, output.writer());
                    events.log(PipelineEvent.FILE_NORMALIZED, params("file", file,
                        "encoding", result.encoding().name(), "headers", result.headers()));
                }
            }
            markers.unmark(collection);
            return skipped;
        }
    }

    /// Retrieve to a part file that is moved into place once complete and removed otherwise.
    private void retrieve(Connection connection, String file, Path target) throws IOException {
        Path part = target.resolveSibling(file + PART_SUFFIX);
        try {
            long bytes = retry.execute("download of " + file, attempt -> {
                TransferSession session = attempt == 0 ? connection.session() : connection.reconnect();
                return session.retrieve(file, part);
            });
            Files.move(part, target, StandardCopyOption.REPLACE_EXISTING);
            events.log(PipelineEvent.FILE_RETRIEVED, params("file", file, "bytes", bytes));
        } finally {
            try {
                Files.deleteIfExists(part);
            } catch (IOException e) {
                logger.warn("unable to remove partial file {}: {}", part, e.getMessage());
            }
        }
    }

    private ExitStatus finish(ProgressLedger ledger) {
        if (config.downloadOnly()) {
            return ExitStatus.SUCCESS;
        }
        try {
            ledger.clear();
            return ExitStatus.SUCCESS;
        } catch (IOException e) {
            events.log(PipelineEvent.LEDGER_CLEANUP_FAILED,
                params("ledger", ledger.file().getFileName().toString(), "error", e));
            return ExitStatus.LEDGER_CLEANUP_FAILED;
        }
    }

    private ExitStatus fatal(FaultKind kind, ExitStatus status, String message, Throwable error) {
        logger.debug("run failed with {}", status, error);
        events.log(PipelineEvent.FATAL, params(
            "kind", kind.name(),
            "message", message,
            "resumable", kind.isResumable(),
            "error", error));
        return status;
    }

    private List<String> localWgsFiles() throws IOException {
        List<String> names = new ArrayList<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(config.workdir(), "*" + WGS_FILE_SUFFIX)) {
            for (Path entry : entries) {
                if (Files.isRegularFile(entry)) {
                    names.add(entry.getFileName().toString());
                }
            }
        }
        Collections.sort(names);
        return names;
    }

    private static List<String> owned(CollectionId collection, List<String> names) {
        List<String> owned = new ArrayList<>();
        for (String name : names) {
            if (collection.owns(name)) {
                owned.add(name);
            }
        }
        return owned;
    }

    private static List<String> wgsFiles(List<String> listing) {
        List<String> files = new ArrayList<>();
        for (String name : listing) {
            String file = name.substring(name.lastIndexOf('/') + 1);
            if (file.endsWith(WGS_FILE_SUFFIX)) {
                files.add(file);
            }
        }
        return files;
    }

    private static Map<String, Object> params(Object... namesAndValues) {
        Map<String, Object> params = new LinkedHashMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            params.put((String) namesAndValues[i], namesAndValues[i + 1]);
        }
        return params;
    }

    private static void closeQuietly(AutoCloseable closeable) {
        try {
            closeable.close();
        } catch (Exception e) {
            logger.warn("unable to close {}: {}", closeable, e.getMessage());
        }
    }

    /// The archive connection of one collection, reused across its files and replaced
    /// when a retried retrieval reconnects.
    private final class Connection implements AutoCloseable {
        private final CollectionId collection;
        private TransferSession session;

        private Connection(CollectionId collection) {
            this.collection = collection;
        }

        List<String> connect() throws IOException {
            close();
            TransferSession opened = sessions.create();
            try {
                List<String> listing = opened.open(collection);
                session = opened;
                return listing;
            } catch (IOException | RuntimeException e) {
                opened.close();
                throw e;
            }
        }

        TransferSession session() throws IOException {
            if (session == null) {
                connect();
            }
            return session;
        }

        TransferSession reconnect() throws IOException {
            connect();
            return session;
        }

        @Override
        public void close() {
            if (session != null) {
                session.close();
                session = null;
            }
        }
    }

    private final class EventRetryListener implements RetryListener {
        @Override
        public void waiting(String operation, int attempt, Duration delay) {
            events.log(PipelineEvent.RETRY_WAIT, params("operation", operation, "seconds", delay.toSeconds()));
        }

        @Override
        public void attemptFailed(String operation, int attempt, int maxAttempts, IOException error) {
            events.log(PipelineEvent.ATTEMPT_FAILED, params("operation", operation, "attempt", attempt + 1,
                "attempts", maxAttempts, "error", error));
        }
    }
}
