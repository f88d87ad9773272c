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

import io.wgstools.api.CollectionId;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashSet;
import java.util.Set;

/// Append-only record of the projects whose data is complete.
///
/// One project id per line. Every record is forced to the storage device before
/// [#record(CollectionId)] returns, so an id is never listed before its data is durable.
public class ProgressLedger implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(ProgressLedger.class);

    private final Path file;
    private FileChannel channel;

    public ProgressLedger(Path file) {
        this.file = file;
    }

    public Path file() {
        return file;
    }

    public boolean exists() {
        return Files.exists(file);
    }

    /// Read the completed ids. Trailing whitespace is removed and blank lines are ignored.
    /// @return the ids in file order, empty if the ledger does not exist
    /// @throws IOException if the ledger cannot be read
    public Set<CollectionId> load() throws IOException {
        Set<CollectionId> ids = new LinkedHashSet<>();
        if (!exists()) {
            return ids;
        }
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            String id = line.stripTrailing();
            if (!id.isBlank()) {
                ids.add(CollectionId.of(id));
            }
        }
        logger.debug("ledger {} lists {} completed projects", file, ids.size());
        return ids;
    }

    /// Open the ledger for appending, creating it if needed.
    /// @throws IOException if the ledger cannot be opened
    public void open() throws IOException {
        if (channel == null) {
            channel = FileChannel.open(file, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
                StandardOpenOption.APPEND);
        }
    }

    /// Append one id and force it to disk.
    /// @param id the completed project
    /// @throws IOException if the record cannot be written
    public void record(CollectionId id) throws IOException {
        if (channel == null) {
            throw new IllegalStateException("Ledger " + file + " is not open");
        }
        ByteBuffer line = ByteBuffer.wrap((id.value() + "\n").getBytes(StandardCharsets.UTF_8));
        while (line.hasRemaining()) {
            channel.write(line);
        }
        channel.force(true);
    }

    /// Close and delete the ledger.
    /// @throws IOException if the ledger exists and cannot be deleted
    public void clear() throws IOException {
        close();
        Files.deleteIfExists(file);
    }

    @Override
    public void close() throws IOException {
        if (channel != null) {
            try {
                channel.close();
            } finally {
                channel = null;
            }
        }
    }
}
