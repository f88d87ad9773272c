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

import io.wgstools.fasta.RecordNormalizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/// The merged FASTA output, opened for appending.
///
/// A collection is written between a [#mark()] and a [#commit()]. If it fails half way
/// [#rollback(long)] truncates the file back to the mark, so the output only ever holds
/// complete collections.
public class FastaOutput implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(FastaOutput.class);

    private final Path file;
    private FileChannel channel;
    private Writer writer;

    public FastaOutput(Path file) {
        this.file = file;
    }

    public Path file() {
        return file;
    }

    public boolean exists() {
        return Files.exists(file);
    }

    /// @throws IOException if the file exists and cannot be deleted
    public void delete() throws IOException {
        close();
        Files.deleteIfExists(file);
    }

    /// Open the output, creating it if needed, positioned at its end.
    /// @throws IOException if the file cannot be opened
    public void open() throws IOException {
        if (channel != null) {
            return;
        }
        channel = FileChannel.open(file, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        channel.position(channel.size());
        writer = new BufferedWriter(new OutputStreamWriter(Channels.newOutputStream(channel), RecordNormalizer.CHARSET),
            1 << 16);
    }

    /// @return the writer records are appended to
    public Writer writer() {
        if (writer == null) {
            throw new IllegalStateException("Output " + file + " is not open");
        }
        return writer;
    }

    /// @return the current length of the output, including buffered content
    /// @throws IOException if buffered content cannot be written
    public long mark() throws IOException {
        writer().flush();
        return channel.size();
    }

    /// Flush buffered content and force it to the storage device.
    /// @throws IOException if the content cannot be written
    public void commit() throws IOException {
        writer().flush();
        channel.force(true);
    }

    /// Drop everything written after a mark.
    /// @param mark a value returned by [#mark()]
    /// @throws IOException if the file cannot be truncated
    public void rollback(long mark) throws IOException {
        try {
            writer().flush();
        } catch (IOException e) {
            logger.warn("unable to flush {} before truncating it: {}", file, e.getMessage());
        }
        if (channel.size() > mark) {
            logger.debug("truncating {} from {} back to {} bytes", file, channel.size(), mark);
            channel.truncate(mark);
            channel.force(true);
        }
        channel.position(mark);
    }

    @Override
    public void close() throws IOException {
        if (channel == null) {
            return;
        }
        try {
            writer.close();
        } finally {
            channel = null;
            writer = null;
        }
    }
}
