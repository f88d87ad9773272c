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
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/// Projects whose local files may be incomplete.
///
/// A project is marked before the first of its files is retrieved and unmarked once all of
/// its files are on disk. When resuming, the local files of a marked project are not taken
/// as its complete file list; the project is listed on the archive again.
///
/// The set is persisted one id per line. Every change replaces the file atomically after
/// forcing the new content to the storage device; the file is removed once the set is empty.
public class InFlightMarkers {
    private static final Logger logger = LogManager.getLogger(InFlightMarkers.class);

    private final Path file;
    private final Set<CollectionId> marked = new LinkedHashSet<>();

    public InFlightMarkers(Path file) {
        this.file = file;
    }

    public Path file() {
        return file;
    }

    /// Read the persisted markers, replacing any held in memory.
    /// @return the marked projects, empty if the file does not exist
    /// @throws IOException if the file cannot be read
    public Set<CollectionId> load() throws IOException {
        marked.clear();
        if (Files.exists(file)) {
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                String id = line.strip();
                if (!id.isEmpty()) {
                    marked.add(CollectionId.of(id));
                }
            }
            logger.debug("{} lists {} projects with possibly incomplete files", file, marked.size());
        }
        return Collections.unmodifiableSet(marked);
    }

    public boolean isMarked(CollectionId id) {
        return marked.contains(id);
    }

    /// @param id a project about to have files retrieved
    /// @throws IOException if the markers cannot be written
    public void mark(CollectionId id) throws IOException {
        if (marked.add(id)) {
            persist();
        }
    }

    /// @param id a project whose files are all on disk
    /// @throws IOException if the markers cannot be written
    public void unmark(CollectionId id) throws IOException {
        if (marked.remove(id)) {
            persist();
        }
    }

    /// Drop every marker and remove the file.
    /// @throws IOException if the file exists and cannot be deleted
    public void clear() throws IOException {
        marked.clear();
        Files.deleteIfExists(file);
    }

    private void persist() throws IOException {
        if (marked.isEmpty()) {
            Files.deleteIfExists(file);
            return;
        }
        StringBuilder content = new StringBuilder();
        for (CollectionId id : marked) {
            content.append(id.value()).append('\n');
        }
        Path next = file.resolveSibling(file.getFileName() + ".new");
        try (FileChannel channel = FileChannel.open(next, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
            StandardOpenOption.TRUNCATE_EXISTING)) {
            ByteBuffer bytes = ByteBuffer.wrap(content.toString().getBytes(StandardCharsets.UTF_8));
            while (bytes.hasRemaining()) {
                channel.write(bytes);
            }
            channel.force(true);
        }
        Files.move(next, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
