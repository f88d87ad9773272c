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

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/// One stateful connection to the sequence archive, scoped to a single collection.
///
/// Every network fault surfaces as an [IOException] and is treated as transient by
/// the caller; sessions never retry on their own.
public interface TransferSession extends AutoCloseable {

    /// Connect, authenticate and change to the directory of the collection.
    /// @param collection the collection to navigate to
    /// @return the names of the entries in the collection directory
    /// @throws IOException on any connection, protocol or timeout failure
    List<String> open(CollectionId collection) throws IOException;

    /// Stream one remote file of the opened collection to a local file in binary mode.
    ///
    /// The target is created or truncated. On failure its content is undefined and the
    /// caller is responsible for discarding it.
    /// @param filename the remote file name, as returned by [#open(CollectionId)]
    /// @param target the local file to write
    /// @return the number of bytes written
    /// @throws IOException on any transfer failure
    long retrieve(String filename, Path target) throws IOException;

    /// Terminate the session. Falls back to an abrupt disconnect when a graceful
    /// shutdown is not possible. Never throws.
    @Override
    void close();
}
