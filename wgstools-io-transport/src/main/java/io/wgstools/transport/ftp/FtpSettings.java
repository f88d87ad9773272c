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

import io.wgstools.api.CollectionId;

import java.time.Duration;
import java.util.Objects;

/// Connection settings for the sequence archive FTP server.
///
/// @param host the server host name
/// @param port the control port
/// @param baseDirectory the root of the sharded WGS directory tree
/// @param user the login name
/// @param password the login password, by convention an email address for anonymous login
/// @param connectTimeout bound on establishing the control connection
/// @param dataTimeout socket read timeout on the control and data connections
/// @param keepAliveInterval interval between `NOOP` commands while a file is transferred
public record FtpSettings(
    String host,
    int port,
    String baseDirectory,
    String user,
    String password,
    Duration connectTimeout,
    Duration dataTimeout,
    Duration keepAliveInterval
) {
    public static final String DEFAULT_HOST = "ftp.ncbi.nlm.nih.gov";
    public static final int DEFAULT_PORT = 21;
    public static final String DEFAULT_BASE = "/sra/wgs_aux";
    public static final String ANONYMOUS = "anonymous";

    public FtpSettings {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(baseDirectory, "baseDirectory");
        Objects.requireNonNull(user, "user");
        Objects.requireNonNull(password, "password");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(dataTimeout, "dataTimeout");
        Objects.requireNonNull(keepAliveInterval, "keepAliveInterval");
        if (host.isBlank()) {
            throw new IllegalArgumentException("FTP host must not be blank");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("FTP port out of range: " + port);
        }
        if (keepAliveInterval.isZero() || keepAliveInterval.isNegative()) {
            throw new IllegalArgumentException("Keepalive interval must be positive: " + keepAliveInterval);
        }
    }

    /// @return the settings used against the public NCBI server
    public static FtpSettings defaults() {
        return new FtpSettings(DEFAULT_HOST, DEFAULT_PORT, DEFAULT_BASE, ANONYMOUS, "anonymous@",
            Duration.ofSeconds(30), Duration.ofSeconds(120), Duration.ofSeconds(30));
    }

    /// @return a copy pointing at another server, used by tests
    public FtpSettings withServer(String host, int port) {
        return new FtpSettings(host, port, baseDirectory, user, password, connectTimeout, dataTimeout, keepAliveInterval);
    }

    /// @return the remote directory holding the files of a collection
    public String directoryOf(CollectionId collection) {
        return collection.remoteDirectory(baseDirectory);
    }
}
