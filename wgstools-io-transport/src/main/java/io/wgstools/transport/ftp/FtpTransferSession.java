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

import io.wgstools.api.CancellationToken;
import io.wgstools.api.CollectionId;
import io.wgstools.api.TransferSession;
import org.apache.commons.net.ftp.FTP;
import org.apache.commons.net.ftp.FTPClient;
import org.apache.commons.net.ftp.FTPReply;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/// A [TransferSession] backed by an Apache Commons Net [FTPClient].
///
/// Every negative reply is turned into an [IOException] that includes the server's reply
/// text. While a file is streamed over the data connection a [KeepAliveTimer] keeps the
/// control connection alive.
public class FtpTransferSession implements TransferSession {
    private static final Logger logger = LogManager.getLogger(FtpTransferSession.class);

    private static final int BUFFER_SIZE = 64 * 1024;

    private final FtpSettings settings;
    private final CancellationToken token;
    private FTPClient client;
    private CollectionId collection;

    public FtpTransferSession(FtpSettings settings, CancellationToken token) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.token = Objects.requireNonNull(token, "token");
    }

    @Override
    public List<String> open(CollectionId collection) throws IOException {
        if (client != null) {
            throw new IllegalStateException("Session already opened for " + this.collection);
        }
        this.collection = collection;
        client = new FTPClient();
        client.setConnectTimeout(Math.toIntExact(settings.connectTimeout().toMillis()));
        client.setDefaultTimeout(Math.toIntExact(settings.dataTimeout().toMillis()));
        client.setDataTimeout(settings.dataTimeout());

        logger.debug("connecting to {}:{}", settings.host(), settings.port());
        client.connect(settings.host(), settings.port());
        expectPositive("connect to " + settings.host());
        client.setSoTimeout(Math.toIntExact(settings.dataTimeout().toMillis()));

        if (!client.login(settings.user(), settings.password())) {
            throw failure("login as " + settings.user());
        }
        client.enterLocalPassiveMode();
        if (!client.setFileType(FTP.BINARY_FILE_TYPE)) {
            throw failure("switch to binary mode");
        }
        String directory = settings.directoryOf(collection);
        if (!client.changeWorkingDirectory(directory)) {
            throw failure("change directory to " + directory);
        }
        String[] names = client.listNames();
        if (names == null) {
            throw failure("list " + directory);
        }
        logger.debug("{} lists {} entries", directory, names.length);
        return Arrays.asList(names);
    }

    @Override
    public long retrieve(String filename, Path target) throws IOException {
        if (client == null) {
            throw new IllegalStateException("Session is not open");
        }
        InputStream in = client.retrieveFileStream(filename);
        if (in == null) {
            throw failure("retrieve " + filename);
        }
        long bytes = 0;
        KeepAliveTimer keepAlive = KeepAliveTimer.start(settings.keepAliveInterval(), client::sendNoOp, filename);
        try (InputStream data = in; OutputStream out = Files.newOutputStream(target)) {
            byte[] buffer = new byte[BUFFER_SIZE];
            int read;
            while ((read = data.read(buffer)) != -1) {
                token.throwIfCancelled("transfer of " + filename);
                out.write(buffer, 0, read);
                bytes += read;
            }
        } finally {
            keepAlive.stop();
        }
        keepAlive.throwIfFailed();
        if (!client.completePendingCommand()) {
            throw failure("complete transfer of " + filename);
        }
        logger.debug("retrieved {} ({} bytes, {} keepalives)", filename, bytes, keepAlive.pings());
        return bytes;
    }

    @Override
    public void close() {
        if (client == null || !client.isConnected()) {
            return;
        }
        try {
            client.logout();
        } catch (IOException e) {
            logger.debug("logout from {} failed, disconnecting: {}", settings.host(), e.getMessage());
        } finally {
            try {
                client.disconnect();
            } catch (IOException e) {
                logger.debug("disconnect from {} failed: {}", settings.host(), e.getMessage());
            }
        }
    }

    private void expectPositive(String action) throws IOException {
        if (!FTPReply.isPositiveCompletion(client.getReplyCode())) {
            throw failure(action);
        }
    }

    private IOException failure(String action) {
        String reply = client.getReplyString();
        return new IOException("FTP failed to " + action + ": "
            + (reply == null ? "no reply" : reply.strip()));
    }
}
