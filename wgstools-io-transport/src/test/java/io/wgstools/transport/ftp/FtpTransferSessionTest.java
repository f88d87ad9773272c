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
import io.wgstools.api.RunInterruptedException;
import io.wgstools.api.TransferSession;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockftpserver.fake.FakeFtpServer;
import org.mockftpserver.fake.UserAccount;
import org.mockftpserver.fake.filesystem.DirectoryEntry;
import org.mockftpserver.fake.filesystem.FileEntry;
import org.mockftpserver.fake.filesystem.FileSystem;
import org.mockftpserver.fake.filesystem.UnixFakeFileSystem;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FtpTransferSessionTest {

    private static final String PROJECT_DIR = "/sra/wgs_aux/AA/AA/AAAA01";

    private FakeFtpServer server;
    private byte[] firstFile;
    private byte[] secondFile;

    @BeforeEach
    void startServer() throws InterruptedException {
        Random random = new Random(42);
        firstFile = new byte[300_000];
        random.nextBytes(firstFile);
        secondFile = new byte[]{0, 1, 2, (byte) 0xff, '\r', '\n'};

        FileSystem fileSystem = new UnixFakeFileSystem();
        fileSystem.add(new DirectoryEntry("/"));
        fileSystem.add(new DirectoryEntry(PROJECT_DIR));
        fileSystem.add(file(PROJECT_DIR + "/AAAA01.1.fsa_nt.gz", firstFile));
        fileSystem.add(file(PROJECT_DIR + "/AAAA01.2.fsa_nt.gz", secondFile));

        server = new FakeFtpServer();
        server.setServerControlPort(0);
        server.addUserAccount(new UserAccount("anonymous", "anonymous@", "/"));
        server.setFileSystem(fileSystem);
        server.start();
        for (int i = 0; i < 500 && !server.isStarted(); i++) {
            Thread.sleep(10);
        }
        assertThat(server.isStarted()).isTrue();
    }

    @AfterEach
    void stopServer() {
        server.stop();
    }

    private static FileEntry file(String path, byte[] contents) {
        FileEntry entry = new FileEntry(path);
        entry.setContents(contents);
        return entry;
    }

    private FtpSettings settings() {
        return FtpSettings.defaults().withServer("localhost", server.getServerControlPort());
    }

    @Test
    void testListAndRetrieveBinaryFiles(@TempDir Path dir) throws IOException {
        try (TransferSession session = new FtpTransferSession(settings(), new CancellationToken())) {
            List<String> names = session.open(CollectionId.of("AAAA01"));
            assertThat(names).containsExactlyInAnyOrder("AAAA01.1.fsa_nt.gz", "AAAA01.2.fsa_nt.gz");

            Path first = dir.resolve("AAAA01.1.fsa_nt.gz");
            assertThat(session.retrieve("AAAA01.1.fsa_nt.gz", first)).isEqualTo(firstFile.length);
            assertThat(Files.readAllBytes(first)).isEqualTo(firstFile);

            Path second = dir.resolve("AAAA01.2.fsa_nt.gz");
            assertThat(session.retrieve("AAAA01.2.fsa_nt.gz", second)).isEqualTo(secondFile.length);
            assertThat(Files.readAllBytes(second)).isEqualTo(secondFile);
        }
    }

    @Test
    void testMissingDirectoryIsAnIOException() {
        try (TransferSession session = new FtpTransferSession(settings(), new CancellationToken())) {
            assertThatThrownBy(() -> session.open(CollectionId.of("BBBB02")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("/sra/wgs_aux/BB/BB/BBBB02");
        }
    }

    @Test
    void testMissingFileIsAnIOException(@TempDir Path dir) throws IOException {
        try (TransferSession session = new FtpTransferSession(settings(), new CancellationToken())) {
            session.open(CollectionId.of("AAAA01"));
            assertThatThrownBy(() -> session.retrieve("AAAA01.9.fsa_nt.gz", dir.resolve("x")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("AAAA01.9.fsa_nt.gz");
        }
    }

    @Test
    void testBadPasswordIsAnIOException() {
        FtpSettings wrong = new FtpSettings("localhost", server.getServerControlPort(), FtpSettings.DEFAULT_BASE,
            "anonymous", "wrong", settings().connectTimeout(), settings().dataTimeout(), settings().keepAliveInterval());
        try (TransferSession session = new FtpTransferSession(wrong, new CancellationToken())) {
            assertThatThrownBy(() -> session.open(CollectionId.of("AAAA01")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("login");
        }
    }

    @Test
    void testCancelledTransferStops(@TempDir Path dir) throws IOException {
        CancellationToken token = new CancellationToken();
        try (TransferSession session = new FtpTransferSession(settings(), token)) {
            session.open(CollectionId.of("AAAA01"));
            token.cancel();
            assertThatThrownBy(() -> session.retrieve("AAAA01.1.fsa_nt.gz", dir.resolve("part")))
                .isInstanceOf(RunInterruptedException.class);
        }
    }

    @Test
    void testCloseWithoutOpenIsHarmless() {
        new FtpTransferSession(settings(), new CancellationToken()).close();
    }
}
