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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProgressLedgerTest {

    @Test
    void testMissingLedgerLoadsEmpty(@TempDir Path dir) throws IOException {
        ProgressLedger ledger = new ProgressLedger(dir.resolve("WGS4taxid1.tmp"));
        assertThat(ledger.exists()).isFalse();
        assertThat(ledger.load()).isEmpty();
    }

    @Test
    void testRecordAppendsAndLoadTrims(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("WGS4taxid1.tmp");
        Files.writeString(file, "AAAA01  \r\n\n   \nBBBB02\n");
        try (ProgressLedger ledger = new ProgressLedger(file)) {
            ledger.open();
            ledger.record(CollectionId.of("CCCC03"));
        }
        assertThat(new ProgressLedger(file).load()).extracting(CollectionId::value)
            .containsExactly("AAAA01", "BBBB02", "CCCC03");
        assertThat(Files.readString(file)).endsWith("BBBB02\nCCCC03\n");
    }

    @Test
    void testRecordRequiresOpen(@TempDir Path dir) {
        ProgressLedger ledger = new ProgressLedger(dir.resolve("x.tmp"));
        assertThatThrownBy(() -> ledger.record(CollectionId.of("AAAA01")))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testClearDeletes(@TempDir Path dir) throws IOException {
        ProgressLedger ledger = new ProgressLedger(dir.resolve("x.tmp"));
        ledger.open();
        ledger.record(CollectionId.of("AAAA01"));
        ledger.clear();
        assertThat(ledger.exists()).isFalse();
        ledger.clear();
    }
}
