package io.wgstools.fasta;

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
import io.wgstools.api.CorruptRecordException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.zip.GZIPOutputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecordNormalizerTest {

    private static final CollectionId AAAA01 = CollectionId.of("AAAA01");

    private final RecordNormalizer normalizer = new RecordNormalizer();

    private static Path gzip(Path dir, String name, byte[] content) throws IOException {
        Path file = dir.resolve(name);
        try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(file))) {
            out.write(content);
        }
        return file;
    }

    @Test
    void testCanonicalFileIsCopiedByteForByte(@TempDir Path dir) throws IOException {
        byte[] content = (">AAAA01000001.1 Café contig\r\nACGT\nNNNN\n>AAAA01000002.1 x\nAC").getBytes(RecordNormalizer.CHARSET);
        content[content.length - 1] = (byte) 0xe9;
        Path file = gzip(dir, "AAAA01.1.fsa_nt.gz", content);
        StringWriter out = new StringWriter();

        RecordNormalizer.Result result = normalizer.normalize(AAAA01, file, out);

        assertThat(result.encoding()).isEqualTo(HeaderEncoding.CANONICAL);
        assertThat(result.headers()).isZero();
        assertThat(result.lines()).isEqualTo(5);
        assertThat(out.toString().getBytes(RecordNormalizer.CHARSET)).isEqualTo(content);
    }

    @Test
    void testLegacyHeadersAreRewritten(@TempDir Path dir) throws IOException {
        String legacy = ">gi|11|gb|AAAA01000001.1|Contig one\n"
            + "ACGTACGT\n"
            + "ACGT\r\n"
            + ">gi|12|gb|AAAA01000002.1|  Contig two  \r\n"
            + "GGGG\n";
        Path file = gzip(dir, "AAAA01.1.fsa_nt.gz", legacy.getBytes(RecordNormalizer.CHARSET));
        StringWriter out = new StringWriter();

        RecordNormalizer.Result result = normalizer.normalize(AAAA01, file, out);

        assertThat(result.encoding()).isEqualTo(HeaderEncoding.LEGACY_PIPE);
        assertThat(result.headers()).isEqualTo(2);
        assertThat(out.toString()).isEqualTo(">AAAA01000001.1 Contig one\n"
            + "ACGTACGT\n"
            + "ACGT\r\n"
            + ">AAAA01000002.1 Contig two\n"
            + "GGGG\n");
    }

    @Test
    void testFirstLineIsWrittenOnce() throws IOException {
        StringWriter out = new StringWriter();
        normalizer.normalize(AAAA01, new StringReader(">gi|1|gb|AAAA01000001.1|only\nAC\n"), out, "f");
        assertThat(out.toString()).isEqualTo(">AAAA01000001.1 only\nAC\n");
    }

    @Test
    void testEmptyDescriptionKeepsTheSeparator() throws IOException {
        StringWriter out = new StringWriter();
        normalizer.normalize(AAAA01, new StringReader(">gi|1|gb|AAAA01000001.1|\nAC\n"), out, "f");
        assertThat(out.toString()).isEqualTo(">AAAA01000001.1 \nAC\n");
    }

    @Test
    void testLinesSpanningReadBuffersAreCopiedWhole(@TempDir Path dir) throws IOException {
        StringBuilder text = new StringBuilder(">AAAA01000001.1 long\n");
        text.append("ACGT".repeat(5000)).append('\n');
        for (int i = 0; i < 20000; i++) {
            text.append("ACGTACGTACGTACGTACGTACGTACGTACGTACGTACGTACGTACGTACGTACGTACGTACGTACGTACG\n");
        }
        text.append(">AAAA01000002.1 tail\nNNN");
        byte[] content = text.toString().getBytes(RecordNormalizer.CHARSET);
        Path file = gzip(dir, "AAAA01.1.fsa_nt.gz", content);
        StringWriter out = new StringWriter();

        RecordNormalizer.Result result = normalizer.normalize(AAAA01, file, out);

        assertThat(result.lines()).isEqualTo(20004);
        assertThat(out.toString().getBytes(RecordNormalizer.CHARSET)).isEqualTo(content);
    }

    @Test
    void testDetectionOnlyLooksAtFirstSevenCharacters() {
        assertThat(HeaderEncoding.detect(AAAA01, ">AAAA01000001.1 x")).isEqualTo(HeaderEncoding.CANONICAL);
        assertThat(HeaderEncoding.detect(AAAA01, ">gi|1|gb|AAAA01000001.1|x")).isEqualTo(HeaderEncoding.LEGACY_PIPE);
        assertThat(HeaderEncoding.detect(AAAA01, ">")).isEqualTo(HeaderEncoding.LEGACY_PIPE);
    }

    @Test
    void testUnparseableHeaderIsCorruption() {
        StringReader lines = new StringReader(">gi|1|gb|AAAA01000001.1|ok\nAC\n>garbage header\n");
        assertThatThrownBy(() -> normalizer.normalize(AAAA01, lines, new StringWriter(), "AAAA01.1.fsa_nt.gz"))
            .isInstanceOf(CorruptRecordException.class)
            .hasMessageContaining("AAAA01.1.fsa_nt.gz");
    }

    @Test
    void testEmptyFileIsCorruption(@TempDir Path dir) throws IOException {
        Path file = gzip(dir, "AAAA01.1.fsa_nt.gz", new byte[0]);
        assertThatThrownBy(() -> normalizer.normalize(AAAA01, file, new StringWriter()))
            .isInstanceOf(CorruptRecordException.class)
            .hasMessageContaining("Unexpected EOF");
    }

    @Test
    void testTruncatedGzipIsCorruption(@TempDir Path dir) throws IOException {
        Path file = gzip(dir, "full.gz", ">AAAA01000001.1 x\nACGTACGTACGTACGT\n".repeat(200).getBytes(RecordNormalizer.CHARSET));
        byte[] bytes = Files.readAllBytes(file);
        Path truncated = dir.resolve("AAAA01.1.fsa_nt.gz");
        Files.write(truncated, Arrays.copyOf(bytes, bytes.length / 2));

        assertThatThrownBy(() -> normalizer.normalize(AAAA01, truncated, new StringWriter()))
            .isInstanceOf(CorruptRecordException.class)
            .hasMessageContaining("AAAA01.1.fsa_nt.gz");
    }

    @Test
    void testNotGzipIsCorruption(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("AAAA01.1.fsa_nt.gz");
        Files.writeString(file, "<html>not found</html>");
        assertThatThrownBy(() -> normalizer.normalize(AAAA01, file, new StringWriter()))
            .isInstanceOf(CorruptRecordException.class);
    }
}
