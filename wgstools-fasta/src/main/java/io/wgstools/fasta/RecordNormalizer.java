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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPInputStream;
import java.util.zip.ZipException;

/// Rewrites the records of a WGS project file into canonical `>accession description` form.
///
/// Files whose first line already carries the collection id within its first seven
/// characters are copied unchanged. Otherwise every header line is parsed with the
/// collection's [HeaderParser] and rewritten; sequence lines are copied unchanged.
///
/// Content is decoded and encoded as ISO-8859-1, so unchanged lines are reproduced byte
/// for byte whatever their encoding.
public class RecordNormalizer {
    private static final Logger logger = LogManager.getLogger(RecordNormalizer.class);

    /// Charset used to read decompressed files and to write the merged output
    public static final Charset CHARSET = StandardCharsets.ISO_8859_1;

    private static final char HEADER_MARKER = '>';

    /// The outcome of normalizing one file
    /// @param encoding the header encoding that was detected
    /// @param lines number of lines written
    /// @param headers number of header lines rewritten, zero for canonical files
    public record Result(HeaderEncoding encoding, long lines, long headers) {
    }

    /// Decompress a gzip file and normalize its records into the output.
    ///
    /// The file is streamed line by line; a failure part way leaves the records written so far
    /// in the output, for the caller to roll back.
    ///
    /// @param collection the collection the file belongs to
    /// @param gzFile the gzip compressed FASTA file
    /// @param out the output to append to
    /// @return what was written
    /// @throws CorruptRecordException if the file is truncated, not valid gzip, empty or has bad headers
    /// @throws UncheckedIOException if the file cannot be read or the output cannot be written
    public Result normalize(CollectionId collection, Path gzFile, Writer out) {
        String source = gzFile.getFileName().toString();
        try (Reader in = new InputStreamReader(new GZIPInputStream(Files.newInputStream(gzFile)), CHARSET)) {
            return normalize(collection, in, out, source);
        } catch (EOFException | ZipException e) {
            throw new CorruptRecordException("Unexpected EOF while parsing file " + source + ". Is it corrupted?", e);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to normalize " + gzFile, e);
        }
    }

    /// Normalize decompressed text into the output.
    ///
    /// @param collection the collection the text belongs to
    /// @param in the decompressed content of one file
    /// @param out the output to append to
    /// @param source the name of the file, for messages
    /// @return what was written
    /// @throws CorruptRecordException if there is no content or a header cannot be parsed
    /// @throws IOException if the input cannot be read or the output cannot be written
    public Result normalize(CollectionId collection, Reader in, Writer out, String source) throws IOException {
        FastaLines lines = new FastaLines(in);
        String first = lines.next();
        if (first == null) {
            throw new CorruptRecordException("Unexpected EOF while parsing file " + source + ". Is it corrupted?");
        }
        HeaderEncoding encoding = HeaderEncoding.detect(collection, first);
        long count = 0;
        if (encoding == HeaderEncoding.CANONICAL) {
            for (String line = first; line != null; line = lines.next()) {
                out.write(line);
                count++;
            }
            logger.debug("{}: canonical headers, copied {} lines", source, count);
            return new Result(encoding, count, 0);
        }

        HeaderParser parser = HeaderParser.forCollection(collection);
        long headers = 0;
        for (String line = first; line != null; line = lines.next()) {
            if (count == 0 || (!line.isEmpty() && line.charAt(0) == HEADER_MARKER)) {
                out.write(parser.parse(line, source).canonical());
                out.write('\n');
                headers++;
            } else {
                out.write(line);
            }
            count++;
        }
        logger.debug("{}: rewrote {} legacy headers in {} lines", source, headers, count);
        return new Result(encoding, count, headers);
    }
}
