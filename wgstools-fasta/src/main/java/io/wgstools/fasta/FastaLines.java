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


import java.io.IOException;
import java.io.Reader;

/// Reads lines that keep their own terminators, so lines can be written back byte for byte.
final class FastaLines {
    private final Reader in;
    private final char[] buffer = new char[8192];
    private final StringBuilder line = new StringBuilder(128);
    private int position;
    private int limit;

    FastaLines(Reader in) {
        this.in = in;
    }

    /// @return the next line including its `\n`, or null at the end of the input
    String next() throws IOException {
        line.setLength(0);
        while (true) {
            if (position == limit) {
                int read = in.read(buffer, 0, buffer.length);
                position = 0;
                limit = Math.max(read, 0);
                if (read < 0) {
                    return line.length() == 0 ? null : line.toString();
                }
            }
            for (int i = position; i < limit; i++) {
                if (buffer[i] == '\n') {
                    line.append(buffer, position, i + 1 - position);
                    position = i + 1;
                    return line.toString();
                }
            }
            line.append(buffer, position, limit - position);
            position = limit;
        }
    }
}
