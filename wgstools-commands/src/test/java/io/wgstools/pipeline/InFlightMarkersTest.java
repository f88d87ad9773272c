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

class InFlightMarkersTest {

    @Test
    void testMarkersSurviveAReload(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("WGS4taxid1.partial");
        InFlightMarkers markers = new InFlightMarkers(file);
        markers.mark(CollectionId.of("BBBB02"));
        markers.mark(CollectionId.of("AAAA01"));
        markers.mark(CollectionId.of("BBBB02"));

        assertThat(Files.readAllLines(file)).containsExactly("BBBB02", "AAAA01");
        assertThat(new InFlightMarkers(file).load()).extracting(CollectionId::value).containsExactly("BBBB02", "AAAA01");
        assertThat(dir.resolve("WGS4taxid1.partial.new")).doesNotExist();
    }

    @Test
    void testFileIsRemovedWhenTheLastMarkerGoes(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("WGS4taxid1.partial");
        InFlightMarkers markers = new InFlightMarkers(file);
        markers.mark(CollectionId.of("AAAA01"));
        markers.mark(CollectionId.of("BBBB02"));

        markers.unmark(CollectionId.of("AAAA01"));
        assertThat(Files.readAllLines(file)).containsExactly("BBBB02");
        assertThat(markers.isMarked(CollectionId.of("AAAA01"))).isFalse();

        markers.unmark(CollectionId.of("BBBB02"));
        assertThat(file).doesNotExist();
    }

    @Test
    void testLoadWithoutFile(@TempDir Path dir) throws IOException {
        InFlightMarkers markers = new InFlightMarkers(dir.resolve("none.partial"));
        assertThat(markers.load()).isEmpty();
        markers.clear();
        assertThat(markers.isMarked(CollectionId.of("AAAA01"))).isFalse();
    }
}
