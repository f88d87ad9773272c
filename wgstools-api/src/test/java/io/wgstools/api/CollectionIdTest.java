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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CollectionIdTest {

    @Test
    void testShardedPath() {
        CollectionId id = CollectionId.of("AAAA01");
        assertThat(id.shardedPath()).isEqualTo("AA/AA/AAAA01");
        assertThat(id.remoteDirectory("/sra/wgs_aux")).isEqualTo("/sra/wgs_aux/AA/AA/AAAA01");
        assertThat(id.remoteDirectory("/sra/wgs_aux/")).isEqualTo("/sra/wgs_aux/AA/AA/AAAA01");
    }

    @Test
    void testShortIdsAreSlicedLeniently() {
        assertThat(CollectionId.of("ABC").shardedPath()).isEqualTo("AB/C/ABC");
        assertThat(CollectionId.of("A").shardedPath()).isEqualTo("A//A");
    }

    @Test
    void testValueIsTrimmedAndValidated() {
        assertThat(CollectionId.of(" JAAB02 \r").value()).isEqualTo("JAAB02");
        assertThatThrownBy(() -> CollectionId.of("  ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CollectionId.of(null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void testOwnsAndOrdering() {
        CollectionId id = CollectionId.of("AAAA01");
        assertThat(id.owns("AAAA01.1.fsa_nt.gz")).isTrue();
        assertThat(id.owns("AAAB01.1.fsa_nt.gz")).isFalse();
        assertThat(CollectionId.of("B")).isGreaterThan(CollectionId.of("A"));
    }
}
