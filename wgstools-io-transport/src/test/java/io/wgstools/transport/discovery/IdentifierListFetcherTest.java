package io.wgstools.transport.discovery;

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
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpStatus;
import org.apache.hc.core5.http.impl.bootstrap.HttpServer;
import org.apache.hc.core5.http.impl.bootstrap.ServerBootstrap;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.io.CloseMode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IdentifierListFetcherTest {

    private HttpServer server;
    private final AtomicReference<String> requestUri = new AtomicReference<>();

    private String serve(int status, String body) throws IOException {
        server = ServerBootstrap.bootstrap()
            .setListenerPort(0)
            .register("*", (request, response, context) -> {
                requestUri.set(request.getRequestUri());
                response.setCode(status);
                response.setEntity(new StringEntity(body, ContentType.TEXT_PLAIN));
            })
            .create();
        server.start();
        return "http://127.0.0.1:" + server.getLocalPort() + "/blast/BDB2EZ/taxid2wgs.cgi";
    }

    @AfterEach
    void stopServer() {
        if (server != null) {
            server.close(CloseMode.GRACEFUL);
        }
    }

    @Test
    void testFetchStripsPrefixAndKeepsOrder() throws IOException {
        String url = serve(HttpStatus.SC_OK, "WGS_VDB://BBBB02\nWGS_VDB://AAAA01\n\nWGS_VDB://BBBB02\n");
        IdentifierListFetcher fetcher = IdentifierListFetcher.create(url, Duration.ofSeconds(10));

        List<CollectionId> ids = fetcher.fetch("548681", "");

        assertThat(ids).extracting(CollectionId::value).containsExactly("BBBB02", "AAAA01", "BBBB02");
        assertThat(requestUri.get())
            .startsWith("/blast/BDB2EZ/taxid2wgs.cgi?")
            .contains("INCLUDE_TAXIDS=548681")
            .contains("EXCLUDE_TAXIDS=");
    }

    @Test
    void testExcludeIsSent() throws IOException {
        String url = serve(HttpStatus.SC_OK, "WGS_VDB://CCCC03\r\n");
        IdentifierListFetcher fetcher = IdentifierListFetcher.create(url, Duration.ofSeconds(10));

        assertThat(fetcher.fetch("9606", "10090")).containsExactly(CollectionId.of("CCCC03"));
        assertThat(requestUri.get()).contains("INCLUDE_TAXIDS=9606").contains("EXCLUDE_TAXIDS=10090");
    }

    @Test
    void testEmptyAnswerIsAnEmptyList() throws IOException {
        String url = serve(HttpStatus.SC_OK, "\n");
        assertThat(IdentifierListFetcher.create(url, Duration.ofSeconds(10)).fetch("1", "")).isEmpty();
    }

    @Test
    void testServerErrorIsAnIOException() throws IOException {
        String url = serve(HttpStatus.SC_SERVICE_UNAVAILABLE, "busy");
        IdentifierListFetcher fetcher = IdentifierListFetcher.create(url, Duration.ofSeconds(10));

        assertThatThrownBy(() -> fetcher.fetch("548681", ""))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("503");
    }

    @Test
    void testInvalidUrlIsRejected() {
        assertThatThrownBy(() -> IdentifierListFetcher.create("ftp://example", Duration.ofSeconds(1)))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
