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
import io.wgstools.api.IdentifierSource;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Asks the NCBI discovery service which WGS projects belong to a taxonomy id.
///
/// The service answers with one `WGS_VDB://<id>` line per project. The prefix is removed,
/// blank lines are dropped and the order of the answer is kept; duplicates are left for
/// the caller to handle.
public class IdentifierListFetcher implements IdentifierSource {
    private static final Logger logger = LogManager.getLogger(IdentifierListFetcher.class);

    /// The public discovery endpoint
    public static final String DEFAULT_URL = "https://www.ncbi.nlm.nih.gov/blast/BDB2EZ/taxid2wgs.cgi";

    static final String PREFIX = "WGS_VDB://";

    private final HttpUrl endpoint;
    private final OkHttpClient httpClient;

    /// @param endpoint the discovery URL, without query parameters
    /// @param httpClient the client used for the request
    public IdentifierListFetcher(HttpUrl endpoint, OkHttpClient httpClient) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    /// @param url the discovery URL
    /// @param timeout connect and read timeout
    /// @return a fetcher with its own client
    /// @throws IllegalArgumentException if the URL is not a valid HTTP or HTTPS URL
    public static IdentifierListFetcher create(String url, Duration timeout) {
        HttpUrl endpoint = HttpUrl.parse(url);
        if (endpoint == null) {
            throw new IllegalArgumentException("Discovery URL must be HTTP or HTTPS: " + url);
        }
        OkHttpClient client = new OkHttpClient.Builder()
            .connectTimeout(timeout)
            .readTimeout(timeout)
            .followRedirects(true)
            .build();
        return new IdentifierListFetcher(endpoint, client);
    }

    /// @return the request URL for a selection
    HttpUrl requestUrl(String includeTaxid, String excludeTaxid) {
        return endpoint.newBuilder()
            .addQueryParameter("INCLUDE_TAXIDS", includeTaxid)
            .addQueryParameter("EXCLUDE_TAXIDS", excludeTaxid == null ? "" : excludeTaxid)
            .build();
    }

    @Override
    public List<CollectionId> fetch(String includeTaxid, String excludeTaxid) throws IOException {
        HttpUrl url = requestUrl(includeTaxid, excludeTaxid);
        logger.debug("discovery request {}", url);
        Request request = new Request.Builder().url(url).get().build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("Discovery request failed with HTTP " + response.code() + " " + response.message());
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new IOException("Discovery response has no body");
            }
            List<CollectionId> ids = parse(body.string());
            logger.debug("discovery returned {} ids", ids.size());
            return ids;
        }
    }

    static List<CollectionId> parse(String body) {
        List<CollectionId> ids = new ArrayList<>();
        for (String line : body.split("\n")) {
            String value = line.strip();
            if (value.startsWith(PREFIX)) {
                value = value.substring(PREFIX.length()).strip();
            }
            if (!value.isEmpty()) {
                ids.add(CollectionId.of(value));
            }
        }
        return ids;
    }
}
