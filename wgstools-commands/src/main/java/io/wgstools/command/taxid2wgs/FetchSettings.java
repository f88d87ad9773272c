package io.wgstools.command.taxid2wgs;

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

import io.wgstools.transport.RetryPolicy;
import io.wgstools.transport.discovery.IdentifierListFetcher;
import io.wgstools.transport.ftp.FtpSettings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Service endpoints, timeouts and retry schedule of the fetch command.
///
/// Defaults target the public NCBI services. A YAML file may override any of them:
/// ```yaml
/// discovery:
///   url: https://www.ncbi.nlm.nih.gov/blast/BDB2EZ/taxid2wgs.cgi
/// ftp:
///   host: ftp.ncbi.nlm.nih.gov
///   port: 21
///   base: /sra/wgs_aux
///   password: anonymous@
///   connect_timeout_seconds: 30
///   data_timeout_seconds: 120
///   keepalive_seconds: 30
/// retry:
///   schedule_seconds: [0, 5, 15, 30, 60, 120]
/// ```
///
/// @param discoveryUrl the discovery service URL
/// @param ftp the archive connection settings
/// @param retrySchedule the delay before each attempt of a network operation
public record FetchSettings(String discoveryUrl, FtpSettings ftp, List<Duration> retrySchedule) {
    private static final Logger logger = LogManager.getLogger(FetchSettings.class);

    private static final Map<String, Set<String>> KNOWN_KEYS = Map.of(
        "discovery", Set.of("url"),
        "ftp", Set.of("host", "port", "base", "password", "connect_timeout_seconds", "data_timeout_seconds",
            "keepalive_seconds"),
        "retry", Set.of("schedule_seconds")
    );

    public FetchSettings {
        retrySchedule = List.copyOf(retrySchedule);
    }

    public static FetchSettings defaults() {
        return new FetchSettings(IdentifierListFetcher.DEFAULT_URL, FtpSettings.defaults(), RetryPolicy.DEFAULT_SCHEDULE);
    }

    /// Load settings from a YAML file; keys that are absent keep their defaults.
    ///
    /// @param file the settings file
    /// @return the merged settings
    /// @throws IOException if the file cannot be read
    /// @throws IllegalArgumentException if the content is not a valid settings document
    public static FetchSettings load(Path file) throws IOException {
        LoadSettings loadSettings = LoadSettings.builder().setLabel(file.toString()).build();
        Load yaml = new Load(loadSettings);
        Object document = yaml.loadFromString(Files.readString(file));
        FetchSettings settings = fromYaml(document, file.toString());
        logger.debug("loaded settings from {}: {}", file, settings);
        return settings;
    }

    static FetchSettings fromYaml(Object document, String source) {
        FetchSettings defaults = defaults();
        if (document == null) {
            return defaults;
        }
        Map<?, ?> root = asMap(document, source);
        for (Object key : root.keySet()) {
            if (!KNOWN_KEYS.containsKey(String.valueOf(key))) {
                throw new IllegalArgumentException("Unknown section '" + key + "' in " + source);
            }
        }
        Map<?, ?> discovery = section(root, "discovery", source);
        Map<?, ?> ftp = section(root, "ftp", source);
        Map<?, ?> retry = section(root, "retry", source);

        FtpSettings base = defaults.ftp();
        FtpSettings ftpSettings = new FtpSettings(
            string(ftp, "host", base.host(), source),
            integer(ftp, "port", base.port(), source),
            string(ftp, "base", base.baseDirectory(), source),
            base.user(),
            string(ftp, "password", base.password(), source),
            seconds(ftp, "connect_timeout_seconds", base.connectTimeout(), source),
            seconds(ftp, "data_timeout_seconds", base.dataTimeout(), source),
            seconds(ftp, "keepalive_seconds", base.keepAliveInterval(), source));

        List<Duration> schedule = defaults.retrySchedule();
        Object scheduleValue = retry.get("schedule_seconds");
        if (scheduleValue != null) {
            if (!(scheduleValue instanceof List<?> list) || list.isEmpty()) {
                throw new IllegalArgumentException("retry.schedule_seconds must be a non-empty list of seconds in " + source);
            }
            schedule = new ArrayList<>();
            for (Object entry : list) {
                if (!(entry instanceof Number number) || number.longValue() < 0) {
                    throw new IllegalArgumentException("retry.schedule_seconds entries must be non-negative numbers in "
                        + source + ": " + entry);
                }
                schedule.add(Duration.ofSeconds(number.longValue()));
            }
        }
        return new FetchSettings(string(discovery, "url", defaults.discoveryUrl(), source), ftpSettings, schedule);
    }

    private static Map<?, ?> asMap(Object value, String where) {
        if (value instanceof Map<?, ?> map) {
            return map;
        }
        throw new IllegalArgumentException(where + " must be a mapping");
    }

    private static Map<?, ?> section(Map<?, ?> root, String name, String source) {
        Object value = root.get(name);
        if (value == null) {
            return Map.of();
        }
        Map<?, ?> section = asMap(value, "Section '" + name + "' in " + source);
        for (Object key : section.keySet()) {
            if (!KNOWN_KEYS.get(name).contains(String.valueOf(key))) {
                throw new IllegalArgumentException("Unknown key '" + name + "." + key + "' in " + source);
            }
        }
        return section;
    }

    private static String string(Map<?, ?> section, String key, String fallback, String source) {
        Object value = section.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Map || value instanceof List) {
            throw new IllegalArgumentException("'" + key + "' must be a scalar in " + source);
        }
        return String.valueOf(value);
    }

    private static int integer(Map<?, ?> section, String key, int fallback, String source) {
        Object value = section.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        throw new IllegalArgumentException("'" + key + "' must be a number in " + source + ": " + value);
    }

    private static Duration seconds(Map<?, ?> section, String key, Duration fallback, String source) {
        Object value = section.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Number number && number.longValue() >= 0) {
            return Duration.ofSeconds(number.longValue());
        }
        throw new IllegalArgumentException("'" + key + "' must be a non-negative number of seconds in " + source
            + ": " + value);
    }
}
