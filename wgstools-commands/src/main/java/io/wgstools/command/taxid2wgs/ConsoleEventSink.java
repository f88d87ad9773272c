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

import io.wgstools.pipeline.PipelineEvent;
import io.wgstools.status.EventSink;
import io.wgstools.status.EventType;
import picocli.CommandLine.Help.Ansi;

import java.io.PrintWriter;
import java.util.Locale;
import java.util.Map;

/// Renders pipeline events as coloured console text.
///
/// Without verbose mode only the essentials are shown and progress is a single line,
/// rewritten after each project with a spinner and the completed percentage. Verbose mode
/// prints one line per step instead.
public class ConsoleEventSink implements EventSink {

    private static final String RESUME_INFO =
        "Run the same command again with --resume to continue from the last completed project.";
    private static final char[] SPINNER = {'-', '\\', '|', '/'};

    private final PrintWriter out;
    private final boolean verbose;
    private final Ansi ansi;
    private int spin;
    private boolean progressLine;

    public ConsoleEventSink(PrintWriter out, boolean verbose, Ansi ansi) {
        this.out = out;
        this.verbose = verbose;
        this.ansi = ansi;
    }

    @Override
    public void log(EventType event, Map<String, Object> params) {
        validateRequiredParams(event, params);
        if (!(event instanceof PipelineEvent pipelineEvent)) {
            println("", formatEventMessage(event, params));
            return;
        }
        switch (pipelineEvent) {
            case MODE_FORCE -> detail("@|blue INFO:|@ @|faint All cleared by flag|@ @|yellow force|@");
            case MODE_DOWNLOAD_ONLY -> detail("@|blue INFO:|@ @|faint \"Just download\" mode enabled.|@");
            case MODE_REVERSE -> detail("@|blue INFO:|@ @|faint Reversed mode enabled.|@");
            case LOCAL_STATE -> {
                println(params.get("localFiles") + " @|faint WGS project files are in the working directory. "
                    + "If any, we won't look for them.|@");
                println(params.get("completed") + " @|faint WGS projects already parsed. If any, we will ignore them.|@");
            }
            case DISCOVERY_RESPONSE -> detail("@|faint NCBI server response:|@ " + params.get("ids") + " @|faint ids|@");
            case NOTHING_PENDING -> println("@|faint No projects to process!|@ @|green All done!|@");
            case PENDING -> {
                String exclude = (String) params.get("exclude");
                println(params.get("count") + " @|faint WGS projects to collect for tid|@ " + params.get("taxid")
                    + (exclude == null || exclude.isEmpty() ? "" : " @|faint excluding tid|@ " + exclude));
            }
            case COLLECTION_IN_DISK -> detail("@|faint Project|@ " + params.get("collection")
                + " @|faint in disk. Skipping...|@");
            case COLLECTION_START -> detail("@|faint " + params.get("index") + " of " + params.get("total")
                + ": Process WGS|@ " + params.get("collection") + " @|faint project...|@");
            case ATTEMPT_FAILED -> {
                Throwable error = (Throwable) params.get("error");
                println("@|yellow  PROBLEM!|@ @|faint " + params.get("operation") + " (attempt " + params.get("attempt")
                    + " of " + params.get("attempts") + "):|@ ", error == null ? "" : error.getMessage());
            }
            case RETRY_WAIT -> println("@|faint  Retrying in " + params.get("seconds") + " seconds...|@");
            case FILE_PRESENT -> detail("@|faint [" + params.get("file") + " already downloaded]|@");
            case FILE_RETRIEVED -> detail("@|faint [" + params.get("file") + " retrieved, " + params.get("bytes")
                + " bytes]|@");
            case FILE_NORMALIZED -> {
            }
            case COLLECTION_DONE -> collectionDone(params);
            case RUN_DONE -> println(Boolean.TRUE.equals(params.get("downloadOnly"))
                ? "@|green All downloaded!|@" : "@|green All OK!|@");
            case LEDGER_CLEANUP_FAILED -> println("@|yellow  WARNING!|@ @|faint Failed to remove temporal file|@ "
                + params.get("ledger") + "@|faint !|@");
            case FATAL -> fatal(params);
        }
    }

    private void collectionDone(Map<String, Object> params) {
        if (verbose) {
            println("@|faint " + params.get("collection") + "|@ @|green OK!|@");
            return;
        }
        double ratio = ((Number) params.get("ratio")).doubleValue();
        String action;
        if (Boolean.TRUE.equals(params.get("skipped"))) {
            action = " Skipping download. Parsing...";
        } else if (Boolean.TRUE.equals(params.get("downloadOnly"))) {
            action = " Just downloading...          ";
        } else {
            action = " Downloading and parsing...   ";
        }
        out.print("\r" + ansi.string("@|magenta " + SPINNER[spin++ % SPINNER.length] + "|@ ["
            + String.format(Locale.ROOT, "%.2f%%", ratio * 100) + "]@|faint " + action + "|@"));
        out.flush();
        progressLine = true;
    }

    private void fatal(Map<String, Object> params) {
        String kind = String.valueOf(params.get("kind"));
        if ("CANCELLATION".equals(kind)) {
            println("@|faint  User|@ @|yellow interrupted!|@");
        } else {
            String label = "CONFIGURATION".equals(kind) ? "@|red  ERROR!|@ " : "@|red  FAILED!|@ ";
            println(label, params.get("message"));
        }
        if (Boolean.TRUE.equals(params.get("resumable"))) {
            println("@|faint " + RESUME_INFO + "|@");
        }
    }

    private void detail(String markup) {
        if (verbose) {
            println(markup);
        }
    }

    private void println(String markup) {
        println(markup, "");
    }

    /// Print markup followed by text that is not interpreted as markup.
    private void println(String markup, Object plain) {
        if (progressLine) {
            out.println();
            progressLine = false;
        }
        out.println(ansi.string(markup) + plain);
        out.flush();
    }
}
