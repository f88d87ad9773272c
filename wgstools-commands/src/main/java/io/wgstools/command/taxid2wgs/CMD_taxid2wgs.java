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

import io.wgstools.api.CancellationToken;
import io.wgstools.api.ExitStatus;
import io.wgstools.pipeline.PipelineConfig;
import io.wgstools.pipeline.PipelineOrchestrator;
import io.wgstools.status.EventSink;
import io.wgstools.status.sinks.LoggerEventSink;
import io.wgstools.status.sinks.MulticastEventSink;
import io.wgstools.transport.discovery.IdentifierListFetcher;
import io.wgstools.transport.ftp.FtpTransferSessionFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;

/// Collect the WGS projects of a taxonomy id into one FASTA file.
///
/// Usage:
/// ```
/// taxid2wgs [-deVv] [-f | -r] [-t taxid] [-x taxid] [--workdir dir] [--config file]
/// ```
@CommandLine.Command(name = "taxid2wgs",
    header = "Get WGS projects of a NCBI taxonomy id and merge them into one FASTA file",
    description = """
        Asks NCBI which whole genome shotgun projects belong to the taxonomy id,
        downloads their nucleotide FASTA files from the NCBI FTP server and merges
        them into WGS4taxid<taxid>[-<exclude>].fa, rewriting old style headers.
        Completed projects are recorded in a .tmp ledger so an interrupted run can
        be continued with --resume.
        """,
    mixinStandardHelpOptions = true,
    version = {"taxid2wgs 0.2.0"},
    exitCodeListHeading = "Exit codes:%n")
public class CMD_taxid2wgs implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_taxid2wgs.class);

    /// How long an interrupted run may take to clean up before the process halts
    static final Duration INTERRUPT_GRACE = Duration.ofSeconds(15);

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = {"-t", "--taxid"}, defaultValue = "548681",
        description = "NCBI taxonomy id of the projects to collect (default: ${DEFAULT-VALUE})")
    private String taxid;

    @CommandLine.Option(names = {"-x", "--exclude"},
        description = "NCBI taxonomy id whose projects are left out")
    private String exclude = "";

    @CommandLine.Option(names = {"-d", "--download"},
        description = "Just download the project files, without merging them")
    private boolean download;

    @CommandLine.Option(names = {"-e", "--reverse"},
        description = "Process the projects in reverse order")
    private boolean reverse;

    @CommandLine.ArgGroup(exclusive = true, multiplicity = "0..1")
    private Mode mode = new Mode();

    static class Mode {
        @CommandLine.Option(names = {"-f", "--force"}, required = true,
            description = "Discard previous output and ledger and download files again")
        boolean force;

        @CommandLine.Option(names = {"-r", "--resume"}, required = true,
            description = "Continue an interrupted run from its ledger")
        boolean resume;
    }

    @CommandLine.Option(names = {"-v", "--verbose"},
        description = "Show every step")
    private boolean verbose;

    @CommandLine.Option(names = "--workdir", defaultValue = ".",
        description = "Directory for the output, the ledger and the downloaded files (default: ${DEFAULT-VALUE})")
    private Path workdir;

    @CommandLine.Option(names = "--config",
        description = "YAML file overriding service endpoints, timeouts and the retry schedule")
    private Path config;

    /// Create the taxid2wgs command
    public CMD_taxid2wgs() {
    }

    /// Run taxid2wgs directly
    /// @param args command line arguments
    public static void main(String[] args) {
        int exitCode = createCommandLine(new CMD_taxid2wgs()).execute(args);
        System.exit(exitCode);
    }

    /// @param command the command instance to wrap
    /// @return a command line with the exit code list filled in
    static CommandLine createCommandLine(CMD_taxid2wgs command) {
        CommandLine commandLine = new CommandLine(command);
        commandLine.getCommandSpec().usageMessage().exitCodeList(ExitStatus.exitCodeList());
        return commandLine;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        CommandLine.Help.Ansi ansi = spec.commandLine().getColorScheme().ansi();
        out.println();
        out.println(ansi.string("@|bold =-= taxid2wgs =-= v0.2.0 =-=|@"));
        out.println();
        out.flush();

        FetchSettings settings = loadSettings();
        if (!Files.isDirectory(workdir)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Working directory does not exist: " + workdir);
        }
        PipelineConfig pipelineConfig;
        try {
            pipelineConfig = new PipelineConfig(taxid, exclude, download, reverse, mode.force, mode.resume, workdir);
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
        }

        CancellationToken token = new CancellationToken();
        EventSink events = new MulticastEventSink(
            new ConsoleEventSink(out, verbose, ansi),
            new LoggerEventSink("io.wgstools.events"));
        PipelineOrchestrator orchestrator = new PipelineOrchestrator(
            pipelineConfig,
            IdentifierListFetcher.create(settings.discoveryUrl(), settings.ftp().dataTimeout()),
            new FtpTransferSessionFactory(settings.ftp(), token),
            settings.retrySchedule(),
            token,
            token,
            events);

        InterruptHandler interrupts = InterruptHandler.install(token, INTERRUPT_GRACE);
        try {
            ExitStatus status = orchestrator.run();
            logger.debug("taxid2wgs finished with {}", status);
            return status.code();
        } finally {
            interrupts.finished();
        }
    }

    private FetchSettings loadSettings() {
        if (config == null) {
            return FetchSettings.defaults();
        }
        try {
            return FetchSettings.load(config);
        } catch (IOException | RuntimeException e) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Unable to load settings from " + config + ": " + e.getMessage(), e);
        }
    }
}
