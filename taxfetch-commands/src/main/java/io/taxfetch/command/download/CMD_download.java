package io.taxfetch.command.download;


/*
 * Copyright (c) taxfetch
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

import io.taxfetch.api.entrez.ContactIdentity;
import io.taxfetch.command.common.OutputDirectoryOption;
import io.taxfetch.command.common.VerbosityOption;
import io.taxfetch.command.logging.LoggingConfigurator;
import io.taxfetch.retrieval.AcquisitionMode;
import io.taxfetch.retrieval.RetrievalAbortedException;
import io.taxfetch.retrieval.RetrievalSettings;
import io.taxfetch.retrieval.pipeline.AssemblyCount;
import io.taxfetch.retrieval.pipeline.PipelineOrchestrator;
import io.taxfetch.retrieval.pipeline.RunReport;
import io.taxfetch.transport.OkHttpEntrezClient;
import io.taxfetch.transport.OkHttpTransferClient;
import io.taxfetch.transport.TransportSettings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/// Download the assemblies of one or more taxa with their classes and labels
@CommandLine.Command(name = "download",
    header = "Download assembly sequences for NCBI taxa",
    description = {
        "Resolves every assembly below the given taxa, downloads its sequences into the output",
        "directory and writes classes and labels files describing each assembly."
    },
    exitCodeList = {"0: success, possibly with skipped assemblies", "1: retrieval aborted",
        "2: usage or precondition error"})
public class CMD_download implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_download.class);

    /// Exit code when a fatal retrieval error ends the run.
    public static final int EXIT_ABORTED = 1;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    private OutputDirectoryOption outputDirectoryOption = new OutputDirectoryOption();

    @CommandLine.Mixin
    private VerbosityOption verbosityOption = new VerbosityOption();

    @CommandLine.Option(names = {"-t", "--taxon"}, split = ",", required = true,
        description = "Comma-separated NCBI taxonomy IDs")
    private List<String> taxa = new ArrayList<>();

    @CommandLine.Option(names = {"--email"}, defaultValue = "${env:NCBI_EMAIL}",
        description = "Contact e-mail sent with every NCBI request (default: $NCBI_EMAIL)")
    private String email;

    @CommandLine.Option(names = {"--retries"}, defaultValue = "" + RetrievalSettings.DEFAULT_MAX_ATTEMPTS,
        description = "Attempts per remote call before giving up (default: ${DEFAULT-VALUE})")
    private int retries;

    @CommandLine.Option(names = {"--timeout"}, defaultValue = "30",
        description = "Connect and read timeout in seconds (default: ${DEFAULT-VALUE})")
    private int timeoutSeconds;

    @CommandLine.Option(names = {"--request-interval"}, defaultValue = "340",
        description = "Minimum milliseconds between two E-utilities requests (default: ${DEFAULT-VALUE})")
    private long requestIntervalMillis;

    @CommandLine.Option(names = {"--mode"}, defaultValue = "ENTREZ",
        description = "How sequences are acquired: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private AcquisitionMode mode;

    @CommandLine.Option(names = {"--count"},
        description = "Only report how many assemblies and contigs would be downloaded")
    private boolean countOnly;

    @CommandLine.Option(names = {"--classes"}, defaultValue = RetrievalSettings.DEFAULT_CLASSES_FILE,
        description = "Name of the classes file (default: ${DEFAULT-VALUE})")
    private String classesFileName;

    @CommandLine.Option(names = {"--labels"}, defaultValue = RetrievalSettings.DEFAULT_LABELS_FILE,
        description = "Name of the labels file (default: ${DEFAULT-VALUE})")
    private String labelsFileName;

    @CommandLine.Option(names = {"--eutils-url"}, defaultValue = TransportSettings.DEFAULT_EUTILS_URL,
        description = "E-utilities base URL (default: ${DEFAULT-VALUE})")
    private String eutilsUrl;

    @CommandLine.Option(names = {"--archive-url"}, defaultValue = RetrievalSettings.DEFAULT_ARCHIVE_BASE_URL,
        description = "Prefix for WGS archive downloads (default: ${DEFAULT-VALUE})")
    private String archiveUrl;

    @CommandLine.Option(names = {"--genome-url"}, defaultValue = RetrievalSettings.DEFAULT_GENOME_BASE_URL,
        description = "Root of the genomes file tree (default: ${DEFAULT-VALUE})")
    private String genomeUrl;

    @Override
    public Integer call() {
        LoggingConfigurator.configure(verbosityOption.consoleLevel(), verbosityOption.getLogfile());
        logger.info("Running taxfetch download for taxa {}", taxa);

        if (email == null || email.isBlank()) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "A contact e-mail is required: pass --email or set NCBI_EMAIL");
        }
        List<String> taxonIds = taxonIds(taxa);
        if (taxonIds.isEmpty()) {
            throw new CommandLine.ParameterException(spec.commandLine(), "No taxon IDs given");
        }

        RetrievalSettings settings;
        TransportSettings transportSettings;
        try {
            settings = RetrievalSettings.builder()
                .maxAttempts(retries)
                .mode(mode)
                .noClobber(outputDirectoryOption.isNoClobber())
                .classesFileName(classesFileName)
                .labelsFileName(labelsFileName)
                .archiveBaseUrl(archiveUrl)
                .genomeBaseUrl(genomeUrl)
                .build();
            transportSettings = new TransportSettings(eutilsUrl, new ContactIdentity(email),
                Duration.ofSeconds(timeoutSeconds), Duration.ofMillis(requestIntervalMillis));
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
        }

        try (OkHttpEntrezClient entrez = new OkHttpEntrezClient(transportSettings);
             OkHttpTransferClient transfer = new OkHttpTransferClient(transportSettings)) {
            PipelineOrchestrator orchestrator = new PipelineOrchestrator(entrez, transfer, settings);
            if (countOnly) {
                return count(orchestrator, taxonIds);
            }
            Path outputDir = prepareOutputDirectory();
            RunReport report = orchestrator.run(taxonIds, outputDir);
            if (report.status() == RunReport.Status.COMPLETED_WITH_SKIPS) {
                logger.warn("Completed with {} skipped assemblies", report.skipped().size());
            }
            if (report.shortfalls() > 0) {
                logger.warn("{} assemblies were written with missing records", report.shortfalls());
            }
            return CommandLine.ExitCode.OK;
        } catch (RetrievalAbortedException e) {
            logger.error("Retrieval aborted: {}", e.getMessage());
            logger.debug("Abort cause", e);
            return EXIT_ABORTED;
        }
    }

    private int count(PipelineOrchestrator orchestrator, List<String> taxonIds) {
        List<AssemblyCount> counts = orchestrator.count(taxonIds);
        PrintWriter out = spec.commandLine().getOut();
        for (AssemblyCount count : counts) {
            out.printf("%s\t%s\t%s%n", count.taxonId(), count.assemblyUid(),
                count.isArchive() ? "archive" : Integer.toString(count.contigCount()));
        }
        out.flush();
        return CommandLine.ExitCode.OK;
    }

    private Path prepareOutputDirectory() {
        OutputDirectoryOption.OutputDirectory outputDirectory = outputDirectoryOption.getOutputDirectory();
        try {
            return outputDirectory.prepare();
        } catch (IllegalStateException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
        } catch (IOException e) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Could not prepare output directory " + outputDirectory.path() + ": " + e.getMessage(), e);
        }
    }

    /// Trim taxon IDs and drop empty entries left by stray commas.
    /// @param raw the values as given on the command line
    /// @return the taxon IDs in order
    static List<String> taxonIds(List<String> raw) {
        List<String> ids = new ArrayList<>();
        for (String value : raw) {
            String id = value.trim();
            if (!id.isEmpty()) {
                ids.add(id);
            }
        }
        return ids;
    }
}
