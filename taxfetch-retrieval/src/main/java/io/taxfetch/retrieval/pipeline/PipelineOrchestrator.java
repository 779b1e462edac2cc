package io.taxfetch.retrieval.pipeline;


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

import io.taxfetch.api.entrez.EntrezClient;
import io.taxfetch.api.transfer.TransferClient;
import io.taxfetch.retrieval.AcquisitionMode;
import io.taxfetch.retrieval.RetrievalSettings;
import io.taxfetch.retrieval.archive.ArchiveFetcher;
import io.taxfetch.retrieval.archive.ArchiveResult;
import io.taxfetch.retrieval.archive.ArchiveTransferException;
import io.taxfetch.retrieval.assembly.AssemblyMetadata;
import io.taxfetch.retrieval.assembly.AssemblyMetadataReader;
import io.taxfetch.retrieval.download.DownloadOutcome;
import io.taxfetch.retrieval.download.GenomeFtpFetcher;
import io.taxfetch.retrieval.download.GzipExtractor;
import io.taxfetch.retrieval.integrity.HashCheckResult;
import io.taxfetch.retrieval.integrity.IntegrityVerifier;
import io.taxfetch.retrieval.links.LinkStrategy;
import io.taxfetch.retrieval.links.LinkStrategyResolver;
import io.taxfetch.retrieval.retry.RetryExecutor;
import io.taxfetch.retrieval.sequence.BatchFetchResult;
import io.taxfetch.retrieval.sequence.BatchSequenceFetcher;
import io.taxfetch.retrieval.sequence.FastaWriter;
import io.taxfetch.retrieval.taxon.TaxonResolver;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// Runs retrieval for a list of taxa, one assembly at a time.
///
/// All taxa are resolved to assemblies first. Each assembly then moves through
/// the [AssemblyState]s: metadata, strategy, fetch, verification, and ends as
/// written or skipped. Failures are handled by the component of the stage they
/// occur in; an assembly is never restarted from the top. Fatal conditions
/// surface as [io.taxfetch.retrieval.RetrievalAbortedException].
public class PipelineOrchestrator {

    private static final Logger logger = LogManager.getLogger(PipelineOrchestrator.class);

    private final RetrievalSettings settings;
    private final TaxonResolver taxonResolver;
    private final AssemblyMetadataReader metadataReader;
    private final LinkStrategyResolver linkResolver;
    private final BatchSequenceFetcher batchFetcher;
    private final ArchiveFetcher archiveFetcher;
    private final GenomeFtpFetcher genomeFetcher;
    private final IntegrityVerifier verifier = new IntegrityVerifier();
    private final GzipExtractor extractor = new GzipExtractor();

    /// @param entrez the query client
    /// @param transfer the file client
    /// @param settings run settings
    public PipelineOrchestrator(EntrezClient entrez, TransferClient transfer, RetrievalSettings settings) {
        this.settings = settings;
        RetryExecutor retry = new RetryExecutor(settings.maxAttempts(), settings.retryBackoff());
        this.taxonResolver = new TaxonResolver(entrez, retry, settings.searchPageSize());
        this.metadataReader = new AssemblyMetadataReader(entrez, retry);
        this.linkResolver = new LinkStrategyResolver(entrez, retry, settings.linkResultCap());
        this.batchFetcher = new BatchSequenceFetcher(entrez, retry, settings.sequenceBatchSize(),
            settings.maxAttempts());
        this.archiveFetcher = new ArchiveFetcher(entrez, transfer, retry, settings.archiveBaseUrl());
        this.genomeFetcher = new GenomeFtpFetcher(transfer, settings.genomeBaseUrl());
    }

    /// Retrieve every assembly of the given taxa into an output directory.
    /// @param taxonIds the taxa, already split and trimmed
    /// @param outputDir the output directory, which must exist
    /// @return the run summary
    public RunReport run(List<String> taxonIds, Path outputDir) {
        if (!Files.isDirectory(outputDir)) {
            throw new IllegalArgumentException("Output directory does not exist: " + outputDir);
        }
        Map<String, Set<String>> assemblies = resolveTaxa(taxonIds);
        RunAccumulator accumulator = new RunAccumulator();
        Map<String, String> seen = new HashMap<>();
        int resolved = 0;

        for (Map.Entry<String, Set<String>> entry : assemblies.entrySet()) {
            String taxonId = entry.getKey();
            logger.info("Downloading contigs for taxon ID {}", taxonId);
            for (String assemblyUid : entry.getValue()) {
                resolved++;
                String firstTaxon = seen.putIfAbsent(assemblyUid, taxonId);
                if (firstTaxon != null) {
                    logger.warn("Assembly {} is listed under taxon {} and taxon {}; processing it again",
                        assemblyUid, firstTaxon, taxonId);
                }
                AssemblyState state = settings.mode() == AcquisitionMode.FTP
                    ? processGenome(taxonId, assemblyUid, outputDir, accumulator)
                    : processContigs(assemblyUid, outputDir, accumulator);
                enter(assemblyUid, state);
            }
        }

        ClassLabelWriter writer = new ClassLabelWriter(settings.noClobber());
        Path classesFile = outputDir.resolve(settings.classesFileName());
        Path labelsFile = outputDir.resolve(settings.labelsFileName());
        if (!writer.write(accumulator.classes(), classesFile)) {
            classesFile = null;
        }
        if (!writer.write(accumulator.labels(), labelsFile)) {
            labelsFile = null;
        }

        List<SkippedAssembly> skipped = accumulator.skipped();
        if (!skipped.isEmpty()) {
            logger.warn("{} genome downloads were skipped", skipped.size());
            for (SkippedAssembly skip : skipped) {
                logger.warn(skip.describe());
            }
        }
        RunReport report = new RunReport(resolved, accumulator.written(), skipped, accumulator.shortfalls(),
            accumulator.hashFailures(), classesFile, labelsFile);
        logger.info("Run {}: {} assemblies, {} written, {} skipped", report.status(), resolved, report.written(),
            skipped.size());
        return report;
    }

    /// Resolve taxa and link strategies without downloading anything.
    /// @param taxonIds the taxa, already split and trimmed
    /// @return one entry per assembly, in resolution order
    public List<AssemblyCount> count(List<String> taxonIds) {
        Map<String, Set<String>> assemblies = resolveTaxa(taxonIds);
        List<AssemblyCount> counts = new ArrayList<>();
        for (Map.Entry<String, Set<String>> entry : assemblies.entrySet()) {
            for (String assemblyUid : entry.getValue()) {
                LinkStrategy strategy = linkResolver.resolve(assemblyUid);
                int contigs = strategy instanceof LinkStrategy.DirectLinks direct ? direct.contigUids().size() : -1;
                AssemblyCount count = new AssemblyCount(entry.getKey(), assemblyUid, strategy.category(), contigs);
                if (count.isArchive()) {
                    logger.info("Assembly {}: archive", assemblyUid);
                } else {
                    logger.info("Assembly {}: {} contigs", assemblyUid, contigs);
                }
                counts.add(count);
            }
        }
        return counts;
    }

    private Map<String, Set<String>> resolveTaxa(List<String> taxonIds) {
        logger.info("Passed taxon IDs: {}", String.join(", ", taxonIds));
        Map<String, Set<String>> assemblies = new LinkedHashMap<>();
        for (String taxonId : taxonIds) {
            assemblies.put(taxonId, taxonResolver.resolve(taxonId));
        }
        assemblies.forEach((taxonId, uids) -> logger.info("Taxon {}: {} assemblies", taxonId, uids.size()));
        return assemblies;
    }

    private AssemblyState processContigs(String assemblyUid, Path outputDir, RunAccumulator accumulator) {
        enter(assemblyUid, AssemblyState.RESOLVING);
        AssemblyMetadata metadata = metadataReader.read(assemblyUid);
        enter(assemblyUid, AssemblyState.METADATA_FETCHED);
        LinkStrategy strategy = linkResolver.resolve(assemblyUid);
        enter(assemblyUid, AssemblyState.STRATEGY_CHOSEN);
        if (strategy instanceof LinkStrategy.ArchiveLink archive) {
            ArchiveResult result = archiveFetcher.fetch(archive.archiveUid(), metadata.accession(), outputDir);
            enter(assemblyUid, AssemblyState.ARCHIVE_FETCHED);
            logger.info("Wrote {} contigs to {}", result.contigDescriptions().size(), result.fastaPath());
        } else if (strategy instanceof LinkStrategy.DirectLinks direct) {
            BatchFetchResult result = batchFetcher.fetch(assemblyUid, direct.contigUids());
            enter(assemblyUid, AssemblyState.BATCH_FETCHED);
            if (!result.complete()) {
                accumulator.recordShortfall();
            }
            Path fastaPath = outputDir.resolve(metadata.accession() + ".fasta");
            try {
                int written = FastaWriter.write(result.records(), fastaPath);
                logger.info("Wrote {} contigs to {}", written, fastaPath);
            } catch (IOException e) {
                throw new OutputWriteException(fastaPath, e);
            }
        }
        accumulator.recordWritten(metadata);
        logger.info("UID: {} Label: {}", assemblyUid, metadata.labelLine());
        logger.info("UID: {} Class: {}", assemblyUid, metadata.classLine());
        return AssemblyState.WRITTEN;
    }

    private AssemblyState processGenome(String taxonId, String assemblyUid, Path outputDir,
                                        RunAccumulator accumulator) {
        enter(assemblyUid, AssemblyState.RESOLVING);
        AssemblyMetadata metadata = metadataReader.read(assemblyUid);
        enter(assemblyUid, AssemblyState.METADATA_FETCHED);
        DownloadOutcome outcome = genomeFetcher.fetch(metadata, outputDir);
        if (outcome.skipped()) {
            accumulator.recordSkipped(new SkippedAssembly(taxonId, metadata.accession(), metadata.organism(),
                metadata.strain(), outcome.sourceUrl()));
            return AssemblyState.SKIPPED;
        }

        Optional<Path> hashFile = outcome.hashFile();
        if (hashFile.isPresent()) {
            HashCheckResult check = verifier.verify(outcome.localPath(), hashFile.get());
            if (!check.passed()) {
                accumulator.recordHashFailure();
            }
            enter(assemblyUid, AssemblyState.VERIFIED);
        } else {
            logger.warn("No hash listing for {}, not verified", outcome.localPath());
            accumulator.recordHashFailure();
        }

        Path archive = outcome.localPath();
        String archiveName = archive.getFileName().toString();
        Path extracted = archive.resolveSibling(archiveName.substring(0, archiveName.length() - ".gz".length()));
        if (settings.noClobber() && Files.exists(extracted)) {
            logger.warn("Output file {} exists, not extracting", extracted);
        } else {
            try {
                extractor.extract(archive, extracted);
            } catch (IOException e) {
                logger.error("Extracting archive {} failed (exiting)", archive);
                throw new ArchiveTransferException("Extracting archive " + archive + " failed", e);
            }
        }
        accumulator.recordWritten(metadata);
        logger.info("UID: {} Label: {}", assemblyUid, metadata.labelLine());
        logger.info("UID: {} Class: {}", assemblyUid, metadata.classLine());
        return AssemblyState.WRITTEN;
    }

    private static void enter(String assemblyUid, AssemblyState state) {
        logger.debug("Assembly {}: {}", assemblyUid, state);
    }
}
