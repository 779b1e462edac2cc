package io.taxfetch.retrieval.archive;


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

import com.fasterxml.jackson.databind.JsonNode;
import io.taxfetch.api.entrez.EntrezClient;
import io.taxfetch.api.transfer.RemoteResource;
import io.taxfetch.api.transfer.TransferClient;
import io.taxfetch.retrieval.download.GzipExtractor;
import io.taxfetch.retrieval.download.ResourceDownloader;
import io.taxfetch.retrieval.retry.RetryExecutor;
import io.taxfetch.retrieval.sequence.FastaReader;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/// Obtains all contigs of an assembly from its WGS master archive.
///
/// The archive name comes from the annotation of the WGS master record. Versions
/// are probed from the annotated one downwards until the server declares a
/// content length; the archive is then streamed to the output directory and
/// unpacked to `<accession>.fasta`.
public class ArchiveFetcher {

    private static final Logger logger = LogManager.getLogger(ArchiveFetcher.class);

    private final EntrezClient entrez;
    private final TransferClient transfer;
    private final RetryExecutor retry;
    private final String archiveBaseUrl;
    private final ResourceDownloader downloader = new ResourceDownloader();
    private final GzipExtractor extractor = new GzipExtractor();

    /// @param entrez the query client, for the master record summary
    /// @param transfer the file client, for the archive
    /// @param retry the retry policy for the summary call
    /// @param archiveBaseUrl prefix to which archive file names are appended
    public ArchiveFetcher(EntrezClient entrez, TransferClient transfer, RetryExecutor retry, String archiveBaseUrl) {
        this.entrez = entrez;
        this.transfer = transfer;
        this.retry = retry;
        this.archiveBaseUrl = archiveBaseUrl;
    }

    /// @param archiveUid nucleotide identifier of the WGS master record
    /// @param accession the assembly accession, which names the FASTA file
    /// @param outputDir directory receiving the archive and the FASTA file
    /// @return the unpacked archive
    /// @throws AnnotationFormatException if the master record annotation cannot be read
    /// @throws ArchiveVersionExhaustedException if no archive version answers
    /// @throws ArchiveTransferException if the download or decompression fails
    public ArchiveResult fetch(String archiveUid, String accession, Path outputDir) {
        logger.info("Processing wgsmaster UID: {}", archiveUid);
        JsonNode summary = retry.execute("ESummary nuccore " + archiveUid, () -> entrez.summary("nuccore", archiveUid));
        ArchiveReference reference = ArchiveReference.parse(summary.path("extra").asText(null));

        Probe probe = probe(reference);
        ArchiveReference found = probe.reference();
        try (RemoteResource resource = probe.resource()) {
            Path archivePath = outputDir.resolve(found.fileName());
            try {
                downloader.download(resource, archivePath);
            } catch (IOException e) {
                logger.error("Download failed for {} (exiting)", found.fileName());
                throw new ArchiveTransferException("Download failed for " + resource.url(), e);
            }

            Path fastaPath = outputDir.resolve(accession + ".fasta");
            List<String> descriptions;
            try {
                extractor.extract(archivePath, fastaPath);
                descriptions = FastaReader.descriptions(fastaPath);
            } catch (IOException e) {
                logger.error("Extracting archive {} failed (exiting)", archivePath);
                throw new ArchiveTransferException("Extracting archive " + archivePath + " failed", e);
            }
            logger.info("Archive {} holds {} contigs", found.fileName(), descriptions.size());
            return new ArchiveResult(found, resource.url(), archivePath, fastaPath, descriptions);
        } catch (IOException e) {
            throw new ArchiveTransferException("Could not release archive connection", e);
        }
    }

    /// @param reference an archive version
    /// @return its download URL
    public String urlFor(ArchiveReference reference) {
        return archiveBaseUrl + reference.fileName();
    }

    private record Probe(ArchiveReference reference, RemoteResource resource) {
    }

    private Probe probe(ArchiveReference start) {
        List<String> attempted = new ArrayList<>();
        ArchiveReference reference = start;
        while (true) {
            String url = urlFor(reference);
            attempted.add(url);
            logger.info("Trying URL: {}", url);
            try {
                RemoteResource resource = transfer.open(url);
                if (resource.contentLength() > 0) {
                    logger.info("Downloading: {} Bytes: {}", reference.fileName(), resource.contentLength());
                    return new Probe(reference, resource);
                }
                resource.close();
                logger.warn("Download failed for ({}): no content length established", url);
            } catch (IOException e) {
                logger.warn("Download failed for ({}): {}", url, e.getMessage());
            }
            if (!reference.hasPrevious()) {
                logger.error("No archive version left to try for {} (exiting)", start.stem());
                throw new ArchiveVersionExhaustedException(start.stem(), attempted);
            }
            reference = reference.previous();
            logger.info("Retrying download with version = {}", reference.version());
        }
    }
}
