package io.taxfetch.retrieval.download;


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

import io.taxfetch.api.transfer.RemoteResource;
import io.taxfetch.api.transfer.TransferClient;
import io.taxfetch.retrieval.assembly.AssemblyMetadata;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/// Downloads the whole-genome FASTA archive and MD5 listing of an assembly from the genomes file tree.
///
/// Candidate directories are derived from the accession and assembly name, then
/// from the GenBank and RefSeq paths of the summary. The first candidate that
/// answers with a content length is downloaded; if none does the assembly is skipped.
public class GenomeFtpFetcher {

    private static final Logger logger = LogManager.getLogger(GenomeFtpFetcher.class);

    /// Suffix of the genome archive within an assembly directory.
    public static final String GENOME_SUFFIX = "_genomic.fna.gz";
    /// Name of the hash listing within an assembly directory.
    public static final String HASH_LISTING = "md5checksums.txt";

    private final TransferClient transfer;
    private final String genomeBaseUrl;
    private final ResourceDownloader downloader = new ResourceDownloader();

    /// @param transfer the file client
    /// @param genomeBaseUrl root of the genomes tree, e.g. `https://ftp.ncbi.nlm.nih.gov/genomes/all`
    public GenomeFtpFetcher(TransferClient transfer, String genomeBaseUrl) {
        this.transfer = transfer;
        this.genomeBaseUrl = genomeBaseUrl.endsWith("/")
            ? genomeBaseUrl.substring(0, genomeBaseUrl.length() - 1) : genomeBaseUrl;
    }

    /// File stem of an assembly, `<accession>_<assembly name>` with unsafe characters replaced.
    /// @param metadata the assembly
    /// @return the stem
    public static String fileStem(AssemblyMetadata metadata) {
        String stem = metadata.assemblyName().isEmpty()
            ? metadata.accession() : metadata.accession() + "_" + metadata.assemblyName();
        return stem.replaceAll("[ /,#()]", "_");
    }

    /// Candidate assembly directories, most specific first.
    /// @param metadata the assembly
    /// @return directory URLs without trailing slash
    public List<String> candidateDirectories(AssemblyMetadata metadata) {
        Set<String> candidates = new LinkedHashSet<>();
        String accession = metadata.accession();
        String stem = fileStem(metadata);
        int underscore = accession.indexOf('_');
        if (underscore > 0) {
            String prefix = accession.substring(0, underscore);
            String digits = accession.substring(underscore + 1).replaceAll("\\..*$", "");
            if (digits.matches("\\d{9}")) {
                candidates.add(String.join("/", genomeBaseUrl, prefix, digits.substring(0, 3), digits.substring(3, 6),
                    digits.substring(6, 9), stem));
            }
        }
        addPath(candidates, metadata.genbankFtpPath());
        addPath(candidates, metadata.refseqFtpPath());
        return new ArrayList<>(candidates);
    }

    /// @param metadata the assembly
    /// @param outputDir directory receiving the archive and the listing
    /// @return the outcome, skipped if no candidate answered
    public DownloadOutcome fetch(AssemblyMetadata metadata, Path outputDir) {
        List<String> directories = candidateDirectories(metadata);
        String lastUrl = null;
        for (String directory : directories) {
            String name = directory.substring(directory.lastIndexOf('/') + 1);
            String url = directory + "/" + name + GENOME_SUFFIX;
            lastUrl = url;
            logger.info("Trying URL: {}", url);
            Path genomePath = outputDir.resolve(name + GENOME_SUFFIX);
            try (RemoteResource resource = transfer.open(url)) {
                if (resource.contentLength() < 0) {
                    logger.warn("No content length for {}", url);
                    continue;
                }
                downloader.download(resource, genomePath);
            } catch (IOException | IllegalArgumentException e) {
                logger.warn("Download failed for {}: {}", url, e.getMessage());
                deleteQuietly(genomePath);
                continue;
            }
            Path hashPath = fetchHashes(directory, outputDir.resolve(name + "_hashes.txt"));
            logger.info("Downloaded from URL: {}", url);
            return DownloadOutcome.downloaded(genomePath, hashPath, url);
        }
        logger.warn("No download candidate answered for {} ({})", metadata.accession(), metadata.displayName());
        return DownloadOutcome.skipped(lastUrl == null ? genomeBaseUrl : lastUrl);
    }

    private Path fetchHashes(String directory, Path hashPath) {
        String url = directory + "/" + HASH_LISTING;
        try (RemoteResource resource = transfer.open(url)) {
            downloader.download(resource, hashPath);
            return hashPath;
        } catch (IOException e) {
            logger.warn("Could not download hash listing {}: {}", url, e.getMessage());
            deleteQuietly(hashPath);
            return null;
        }
    }

    private static void addPath(Set<String> candidates, String path) {
        if (path == null || path.isBlank()) {
            return;
        }
        String trimmed = path.trim();
        String lower = trimmed.toLowerCase();
        if (!lower.startsWith("ftp://") && !lower.startsWith("http://") && !lower.startsWith("https://")) {
            logger.warn("Ignoring download path without a supported scheme: {}", trimmed);
            return;
        }
        if (lower.startsWith("ftp://")) {
            trimmed = "https://" + trimmed.substring("ftp://".length());
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        candidates.add(trimmed);
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.debug("Could not remove partial file {}: {}", path, e.getMessage());
        }
    }
}
