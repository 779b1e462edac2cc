package io.taxfetch.retrieval;


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

import java.time.Duration;

/// Immutable settings for a retrieval run.
///
/// @param maxAttempts attempts per remote call and per batched sequence fetch
/// @param retryBackoff pause between attempts
/// @param searchPageSize identifiers per search page
/// @param sequenceBatchSize identifiers per sequence fetch
/// @param linkResultCap the largest link result the server returns; a result of exactly this size is truncated
/// @param archiveBaseUrl prefix to which WGS archive file names are appended
/// @param genomeBaseUrl root of the genomes file tree
/// @param mode how sequence data is acquired
/// @param noClobber keep existing class, label and extracted genome files
/// @param classesFileName name of the classes file in the output directory
/// @param labelsFileName name of the labels file in the output directory
public record RetrievalSettings(
    int maxAttempts,
    Duration retryBackoff,
    int searchPageSize,
    int sequenceBatchSize,
    int linkResultCap,
    String archiveBaseUrl,
    String genomeBaseUrl,
    AcquisitionMode mode,
    boolean noClobber,
    String classesFileName,
    String labelsFileName
) {

    public static final int DEFAULT_MAX_ATTEMPTS = 20;
    public static final int DEFAULT_SEARCH_PAGE_SIZE = 250;
    public static final int DEFAULT_SEQUENCE_BATCH_SIZE = 10000;
    public static final int DEFAULT_LINK_RESULT_CAP = 100000;
    public static final String DEFAULT_ARCHIVE_BASE_URL = "https://www.ncbi.nlm.nih.gov/Traces/wgs/?download=";
    public static final String DEFAULT_GENOME_BASE_URL = "https://ftp.ncbi.nlm.nih.gov/genomes/all";
    public static final String DEFAULT_CLASSES_FILE = "classes.txt";
    public static final String DEFAULT_LABELS_FILE = "labels.txt";

    public RetrievalSettings {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        if (retryBackoff == null) {
            retryBackoff = Duration.ZERO;
        }
        if (retryBackoff.isNegative()) {
            throw new IllegalArgumentException("retryBackoff cannot be negative: " + retryBackoff);
        }
        requirePositive("searchPageSize", searchPageSize);
        requirePositive("sequenceBatchSize", sequenceBatchSize);
        requirePositive("linkResultCap", linkResultCap);
        archiveBaseUrl = requireUrl("archiveBaseUrl", archiveBaseUrl, DEFAULT_ARCHIVE_BASE_URL);
        genomeBaseUrl = requireUrl("genomeBaseUrl", genomeBaseUrl, DEFAULT_GENOME_BASE_URL);
        while (genomeBaseUrl.endsWith("/")) {
            genomeBaseUrl = genomeBaseUrl.substring(0, genomeBaseUrl.length() - 1);
        }
        if (mode == null) {
            mode = AcquisitionMode.ENTREZ;
        }
        classesFileName = requireFileName("classesFileName", classesFileName, DEFAULT_CLASSES_FILE);
        labelsFileName = requireFileName("labelsFileName", labelsFileName, DEFAULT_LABELS_FILE);
    }

    /// @return settings with every default applied
    public static RetrievalSettings defaults() {
        return builder().build();
    }

    /// @return a builder starting from the defaults
    public static Builder builder() {
        return new Builder();
    }

    private static void requirePositive(String name, int value) {
        if (value < 1) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
    }

    private static String requireUrl(String name, String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        String lower = value.trim().toLowerCase();
        if (!lower.startsWith("http://") && !lower.startsWith("https://") && !lower.startsWith("ftp://")) {
            throw new IllegalArgumentException(name + " must be an HTTP, HTTPS or FTP URL: " + value);
        }
        return value.trim();
    }

    private static String requireFileName(String name, String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        if (value.contains("/") || value.contains("\\")) {
            throw new IllegalArgumentException(name + " must be a plain file name: " + value);
        }
        return value.trim();
    }

    /// Builder for [RetrievalSettings].
    public static final class Builder {
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private Duration retryBackoff = Duration.ZERO;
        private int searchPageSize = DEFAULT_SEARCH_PAGE_SIZE;
        private int sequenceBatchSize = DEFAULT_SEQUENCE_BATCH_SIZE;
        private int linkResultCap = DEFAULT_LINK_RESULT_CAP;
        private String archiveBaseUrl = DEFAULT_ARCHIVE_BASE_URL;
        private String genomeBaseUrl = DEFAULT_GENOME_BASE_URL;
        private AcquisitionMode mode = AcquisitionMode.ENTREZ;
        private boolean noClobber;
        private String classesFileName = DEFAULT_CLASSES_FILE;
        private String labelsFileName = DEFAULT_LABELS_FILE;

        private Builder() {
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder retryBackoff(Duration retryBackoff) {
            this.retryBackoff = retryBackoff;
            return this;
        }

        public Builder searchPageSize(int searchPageSize) {
            this.searchPageSize = searchPageSize;
            return this;
        }

        public Builder sequenceBatchSize(int sequenceBatchSize) {
            this.sequenceBatchSize = sequenceBatchSize;
            return this;
        }

        public Builder linkResultCap(int linkResultCap) {
            this.linkResultCap = linkResultCap;
            return this;
        }

        public Builder archiveBaseUrl(String archiveBaseUrl) {
            this.archiveBaseUrl = archiveBaseUrl;
            return this;
        }

        public Builder genomeBaseUrl(String genomeBaseUrl) {
            this.genomeBaseUrl = genomeBaseUrl;
            return this;
        }

        public Builder mode(AcquisitionMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder noClobber(boolean noClobber) {
            this.noClobber = noClobber;
            return this;
        }

        public Builder classesFileName(String classesFileName) {
            this.classesFileName = classesFileName;
            return this;
        }

        public Builder labelsFileName(String labelsFileName) {
            this.labelsFileName = labelsFileName;
            return this;
        }

        public RetrievalSettings build() {
            return new RetrievalSettings(maxAttempts, retryBackoff, searchPageSize, sequenceBatchSize,
                linkResultCap, archiveBaseUrl, genomeBaseUrl, mode, noClobber, classesFileName, labelsFileName);
        }
    }
}
