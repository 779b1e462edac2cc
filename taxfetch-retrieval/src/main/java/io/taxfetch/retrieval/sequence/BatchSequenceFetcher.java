package io.taxfetch.retrieval.sequence;


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
import io.taxfetch.retrieval.retry.RetryExecutor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/// Fetches the contig records of one assembly in fixed-size batches.
///
/// A full pass requests every batch and counts the records. A pass that returns
/// fewer records than identifiers is repeated in full, up to the attempt ceiling;
/// a pass that returns more is accepted with a warning. When every pass comes up
/// short the records of the last one are returned anyway and the shortfall is logged.
public class BatchSequenceFetcher {

    private static final Logger logger = LogManager.getLogger(BatchSequenceFetcher.class);

    static final String NUCLEOTIDE_DB = "nucleotide";

    private final EntrezClient entrez;
    private final RetryExecutor retry;
    private final int batchSize;
    private final int maxPasses;

    /// @param entrez the query client
    /// @param retry the retry policy for each batch call
    /// @param batchSize identifiers per batch call
    /// @param maxPasses full passes allowed while records are missing
    public BatchSequenceFetcher(EntrezClient entrez, RetryExecutor retry, int batchSize, int maxPasses) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        if (maxPasses < 1) {
            throw new IllegalArgumentException("maxPasses must be at least 1: " + maxPasses);
        }
        this.entrez = entrez;
        this.retry = retry;
        this.batchSize = batchSize;
        this.maxPasses = maxPasses;
    }

    /// @param assemblyUid the assembly identifier, for log messages
    /// @param contigUids the contig identifiers to fetch
    /// @return the records collected, whether or not the expected count was met
    public BatchFetchResult fetch(String assemblyUid, Collection<String> contigUids) {
        List<String> ids = List.copyOf(contigUids);
        int expected = ids.size();
        logger.info("Downloading FASTA records for assembly {} ({} contigs)", assemblyUid, expected);

        List<FastaRecord> records = List.of();
        int pass = 0;
        while (pass < maxPasses) {
            pass++;
            records = fetchAllBatches(assemblyUid, ids);
            if (records.size() == expected) {
                break;
            }
            logger.warn("{} contigs expected, {} contigs returned for assembly {}", expected, records.size(),
                assemblyUid);
            if (records.size() > expected) {
                logger.warn("(continuing)");
                break;
            }
            logger.warn("FASTA download for assembly {} incomplete, try {}/{}", assemblyUid, pass, maxPasses);
        }

        BatchFetchResult result = new BatchFetchResult(assemblyUid, expected, records, pass);
        logger.info("Downloaded genome size: {}", result.totalLength());
        if (!result.complete()) {
            logger.error("Failed to download all records for assembly {}, {} missing (continuing)", assemblyUid,
                result.shortfall());
        }
        return result;
    }

    private List<FastaRecord> fetchAllBatches(String assemblyUid, List<String> ids) {
        List<FastaRecord> records = new ArrayList<>();
        for (int start = 0; start < ids.size(); start += batchSize) {
            int retstart = start;
            logger.info("Batch: {}-{}", retstart, retstart + batchSize);
            String fasta = retry.execute("EFetch nucleotide for assembly " + assemblyUid + " batch " + retstart,
                () -> entrez.fetchFasta(NUCLEOTIDE_DB, ids, retstart, batchSize));
            records.addAll(FastaReader.parse(fasta));
        }
        return records;
    }
}
