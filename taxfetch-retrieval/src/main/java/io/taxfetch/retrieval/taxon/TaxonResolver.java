package io.taxfetch.retrieval.taxon;


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
import io.taxfetch.api.entrez.SearchHandle;
import io.taxfetch.retrieval.retry.RetryExecutor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/// Resolves a taxon identifier to the assemblies in its subtree.
///
/// One history-enabled search gives the total count, then the identifiers are
/// read back in fixed-size pages and collected into a set.
public class TaxonResolver {

    private static final Logger logger = LogManager.getLogger(TaxonResolver.class);

    static final String ASSEMBLY_DB = "assembly";

    private final EntrezClient entrez;
    private final RetryExecutor retry;
    private final int pageSize;

    public TaxonResolver(EntrezClient entrez, RetryExecutor retry, int pageSize) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be positive: " + pageSize);
        }
        this.entrez = entrez;
        this.retry = retry;
        this.pageSize = pageSize;
    }

    /// Query selecting every assembly at or below a taxon.
    /// @param taxonId the taxon identifier
    /// @return the search term
    public static String subtreeQuery(String taxonId) {
        return "txid" + taxonId + "[Organism:exp]";
    }

    /// @param taxonId the taxon identifier
    /// @return unique assembly identifiers in the order first seen
    public Set<String> resolve(String taxonId) {
        if (taxonId == null || taxonId.isBlank()) {
            throw new IllegalArgumentException("Taxon ID cannot be blank");
        }
        String query = subtreeQuery(taxonId.trim());
        logger.info("ESearch for {}", query);
        SearchHandle handle = retry.execute("ESearch " + query, () -> entrez.search(ASSEMBLY_DB, query));
        logger.info("ESearch returns {} assembly IDs for taxon {}", handle.count(), taxonId);

        Set<String> assemblies = new LinkedHashSet<>();
        for (int start = 0; start < handle.count(); start += pageSize) {
            int retstart = start;
            List<String> page = retry.execute("EFetch " + query + " page " + retstart,
                () -> entrez.fetchIdPage(ASSEMBLY_DB, handle, retstart, pageSize));
            int window = Math.min(pageSize, handle.count() - retstart);
            if (page.size() > window) {
                logger.warn("Page {} for taxon {} returned {} identifiers, keeping the first {}", retstart,
                    taxonId, page.size(), window);
                page = page.subList(0, window);
            }
            assemblies.addAll(page);
        }
        logger.info("Identified {} unique assemblies for taxon {}", assemblies.size(), taxonId);
        return Collections.unmodifiableSet(assemblies);
    }
}
