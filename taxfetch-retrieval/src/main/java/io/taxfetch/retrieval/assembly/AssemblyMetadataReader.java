package io.taxfetch.retrieval.assembly;


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
import io.taxfetch.retrieval.retry.RetryExecutor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/// Reads [AssemblyMetadata] from an assembly document summary.
///
/// The summary is fetched under the retry policy; a summary that still cannot be
/// obtained, or one without accession or organism, aborts the run.
public class AssemblyMetadataReader {

    private static final Logger logger = LogManager.getLogger(AssemblyMetadataReader.class);

    private final EntrezClient entrez;
    private final RetryExecutor retry;

    public AssemblyMetadataReader(EntrezClient entrez, RetryExecutor retry) {
        this.entrez = entrez;
        this.retry = retry;
    }

    /// @param assemblyUid the assembly identifier
    /// @return metadata for the assembly
    /// @throws IncompleteMetadataException if accession or organism are missing
    public AssemblyMetadata read(String assemblyUid) {
        logger.info("Get eSummary information for assembly {}", assemblyUid);
        JsonNode summary = retry.execute("ESummary assembly " + assemblyUid,
            () -> entrez.summary("assembly", assemblyUid));
        AssemblyMetadata metadata = fromSummary(assemblyUid, summary);
        logger.info("Assembly {}: accession {}, organism {}, strain '{}', species taxid {}", assemblyUid,
            metadata.accession(), metadata.organism(), metadata.strain(), metadata.speciesTaxid());
        return metadata;
    }

    /// @param assemblyUid the assembly identifier
    /// @param summary the document summary record
    /// @return metadata for the assembly
    static AssemblyMetadata fromSummary(String assemblyUid, JsonNode summary) {
        String accession = text(summary, "assemblyaccession");
        if (accession.isEmpty()) {
            throw new IncompleteMetadataException(assemblyUid, "assemblyaccession");
        }
        String organism = text(summary, "speciesname");
        if (organism.isEmpty()) {
            throw new IncompleteMetadataException(assemblyUid, "speciesname");
        }
        JsonNode infraspecies = summary.path("biosource").path("infraspecieslist");
        String strain = infraspecies.isArray() && !infraspecies.isEmpty()
            ? infraspecies.get(0).path("sub_value").asText("") : "";
        return AssemblyMetadata.of(assemblyUid, accession, text(summary, "assemblyname"), organism, strain,
            text(summary, "speciestaxid"), text(summary, "ftppath_genbank"), text(summary, "ftppath_refseq"));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isValueNode() ? value.asText("").trim() : "";
    }
}
