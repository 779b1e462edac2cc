package io.taxfetch.retrieval.links;


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
import io.taxfetch.api.entrez.LinkSet;
import io.taxfetch.retrieval.retry.RetryExecutor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/// Chooses how an assembly's sequences will be obtained from its nucleotide links.
///
/// Categories are matched in the order INSDC, RefSeq, WGS master. A direct result
/// whose size equals the server's cap is truncated and is replaced by the WGS
/// master archive.
public class LinkStrategyResolver {

    private static final Logger logger = LogManager.getLogger(LinkStrategyResolver.class);

    private final EntrezClient entrez;
    private final RetryExecutor retry;
    private final int resultCap;

    public LinkStrategyResolver(EntrezClient entrez, RetryExecutor retry, int resultCap) {
        this.entrez = entrez;
        this.retry = retry;
        this.resultCap = resultCap;
    }

    /// @param assemblyUid the assembly identifier
    /// @return the chosen strategy
    /// @throws UnrecognizedLinkCategoryException if no usable category is linked
    public LinkStrategy resolve(String assemblyUid) {
        logger.info("Finding contig UIDs for assembly {}", assemblyUid);
        LinkSet links = retry.execute("ELink assembly " + assemblyUid,
            () -> entrez.link("assembly", "nuccore", assemblyUid));
        LinkStrategy strategy = select(links, resultCap);
        if (strategy instanceof LinkStrategy.DirectLinks direct) {
            logger.info("Using {} links: {} contig UIDs for assembly {}", direct.category().linkName(),
                direct.contigUids().size(), assemblyUid);
        } else if (strategy instanceof LinkStrategy.ArchiveLink archive) {
            logger.info("Using {} link {} for assembly {}", LinkCategory.WGS_MASTER.linkName(),
                archive.archiveUid(), assemblyUid);
        }
        return strategy;
    }

    /// Select a strategy from the links of one assembly.
    /// @param links the assembly's nucleotide links
    /// @param resultCap size at which a direct result is considered truncated
    /// @return the chosen strategy
    /// @throws UnrecognizedLinkCategoryException if no usable category is linked
    public static LinkStrategy select(LinkSet links, int resultCap) {
        for (LinkCategory category : LinkCategory.values()) {
            if (!links.has(category.linkName())) {
                continue;
            }
            if (category.isDirect()) {
                Set<String> contigs = new LinkedHashSet<>(links.ids(category.linkName()));
                if (contigs.size() != resultCap) {
                    return new LinkStrategy.DirectLinks(category, contigs);
                }
                logger.warn("{} returned {} contig UIDs for assembly {}, the result cap; using the WGS master archive",
                    category.linkName(), contigs.size(), links.uid());
                return archiveLink(links, true, "Capped " + category.linkName() + " result and no WGS master link");
            }
            return archiveLink(links, false, "Empty " + category.linkName() + " link");
        }
        logger.error("No recognised contig link for assembly {}; available links: {}", links.uid(), links.names());
        throw new UnrecognizedLinkCategoryException(links.uid(), new ArrayList<>(links.names()),
            "No recognised contig link");
    }

    private static LinkStrategy archiveLink(LinkSet links, boolean capOverride, String failure) {
        String name = LinkCategory.WGS_MASTER.linkName();
        List<String> ids = links.has(name) ? links.ids(name) : List.of();
        if (ids.isEmpty()) {
            logger.error("{} for assembly {}; available links: {}", failure, links.uid(), links.names());
            throw new UnrecognizedLinkCategoryException(links.uid(), new ArrayList<>(links.names()), failure);
        }
        return new LinkStrategy.ArchiveLink(ids.get(0), capOverride);
    }
}
