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

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/// The chosen way of obtaining sequence data for one assembly.
public sealed interface LinkStrategy permits LinkStrategy.DirectLinks, LinkStrategy.ArchiveLink {

    /// @return the link category the strategy was taken from
    LinkCategory category();

    /// Contig records fetched by identifier.
    /// @param category [LinkCategory#INSDC] or [LinkCategory#REFSEQ]
    /// @param contigUids the contig identifiers, fixed for the rest of the assembly's processing
    record DirectLinks(LinkCategory category, Set<String> contigUids) implements LinkStrategy {
        public DirectLinks {
            if (category == null || !category.isDirect()) {
                throw new IllegalArgumentException("Direct links need a direct category: " + category);
            }
            contigUids = Collections.unmodifiableSet(new LinkedHashSet<>(contigUids));
        }
    }

    /// The WGS master record whose archive holds every contig.
    /// @param archiveUid nucleotide identifier of the WGS master record
    /// @param capOverride true when a truncated direct result was discarded in favour of the archive
    record ArchiveLink(String archiveUid, boolean capOverride) implements LinkStrategy {
        public ArchiveLink {
            if (archiveUid == null || archiveUid.isBlank()) {
                throw new IllegalArgumentException("Archive link needs a record identifier");
            }
        }

        @Override
        public LinkCategory category() {
            return LinkCategory.WGS_MASTER;
        }
    }
}
