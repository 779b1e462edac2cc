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

import io.taxfetch.retrieval.links.LinkCategory;

/// Resolution result for one assembly in a count-only run.
///
/// @param taxonId the taxon the assembly was found under
/// @param assemblyUid the assembly identifier
/// @param category the chosen link category
/// @param contigCount the number of contig identifiers, -1 for archive strategies
public record AssemblyCount(String taxonId, String assemblyUid, LinkCategory category, int contigCount) {

    /// @return true if the contigs would come from a WGS archive
    public boolean isArchive() {
        return category == LinkCategory.WGS_MASTER;
    }
}
