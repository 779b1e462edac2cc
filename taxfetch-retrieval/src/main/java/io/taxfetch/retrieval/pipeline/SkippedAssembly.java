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

/// An assembly for which no data could be retrieved.
///
/// @param taxonId the taxon the assembly was found under
/// @param accession the assembly accession
/// @param organism the organism name
/// @param strain the strain, may be empty
/// @param url the last URL tried
public record SkippedAssembly(String taxonId, String accession, String organism, String strain, String url) {

    /// @return a multi-line description for the end-of-run summary
    public String describe() {
        return organism + " " + strain + ":\n\ttaxon id: " + taxonId + "\n\taccession: " + accession
            + "\n\tURL: " + url;
    }
}
