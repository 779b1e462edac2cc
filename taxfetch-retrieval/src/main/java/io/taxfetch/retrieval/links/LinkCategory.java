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

import java.util.Optional;

/// Assembly to nucleotide link categories, in order of preference.
public enum LinkCategory {
    INSDC("assembly_nuccore_insdc"),
    REFSEQ("assembly_nuccore_refseq"),
    WGS_MASTER("assembly_nuccore_wgsmaster");

    private final String linkName;

    LinkCategory(String linkName) {
        this.linkName = linkName;
    }

    /// @return the E-utilities link name
    public String linkName() {
        return linkName;
    }

    /// @return true for categories whose links are contig records
    public boolean isDirect() {
        return this != WGS_MASTER;
    }

    /// @param linkName an E-utilities link name
    /// @return the matching category, if it is one of ours
    public static Optional<LinkCategory> fromLinkName(String linkName) {
        for (LinkCategory category : values()) {
            if (category.linkName.equals(linkName)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }
}
