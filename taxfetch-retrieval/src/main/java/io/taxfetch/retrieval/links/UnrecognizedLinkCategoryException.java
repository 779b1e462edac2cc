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

import io.taxfetch.retrieval.RetrievalAbortedException;

import java.util.List;

/// None of the link categories of an assembly can be used to obtain its sequences.
public class UnrecognizedLinkCategoryException extends RetrievalAbortedException {

    private final String assemblyUid;
    private final List<String> availableLinks;

    public UnrecognizedLinkCategoryException(String assemblyUid, List<String> availableLinks, String reason) {
        super(reason + " for assembly " + assemblyUid + "; available links: " + availableLinks);
        this.assemblyUid = assemblyUid;
        this.availableLinks = List.copyOf(availableLinks);
    }

    public String getAssemblyUid() {
        return assemblyUid;
    }

    /// @return the link names the server reported
    public List<String> getAvailableLinks() {
        return availableLinks;
    }
}
