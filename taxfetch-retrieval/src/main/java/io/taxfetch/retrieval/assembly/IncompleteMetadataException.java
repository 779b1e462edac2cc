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

import io.taxfetch.retrieval.RetrievalAbortedException;

/// An assembly summary lacks the accession or organism needed to name its output.
public class IncompleteMetadataException extends RetrievalAbortedException {

    public IncompleteMetadataException(String assemblyUid, String field) {
        super("Assembly summary for " + assemblyUid + " has no " + field);
    }
}
