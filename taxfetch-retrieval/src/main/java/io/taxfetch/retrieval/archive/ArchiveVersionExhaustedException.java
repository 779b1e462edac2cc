package io.taxfetch.retrieval.archive;


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

/// No version of a WGS archive could be found on the server.
public class ArchiveVersionExhaustedException extends RetrievalAbortedException {

    private final String stem;
    private final List<String> attemptedUrls;

    public ArchiveVersionExhaustedException(String stem, List<String> attemptedUrls) {
        super("No downloadable archive for " + stem + " after trying " + attemptedUrls.size() + " versions");
        this.stem = stem;
        this.attemptedUrls = List.copyOf(attemptedUrls);
    }

    public String getStem() {
        return stem;
    }

    /// @return the probed URLs, highest version first
    public List<String> getAttemptedUrls() {
        return attemptedUrls;
    }
}
