package io.taxfetch.api.entrez;


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

/// Result of an Entrez search kept on the server's history.
///
/// @param count total number of hits
/// @param webEnv the server-side environment key
/// @param queryKey the query key within that environment
public record SearchHandle(int count, String webEnv, String queryKey) {

    public SearchHandle {
        if (count < 0) {
            throw new IllegalArgumentException("Search count cannot be negative: " + count);
        }
        if (count > 0 && (webEnv == null || webEnv.isBlank() || queryKey == null || queryKey.isBlank())) {
            throw new IllegalArgumentException("A non-empty search needs a WebEnv and query key");
        }
    }

    /// @param pageSize the page size used for paging
    /// @return the number of pages needed to cover [#count()]
    public int pages(int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("Page size must be positive: " + pageSize);
        }
        return (count + pageSize - 1) / pageSize;
    }
}
