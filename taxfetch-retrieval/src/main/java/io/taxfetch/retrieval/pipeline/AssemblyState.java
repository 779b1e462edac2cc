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

/// Processing stages of one assembly. `WRITTEN` and `SKIPPED` are terminal.
public enum AssemblyState {
    RESOLVING,
    METADATA_FETCHED,
    STRATEGY_CHOSEN,
    ARCHIVE_FETCHED,
    BATCH_FETCHED,
    VERIFIED,
    WRITTEN,
    SKIPPED;

    /// @return true for the states an assembly ends in
    public boolean isTerminal() {
        return this == WRITTEN || this == SKIPPED;
    }
}
