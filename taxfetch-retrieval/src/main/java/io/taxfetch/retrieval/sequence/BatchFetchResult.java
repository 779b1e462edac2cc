package io.taxfetch.retrieval.sequence;


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

import java.util.List;

/// Records collected for one assembly by [BatchSequenceFetcher].
///
/// @param assemblyUid the assembly identifier
/// @param expected the number of contig identifiers requested
/// @param records the records of the last full pass
/// @param passes the number of full passes made
public record BatchFetchResult(String assemblyUid, int expected, List<FastaRecord> records, int passes) {

    public BatchFetchResult {
        records = List.copyOf(records);
    }

    /// @return the number of records returned
    public int returned() {
        return records.size();
    }

    /// @return how many records are missing, zero when the count was met or exceeded
    public int shortfall() {
        return Math.max(0, expected - records.size());
    }

    /// @return true if at least the expected number of records arrived
    public boolean complete() {
        return records.size() >= expected;
    }

    /// @return total residues over all records
    public long totalLength() {
        long total = 0;
        for (FastaRecord record : records) {
            total += record.length();
        }
        return total;
    }
}
