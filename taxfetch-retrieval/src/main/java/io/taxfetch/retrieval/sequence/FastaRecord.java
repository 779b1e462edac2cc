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

/// One FASTA record.
/// @param description the header line without the leading `>`
/// @param sequence the residues with line breaks removed
public record FastaRecord(String description, String sequence) {

    public FastaRecord {
        if (description == null) {
            throw new IllegalArgumentException("description cannot be null");
        }
        description = description.strip();
        sequence = sequence == null ? "" : sequence;
    }

    /// @return the first word of the header, the record identifier
    public String id() {
        int space = description.indexOf(' ');
        return space < 0 ? description : description.substring(0, space);
    }

    /// @return the number of residues
    public int length() {
        return sequence.length();
    }
}
