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

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;

/// Writes [FastaRecord]s with sequence lines wrapped at a fixed width.
public final class FastaWriter {

    /// Residues per sequence line.
    public static final int LINE_WIDTH = 60;

    private FastaWriter() {
    }

    /// @param records the records to write
    /// @param file the output file, replaced if present
    /// @return the number of records written
    /// @throws IOException if the file cannot be written
    public static int write(Collection<FastaRecord> records, Path file) throws IOException {
        int count = 0;
        try (BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            for (FastaRecord record : records) {
                out.write('>');
                out.write(record.description());
                out.write('\n');
                String sequence = record.sequence();
                for (int start = 0; start < sequence.length(); start += LINE_WIDTH) {
                    out.write(sequence, start, Math.min(LINE_WIDTH, sequence.length() - start));
                    out.write('\n');
                }
                count++;
            }
        }
        return count;
    }
}
