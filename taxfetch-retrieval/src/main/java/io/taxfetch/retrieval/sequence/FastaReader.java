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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/// Parses FASTA text into [FastaRecord]s.
///
/// Blank lines are ignored, as is any text before the first header.
public final class FastaReader {

    private FastaReader() {
    }

    /// @param text FASTA text
    /// @return the records in input order
    public static List<FastaRecord> parse(String text) {
        try {
            return parse(new StringReader(text));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /// @param file a FASTA file
    /// @return the records in file order
    /// @throws IOException if the file cannot be read
    public static List<FastaRecord> read(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return parse(reader);
        }
    }

    /// Header descriptions of a FASTA file, without holding the sequences.
    /// @param file a FASTA file
    /// @return one description per record, in file order
    /// @throws IOException if the file cannot be read
    public static List<String> descriptions(Path file) throws IOException {
        List<String> descriptions = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.startsWith(">")) {
                    descriptions.add(line.substring(1).strip());
                }
            }
        }
        return descriptions;
    }

    private static List<FastaRecord> parse(Reader source) throws IOException {
        List<FastaRecord> records = new ArrayList<>();
        BufferedReader reader = source instanceof BufferedReader buffered ? buffered : new BufferedReader(source);
        String header = null;
        StringBuilder sequence = new StringBuilder();
        String line;
        while ((line = reader.readLine()) != null) {
            if (line.startsWith(">")) {
                if (header != null) {
                    records.add(new FastaRecord(header, sequence.toString()));
                }
                header = line.substring(1);
                sequence.setLength(0);
            } else if (header != null) {
                sequence.append(line.strip());
            }
        }
        if (header != null) {
            records.add(new FastaRecord(header, sequence.toString()));
        }
        return records;
    }
}
