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

import java.nio.file.Path;
import java.util.List;

/// An archive that was downloaded and unpacked.
///
/// @param reference the version that was found
/// @param sourceUrl the URL the archive was read from
/// @param archivePath the downloaded archive
/// @param fastaPath the decompressed FASTA file
/// @param contigDescriptions the header descriptions found in the FASTA file
public record ArchiveResult(ArchiveReference reference, String sourceUrl, Path archivePath, Path fastaPath,
                            List<String> contigDescriptions) {

    public ArchiveResult {
        contigDescriptions = List.copyOf(contigDescriptions);
    }
}
