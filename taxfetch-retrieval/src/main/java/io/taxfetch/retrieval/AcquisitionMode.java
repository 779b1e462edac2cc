package io.taxfetch.retrieval;


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

/// How sequence data is obtained for each assembly.
public enum AcquisitionMode {
    /// Contig records through E-utilities links, with the WGS archive as fallback.
    ENTREZ,
    /// Whole-genome FASTA and MD5 listing from the genomes file tree.
    FTP
}
