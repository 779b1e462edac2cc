package io.taxfetch.retrieval.download;


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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPInputStream;

/// Decompresses gzip archives, including multi-member ones, to a plain file.
public class GzipExtractor {

    private static final Logger logger = LogManager.getLogger(GzipExtractor.class);

    /// @param archive the gzip file
    /// @param target the decompressed file, replaced if present
    /// @return the number of decompressed bytes
    /// @throws IOException if the archive cannot be read or is not valid gzip
    public long extract(Path archive, Path target) throws IOException {
        logger.info("Extracting archive {} to {}", archive, target);
        try (InputStream in = new GZIPInputStream(new BufferedInputStream(Files.newInputStream(archive)),
                 ResourceDownloader.CHUNK_SIZE);
             OutputStream out = Files.newOutputStream(target)) {
            long written = in.transferTo(out);
            logger.info("Archive extracted to {} ({} bytes)", target, written);
            return written;
        }
    }
}
