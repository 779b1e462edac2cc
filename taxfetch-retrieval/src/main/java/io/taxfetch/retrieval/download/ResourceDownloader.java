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

import io.taxfetch.api.transfer.RemoteResource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/// Streams an opened [RemoteResource] to a local file in fixed-size chunks.
public class ResourceDownloader {

    private static final Logger logger = LogManager.getLogger(ResourceDownloader.class);

    /// Chunk size used for reading the response body.
    public static final int CHUNK_SIZE = 1024 * 1024;

    /// Copy the body of a resource to a file, replacing any existing file.
    /// @param resource the opened resource; it is not closed here
    /// @param target the local file
    /// @return the number of bytes written
    /// @throws IOException if reading or writing fails, or fewer bytes arrive than were declared
    public long download(RemoteResource resource, Path target) throws IOException {
        long declared = resource.contentLength();
        logger.info("Downloading {} to {} ({} bytes)", resource.url(), target, declared);
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        long received = 0;
        byte[] buffer = new byte[CHUNK_SIZE];
        try (InputStream in = resource.body(); OutputStream out = Files.newOutputStream(target)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                out.write(buffer, 0, read);
                received += read;
                if (declared > 0 && logger.isDebugEnabled()) {
                    logger.debug(String.format("%10d  [%3.2f%%]", received, received * 100.0 / declared));
                }
            }
        }
        if (declared >= 0 && received != declared) {
            throw new IOException("Download of " + resource.url() + " ended after " + received + " of "
                + declared + " bytes");
        }
        return received;
    }
}
