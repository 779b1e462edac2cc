package io.taxfetch.retrieval.integrity;


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

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/// Compares the MD5 digest of a downloaded file with the digest the server lists for it.
///
/// The hash listing has one `<digest>  <path>` line per file, as in NCBI
/// `md5checksums.txt`. The line whose path ends with the downloaded file's name is
/// used. Verification never throws: any problem gives a failed result and a warning.
public class IntegrityVerifier {

    private static final Logger logger = LogManager.getLogger(IntegrityVerifier.class);

    private static final int BUFFER_SIZE = 1024 * 1024;

    /// @param file the downloaded file
    /// @param hashFile the server's hash listing
    /// @return the comparison result
    public HashCheckResult verify(Path file, Path hashFile) {
        String remote = "";
        String local = "";
        try {
            remote = declaredHash(hashFile, file.getFileName().toString());
            local = md5(file);
        } catch (IOException e) {
            logger.warn("Could not check hash of {}: {}", file, e.getMessage());
        }
        HashCheckResult result = HashCheckResult.compare(file, local, remote);
        logger.info("Local MD5 hash: {}", result.localHash());
        logger.info("NCBI MD5 hash: {}", result.remoteHash());
        if (result.passed()) {
            logger.info("MD5 hash check passed for {}", file.getFileName());
        } else {
            logger.warn("MD5 hash check failed for {}", file.getFileName());
        }
        return result;
    }

    /// @param file any file
    /// @return its MD5 digest as lower-case hex
    /// @throws IOException if the file cannot be read
    public static String md5(Path file) throws IOException {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 is not available", e);
        }
        byte[] buffer = new byte[BUFFER_SIZE];
        try (InputStream in = new DigestInputStream(Files.newInputStream(file), digest)) {
            while (in.read(buffer) != -1) {
                // digest is updated while reading
            }
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    /// @param hashFile a hash listing
    /// @param fileName the file name to look up
    /// @return the listed digest, empty if the file is not listed
    /// @throws IOException if the listing cannot be read
    static String declaredHash(Path hashFile, String fileName) throws IOException {
        List<String> lines = Files.readAllLines(hashFile, StandardCharsets.UTF_8);
        for (String line : lines) {
            String[] parts = line.trim().split("\\s+", 2);
            if (parts.length == 2 && pathMatches(parts[1].trim(), fileName)) {
                return parts[0].toLowerCase();
            }
        }
        logger.warn("No hash listed for {} in {}", fileName, hashFile);
        return "";
    }

    private static boolean pathMatches(String listedPath, String fileName) {
        return listedPath.equals(fileName) || listedPath.endsWith("/" + fileName);
    }
}
