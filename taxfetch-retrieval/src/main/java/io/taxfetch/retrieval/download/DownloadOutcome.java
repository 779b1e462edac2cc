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

import java.nio.file.Path;
import java.util.Optional;

/// Result of acquiring the files of one assembly.
///
/// A skipped outcome means no bytes were retrieved; it must not be hashed,
/// extracted or counted as written.
///
/// @param localPath the downloaded file, null when skipped
/// @param hashFilePath the downloaded hash listing, null when none was obtained
/// @param sourceUrl the URL downloaded from, or the last URL tried when skipped
/// @param skipped true if nothing was retrieved
public record DownloadOutcome(Path localPath, Path hashFilePath, String sourceUrl, boolean skipped) {

    public DownloadOutcome {
        if (!skipped && localPath == null) {
            throw new IllegalArgumentException("A completed download needs a local path");
        }
    }

    /// @param localPath the downloaded file
    /// @param hashFilePath the hash listing, or null
    /// @param sourceUrl the URL downloaded from
    /// @return a completed outcome
    public static DownloadOutcome downloaded(Path localPath, Path hashFilePath, String sourceUrl) {
        return new DownloadOutcome(localPath, hashFilePath, sourceUrl, false);
    }

    /// @param lastUrl the last URL tried
    /// @return a skipped outcome
    public static DownloadOutcome skipped(String lastUrl) {
        return new DownloadOutcome(null, null, lastUrl, true);
    }

    /// @return the hash listing, if one was downloaded
    public Optional<Path> hashFile() {
        return Optional.ofNullable(hashFilePath);
    }
}
