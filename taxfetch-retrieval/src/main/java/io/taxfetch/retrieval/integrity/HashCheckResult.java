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

import java.nio.file.Path;

/// Outcome of comparing a downloaded file with its declared hash.
///
/// @param file the checked file
/// @param localHash hex digest computed from the file, empty if it could not be computed
/// @param remoteHash hex digest declared by the server, empty if none was found
/// @param passed true if both digests are present and equal
public record HashCheckResult(Path file, String localHash, String remoteHash, boolean passed) {

    public HashCheckResult {
        localHash = localHash == null ? "" : localHash;
        remoteHash = remoteHash == null ? "" : remoteHash;
    }

    /// @param file the checked file
    /// @param localHash computed digest
    /// @param remoteHash declared digest
    /// @return a result whose pass flag is the case-insensitive equality of the digests
    public static HashCheckResult compare(Path file, String localHash, String remoteHash) {
        boolean passed = localHash != null && !localHash.isEmpty() && localHash.equalsIgnoreCase(remoteHash);
        return new HashCheckResult(file, localHash, remoteHash, passed);
    }
}
