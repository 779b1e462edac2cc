package io.taxfetch.retrieval.pipeline;


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

/// Summary of a completed run.
///
/// @param assembliesResolved assemblies found over all taxa, duplicates included
/// @param written assemblies whose sequence file was produced
/// @param skipped assemblies that could not be retrieved
/// @param shortfalls assemblies written with fewer records than expected
/// @param hashFailures downloads whose hash check failed
/// @param classesFile the classes file, null if not written
/// @param labelsFile the labels file, null if not written
public record RunReport(int assembliesResolved, int written, List<SkippedAssembly> skipped, int shortfalls,
                        int hashFailures, Path classesFile, Path labelsFile) {

    /// How a run ended.
    public enum Status {
        COMPLETED,
        COMPLETED_WITH_SKIPS
    }

    public RunReport {
        skipped = List.copyOf(skipped);
    }

    /// @return the run status
    public Status status() {
        return skipped.isEmpty() ? Status.COMPLETED : Status.COMPLETED_WITH_SKIPS;
    }
}
