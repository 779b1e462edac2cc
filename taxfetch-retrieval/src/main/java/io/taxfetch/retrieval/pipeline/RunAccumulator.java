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

import io.taxfetch.retrieval.assembly.AssemblyMetadata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/// Run-scoped collections of class lines, label lines and skipped assemblies.
///
/// An assembly is recorded either as written, contributing one class line and one
/// label line, or as skipped, contributing one skip entry. Entries keep run order.
/// Methods are synchronized so that concurrent writers cannot interleave entries.
public class RunAccumulator {

    private final List<String> classes = new ArrayList<>();
    private final List<String> labels = new ArrayList<>();
    private final List<SkippedAssembly> skipped = new ArrayList<>();
    private int written;
    private int shortfalls;
    private int hashFailures;

    /// @param metadata an assembly whose sequence file was produced
    public synchronized void recordWritten(AssemblyMetadata metadata) {
        classes.add(metadata.classLine());
        labels.add(metadata.labelLine());
        written++;
    }

    /// @param skip an assembly that could not be retrieved
    public synchronized void recordSkipped(SkippedAssembly skip) {
        skipped.add(skip);
    }

    public synchronized void recordShortfall() {
        shortfalls++;
    }

    public synchronized void recordHashFailure() {
        hashFailures++;
    }

    public synchronized List<String> classes() {
        return Collections.unmodifiableList(new ArrayList<>(classes));
    }

    public synchronized List<String> labels() {
        return Collections.unmodifiableList(new ArrayList<>(labels));
    }

    public synchronized List<SkippedAssembly> skipped() {
        return Collections.unmodifiableList(new ArrayList<>(skipped));
    }

    public synchronized int written() {
        return written;
    }

    public synchronized int shortfalls() {
        return shortfalls;
    }

    public synchronized int hashFailures() {
        return hashFailures;
    }
}
