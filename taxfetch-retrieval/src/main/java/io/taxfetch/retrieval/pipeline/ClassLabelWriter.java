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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/// Writes the classes and labels files.
///
/// Lines are joined with a newline and the file has no trailing newline.
public class ClassLabelWriter {

    private static final Logger logger = LogManager.getLogger(ClassLabelWriter.class);

    private final boolean noClobber;

    /// @param noClobber keep files that already exist
    public ClassLabelWriter(boolean noClobber) {
        this.noClobber = noClobber;
    }

    /// @param lines the lines to write
    /// @param file the target file
    /// @return true if the file was written, false if it was kept
    /// @throws OutputWriteException if the file cannot be written
    public boolean write(List<String> lines, Path file) {
        if (noClobber && Files.exists(file)) {
            logger.warn("{} exists, not overwriting", file);
            return false;
        }
        logger.info("Writing {} lines to {}", lines.size(), file);
        try {
            Files.writeString(file, String.join("\n", lines), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new OutputWriteException(file, e);
        }
        return true;
    }
}
