package io.taxfetch.command.common;


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
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;

/// Shared output directory option with force and no-clobber flags.
///
/// An existing directory is an error unless `--force` is given. With `--force`
/// alone it is deleted and recreated; with `--force --noclobber` it is kept as is.
public class OutputDirectoryOption {

    private static final Logger logger = LogManager.getLogger(OutputDirectoryOption.class);

    /// Output directory with its collision policy.
    ///
    /// @param path the directory (never null)
    /// @param force replace or reuse an existing directory
    /// @param noClobber keep existing contents when reusing a directory
    public record OutputDirectory(Path path, boolean force, boolean noClobber) {

        public OutputDirectory {
            if (path == null) {
                throw new IllegalArgumentException("Output directory cannot be null");
            }
        }

        /// @return true if the directory exists and force is not set
        public boolean existsWithoutForce() {
            return Files.exists(path) && !force;
        }

        /// Apply the collision policy and make sure the directory exists afterwards.
        /// @return the directory
        /// @throws IllegalStateException if the directory exists and force is not set
        /// @throws IOException if the directory cannot be removed or created
        public Path prepare() throws IOException {
            if (Files.exists(path)) {
                if (!force) {
                    throw new IllegalStateException(
                        "Output directory already exists: " + path + ". Use --force to replace it.");
                }
                if (noClobber) {
                    logger.warn("Output directory {} exists, keeping existing files", path);
                } else {
                    logger.info("Removing existing output directory {}", path);
                    deleteRecursively(path);
                }
            }
            logger.info("Creating output directory {}", path);
            Files.createDirectories(path);
            return path;
        }

        @Override
        public String toString() {
            if (force) {
                return path + (noClobber ? " (force, noclobber)" : " (force)");
            }
            return path.toString();
        }
    }

    @CommandLine.Option(
        names = {"-o", "--outdir"},
        description = "Output directory for sequences, classes and labels",
        required = true
    )
    private Path outputPath;

    @CommandLine.Option(
        names = {"-f", "--force"},
        description = "Replace the output directory if it already exists"
    )
    private boolean force = false;

    @CommandLine.Option(
        names = {"--noclobber"},
        description = "Keep existing files: with --force reuse the output directory, never overwrite class, label or genome files"
    )
    private boolean noClobber = false;

    /// @return the output directory record constructed from the options
    public OutputDirectory getOutputDirectory() {
        return new OutputDirectory(outputPath, force, noClobber);
    }

    /// @return true if existing files must be kept
    public boolean isNoClobber() {
        return noClobber;
    }

    @Override
    public String toString() {
        return getOutputDirectory().toString();
    }

    private static void deleteRecursively(Path root) throws IOException {
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
