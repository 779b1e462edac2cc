package io.taxfetch.retrieval.archive;


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

/// Names one version of a WGS sequence archive.
///
/// The version is maintained independently of the assembly version, so a
/// reference read from an annotation may point past the newest archive on the
/// server; [#previous()] steps back one version.
///
/// @param stem the six-character WGS project prefix, e.g. `ABCDEF`
/// @param version the archive version, positive
public record ArchiveReference(String stem, int version) {

    /// Suffix of the archive files.
    public static final String SUFFIX = ".fsa_nt.gz";

    public ArchiveReference {
        if (stem == null || stem.isBlank()) {
            throw new IllegalArgumentException("Archive stem cannot be blank");
        }
        if (version < 1) {
            throw new IllegalArgumentException("Archive version must be positive: " + version);
        }
    }

    /// Read stem and version from the `extra` annotation of a WGS master record.
    ///
    /// The annotation is a `|`-separated list. The stem is the first six characters
    /// of its last field, the version is the text after the last `.` of its fourth field.
    /// @param annotation the annotation text
    /// @return the reference
    /// @throws AnnotationFormatException if the annotation does not follow that layout
    public static ArchiveReference parse(String annotation) {
        if (annotation == null || annotation.isBlank()) {
            throw new AnnotationFormatException(String.valueOf(annotation), "empty");
        }
        String[] fields = annotation.trim().split("\\|", -1);
        if (fields.length < 4) {
            throw new AnnotationFormatException(annotation, "expected at least 4 fields, found " + fields.length);
        }
        String last = fields[fields.length - 1].trim();
        if (last.length() < 6) {
            throw new AnnotationFormatException(annotation, "last field shorter than 6 characters");
        }
        String accession = fields[3].trim();
        int dot = accession.lastIndexOf('.');
        String versionText = dot < 0 ? "" : accession.substring(dot + 1);
        if (!versionText.matches("\\d{1,9}")) {
            throw new AnnotationFormatException(annotation, "no numeric version in field 4");
        }
        int version = Integer.parseInt(versionText);
        if (version < 1) {
            throw new AnnotationFormatException(annotation, "version " + version);
        }
        return new ArchiveReference(last.substring(0, 6), version);
    }

    /// @return the archive file name, `<stem>.<version>.fsa_nt.gz`
    public String fileName() {
        return stem + "." + version + SUFFIX;
    }

    /// @return true if a lower version exists
    public boolean hasPrevious() {
        return version > 1;
    }

    /// @return the reference one version lower
    public ArchiveReference previous() {
        return new ArchiveReference(stem, version - 1);
    }
}
