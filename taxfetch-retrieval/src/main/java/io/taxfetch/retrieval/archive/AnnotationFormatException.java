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

import io.taxfetch.retrieval.RetrievalAbortedException;

/// The annotation of a WGS master record does not have the expected field layout.
public class AnnotationFormatException extends RetrievalAbortedException {

    private final String annotation;

    public AnnotationFormatException(String annotation, String problem) {
        super("Annotation format unrecognized (" + problem + "): " + annotation);
        this.annotation = annotation;
    }

    /// @return the annotation text as received
    public String getAnnotation() {
        return annotation;
    }
}
