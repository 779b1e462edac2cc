package io.taxfetch.retrieval;


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

/// Raised when retrieval cannot continue and the whole run must stop.
///
/// Conditions that only affect a single assembly are reported as values
/// (skips, shortfalls, hash mismatches) and never as this exception.
public class RetrievalAbortedException extends RuntimeException {

    public RetrievalAbortedException(String message) {
        super(message);
    }

    public RetrievalAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}
