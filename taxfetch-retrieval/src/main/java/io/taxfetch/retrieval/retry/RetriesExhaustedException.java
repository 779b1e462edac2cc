package io.taxfetch.retrieval.retry;


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

/// A remote call failed on every allowed attempt.
public class RetriesExhaustedException extends RetrievalAbortedException {

    private final String operation;
    private final int attempts;

    public RetriesExhaustedException(String operation, int attempts, Throwable lastFailure) {
        super("Too many failures for " + operation + " (" + attempts + " attempts)", lastFailure);
        this.operation = operation;
        this.attempts = attempts;
    }

    /// @return a description of the call that failed
    public String getOperation() {
        return operation;
    }

    /// @return the number of attempts made
    public int getAttempts() {
        return attempts;
    }
}
