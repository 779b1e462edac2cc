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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;

/// Bounded retry around a remote call.
///
/// Every failure is retried alike, whether it is a transport error, an error
/// status, or a response that could not be interpreted. Attempts follow each
/// other immediately unless a backoff is configured. When the last attempt
/// fails the run is aborted with [RetriesExhaustedException]; callers never
/// see a partial failure from this class.
///
/// [RetrievalAbortedException]s raised inside the call are not retried.
public class RetryExecutor {

    private static final Logger logger = LogManager.getLogger(RetryExecutor.class);

    private final int maxAttempts;
    private final Duration backoff;

    /// @param maxAttempts attempts per call, at least one
    /// @param backoff pause between attempts, zero for none
    public RetryExecutor(int maxAttempts, Duration backoff) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        if (backoff == null || backoff.isNegative()) {
            throw new IllegalArgumentException("backoff must be zero or positive: " + backoff);
        }
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
    }

    /// Invoke a call until it succeeds or the attempts run out.
    /// @param operation description used in log messages
    /// @param call the remote call
    /// @param <T> the result type
    /// @return the result of the first successful attempt
    /// @throws RetriesExhaustedException if every attempt failed
    public <T> T execute(String operation, RemoteCall<T> call) {
        Exception lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return call.call();
            } catch (RetrievalAbortedException e) {
                throw e;
            } catch (Exception e) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new RetrievalAbortedException("Interrupted during " + operation, e);
                }
                lastFailure = e;
                logger.warn("{} failed ({}/{}): {}", operation, attempt, maxAttempts, e.getMessage());
                if (attempt < maxAttempts) {
                    pause(operation);
                }
            }
        }
        logger.error("Too many failures for {} after {} attempts", operation, maxAttempts);
        throw new RetriesExhaustedException(operation, maxAttempts, lastFailure);
    }

    /// @return attempts per call
    public int getMaxAttempts() {
        return maxAttempts;
    }

    private void pause(String operation) {
        if (backoff.isZero()) {
            return;
        }
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RetrievalAbortedException("Interrupted while waiting to retry " + operation, e);
        }
    }
}
