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
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryExecutorTest {

    @Test
    void returnsFirstSuccess() {
        RetryExecutor retry = new RetryExecutor(5, Duration.ZERO);
        AtomicInteger calls = new AtomicInteger();

        String result = retry.execute("lookup", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new IOException("timeout");
            }
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(calls).hasValue(3);
    }

    @Test
    void retriesEveryKindOfFailure() {
        RetryExecutor retry = new RetryExecutor(3, Duration.ZERO);
        AtomicInteger calls = new AtomicInteger();

        Integer result = retry.execute("parse", () -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("malformed page");
            }
            return 7;
        });

        assertThat(result).isEqualTo(7);
    }

    @Test
    void exhaustionAbortsWithLastFailure() {
        RetryExecutor retry = new RetryExecutor(4, Duration.ZERO);
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> retry.execute("ESearch txid1", () -> {
            throw new IOException("failure " + calls.incrementAndGet());
        }))
            .isInstanceOfSatisfying(RetriesExhaustedException.class, e -> {
                assertThat(e.getAttempts()).isEqualTo(4);
                assertThat(e.getOperation()).isEqualTo("ESearch txid1");
                assertThat(e.getCause()).hasMessage("failure 4");
            })
            .isInstanceOf(RetrievalAbortedException.class);
        assertThat(calls).hasValue(4);
    }

    @Test
    void singleAttemptDoesNotRetry() {
        RetryExecutor retry = new RetryExecutor(1, Duration.ZERO);
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> retry.execute("once", () -> {
            calls.incrementAndGet();
            throw new IOException("down");
        })).isInstanceOf(RetriesExhaustedException.class);
        assertThat(calls).hasValue(1);
    }

    @Test
    void abortsAreNotRetried() {
        RetryExecutor retry = new RetryExecutor(5, Duration.ZERO);
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> retry.execute("nested", () -> {
            calls.incrementAndGet();
            throw new RetrievalAbortedException("fatal inside");
        })).hasMessage("fatal inside");
        assertThat(calls).hasValue(1);
    }

    @Test
    void backoffSpacesAttempts() {
        RetryExecutor retry = new RetryExecutor(3, Duration.ofMillis(30));
        AtomicInteger calls = new AtomicInteger();
        long start = System.nanoTime();

        retry.execute("slow", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new IOException("busy");
            }
            return null;
        });

        assertThat(Duration.ofNanos(System.nanoTime() - start)).isGreaterThanOrEqualTo(Duration.ofMillis(60));
    }

    @Test
    void rejectsInvalidSettings() {
        assertThatThrownBy(() -> new RetryExecutor(0, Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryExecutor(1, Duration.ofMillis(-1)))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
