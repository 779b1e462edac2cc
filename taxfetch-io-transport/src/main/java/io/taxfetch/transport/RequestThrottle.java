package io.taxfetch.transport;


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

import java.io.InterruptedIOException;
import java.time.Duration;

/// Spaces consecutive requests at least a fixed interval apart.
public class RequestThrottle {

    private final long intervalNanos;
    private long lastRequestNanos;
    private boolean started;

    /// @param interval the minimum spacing; zero disables throttling
    public RequestThrottle(Duration interval) {
        this.intervalNanos = interval.toNanos();
    }

    /// Block until the next request may be sent, then record it as sent.
    /// @throws InterruptedIOException if the thread is interrupted while waiting
    public synchronized void acquire() throws InterruptedIOException {
        if (intervalNanos > 0 && started) {
            long waitNanos = lastRequestNanos + intervalNanos - System.nanoTime();
            if (waitNanos > 0) {
                try {
                    Thread.sleep(waitNanos / 1_000_000L, (int) (waitNanos % 1_000_000L));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new InterruptedIOException("Interrupted while waiting to send request");
                }
            }
        }
        lastRequestNanos = System.nanoTime();
        started = true;
    }
}
