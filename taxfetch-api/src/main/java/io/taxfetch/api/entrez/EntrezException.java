package io.taxfetch.api.entrez;


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

import java.io.IOException;

/// A failed Entrez call: an HTTP error status, or a payload the client could not use.
public class EntrezException extends IOException {

    private final int status;

    public EntrezException(String message) {
        this(message, -1, null);
    }

    public EntrezException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public EntrezException(String message, int status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    /// @return the HTTP status, or -1 when the failure was not an HTTP status
    public int getStatus() {
        return status;
    }
}
