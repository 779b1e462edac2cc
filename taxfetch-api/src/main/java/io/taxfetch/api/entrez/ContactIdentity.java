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

/// Identifies the caller to NCBI on every outbound request.
///
/// @param email contact address of the person running the tool
/// @param tool the registered tool name
public record ContactIdentity(String email, String tool) {

    /// Tool name sent when none is given.
    public static final String DEFAULT_TOOL = "taxfetch";

    public ContactIdentity {
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("A contact email is required for NCBI requests");
        }
        email = email.trim();
        tool = tool == null || tool.isBlank() ? DEFAULT_TOOL : tool.trim();
    }

    public ContactIdentity(String email) {
        this(email, DEFAULT_TOOL);
    }

    /// @return a User-Agent value carrying the tool and the contact
    public String userAgent() {
        return tool + " (" + email + ")";
    }
}
