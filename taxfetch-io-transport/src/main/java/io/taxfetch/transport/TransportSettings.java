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

import io.taxfetch.api.entrez.ContactIdentity;

import java.time.Duration;

/// Connection settings shared by the HTTP clients.
///
/// @param eutilsBaseUrl base URL of the E-utilities endpoints, without a trailing slash
/// @param contact the identity attached to every request
/// @param timeout connect and read timeout for a single call
/// @param requestInterval minimum spacing between two E-utilities requests
public record TransportSettings(String eutilsBaseUrl, ContactIdentity contact, Duration timeout,
                                Duration requestInterval) {

    /// The public NCBI E-utilities endpoint.
    public static final String DEFAULT_EUTILS_URL = "https://eutils.ncbi.nlm.nih.gov/entrez/eutils";
    /// Per-call timeout used when none is given.
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    /// Keeps an unkeyed client at about three requests per second.
    public static final Duration DEFAULT_REQUEST_INTERVAL = Duration.ofMillis(340);

    public TransportSettings {
        if (contact == null) {
            throw new IllegalArgumentException("Contact identity cannot be null");
        }
        if (eutilsBaseUrl == null || eutilsBaseUrl.isBlank()) {
            eutilsBaseUrl = DEFAULT_EUTILS_URL;
        }
        eutilsBaseUrl = eutilsBaseUrl.trim();
        while (eutilsBaseUrl.endsWith("/")) {
            eutilsBaseUrl = eutilsBaseUrl.substring(0, eutilsBaseUrl.length() - 1);
        }
        if (!eutilsBaseUrl.toLowerCase().startsWith("http://")
            && !eutilsBaseUrl.toLowerCase().startsWith("https://")) {
            throw new IllegalArgumentException("E-utilities URL must be HTTP or HTTPS: " + eutilsBaseUrl);
        }
        if (timeout == null) {
            timeout = DEFAULT_TIMEOUT;
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Timeout must be positive: " + timeout);
        }
        if (requestInterval == null) {
            requestInterval = DEFAULT_REQUEST_INTERVAL;
        }
        if (requestInterval.isNegative()) {
            throw new IllegalArgumentException("Request interval cannot be negative: " + requestInterval);
        }
    }

    /// Settings against the public endpoint with default timeout and spacing.
    /// @param contact the identity attached to every request
    /// @return the settings
    public static TransportSettings defaults(ContactIdentity contact) {
        return new TransportSettings(DEFAULT_EUTILS_URL, contact, DEFAULT_TIMEOUT, DEFAULT_REQUEST_INTERVAL);
    }
}
