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

import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;

import java.util.Arrays;
import java.util.concurrent.TimeUnit;

/// Builds the OkHttp client used for E-utilities calls and file transfers.
///
/// Requests are issued one at a time, so the pool is small. Every request carries
/// the contact identity in its User-Agent header.
public final class HttpClients {

    private HttpClients() {
    }

    /// @param settings transport settings
    /// @return a configured client
    public static OkHttpClient create(TransportSettings settings) {
        String userAgent = settings.contact().userAgent();
        long timeoutMillis = settings.timeout().toMillis();
        return new OkHttpClient.Builder()
            .connectionPool(new ConnectionPool(4, 5, TimeUnit.MINUTES))
            .connectTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
            .readTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
            .writeTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
            .protocols(Arrays.asList(Protocol.HTTP_2, Protocol.HTTP_1_1))
            // Failed calls surface to the caller's retry policy instead.
            .retryOnConnectionFailure(false)
            .followRedirects(true)
            .addInterceptor(chain -> {
                Request tagged = chain.request().newBuilder()
                    .header("User-Agent", userAgent)
                    .build();
                return chain.proceed(tagged);
            })
            .build();
    }

    /// Release the connection pool and dispatcher threads of a client.
    /// @param client the client to shut down
    public static void shutdown(OkHttpClient client) {
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
    }
}
