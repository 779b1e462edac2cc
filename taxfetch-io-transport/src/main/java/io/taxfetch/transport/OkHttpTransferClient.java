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

import io.taxfetch.api.transfer.RemoteResource;
import io.taxfetch.api.transfer.TransferClient;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.atomic.AtomicBoolean;

/// [TransferClient] for HTTP and HTTPS file downloads.
///
/// Only the response headers are read by [#open(String)]; the body is streamed by
/// the caller. `ftp://` URLs are rewritten to `https://`, which the NCBI file
/// servers answer for the same paths.
public class OkHttpTransferClient implements TransferClient {

    private static final Logger logger = LogManager.getLogger(OkHttpTransferClient.class);

    private final OkHttpClient httpClient;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /// @param settings transport settings; only timeout and contact are used
    public OkHttpTransferClient(TransportSettings settings) {
        this(HttpClients.create(settings));
    }

    /// @param httpClient a preconfigured client, shut down when this client is closed
    public OkHttpTransferClient(OkHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public RemoteResource open(String url) throws IOException {
        if (closed.get()) {
            throw new IOException("OkHttpTransferClient has been closed");
        }
        HttpUrl httpUrl = HttpUrl.parse(toHttp(url));
        if (httpUrl == null) {
            throw new IllegalArgumentException("URL must be HTTP, HTTPS or FTP: " + url);
        }
        logger.debug("GET {}", httpUrl);
        Response response = httpClient.newCall(new Request.Builder().url(httpUrl).get().build()).execute();
        if (!response.isSuccessful()) {
            response.close();
            throw new IOException("HTTP request failed with status: " + response.code() + " for " + url);
        }
        ResponseBody body = response.body();
        if (body == null) {
            response.close();
            throw new IOException("Response body is null for " + url);
        }
        return new HttpRemoteResource(url, response, body);
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            HttpClients.shutdown(httpClient);
        }
    }

    static String toHttp(String url) {
        if (url == null) {
            throw new IllegalArgumentException("URL cannot be null");
        }
        String trimmed = url.trim();
        if (trimmed.toLowerCase().startsWith("ftp://")) {
            return "https://" + trimmed.substring("ftp://".length());
        }
        return trimmed;
    }

    private static final class HttpRemoteResource implements RemoteResource {
        private final String url;
        private final Response response;
        private final ResponseBody body;

        private HttpRemoteResource(String url, Response response, ResponseBody body) {
            this.url = url;
            this.response = response;
            this.body = body;
        }

        @Override
        public String url() {
            return url;
        }

        @Override
        public long contentLength() {
            String header = response.header("Content-Length");
            if (header != null) {
                try {
                    return Long.parseLong(header.trim());
                } catch (NumberFormatException e) {
                    return -1L;
                }
            }
            return body.contentLength();
        }

        @Override
        public InputStream body() {
            return body.byteStream();
        }

        @Override
        public void close() {
            response.close();
        }
    }
}
