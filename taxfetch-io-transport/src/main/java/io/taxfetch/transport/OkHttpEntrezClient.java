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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.taxfetch.api.entrez.EntrezClient;
import io.taxfetch.api.entrez.EntrezException;
import io.taxfetch.api.entrez.LinkSet;
import io.taxfetch.api.entrez.SearchHandle;
import okhttp3.FormBody;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// [EntrezClient] over the NCBI E-utilities HTTP interface.
///
/// Searches, links and summaries are requested as JSON and read with Jackson.
/// Identifier pages and sequence records are requested as plain text. Sequence
/// fetches are POSTed because the identifier list can be tens of thousands long.
///
/// Requests are spaced by a [RequestThrottle] and carry the `tool` and `email`
/// parameters of the configured contact identity.
public class OkHttpEntrezClient implements EntrezClient {

    private static final Logger logger = LogManager.getLogger(OkHttpEntrezClient.class);

    private final TransportSettings settings;
    private final OkHttpClient httpClient;
    private final RequestThrottle throttle;
    private final ObjectMapper mapper = new ObjectMapper();

    /// @param settings transport settings
    public OkHttpEntrezClient(TransportSettings settings) {
        this(settings, HttpClients.create(settings));
    }

    /// @param settings transport settings
    /// @param httpClient a preconfigured client, shut down when this client is closed
    public OkHttpEntrezClient(TransportSettings settings, OkHttpClient httpClient) {
        this.settings = settings;
        this.httpClient = httpClient;
        this.throttle = new RequestThrottle(settings.requestInterval());
    }

    @Override
    public SearchHandle search(String db, String term) throws IOException {
        HttpUrl url = endpoint("esearch.fcgi")
            .addQueryParameter("db", db)
            .addQueryParameter("term", term)
            .addQueryParameter("usehistory", "y")
            .addQueryParameter("retmax", "0")
            .addQueryParameter("retmode", "json")
            .build();
        JsonNode result = readJson(get(url)).path("esearchresult");
        if (result.isMissingNode()) {
            throw new EntrezException("ESearch response has no esearchresult for term " + term);
        }
        failOnError(result, "ESearch " + term);
        JsonNode count = result.path("count");
        if (count.isMissingNode() || !count.asText().matches("\\d+")) {
            throw new EntrezException("ESearch response has no usable count for term " + term);
        }
        return new SearchHandle(count.asInt(), result.path("webenv").asText(null),
            result.path("querykey").asText(null));
    }

    @Override
    public List<String> fetchIdPage(String db, SearchHandle handle, int retstart, int retmax)
        throws IOException {
        HttpUrl url = endpoint("efetch.fcgi")
            .addQueryParameter("db", db)
            .addQueryParameter("WebEnv", handle.webEnv())
            .addQueryParameter("query_key", handle.queryKey())
            .addQueryParameter("retstart", Integer.toString(retstart))
            .addQueryParameter("retmax", Integer.toString(retmax))
            .addQueryParameter("rettype", "uilist")
            .addQueryParameter("retmode", "text")
            .build();
        String body = get(url);
        List<String> ids = new ArrayList<>();
        for (String line : body.split("\n")) {
            String id = line.trim();
            if (id.isEmpty()) {
                continue;
            }
            if (!id.matches("\\d+")) {
                throw new EntrezException("EFetch uilist page contains a non-identifier line: " + id);
            }
            ids.add(id);
        }
        return ids;
    }

    @Override
    public LinkSet link(String dbFrom, String dbTo, String uid) throws IOException {
        HttpUrl url = endpoint("elink.fcgi")
            .addQueryParameter("dbfrom", dbFrom)
            .addQueryParameter("db", dbTo)
            .addQueryParameter("id", uid)
            .addQueryParameter("retmode", "json")
            .build();
        JsonNode root = readJson(get(url));
        failOnError(root, "ELink " + uid);
        JsonNode linksets = root.path("linksets");
        if (!linksets.isArray() || linksets.isEmpty()) {
            throw new EntrezException("ELink response has no linksets for " + dbFrom + " " + uid);
        }
        Map<String, List<String>> links = new LinkedHashMap<>();
        for (JsonNode linksetdb : linksets.get(0).path("linksetdbs")) {
            String linkName = linksetdb.path("linkname").asText();
            List<String> ids = new ArrayList<>();
            for (JsonNode link : linksetdb.path("links")) {
                // links are plain ids, or objects with an id field when scores are requested
                ids.add(link.isObject() ? link.path("id").asText() : link.asText());
            }
            links.put(linkName, ids);
        }
        return new LinkSet(uid, links);
    }

    @Override
    public JsonNode summary(String db, String uid) throws IOException {
        HttpUrl url = endpoint("esummary.fcgi")
            .addQueryParameter("db", db)
            .addQueryParameter("id", uid)
            .addQueryParameter("retmode", "json")
            .build();
        JsonNode root = readJson(get(url));
        failOnError(root, "ESummary " + db + " " + uid);
        JsonNode record = root.path("result").path(uid);
        if (!record.isObject()) {
            throw new EntrezException("ESummary response has no record for " + db + " " + uid);
        }
        failOnError(record, "ESummary " + db + " " + uid);
        return record;
    }

    @Override
    public String fetchFasta(String db, List<String> ids, int retstart, int retmax) throws IOException {
        FormBody form = withContact(new FormBody.Builder())
            .add("db", db)
            .add("id", String.join(",", ids))
            .add("rettype", "fasta")
            .add("retmode", "text")
            .add("retstart", Integer.toString(retstart))
            .add("retmax", Integer.toString(retmax))
            .build();
        HttpUrl url = HttpUrl.get(settings.eutilsBaseUrl() + "/efetch.fcgi");
        logger.debug("POST {} ids={} retstart={} retmax={}", url, ids.size(), retstart, retmax);
        return execute(new Request.Builder().url(url).post(form).build());
    }

    @Override
    public void close() {
        HttpClients.shutdown(httpClient);
    }

    private HttpUrl.Builder endpoint(String name) {
        HttpUrl.Builder builder = HttpUrl.get(settings.eutilsBaseUrl() + "/" + name).newBuilder();
        builder.addQueryParameter("tool", settings.contact().tool());
        builder.addQueryParameter("email", settings.contact().email());
        return builder;
    }

    private FormBody.Builder withContact(FormBody.Builder form) {
        return form.add("tool", settings.contact().tool()).add("email", settings.contact().email());
    }

    private String get(HttpUrl url) throws IOException {
        logger.debug("GET {}", url);
        return execute(new Request.Builder().url(url).get().build());
    }

    private String execute(Request request) throws IOException {
        throttle.acquire();
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful()) {
                throw new EntrezException("HTTP " + response.code() + " " + response.message()
                    + " from " + request.url().encodedPath(), response.code(), null);
            }
            if (body == null) {
                throw new EntrezException("Empty response body from " + request.url().encodedPath());
            }
            return body.string();
        }
    }

    private JsonNode readJson(String body) throws EntrezException {
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new EntrezException("Malformed JSON response: " + e.getOriginalMessage(), e);
        }
    }

    private void failOnError(JsonNode node, String call) throws EntrezException {
        JsonNode error = node.has("ERROR") ? node.get("ERROR") : node.get("error");
        if (error != null && !error.isNull() && !error.asText().isBlank()) {
            throw new EntrezException(call + " returned an error: " + error.asText());
        }
    }
}
