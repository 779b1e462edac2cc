package io.taxfetch.jetty.testserver;


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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/// Scripted responses for the E-utilities endpoints served by [EntrezStubServlet].
///
/// Tests register a responder per endpoint name (`esearch.fcgi`, `elink.fcgi`, ...),
/// optionally inject failures, and inspect the recorded requests afterwards.
public class EntrezStub {

    /// One request as seen by the stub.
    /// @param endpoint the endpoint name, for example `esearch.fcgi`
    /// @param method the HTTP method
    /// @param params the first value of every request parameter, query and form alike
    public record RecordedRequest(String endpoint, String method, Map<String, String> params) {
        public String param(String name) {
            return params.get(name);
        }
    }

    /// A scripted answer.
    /// @param status HTTP status
    /// @param body response body
    public record Reply(int status, String body) {
    }

    private final Map<String, Function<Map<String, String>, String>> responders = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> pendingFailures = new ConcurrentHashMap<>();
    private final Map<String, Integer> failureStatus = new ConcurrentHashMap<>();
    private final List<RecordedRequest> requests = new CopyOnWriteArrayList<>();

    /// Answer every call to an endpoint with the same body.
    /// @param endpoint the endpoint name
    /// @param body the response body
    public void respond(String endpoint, String body) {
        respond(endpoint, params -> body);
    }

    /// Answer calls to an endpoint with a body computed from the request parameters.
    /// Returning null from the responder produces a 404.
    /// @param endpoint the endpoint name
    /// @param responder parameters to body
    public void respond(String endpoint, Function<Map<String, String>, String> responder) {
        responders.put(endpoint, responder);
    }

    /// Fail the next calls to an endpoint before answering normally again.
    /// @param endpoint the endpoint name
    /// @param times how many calls fail
    /// @param status the HTTP status of the failures
    public void failNext(String endpoint, int times, int status) {
        pendingFailures.computeIfAbsent(endpoint, k -> new AtomicInteger()).set(times);
        failureStatus.put(endpoint, status);
    }

    /// Forget responders, failures and recorded requests.
    public void reset() {
        responders.clear();
        pendingFailures.clear();
        failureStatus.clear();
        requests.clear();
    }

    /// @param endpoint the endpoint name
    /// @return recorded requests for that endpoint, oldest first
    public List<RecordedRequest> requests(String endpoint) {
        List<RecordedRequest> matching = new ArrayList<>();
        for (RecordedRequest request : requests) {
            if (request.endpoint().equals(endpoint)) {
                matching.add(request);
            }
        }
        return matching;
    }

    /// @return every recorded request, oldest first
    public List<RecordedRequest> requests() {
        return Collections.unmodifiableList(new ArrayList<>(requests));
    }

    Reply handle(String endpoint, String method, Map<String, String> params) {
        requests.add(new RecordedRequest(endpoint, method, Map.copyOf(params)));
        AtomicInteger failures = pendingFailures.get(endpoint);
        if (failures != null && failures.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            return new Reply(failureStatus.getOrDefault(endpoint, 500), "scripted failure");
        }
        Function<Map<String, String>, String> responder = responders.get(endpoint);
        if (responder == null) {
            return new Reply(404, "no responder for " + endpoint);
        }
        String body = responder.apply(params);
        return body == null ? new Reply(404, "no answer for " + params) : new Reply(200, body);
    }
}
