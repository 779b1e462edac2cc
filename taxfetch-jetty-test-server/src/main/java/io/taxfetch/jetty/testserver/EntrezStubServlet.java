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

import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/// Serves [EntrezStub] replies under `/eutils/<endpoint>`.
public class EntrezStubServlet extends HttpServlet {

    private final EntrezStub stub;

    public EntrezStubServlet(EntrezStub stub) {
        this.stub = stub;
    }

    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        answer(req, resp);
    }

    @Override
    protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        answer(req, resp);
    }

    private void answer(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        String path = req.getPathInfo() == null ? "" : req.getPathInfo();
        String endpoint = path.startsWith("/") ? path.substring(1) : path;

        Map<String, String> params = new LinkedHashMap<>();
        req.getParameterMap().forEach((name, values) -> {
            if (values.length > 0) {
                params.put(name, values[0]);
            }
        });

        EntrezStub.Reply reply = stub.handle(endpoint, req.getMethod(), params);
        byte[] bytes = reply.body().getBytes(StandardCharsets.UTF_8);
        resp.setStatus(reply.status());
        resp.setContentType(reply.body().trim().startsWith("{") ? "application/json" : "text/plain");
        resp.setCharacterEncoding("UTF-8");
        resp.setContentLength(bytes.length);
        resp.getOutputStream().write(bytes);
    }
}
