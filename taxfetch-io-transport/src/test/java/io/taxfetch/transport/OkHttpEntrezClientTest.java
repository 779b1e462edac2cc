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

import com.fasterxml.jackson.databind.JsonNode;
import io.taxfetch.api.entrez.ContactIdentity;
import io.taxfetch.api.entrez.EntrezException;
import io.taxfetch.api.entrez.LinkSet;
import io.taxfetch.api.entrez.SearchHandle;
import io.taxfetch.jetty.testserver.EntrezStub;
import io.taxfetch.jetty.testserver.JettyFileServerExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@ExtendWith(JettyFileServerExtension.class)
class OkHttpEntrezClientTest {

    private EntrezStub stub;
    private OkHttpEntrezClient client;

    @BeforeEach
    void setUp() {
        stub = JettyFileServerExtension.getEntrezStub();
        stub.reset();
        TransportSettings settings = new TransportSettings(JettyFileServerExtension.getEutilsUrl(),
            new ContactIdentity("someone@example.org"), Duration.ofSeconds(5), Duration.ZERO);
        client = new OkHttpEntrezClient(settings);
    }

    @AfterEach
    void tearDown() {
        client.close();
    }

    @Nested
    @DisplayName("search")
    class Search {

        @Test
        void readsCountAndHistoryHandle() throws Exception {
            stub.respond("esearch.fcgi",
                "{\"esearchresult\":{\"count\":\"3\",\"webenv\":\"MCID_1\",\"querykey\":\"1\",\"idlist\":[]}}");

            SearchHandle handle = client.search("assembly", "txid203804[Organism:exp]");

            assertThat(handle.count()).isEqualTo(3);
            assertThat(handle.webEnv()).isEqualTo("MCID_1");
            assertThat(handle.queryKey()).isEqualTo("1");

            EntrezStub.RecordedRequest request = stub.requests("esearch.fcgi").get(0);
            assertThat(request.param("db")).isEqualTo("assembly");
            assertThat(request.param("term")).isEqualTo("txid203804[Organism:exp]");
            assertThat(request.param("usehistory")).isEqualTo("y");
            assertThat(request.param("email")).isEqualTo("someone@example.org");
            assertThat(request.param("tool")).isEqualTo("taxfetch");
        }

        @Test
        void zeroHitsNeedNoHistory() throws Exception {
            stub.respond("esearch.fcgi", "{\"esearchresult\":{\"count\":\"0\",\"idlist\":[]}}");

            assertThat(client.search("assembly", "txid1[Organism:exp]").count()).isZero();
        }

        @Test
        void reportedErrorFails() {
            stub.respond("esearch.fcgi", "{\"esearchresult\":{\"ERROR\":\"Invalid query\"}}");

            assertThatThrownBy(() -> client.search("assembly", "bad"))
                .isInstanceOf(EntrezException.class)
                .hasMessageContaining("Invalid query");
        }

        @Test
        void malformedJsonFails() {
            stub.respond("esearch.fcgi", "{\"esearchresult\":");

            assertThatThrownBy(() -> client.search("assembly", "x"))
                .isInstanceOf(EntrezException.class)
                .hasMessageContaining("Malformed JSON");
        }

        @Test
        void serverErrorCarriesStatus() {
            stub.respond("esearch.fcgi", "{}");
            stub.failNext("esearch.fcgi", 1, 503);

            assertThatThrownBy(() -> client.search("assembly", "x"))
                .isInstanceOfSatisfying(EntrezException.class,
                    e -> assertThat(e.getStatus()).isEqualTo(503));
        }
    }

    @Nested
    @DisplayName("fetchIdPage")
    class FetchIdPage {

        @Test
        void readsOneIdentifierPerLine() throws Exception {
            stub.respond("efetch.fcgi", "101\n102\n\n103\n");

            List<String> ids = client.fetchIdPage("assembly", new SearchHandle(3, "W", "1"), 0, 250);

            assertThat(ids).containsExactly("101", "102", "103");
            EntrezStub.RecordedRequest request = stub.requests("efetch.fcgi").get(0);
            assertThat(request.param("WebEnv")).isEqualTo("W");
            assertThat(request.param("query_key")).isEqualTo("1");
            assertThat(request.param("retstart")).isEqualTo("0");
            assertThat(request.param("retmax")).isEqualTo("250");
            assertThat(request.param("rettype")).isEqualTo("uilist");
        }

        @Test
        void rejectsNonIdentifierLines() {
            stub.respond("efetch.fcgi", "101\n<ERROR>oops</ERROR>\n");

            assertThatThrownBy(() -> client.fetchIdPage("assembly", new SearchHandle(2, "W", "1"), 0, 250))
                .isInstanceOf(EntrezException.class);
        }
    }

    @Nested
    @DisplayName("link")
    class Link {

        @Test
        void groupsIdentifiersByLinkName() throws Exception {
            stub.respond("elink.fcgi", "{\"linksets\":[{\"dbfrom\":\"assembly\",\"ids\":[\"42\"],"
                + "\"linksetdbs\":["
                + "{\"dbto\":\"nuccore\",\"linkname\":\"assembly_nuccore_insdc\",\"links\":[\"7\",\"8\"]},"
                + "{\"dbto\":\"nuccore\",\"linkname\":\"assembly_nuccore_refseq\",\"links\":[{\"id\":\"9\",\"score\":1}]}"
                + "]}]}");

            LinkSet links = client.link("assembly", "nuccore", "42");

            assertThat(links.names()).containsExactly("assembly_nuccore_insdc", "assembly_nuccore_refseq");
            assertThat(links.ids("assembly_nuccore_insdc")).containsExactly("7", "8");
            assertThat(links.ids("assembly_nuccore_refseq")).containsExactly("9");
            assertThat(stub.requests("elink.fcgi").get(0).param("dbfrom")).isEqualTo("assembly");
        }

        @Test
        void noLinksetsFails() {
            stub.respond("elink.fcgi", "{\"linksets\":[]}");

            assertThatThrownBy(() -> client.link("assembly", "nuccore", "42"))
                .isInstanceOf(EntrezException.class);
        }

        @Test
        void linksetWithoutDatabasesIsEmpty() throws Exception {
            stub.respond("elink.fcgi", "{\"linksets\":[{\"dbfrom\":\"assembly\",\"ids\":[\"42\"]}]}");

            assertThat(client.link("assembly", "nuccore", "42").names()).isEmpty();
        }
    }

    @Nested
    @DisplayName("summary")
    class Summary {

        @Test
        void returnsTheRecordForTheIdentifier() throws Exception {
            stub.respond("esummary.fcgi", "{\"result\":{\"uids\":[\"42\"],\"42\":{\"uid\":\"42\","
                + "\"assemblyaccession\":\"GCA_000005845.2\",\"speciesname\":\"Escherichia coli\"}}}");

            JsonNode record = client.summary("assembly", "42");

            assertThat(record.path("assemblyaccession").asText()).isEqualTo("GCA_000005845.2");
        }

        @Test
        void missingRecordFails() {
            stub.respond("esummary.fcgi", "{\"result\":{\"uids\":[]}}");

            assertThatThrownBy(() -> client.summary("assembly", "42"))
                .isInstanceOf(EntrezException.class)
                .hasMessageContaining("no record");
        }

        @Test
        void recordLevelErrorFails() {
            stub.respond("esummary.fcgi", "{\"result\":{\"42\":{\"uid\":\"42\",\"error\":\"cannot get document summary\"}}}");

            assertThatThrownBy(() -> client.summary("nuccore", "42"))
                .isInstanceOf(EntrezException.class)
                .hasMessageContaining("cannot get document summary");
        }
    }

    @Nested
    @DisplayName("fetchFasta")
    class FetchFasta {

        @Test
        void postsIdentifiersAndWindow() throws Exception {
            stub.respond("efetch.fcgi", ">AB000001.1 first\nACGT\n>AB000002.1 second\nTTGA\n");

            String text = client.fetchFasta("nucleotide", List.of("1", "2"), 0, 10000);

            assertThat(text).startsWith(">AB000001.1 first");
            EntrezStub.RecordedRequest request = stub.requests("efetch.fcgi").get(0);
            assertThat(request.method()).isEqualTo("POST");
            assertThat(request.param("id")).isEqualTo("1,2");
            assertThat(request.param("rettype")).isEqualTo("fasta");
            assertThat(request.param("retstart")).isEqualTo("0");
            assertThat(request.param("retmax")).isEqualTo("10000");
            assertThat(request.param("email")).isEqualTo("someone@example.org");
        }
    }

    @Test
    void settingsNormalizeTrailingSlash() {
        TransportSettings settings = new TransportSettings("https://example.org/eutils/",
            new ContactIdentity("a@b.c"), null, null);

        assertThat(settings.eutilsBaseUrl()).isEqualTo("https://example.org/eutils");
        assertThat(settings.timeout()).isEqualTo(TransportSettings.DEFAULT_TIMEOUT);
        assertThat(settings.requestInterval()).isEqualTo(TransportSettings.DEFAULT_REQUEST_INTERVAL);
    }

    @Test
    void settingsRejectOtherSchemes() {
        assertThatThrownBy(() -> new TransportSettings("ftp://example.org", new ContactIdentity("a@b.c"),
            null, null)).isInstanceOf(IllegalArgumentException.class);
    }
}
