package io.taxfetch.retrieval.pipeline;


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
import io.taxfetch.jetty.testserver.EntrezStub;
import io.taxfetch.jetty.testserver.JettyFileServerExtension;
import io.taxfetch.retrieval.FakeTransferClient;
import io.taxfetch.retrieval.RetrievalSettings;
import io.taxfetch.retrieval.sequence.FastaReader;
import io.taxfetch.transport.OkHttpEntrezClient;
import io.taxfetch.transport.OkHttpTransferClient;
import io.taxfetch.transport.TransportSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/// Runs the whole contig pipeline over HTTP against the local E-utilities stub and file server.
@ExtendWith(JettyFileServerExtension.class)
class HttpRetrievalIntegrationTest {

    private static final String ASSEMBLY_SUMMARY = "{\"result\":{\"uids\":[\"%s\"],\"%s\":{"
        + "\"uid\":\"%s\",\"assemblyaccession\":\"%s\",\"assemblyname\":\"asm\",\"speciesname\":\"%s\","
        + "\"speciestaxid\":\"562\",\"biosource\":{\"infraspecieslist\":[{\"sub_type\":\"strain\","
        + "\"sub_value\":\"%s\"}]}}}}";

    @TempDir
    Path outputDir;

    private EntrezStub stub;
    private OkHttpEntrezClient entrez;
    private OkHttpTransferClient transfer;

    @BeforeEach
    void setUp() throws Exception {
        stub = JettyFileServerExtension.getEntrezStub();
        stub.reset();
        TransportSettings settings = new TransportSettings(JettyFileServerExtension.getEutilsUrl(),
            new ContactIdentity("someone@example.org"), Duration.ofSeconds(5), Duration.ZERO);
        entrez = new OkHttpEntrezClient(settings);
        transfer = new OkHttpTransferClient(settings);

        Path wgs = Files.createDirectories(JettyFileServerExtension.getRootDirectory().resolve("wgs"));
        Files.write(wgs.resolve("ABCDEF.1.fsa_nt.gz"),
            FakeTransferClient.gzip(">ABCDEF010000001.1 c1\nACGT\n>ABCDEF010000002.1 c2\nGG\n"));

        stub.respond("esearch.fcgi",
            "{\"esearchresult\":{\"count\":\"2\",\"webenv\":\"MCID_9\",\"querykey\":\"1\",\"idlist\":[]}}");
        stub.respond("efetch.fcgi", HttpRetrievalIntegrationTest::efetch);
        stub.respond("elink.fcgi", params -> switch (params.get("id")) {
            case "10" -> "{\"linksets\":[{\"dbfrom\":\"assembly\",\"ids\":[\"10\"],\"linksetdbs\":["
                + "{\"dbto\":\"nuccore\",\"linkname\":\"assembly_nuccore_insdc\",\"links\":[\"100\",\"101\",\"102\"]}]}]}";
            case "20" -> "{\"linksets\":[{\"dbfrom\":\"assembly\",\"ids\":[\"20\"],\"linksetdbs\":["
                + "{\"dbto\":\"nuccore\",\"linkname\":\"assembly_nuccore_wgsmaster\",\"links\":[\"900\"]}]}]}";
            default -> null;
        });
        stub.respond("esummary.fcgi", params -> switch (params.get("id")) {
            case "10" -> String.format(ASSEMBLY_SUMMARY, "10", "10", "10", "GCA_000010.1", "Escherichia coli",
                "K-12");
            case "20" -> String.format(ASSEMBLY_SUMMARY, "20", "20", "20", "GCA_000020.1", "Escherichia albertii",
                "B156");
            case "900" -> "{\"result\":{\"uids\":[\"900\"],\"900\":{\"uid\":\"900\","
                + "\"extra\":\"gi|1|gb|ABCDEF000000.1|ABCDEF000000|ABCDEF01\"}}}";
            default -> null;
        });
    }

    @AfterEach
    void tearDown() {
        entrez.close();
        transfer.close();
    }

    private static String efetch(Map<String, String> params) {
        if ("uilist".equals(params.get("rettype"))) {
            return params.get("retstart").equals("0") ? "10\n20\n" : "";
        }
        StringBuilder fasta = new StringBuilder();
        for (String id : params.get("id").split(",")) {
            fasta.append('>').append("ctg").append(id).append(" contig\n").append("ACGTACGT\n");
        }
        return fasta.toString();
    }

    @Test
    void retrievesDirectAndArchivedAssemblies() throws Exception {
        RetrievalSettings settings = RetrievalSettings.builder()
            .maxAttempts(3)
            .archiveBaseUrl(JettyFileServerExtension.getBaseUrl() + "wgs/")
            .build();
        PipelineOrchestrator orchestrator = new PipelineOrchestrator(entrez, transfer, settings);

        RunReport report = orchestrator.run(List.of("562"), outputDir);

        assertThat(report.written()).isEqualTo(2);
        assertThat(report.skipped()).isEmpty();
        assertThat(FastaReader.read(outputDir.resolve("GCA_000010.1.fasta"))).hasSize(3);
        assertThat(FastaReader.descriptions(outputDir.resolve("GCA_000020.1.fasta")))
            .containsExactly("ABCDEF010000001.1 c1", "ABCDEF010000002.1 c2");
        assertThat(Files.readString(report.labelsFile(), StandardCharsets.UTF_8))
            .isEqualTo("GCA_000010.1\tE. coli K-12\nGCA_000020.1\tE. albertii B156");
        assertThat(stub.requests("efetch.fcgi"))
            .filteredOn(request -> "POST".equals(request.method()))
            .singleElement()
            .satisfies(request -> assertThat(request.param("id")).isEqualTo("100,101,102"));
    }

    @Test
    void transientServerErrorsAreRetried() throws Exception {
        stub.failNext("elink.fcgi", 2, 503);
        RetrievalSettings settings = RetrievalSettings.builder()
            .maxAttempts(3)
            .archiveBaseUrl(JettyFileServerExtension.getBaseUrl() + "wgs/")
            .build();
        PipelineOrchestrator orchestrator = new PipelineOrchestrator(entrez, transfer, settings);

        RunReport report = orchestrator.run(List.of("562"), outputDir);

        assertThat(report.written()).isEqualTo(2);
        assertThat(stub.requests("elink.fcgi")).hasSize(4);
    }
}
