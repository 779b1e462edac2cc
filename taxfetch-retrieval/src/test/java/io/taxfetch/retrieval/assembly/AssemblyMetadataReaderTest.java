package io.taxfetch.retrieval.assembly;


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

import io.taxfetch.retrieval.FakeEntrezClient;
import io.taxfetch.retrieval.retry.RetriesExhaustedException;
import io.taxfetch.retrieval.retry.RetryExecutor;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AssemblyMetadataReaderTest {

    private final RetryExecutor retry = new RetryExecutor(2, Duration.ZERO);

    @Test
    void readsClassificationFromSummary() {
        FakeEntrezClient entrez = new FakeEntrezClient()
            .withAssemblySummary("42", "GCA_000005845.2", "ASM584v2", "Escherichia coli", "K-12");

        AssemblyMetadata metadata = new AssemblyMetadataReader(entrez, retry).read("42");

        assertThat(metadata.accession()).isEqualTo("GCA_000005845.2");
        assertThat(metadata.assemblyName()).isEqualTo("ASM584v2");
        assertThat(metadata.genus()).isEqualTo("Escherichia");
        assertThat(metadata.species()).isEqualTo("coli");
        assertThat(metadata.strain()).isEqualTo("K-12");
        assertThat(metadata.speciesTaxid()).isEqualTo("562");
        assertThat(metadata.classLine()).isEqualTo("GCA_000005845.2\tEscherichia coli");
        assertThat(metadata.labelLine()).isEqualTo("GCA_000005845.2\tE. coli K-12");
    }

    @Test
    void missingStrainKeepsTrailingSpaceInLabel() {
        FakeEntrezClient entrez = new FakeEntrezClient()
            .withAssemblySummary("43", "GCA_000001.1", "x", "Bacillus subtilis subsp. subtilis", null);

        AssemblyMetadata metadata = new AssemblyMetadataReader(entrez, retry).read("43");

        assertThat(metadata.strain()).isEmpty();
        assertThat(metadata.species()).isEqualTo("subtilis subsp. subtilis");
        assertThat(metadata.labelLine()).isEqualTo("GCA_000001.1\tB. subtilis subsp. subtilis ");
    }

    @Test
    void readsFtpPaths() {
        FakeEntrezClient entrez = new FakeEntrezClient().withSummary("assembly", "44", FakeEntrezClient.json(
            "{\"assemblyaccession\":\"GCF_1.1\",\"speciesname\":\"Xanthomonas oryzae\","
                + "\"ftppath_genbank\":\"ftp://host/genomes/all/GCA/a\",\"ftppath_refseq\":\"\"}"));

        AssemblyMetadata metadata = new AssemblyMetadataReader(entrez, retry).read("44");

        assertThat(metadata.genbankFtpPath()).isEqualTo("ftp://host/genomes/all/GCA/a");
        assertThat(metadata.refseqFtpPath()).isEmpty();
        assertThat(metadata.strain()).isEmpty();
    }

    @Test
    void missingAccessionIsFatal() {
        FakeEntrezClient entrez = new FakeEntrezClient().withSummary("assembly", "45",
            FakeEntrezClient.json("{\"speciesname\":\"Escherichia coli\"}"));

        assertThatThrownBy(() -> new AssemblyMetadataReader(entrez, retry).read("45"))
            .isInstanceOf(IncompleteMetadataException.class)
            .hasMessageContaining("assemblyaccession");
    }

    @Test
    void unavailableSummaryIsFatal() {
        FakeEntrezClient entrez = new FakeEntrezClient();

        assertThatThrownBy(() -> new AssemblyMetadataReader(entrez, retry).read("46"))
            .isInstanceOf(RetriesExhaustedException.class);
        assertThat(entrez.calls("summary")).isEqualTo(2);
    }

    @Test
    void singleWordOrganismHasNoSpecies() {
        AssemblyMetadata metadata = AssemblyMetadata.of("1", "GCA_2.1", "", "Bacteria", "", "", "", "");

        assertThat(metadata.genus()).isEqualTo("Bacteria");
        assertThat(metadata.species()).isEmpty();
        assertThat(metadata.labelLine()).isEqualTo("GCA_2.1\tB.  ");
    }
}
