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

import io.taxfetch.retrieval.AcquisitionMode;
import io.taxfetch.retrieval.FakeEntrezClient;
import io.taxfetch.retrieval.FakeTransferClient;
import io.taxfetch.retrieval.RetrievalSettings;
import io.taxfetch.retrieval.integrity.IntegrityVerifier;
import io.taxfetch.retrieval.links.LinkCategory;
import io.taxfetch.retrieval.links.UnrecognizedLinkCategoryException;
import io.taxfetch.retrieval.sequence.FastaReader;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineOrchestratorTest {

    private static final String ARCHIVE_BASE = "https://archive.test/wgs/?download=";
    private static final String GENOME_BASE = "https://genomes.test/genomes/all";

    @TempDir
    Path outputDir;

    private static RetrievalSettings.Builder settings() {
        return RetrievalSettings.builder()
            .maxAttempts(2)
            .archiveBaseUrl(ARCHIVE_BASE)
            .genomeBaseUrl(GENOME_BASE);
    }

    private static String read(Path file) throws Exception {
        return Files.readString(file, StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("contig retrieval")
    class Contigs {

        private FakeEntrezClient twoAssemblies() {
            return new FakeEntrezClient()
                .withAssemblies("562", "10", "20")
                .withAssemblySummary("10", "GCA_000010.1", "asm10", "Escherichia coli", "K-12")
                .withLink("10", LinkCategory.INSDC.linkName(), "100", "101")
                .withAssemblySummary("20", "GCA_000020.1", "asm20", "Escherichia fergusonii", null)
                .withLink("20", LinkCategory.WGS_MASTER.linkName(), "900")
                .withArchiveAnnotation("900", "gi|1|gb|ABCDEF000000.1|ABCDEF000000|ABCDEF01");
        }

        private FakeTransferClient archive() {
            return new FakeTransferClient().withFile(ARCHIVE_BASE + "ABCDEF.1.fsa_nt.gz",
                FakeTransferClient.gzip(">ABCDEF010000001.1 c1\nAC\n>ABCDEF010000002.1 c2\nGT\n>ABCDEF010000003.1 c3\nT\n"));
        }

        @Test
        void writesSequencesClassesAndLabels() throws Exception {
            PipelineOrchestrator orchestrator = new PipelineOrchestrator(twoAssemblies(), archive(),
                settings().build());

            RunReport report = orchestrator.run(List.of("562"), outputDir);

            assertThat(report.status()).isEqualTo(RunReport.Status.COMPLETED);
            assertThat(report.assembliesResolved()).isEqualTo(2);
            assertThat(report.written()).isEqualTo(2);
            assertThat(report.shortfalls()).isZero();
            assertThat(FastaReader.read(outputDir.resolve("GCA_000010.1.fasta"))).hasSize(2);
            assertThat(FastaReader.descriptions(outputDir.resolve("GCA_000020.1.fasta"))).hasSize(3);
            assertThat(read(report.classesFile()))
                .isEqualTo("GCA_000010.1\tEscherichia coli\nGCA_000020.1\tEscherichia fergusonii");
            assertThat(read(report.labelsFile()))
                .isEqualTo("GCA_000010.1\tE. coli K-12\nGCA_000020.1\tE. fergusonii ");
        }

        @Test
        void countReportsStrategiesWithoutDownloading() {
            FakeTransferClient transfer = archive();
            FakeEntrezClient entrez = twoAssemblies();
            PipelineOrchestrator orchestrator = new PipelineOrchestrator(entrez, transfer, settings().build());

            List<AssemblyCount> counts = orchestrator.count(List.of("562"));

            assertThat(counts).containsExactly(
                new AssemblyCount("562", "10", LinkCategory.INSDC, 2),
                new AssemblyCount("562", "20", LinkCategory.WGS_MASTER, -1));
            assertThat(transfer.opened()).isEmpty();
            assertThat(entrez.calls("fasta")).isZero();
        }

        @Test
        void assemblyUnderTwoTaxaIsProcessedTwice() throws Exception {
            FakeEntrezClient entrez = twoAssemblies().withAssemblies("561", "10");
            PipelineOrchestrator orchestrator = new PipelineOrchestrator(entrez, archive(), settings().build());

            RunReport report = orchestrator.run(List.of("562", "561"), outputDir);

            assertThat(report.assembliesResolved()).isEqualTo(3);
            assertThat(report.written()).isEqualTo(3);
            assertThat(read(report.classesFile()).split("\n")).hasSize(3);
        }

        @Test
        void shortfallIsCountedAndFileStillWritten() throws Exception {
            FakeEntrezClient entrez = new FakeEntrezClient()
                .withAssemblies("562", "10")
                .withAssemblySummary("10", "GCA_000010.1", "asm10", "Escherichia coli", "K-12")
                .withLink("10", LinkCategory.INSDC.linkName(), "100", "101", "102")
                .withFastaResponder((ids, retstart, retmax, call) ->
                    FakeEntrezClient.defaultFasta(ids.subList(0, 2), retstart, retmax, call));
            PipelineOrchestrator orchestrator = new PipelineOrchestrator(entrez, new FakeTransferClient(),
                settings().build());

            RunReport report = orchestrator.run(List.of("562"), outputDir);

            assertThat(report.shortfalls()).isEqualTo(1);
            assertThat(report.written()).isEqualTo(1);
            assertThat(entrez.calls("fasta")).isEqualTo(2);
            assertThat(FastaReader.read(outputDir.resolve("GCA_000010.1.fasta"))).hasSize(2);
        }

        @Test
        void unrecognisedLinksAbortTheRun() {
            FakeEntrezClient entrez = new FakeEntrezClient()
                .withAssemblies("562", "10")
                .withAssemblySummary("10", "GCA_000010.1", "asm10", "Escherichia coli", "K-12")
                .withLink("10", "assembly_biosample", "5");
            PipelineOrchestrator orchestrator = new PipelineOrchestrator(entrez, new FakeTransferClient(),
                settings().build());

            assertThatThrownBy(() -> orchestrator.run(List.of("562"), outputDir))
                .isInstanceOf(UnrecognizedLinkCategoryException.class);
            assertThat(outputDir.resolve(RetrievalSettings.DEFAULT_CLASSES_FILE)).doesNotExist();
        }

        @Test
        void emptyTaxonWritesEmptyFiles() throws Exception {
            FakeEntrezClient entrez = new FakeEntrezClient().withAssemblies("1");
            PipelineOrchestrator orchestrator = new PipelineOrchestrator(entrez, new FakeTransferClient(),
                settings().build());

            RunReport report = orchestrator.run(List.of("1"), outputDir);

            assertThat(report.written()).isZero();
            assertThat(read(report.classesFile())).isEmpty();
        }

        @Test
        void missingOutputDirectoryIsRejected() {
            PipelineOrchestrator orchestrator = new PipelineOrchestrator(new FakeEntrezClient(),
                new FakeTransferClient(), settings().build());

            assertThatThrownBy(() -> orchestrator.run(List.of("1"), outputDir.resolve("absent")))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("genome retrieval")
    class Genomes {

        private static final String DIR = GENOME_BASE + "/GCA/000/005/845/GCA_000005845.2_ASM584v2";
        private static final String GENOME = "GCA_000005845.2_ASM584v2_genomic.fna.gz";

        private FakeEntrezClient assemblies() {
            return new FakeEntrezClient()
                .withAssemblies("562", "10", "20")
                .withAssemblySummary("10", "GCA_000005845.2", "ASM584v2", "Escherichia coli", "K-12")
                .withAssemblySummary("20", "GCA_000000001.1", "ASM1v1", "Escherichia albertii", "B156");
        }

        private FakeTransferClient files(String declaredHash) {
            return new FakeTransferClient()
                .withFile(DIR + "/" + GENOME, FakeTransferClient.gzip(">chr\nACGT\n"))
                .withFile(DIR + "/md5checksums.txt", declaredHash + "  ./" + GENOME + "\n");
        }

        @Test
        void skippedAssembliesGetNoClassOrLabel() throws Exception {
            PipelineOrchestrator orchestrator = new PipelineOrchestrator(assemblies(), files("00"),
                settings().mode(AcquisitionMode.FTP).build());

            RunReport report = orchestrator.run(List.of("562"), outputDir);

            assertThat(report.status()).isEqualTo(RunReport.Status.COMPLETED_WITH_SKIPS);
            assertThat(report.written()).isEqualTo(1);
            assertThat(report.skipped()).singleElement().satisfies(skip -> {
                assertThat(skip.accession()).isEqualTo("GCA_000000001.1");
                assertThat(skip.taxonId()).isEqualTo("562");
                assertThat(skip.describe()).contains("Escherichia albertii B156");
            });
            assertThat(read(report.classesFile())).isEqualTo("GCA_000005845.2\tEscherichia coli");
            assertThat(read(report.labelsFile())).isEqualTo("GCA_000005845.2\tE. coli K-12");
        }

        @Test
        void hashMismatchWarnsButStillExtracts() throws Exception {
            PipelineOrchestrator orchestrator = new PipelineOrchestrator(assemblies(),
                files("0123456789abcdef0123456789abcdef"), settings().mode(AcquisitionMode.FTP).build());

            RunReport report = orchestrator.run(List.of("562"), outputDir);

            assertThat(report.hashFailures()).isEqualTo(1);
            assertThat(report.written()).isEqualTo(1);
            assertThat(read(outputDir.resolve("GCA_000005845.2_ASM584v2_genomic.fna"))).isEqualTo(">chr\nACGT\n");
        }

        @Test
        void matchingHashPasses() throws Exception {
            byte[] archive = FakeTransferClient.gzip(">chr\nACGT\n");
            Path reference = Files.write(outputDir.resolve("reference.gz"), archive);
            String md5 = IntegrityVerifier.md5(reference);
            FakeTransferClient transfer = new FakeTransferClient()
                .withFile(DIR + "/" + GENOME, archive)
                .withFile(DIR + "/md5checksums.txt", md5 + "  ./" + GENOME + "\n");
            PipelineOrchestrator orchestrator = new PipelineOrchestrator(assemblies(), transfer,
                settings().mode(AcquisitionMode.FTP).build());

            RunReport report = orchestrator.run(List.of("562"), outputDir);

            assertThat(report.hashFailures()).isZero();
        }

        @Test
        void noClobberKeepsExtractedGenomeAndClassFiles() throws Exception {
            Path extracted = Files.writeString(outputDir.resolve("GCA_000005845.2_ASM584v2_genomic.fna"), "old",
                StandardCharsets.UTF_8);
            Path classes = Files.writeString(outputDir.resolve("classes.txt"), "kept", StandardCharsets.UTF_8);
            PipelineOrchestrator orchestrator = new PipelineOrchestrator(assemblies(), files("00"),
                settings().mode(AcquisitionMode.FTP).noClobber(true).build());

            RunReport report = orchestrator.run(List.of("562"), outputDir);

            assertThat(report.written()).isEqualTo(1);
            assertThat(read(extracted)).isEqualTo("old");
            assertThat(read(classes)).isEqualTo("kept");
            assertThat(read(report.labelsFile())).isEqualTo("GCA_000005845.2\tE. coli K-12");
            assertThat(report.classesFile()).isNull();
            assertThat(report.labelsFile()).isEqualTo(outputDir.resolve("labels.txt"));
        }
    }
}
