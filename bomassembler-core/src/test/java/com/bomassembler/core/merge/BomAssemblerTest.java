package com.bomassembler.core.merge;

import com.bomassembler.core.Fixtures;
import com.bomassembler.core.config.AssemblyConfig;
import com.bomassembler.core.config.AssemblyConfig.AssembleOptions;
import com.bomassembler.core.config.AssemblyConfig.InputConfig;
import com.bomassembler.core.config.AssemblyConfig.OutputConfig;
import com.bomassembler.core.json.BomJson;
import com.bomassembler.core.loader.BomLoadException;
import com.bomassembler.core.loader.SpdxJsonLoader;
import com.bomassembler.core.model.Component;
import com.bomassembler.core.model.Document;
import com.bomassembler.core.model.Relationship;
import com.bomassembler.core.model.RelationshipType;
import com.bomassembler.core.writer.BomWriteException;
import com.bomassembler.core.writer.Destination;
import com.bomassembler.core.writer.DocumentWriter;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.StreamSupport;

import static com.bomassembler.core.TestDocuments.CLOCK;
import static com.bomassembler.core.TestDocuments.TOOL;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests for {@link BomAssembler}.
 */
class BomAssemblerTest {

    @TempDir
    Path tempDir;

    private Path api;
    private Path worker;
    private Path output;
    private BomAssembler assembler;

    @BeforeEach
    void setUp() {
        api = Fixtures.copy("api.spdx.json", tempDir);
        worker = Fixtures.copy("worker.spdx.json", tempDir);
        output = tempDir.resolve("out/platform.spdx.json");
        assembler = new BomAssembler(TOOL, CLOCK, new SpdxJsonLoader());
    }

    private AssemblyConfig config(Path... inputs) {
        return AssemblyConfig.defaults()
            .withApp(AssemblyConfig.defaults().app().withName("platform").withVersion("2.0"))
            .withInput(new InputConfig(List.of(inputs).stream().map(Path::toString).toList()))
            .withOutput(new OutputConfig(output.toString()));
    }

    @Test
    void assemble_writesMergedDocument() {
        MergeResult result = assembler.assemble(config(api, worker));

        Document written = new SpdxJsonLoader().load(output);
        assertThat(written.name()).isEqualTo("platform");
        assertThat(written.components()).extracting(Component::name)
            .containsExactly("platform", "api", "jackson-databind", "worker");
        assertThat(written.components().get(0).id()).isEqualTo(result.rootComponentId());
        assertThat(written.relationships().get(0))
            .isEqualTo(Relationship.of(Document.DOCUMENT_ID, RelationshipType.DESCRIBES, result.rootComponentId()));
        assertThat(written.relationships())
            .filteredOn(rel -> rel.type() == RelationshipType.CONTAINS)
            .allMatch(rel -> rel.refA().equals(result.rootComponentId()))
            .hasSize(2);
        assertThat(written.creationInfo().licenseListVersion()).isEqualTo("3.19");
        assertThat(written.files()).hasSize(1);
        assertThat(written.otherLicenses()).hasSize(1);
    }

    @Test
    void assemble_describedComponentsAreReidentified() {
        assembler.assemble(config(api, worker));

        Document written = new SpdxJsonLoader().load(output);
        assertThat(written.findComponent("SPDXRef-api")).isEmpty();
        assertThat(written.findComponent("SPDXRef-worker")).isEmpty();
        assertThat(written.findComponent("SPDXRef-jackson")).isPresent();
        assertThat(written.relationships()).noneMatch(rel -> rel.references("SPDXRef-api"));
    }

    @Test
    void assemble_missingInput_failsWithoutWriting() {
        Path missing = tempDir.resolve("missing.spdx.json");

        assertThatThrownBy(() -> assembler.assemble(config(api, missing)))
            .isInstanceOf(BomLoadException.class);
        assertThat(output).doesNotExist();
    }

    @Test
    void assemble_flatMerge_failsWithoutWriting() {
        AssemblyConfig config = config(api, worker).withAssemble(AssembleOptions.flat());

        assertThatThrownBy(() -> assembler.assemble(config))
            .isInstanceOf(UnsupportedOperationException.class);
        assertThat(output).doesNotExist();
    }

    @Test
    void mergerFor_picksMergerByMode() {
        assertThat(assembler.mergerFor(config(api), new MergeProgress())).isInstanceOf(HierarchicalMerger.class);
        assertThat(assembler.mergerFor(config(api).withAssemble(AssembleOptions.flat()), new MergeProgress()))
            .isInstanceOf(FlatMerger.class);
    }

    @Test
    void assemble_successfulRun_endsDone() {
        assertThat(assembler.stage()).isNull();

        assembler.assemble(config(api, worker));

        assertThat(assembler.stage()).isEqualTo(MergeStage.DONE);
    }

    @Test
    void assemble_writeFailure_endsAborted() {
        DocumentWriter failing = new DocumentWriter() {
            @Override
            public String getId() {
                return "failing";
            }

            @Override
            public long write(Document document, Destination destination) {
                throw new BomWriteException("disk full", null);
            }
        };
        BomAssembler failingAssembler = new BomAssembler(TOOL, CLOCK, new SpdxJsonLoader(), destination -> failing);

        assertThatThrownBy(() -> failingAssembler.assemble(config(api, worker)))
            .isInstanceOf(BomWriteException.class);
        assertThat(failingAssembler.stage()).isEqualTo(MergeStage.ABORTED);
    }

    @Test
    void assemble_flatMerge_endsAborted() {
        assertThatThrownBy(() -> assembler.assemble(config(api).withAssemble(AssembleOptions.flat())))
            .isInstanceOf(UnsupportedOperationException.class);
        assertThat(assembler.stage()).isEqualTo(MergeStage.ABORTED);
    }

    @Test
    void assemble_keepsPackagePropertiesAndSectionsTheModelDoesNotName() throws IOException {
        assembler.assemble(config(api, worker));

        JsonNode written = BomJson.mapper().readTree(output.toFile());
        JsonNode apiPackage = StreamSupport.stream(written.get("packages").spliterator(), false)
            .filter(pkg -> "api".equals(pkg.path("name").asText()))
            .findFirst().orElseThrow();
        assertThat(apiPackage.get("SPDXID").asText()).startsWith("SPDXRef-Package-");
        assertThat(apiPackage.get("homepage").asText()).isEqualTo("https://acme.example/api");
        assertThat(apiPackage.get("originator").asText()).isEqualTo("Organization: Acme Labs");
        assertThat(apiPackage.get("licenseInfoFromFiles")).hasSize(2);
        assertThat(apiPackage.get("annotations")).hasSize(1);

        assertThat(written.get("snippets").get(0).get("SPDXID").asText()).isEqualTo("SPDXRef-snippet-1");
        assertThat(written.get("annotations").get(0).get("comment").asText()).isEqualTo("generated");
        assertThat(written.get("relationships")).extracting(rel -> rel.get("relationshipType").asText())
            .contains("SOMETHING_NEW");
    }
}
