package com.bomassembler.cli;

import com.bomassembler.BomAssemblerCLI;
import com.bomassembler.core.edit.EditPolicy;
import com.bomassembler.core.edit.EditRequest;
import com.bomassembler.core.edit.SubjectKind;
import com.bomassembler.core.loader.SpdxJsonLoader;
import com.bomassembler.core.model.Component;
import com.bomassembler.core.model.Creator;
import com.bomassembler.core.model.Document;
import com.bomassembler.core.model.ExternalReference;
import com.bomassembler.core.model.Supplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link EditCommand}.
 */
class EditCommandTest {

    @TempDir
    Path tempDir;

    private Path input;
    private Path output;

    @BeforeEach
    void setUp() throws IOException {
        input = CliTestDocuments.write(tempDir, "app", "1.0", "3.19");
        output = tempDir.resolve("edited.spdx.json");
    }

    private int run(String... args) {
        return new CommandLine(new BomAssemblerCLI()).execute(args);
    }

    @Test
    void edit_primaryComponent_appliesFieldsAndWritesFile() {
        int exitCode = run("edit", input.toString(), "-o", output.toString(),
            "--subject", "primary-component",
            "--supplier", "Acme Corp,sbom@acme.example",
            "--purl", "pkg:maven/acme/app@1.0",
            "--license", "MIT", "--license", "Apache-2.0",
            "--hash", "sha-256=abc");

        assertThat(exitCode).isZero();
        Document edited = new SpdxJsonLoader().load(output);
        Component app = edited.findComponent("SPDXRef-app").orElseThrow();
        assertThat(app.supplier()).isEqualTo(Supplier.organization("Acme Corp (sbom@acme.example)"));
        assertThat(app.externalReferences()).containsExactly(ExternalReference.purl("pkg:maven/acme/app@1.0"));
        assertThat(app.licenseConcluded()).isEqualTo("MIT OR Apache-2.0");
        assertThat(app.checksums()).singleElement().satisfies(c -> assertThat(c.algorithm()).isEqualTo("SHA256"));
    }

    @Test
    void edit_replacesStaleSelfStamp() {
        int exitCode = run("edit", input.toString(), "-o", output.toString());

        assertThat(exitCode).isZero();
        Document edited = new SpdxJsonLoader().load(output);
        assertThat(edited.creationInfo().creators()).containsExactly(
            Creator.tool("syft-0.90.0"), BomAssemblerCLI.TOOL.creator());
    }

    @Test
    void edit_missingPolicy_keepsExistingVersion() {
        int exitCode = run("edit", input.toString(), "-o", output.toString(),
            "--subject", "component-name-version", "--search-name", "app-dep",
            "--missing", "--version", "9.9", "--description", "dependency");

        assertThat(exitCode).isZero();
        Component dep = new SpdxJsonLoader().load(output).findComponent("SPDXRef-app-dep").orElseThrow();
        assertThat(dep.version()).isEqualTo("0.1");
        assertThat(dep.description()).isEqualTo("dependency");
    }

    @Test
    void edit_missingInput_returnsOne() {
        int exitCode = run("edit", tempDir.resolve("missing.json").toString(), "-o", output.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(output).doesNotExist();
    }

    @Test
    void edit_unknownSubject_returnsOne() {
        assertThat(run("edit", input.toString(), "--subject", "everything")).isEqualTo(1);
    }

    @Test
    void edit_missingAndAppendTogether_isRejected() {
        assertThat(run("edit", input.toString(), "--missing", "--append")).isNotZero();
    }

    @Test
    void options_mapToEditSettings() {
        EditCommand command = new EditCommand();
        new CommandLine(command).parseArgs(input.toString(),
            "--subject", "component-name-version", "--search-name", "lib", "--search-version", "2.0",
            "--append", "--author", "Jane Doe,jane@acme.example", "--tool", "trivy,0.50.0",
            "--lifecycle", "build,post-build", "--primary-purpose", "library");

        EditRequest request = command.request();

        assertThat(command.policy()).isEqualTo(EditPolicy.APPEND);
        assertThat(command.searchSpec().subject()).isEqualTo(SubjectKind.COMPONENT_NAME_VERSION);
        assertThat(command.searchSpec().version()).isEqualTo("2.0");
        assertThat(request.authors()).singleElement()
            .satisfies(a -> assertThat(a.display()).isEqualTo("Jane Doe (jane@acme.example)"));
        assertThat(request.tools()).containsExactly(new EditRequest.ToolRef("trivy", "0.50.0"));
        assertThat(request.lifecycles()).containsExactly("build", "post-build");
        assertThat(request.primaryPurpose()).isEqualTo("library");
    }
}
