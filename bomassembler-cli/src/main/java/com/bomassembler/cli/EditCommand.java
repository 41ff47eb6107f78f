package com.bomassembler.cli;

import com.bomassembler.BomAssemblerCLI;
import com.bomassembler.core.edit.EditPolicy;
import com.bomassembler.core.edit.EditRequest;
import com.bomassembler.core.edit.EditResult;
import com.bomassembler.core.edit.EditSettings;
import com.bomassembler.core.edit.FieldOutcome;
import com.bomassembler.core.edit.FieldReconciliationEngine;
import com.bomassembler.core.edit.SearchSpec;
import com.bomassembler.core.edit.SubjectKind;
import com.bomassembler.core.loader.SpdxJsonLoader;
import com.bomassembler.core.model.Document;
import com.bomassembler.core.writer.Destination;
import com.bomassembler.core.writer.DocumentWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to edit fields of a document or one of its components.
 *
 * <p>Every field flag is optional; fields without a flag are left alone. The policy decides
 * whether a configured value fills a gap ({@code --missing}), is added next to existing values
 * ({@code --append}) or replaces them (default).
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Set supplier and license of the primary component
 * bomassembler edit app.spdx.json --subject primary-component \
 *     --supplier "Acme Corp,sbom@acme.example" --license Apache-2.0
 *
 * # Add a purl to a named component, keeping existing ones
 * bomassembler edit app.spdx.json --subject component-name-version \
 *     --search-name jackson-databind --append --purl pkg:maven/com.fasterxml.jackson.core/jackson-databind@2.16.1
 *
 * # Add an author to the document only when none is present
 * bomassembler edit app.spdx.json --missing --author "Jane Doe,jane@acme.example" -o app.spdx.json
 * }</pre>
 */
@Command(
    name = "edit",
    description = "Edit fields of a document or one of its components"
)
public class EditCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(EditCommand.class);

    @Option(names = {"-h", "--help"}, usageHelp = true, description = "Show this help message and exit")
    private boolean help;

    @Parameters(index = "0", description = "Input SPDX JSON document")
    private Path input;

    @Option(names = {"-o", "--output"}, description = "Output file (default: standard output)")
    private Path output;

    @Option(
        names = {"--subject"},
        description = "What to edit: document, primary-component or component-name-version (default: document)"
    )
    private String subject = SubjectKind.DOCUMENT.id();

    @Option(names = {"--search-name"}, description = "Component name for component-name-version")
    private String searchName;

    @Option(names = {"--search-version"}, description = "Component version for component-name-version")
    private String searchVersion;

    @ArgGroup(exclusive = true, multiplicity = "0..1")
    private PolicyOptions policyOptions;

    @Option(names = {"--name"}, description = "Component name")
    private String name;

    @Option(names = {"--version"}, description = "Component version")
    private String version;

    @Option(names = {"--supplier"}, description = "Supplier as name[,email]")
    private String supplier;

    @Option(names = {"--author"}, description = "Document author as name[,email] (repeatable)")
    private List<String> authors = new ArrayList<>();

    @Option(names = {"--purl"}, description = "Package URL")
    private String purl;

    @Option(names = {"--cpe"}, description = "CPE 2.3 identifier")
    private String cpe;

    @Option(names = {"--license"}, description = "License id or expression (repeatable, joined with OR)")
    private List<String> licenses = new ArrayList<>();

    @Option(names = {"--hash"}, description = "Checksum as algorithm=value (repeatable)")
    private List<String> hashes = new ArrayList<>();

    @Option(names = {"--tool"}, description = "Tool creator as name[,version] (repeatable)")
    private List<String> tools = new ArrayList<>();

    @Option(names = {"--copyright"}, description = "Copyright text")
    private String copyright;

    @Option(names = {"--lifecycle"}, split = ",", description = "Lifecycle stages (comma separated or repeatable)")
    private List<String> lifecycles = new ArrayList<>();

    @Option(names = {"--description"}, description = "Document comment or component description")
    private String description;

    @Option(names = {"--repository"}, description = "Component download location")
    private String repository;

    @Option(names = {"--primary-purpose"}, description = "Component primary purpose (see 'list purposes')")
    private String primaryPurpose;

    static class PolicyOptions {
        @Option(names = {"--missing"}, description = "Only fill fields that are empty")
        boolean missing;

        @Option(names = {"--append"}, description = "Add values next to existing ones")
        boolean append;
    }

    @Override
    public Integer call() {
        try {
            EditSettings settings = new EditSettings(searchSpec(), policy(), request());

            Document document = new SpdxJsonLoader().load(input);
            FieldReconciliationEngine engine =
                new FieldReconciliationEngine(BomAssemblerCLI.TOOL, Clock.systemUTC());
            EditResult result = engine.edit(document, settings);

            log.info("Edited {}: applied={}, not supported={}, invalid={}",
                input,
                result.report().fieldsWith(FieldOutcome.APPLIED),
                result.report().fieldsWith(FieldOutcome.NOT_SUPPORTED),
                result.report().fieldsWith(FieldOutcome.INVALID_INPUT));

            Destination destination = output == null ? Destination.standardOutput() : Destination.file(output);
            DocumentWriter.forDestination(destination).write(result.document(), destination);
            return 0;

        } catch (Exception e) {
            log.error("Edit failed", e);
            System.err.println("✗ Edit failed: " + e.getMessage());
            return 1;
        }
    }

    SearchSpec searchSpec() {
        SubjectKind kind = SubjectKind.fromId(subject);
        if (kind == SubjectKind.COMPONENT_NAME_VERSION && (searchName == null || searchName.isBlank())) {
            throw new IllegalArgumentException("--search-name is required for subject " + kind);
        }
        return new SearchSpec(kind, searchName, searchVersion);
    }

    EditPolicy policy() {
        if (policyOptions == null) {
            return EditPolicy.OVERWRITE;
        }
        if (policyOptions.missing) {
            return EditPolicy.MISSING;
        }
        return policyOptions.append ? EditPolicy.APPEND : EditPolicy.OVERWRITE;
    }

    EditRequest request() {
        EditRequest.Builder builder = EditRequest.builder()
            .name(name)
            .version(version)
            .purl(purl)
            .cpe(cpe)
            .copyright(copyright)
            .description(description)
            .repository(repository)
            .primaryPurpose(primaryPurpose);

        if (supplier != null) {
            String[] parts = Pairs.split(supplier, ',');
            builder.supplier(parts[0], parts[1]);
        }
        for (String author : authors) {
            String[] parts = Pairs.split(author, ',');
            builder.author(parts[0], parts[1]);
        }
        licenses.forEach(builder::license);
        for (String hash : hashes) {
            String[] parts = Pairs.split(hash, '=');
            if (parts[1] == null) {
                throw new IllegalArgumentException("Invalid --hash '" + hash + "', expected algorithm=value");
            }
            builder.hash(parts[0], parts[1]);
        }
        for (String tool : tools) {
            String[] parts = Pairs.split(tool, ',');
            builder.tool(parts[0], parts[1]);
        }
        lifecycles.stream()
            .map(String::trim)
            .filter(stage -> !stage.isEmpty())
            .forEach(builder::lifecycle);
        return builder.build();
    }
}
