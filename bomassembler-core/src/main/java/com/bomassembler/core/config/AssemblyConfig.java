package com.bomassembler.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Root configuration for assembling several documents into one.
 *
 * <p>Loaded from {@code bomassembler.yaml}. Describes the product the assembled document
 * represents, where the inputs come from and where the result goes.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * app:
 *   name: "payments-platform"
 *   version: "2.4.0"
 *   primaryPurpose: application
 *   supplier:
 *     name: "Acme Corp"
 *     email: "sbom@acme.example"
 *   authors:
 *     - name: "Jane Doe"
 *       email: "jane@acme.example"
 *   license:
 *     id: "Apache-2.0"
 *   checksums:
 *     - algorithm: SHA256
 *       value: "ee1300ac533cebc2d070ce3765685d8f2bf4b4ba0fe1bb1b1e4e6e8bce2a6f8c"
 *   purl: "pkg:generic/acme/payments-platform@2.4.0"
 *
 * input:
 *   files:
 *     - api.spdx.json
 *     - worker.spdx.json
 *
 * output:
 *   file: "payments-platform.spdx.json"
 *
 * assemble:
 *   hierarchicalMerge: true
 * }</pre>
 *
 * @param app metadata of the synthesized root component
 * @param input input documents
 * @param output output destination
 * @param assemble merge options
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AssemblyConfig(
    @JsonProperty("app") App app,
    @JsonProperty("input") InputConfig input,
    @JsonProperty("output") OutputConfig output,
    @JsonProperty("assemble") AssembleOptions assemble
) {
    /**
     * Compact constructor with defaults for omitted sections.
     */
    public AssemblyConfig {
        if (app == null) {
            app = App.unnamed();
        }
        if (input == null) {
            input = new InputConfig(List.of());
        }
        if (output == null) {
            output = new OutputConfig(null);
        }
        if (assemble == null) {
            assemble = AssembleOptions.hierarchical();
        }
    }

    /**
     * Creates a default configuration: unnamed product, no inputs, standard output, hierarchical merge.
     *
     * @return default configuration
     */
    public static AssemblyConfig defaults() {
        return new AssemblyConfig(null, null, null, null);
    }

    public AssemblyConfig withApp(App value) {
        return new AssemblyConfig(value, input, output, assemble);
    }

    public AssemblyConfig withInput(InputConfig value) {
        return new AssemblyConfig(app, value, output, assemble);
    }

    public AssemblyConfig withOutput(OutputConfig value) {
        return new AssemblyConfig(app, input, value, assemble);
    }

    public AssemblyConfig withAssemble(AssembleOptions value) {
        return new AssemblyConfig(app, input, output, value);
    }

    /**
     * Application metadata used for the synthesized root component.
     *
     * @param name product name, also the document name and namespace seed
     * @param version product version
     * @param description free-text description
     * @param primaryPurpose primary purpose name (e.g. {@code application})
     * @param supplier supplier, NOASSERTION when unset
     * @param authors authors, recorded as organization creators
     * @param license license id or expression
     * @param checksums artifact checksums
     * @param purl package URL
     * @param cpe CPE 2.3 identifier
     * @param copyright copyright text, NOASSERTION when unset
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record App(
        @JsonProperty("name") String name,
        @JsonProperty("version") String version,
        @JsonProperty("description") String description,
        @JsonProperty("primaryPurpose") String primaryPurpose,
        @JsonProperty("supplier") Contact supplier,
        @JsonProperty("authors") List<Contact> authors,
        @JsonProperty("license") LicenseSpec license,
        @JsonProperty("checksums") List<HashSpec> checksums,
        @JsonProperty("purl") String purl,
        @JsonProperty("cpe") String cpe,
        @JsonProperty("copyright") String copyright
    ) {
        public App {
            if (authors == null) {
                authors = List.of();
            }
            if (checksums == null) {
                checksums = List.of();
            }
        }

        static App unnamed() {
            return new App(null, null, null, null, null, null, null, null, null, null, null);
        }

        public App withName(String value) {
            return new App(value, version, description, primaryPurpose, supplier, authors, license,
                checksums, purl, cpe, copyright);
        }

        public App withVersion(String value) {
            return new App(name, value, description, primaryPurpose, supplier, authors, license,
                checksums, purl, cpe, copyright);
        }
    }

    /**
     * License of the root component.
     *
     * @param id SPDX license identifier
     * @param expression license expression
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LicenseSpec(
        @JsonProperty("id") String id,
        @JsonProperty("expression") String expression
    ) {}

    /**
     * Input documents, merged in list order.
     *
     * @param files paths of the input documents
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record InputConfig(
        @JsonProperty("files") List<String> files
    ) {
        public InputConfig {
            if (files == null) {
                files = List.of();
            }
        }
    }

    /**
     * Output destination.
     *
     * @param file output file, standard output when null or blank
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("file") String file
    ) {}

    /**
     * Merge options. Hierarchical merge is the default; the flat merge is not implemented.
     *
     * @param flatMerge request a flat merge
     * @param hierarchicalMerge request a hierarchical merge
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AssembleOptions(
        @JsonProperty("flatMerge") boolean flatMerge,
        @JsonProperty("hierarchicalMerge") boolean hierarchicalMerge
    ) {
        public static AssembleOptions hierarchical() {
            return new AssembleOptions(false, true);
        }

        public static AssembleOptions flat() {
            return new AssembleOptions(true, false);
        }
    }
}
