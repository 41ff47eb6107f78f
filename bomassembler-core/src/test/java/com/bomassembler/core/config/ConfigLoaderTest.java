package com.bomassembler.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("bomassembler.yaml");
        Files.writeString(configFile, """
            app:
              name: "payments-platform"
              version: "2.4.0"
              description: "Payments"
              primaryPurpose: application
              supplier:
                name: "Acme Corp"
                email: "sbom@acme.example"
              authors:
                - name: "Jane Doe"
                  email: "jane@acme.example"
              license:
                id: "Apache-2.0"
              checksums:
                - algorithm: sha-256
                  value: "abc"
              purl: "pkg:generic/acme/payments-platform@2.4.0"
              copyright: "Copyright 2024 Acme"

            input:
              files:
                - api.spdx.json
                - worker.spdx.json

            output:
              file: "out.spdx.json"

            assemble:
              hierarchicalMerge: true
            """);

        AssemblyConfig config = ConfigLoader.load(configFile);

        assertThat(config.app().name()).isEqualTo("payments-platform");
        assertThat(config.app().version()).isEqualTo("2.4.0");
        assertThat(config.app().supplier().display()).isEqualTo("Acme Corp (sbom@acme.example)");
        assertThat(config.app().authors()).containsExactly(new Contact("Jane Doe", "jane@acme.example"));
        assertThat(config.app().license().id()).isEqualTo("Apache-2.0");
        assertThat(config.app().checksums()).containsExactly(new HashSpec("sha-256", "abc"));
        assertThat(config.input().files()).containsExactly("api.spdx.json", "worker.spdx.json");
        assertThat(config.output().file()).isEqualTo("out.spdx.json");
        assertThat(config.assemble().hierarchicalMerge()).isTrue();
        assertThat(config.assemble().flatMerge()).isFalse();
    }

    @Test
    void load_minimalYaml_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve("bomassembler.yaml");
        Files.writeString(configFile, """
            app:
              name: "minimal"
            """);

        AssemblyConfig config = ConfigLoader.load(configFile);

        assertThat(config.app().name()).isEqualTo("minimal");
        assertThat(config.app().authors()).isEmpty();
        assertThat(config.input().files()).isEmpty();
        assertThat(config.output().file()).isNull();
        assertThat(config.assemble().hierarchicalMerge()).isTrue();
    }

    @Test
    void load_fileDoesNotExist_returnsDefaults() {
        AssemblyConfig config = ConfigLoader.load(tempDir.resolve("nonexistent.yaml"));

        assertThat(config).isEqualTo(AssemblyConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("bomassembler.yaml");
        Files.writeString(configFile, "invalid: yaml: syntax: [[[");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(AssemblyConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("bomassembler.yaml");
        Files.writeString(configFile, "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(AssemblyConfig.defaults());
    }

    @Test
    void load_directoryInsteadOfFile_returnsDefaults() throws IOException {
        Path directory = Files.createDirectory(tempDir.resolve("directory"));

        assertThat(ConfigLoader.load(directory)).isEqualTo(AssemblyConfig.defaults());
    }
}
