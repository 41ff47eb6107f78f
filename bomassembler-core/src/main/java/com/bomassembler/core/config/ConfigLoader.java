package com.bomassembler.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads the assembly configuration ({@code bomassembler.yaml}) with Jackson YAML.
 *
 * <p>Sections left out of the file take their defaults: an unnamed product, no input documents,
 * output to standard output and a hierarchical merge. A file that is missing, unreadable, empty
 * or not valid YAML yields {@link AssemblyConfig#defaults()} with a logged warning or error, so the
 * CLI flags alone can still drive a run. Command-line overrides are applied by the caller.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * AssemblyConfig config = ConfigLoader.load(Paths.get("bomassembler.yaml"))
 *     .withOutput(new OutputConfig("platform.spdx.json"));
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /**
     * Loads the assembly configuration.
     *
     * @param configPath path to the YAML file
     * @return the configuration, with defaults for omitted sections, or
     *         {@link AssemblyConfig#defaults()} if the file cannot be used
     */
    public static AssemblyConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Assembly configuration not found: {}; using defaults", configPath);
            return AssemblyConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Assembly configuration is not readable: {}; using defaults", configPath);
            return AssemblyConfig.defaults();
        }

        try {
            log.debug("Reading assembly configuration {}", configPath);
            AssemblyConfig config = YAML_MAPPER.readValue(configPath.toFile(), AssemblyConfig.class);
            if (config == null) {
                log.warn("Assembly configuration is empty: {}; using defaults", configPath);
                return AssemblyConfig.defaults();
            }
            log.info("Loaded assembly configuration {}: product={}, inputs={}", configPath,
                config.app().name(), config.input().files().size());
            return config;
        } catch (IOException e) {
            log.error("Invalid assembly configuration {}; using defaults: {}", configPath, e.getMessage());
            return AssemblyConfig.defaults();
        }
    }
}
