package com.bomassembler.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Command to write a starter assembly configuration.
 */
@Command(
    name = "init",
    description = "Write a starter bomassembler.yaml",
    mixinStandardHelpOptions = true
)
public class InitCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(InitCommand.class);

    static final String TEMPLATE = "/templates/bomassembler.yaml";

    @Spec
    private CommandSpec spec;

    @Option(names = {"-o", "--output"}, description = "Configuration file to write")
    private Path output = Paths.get("bomassembler.yaml");

    @Option(names = {"-f", "--force"}, description = "Overwrite an existing file")
    private boolean force;

    @Override
    public Integer call() {
        if (Files.exists(output) && !force) {
            log.error("Configuration file already exists: {}", output);
            System.err.println("✗ " + output + " already exists (use --force to overwrite)");
            return 1;
        }

        try (InputStream template = InitCommand.class.getResourceAsStream(TEMPLATE)) {
            if (template == null) {
                throw new IOException("Template not found on classpath: " + TEMPLATE);
            }
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(output, template.readAllBytes());
            log.info("Wrote starter configuration to {}", output);
            spec.commandLine().getOut().println("✓ Created " + output);
            return 0;
        } catch (IOException e) {
            log.error("Failed to write configuration file: {}", output, e);
            System.err.println("✗ Init failed: " + e.getMessage());
            return 1;
        }
    }
}
