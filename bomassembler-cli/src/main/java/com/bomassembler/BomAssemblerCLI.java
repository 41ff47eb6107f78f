package com.bomassembler;

import ch.qos.logback.classic.Level;
import com.bomassembler.cli.AssembleCommand;
import com.bomassembler.cli.EditCommand;
import com.bomassembler.cli.InitCommand;
import com.bomassembler.cli.ListCommand;
import com.bomassembler.core.config.ToolIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for BomAssembler.
 *
 * <p>BomAssembler edits fields of SPDX documents and assembles several documents into one under a
 * synthesized root component.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code edit} - Edit fields of a document or one of its components</li>
 *   <li>{@code assemble} - Merge documents under a new root component</li>
 *   <li>{@code init} - Write a starter assembly configuration</li>
 *   <li>{@code list} - List editable fields, primary purposes or edit subjects</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Fill in a missing purl on the primary component
 * bomassembler edit app.spdx.json --subject primary-component --missing \
 *     --purl pkg:maven/acme/app@1.0 -o app.spdx.json
 *
 * # Assemble two documents
 * bomassembler assemble -n platform -v 2.0 -o platform.spdx.json api.spdx.json worker.spdx.json
 *
 * # Verbose assembly from a config file
 * bomassembler -v assemble -c bomassembler.yaml
 * }</pre>
 */
@Command(
    name = "bomassembler",
    mixinStandardHelpOptions = true,
    version = "BomAssembler 1.0.0-SNAPSHOT",
    description = "Edit and assemble SPDX bill-of-materials documents",
    subcommands = {
        EditCommand.class,
        AssembleCommand.class,
        InitCommand.class,
        ListCommand.class
    }
)
public class BomAssemblerCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(BomAssemblerCLI.class);

    /** Identity stamped into every document this tool writes. */
    public static final ToolIdentity TOOL = new ToolIdentity("bomassembler", "1.0.0-SNAPSHOT");

    private boolean verbose;
    private boolean quiet;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    void setVerbose(boolean verbose) {
        this.verbose = verbose;
        configureLogging();
    }

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    void setQuiet(boolean quiet) {
        this.quiet = quiet;
        configureLogging();
    }

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("BomAssembler - SPDX document editor and assembler");
        System.out.println("Version: " + TOOL.version());
        System.out.println();
        System.out.println("Use 'bomassembler --help' to see available commands");
        System.out.println("Use 'bomassembler <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options. Runs while options are parsed, so the
     * level is in place before a subcommand executes.
     */
    private void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Log level set to {}", root.getLevel());
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = new CommandLine(new BomAssemblerCLI()).execute(args);
        System.exit(exitCode);
    }
}
