package com.bomassembler.cli;

import com.bomassembler.BomAssemblerCLI;
import com.bomassembler.core.config.AssemblyConfig;
import com.bomassembler.core.config.ConfigLoader;
import com.bomassembler.core.loader.SpdxJsonLoader;
import com.bomassembler.core.merge.BomAssembler;
import com.bomassembler.core.merge.MergeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to assemble several documents into one.
 *
 * <p>Settings come from the assembly configuration file; command-line flags override it.
 * Input documents given as arguments replace the configured input list.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Assemble with bomassembler.yaml from the working directory
 * bomassembler assemble
 *
 * # Assemble without a config file
 * bomassembler assemble -n platform -v 2.0 -o platform.spdx.json api.spdx.json worker.spdx.json
 * }</pre>
 */
@Command(
    name = "assemble",
    description = "Merge documents under a synthesized root component"
)
public class AssembleCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AssembleCommand.class);

    static final Path DEFAULT_CONFIG = Paths.get("bomassembler.yaml");

    @Option(names = {"-h", "--help"}, usageHelp = true, description = "Show this help message and exit")
    private boolean help;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: bomassembler.yaml when present)"
    )
    private Path configPath;

    @Option(names = {"-n", "--name"}, description = "Product name (overrides config)")
    private String name;

    @Option(names = {"-v", "--version"}, description = "Product version (overrides config)")
    private String version;

    @Option(names = {"-o", "--output"}, description = "Output file (overrides config; default: standard output)")
    private String output;

    @ArgGroup(exclusive = true, multiplicity = "0..1")
    private ModeOptions mode;

    @Parameters(arity = "0..*", paramLabel = "INPUT", description = "Input SPDX JSON documents (override config)")
    private List<Path> inputs = new ArrayList<>();

    static class ModeOptions {
        @Option(names = {"--flat"}, description = "Flat merge (not implemented)")
        boolean flat;

        @Option(names = {"--hierarchical"}, description = "Hierarchical merge under a root component (default)")
        boolean hierarchical;
    }

    @Override
    public Integer call() {
        try {
            AssemblyConfig config = effectiveConfig();

            if (config.input().files().isEmpty()) {
                log.error("No input documents given");
                System.err.println("✗ Assemble failed: no input documents given");
                return 1;
            }

            BomAssembler assembler = new BomAssembler(BomAssemblerCLI.TOOL, Clock.systemUTC(), new SpdxJsonLoader());
            MergeResult result = assembler.assemble(config);

            log.info("Assembled {} documents into {} (root {})",
                result.statistics().inputs(), config.app().name(), result.rootComponentId());
            return 0;

        } catch (Exception e) {
            log.error("Assemble failed", e);
            System.err.println("✗ Assemble failed: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Loads the configuration file, if any, and applies command-line overrides.
     *
     * @return effective configuration
     */
    AssemblyConfig effectiveConfig() {
        AssemblyConfig config;
        if (configPath != null) {
            config = ConfigLoader.load(configPath);
        } else if (Files.exists(DEFAULT_CONFIG)) {
            config = ConfigLoader.load(DEFAULT_CONFIG);
        } else {
            log.debug("No configuration file, using command-line settings only");
            config = AssemblyConfig.defaults();
        }

        AssemblyConfig.App app = config.app();
        if (name != null) {
            app = app.withName(name);
        }
        if (version != null) {
            app = app.withVersion(version);
        }
        config = config.withApp(app);

        if (!inputs.isEmpty()) {
            config = config.withInput(new AssemblyConfig.InputConfig(
                inputs.stream().map(Path::toString).toList()));
        }
        if (output != null) {
            config = config.withOutput(new AssemblyConfig.OutputConfig(output));
        }
        if (mode != null) {
            config = config.withAssemble(mode.flat
                ? AssemblyConfig.AssembleOptions.flat()
                : AssemblyConfig.AssembleOptions.hierarchical());
        }
        return config;
    }
}
