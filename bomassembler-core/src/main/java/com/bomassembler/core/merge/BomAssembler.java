package com.bomassembler.core.merge;

import com.bomassembler.core.config.AssemblyConfig;
import com.bomassembler.core.config.ToolIdentity;
import com.bomassembler.core.loader.DocumentLoader;
import com.bomassembler.core.model.Document;
import com.bomassembler.core.writer.Destination;
import com.bomassembler.core.writer.DocumentWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Runs a complete assembly: load every input, merge, write the result once.
 *
 * <p>Load failures, license-list version conflicts and the unimplemented flat merge all abort
 * before anything is written. The write is the only externally visible effect.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * AssemblyConfig config = ConfigLoader.load(Paths.get("bomassembler.yaml"));
 * BomAssembler assembler = new BomAssembler(new ToolIdentity("bomassembler", "1.0.0"),
 *     Clock.systemUTC(), new SpdxJsonLoader());
 * MergeResult result = assembler.assemble(config);
 * }</pre>
 */
public class BomAssembler {

    private static final Logger log = LoggerFactory.getLogger(BomAssembler.class);

    private final ToolIdentity tool;
    private final Clock clock;
    private final DocumentLoader loader;
    private final Function<Destination, DocumentWriter> writers;

    private MergeProgress progress = new MergeProgress();

    public BomAssembler(ToolIdentity tool, Clock clock, DocumentLoader loader) {
        this(tool, clock, loader, DocumentWriter::forDestination);
    }

    public BomAssembler(ToolIdentity tool, Clock clock, DocumentLoader loader,
                        Function<Destination, DocumentWriter> writers) {
        this.tool = Objects.requireNonNull(tool, "tool must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.loader = Objects.requireNonNull(loader, "loader must not be null");
        this.writers = Objects.requireNonNull(writers, "writers must not be null");
    }

    /**
     * Assembles the configured inputs into one document and writes it.
     *
     * @param config assembly configuration
     * @return merge result of the written document
     * @throws com.bomassembler.core.loader.BomLoadException if an input cannot be loaded
     * @throws LicenseListVersionException if license-list versions cannot be reconciled
     * @throws UnsupportedOperationException if a flat merge was requested
     * @throws com.bomassembler.core.writer.BomWriteException if the output cannot be written
     */
    public MergeResult assemble(AssemblyConfig config) {
        List<Document> inputs = loadInputs(config.input().files());
        MergeProgress run = new MergeProgress();
        progress = run;
        DocumentMerger merger = mergerFor(config, run);

        MergeResult result;
        try {
            result = merger.merge(inputs);
        } catch (RuntimeException e) {
            run.abort(e);
            throw e;
        }

        Destination destination = Destination.fromFileName(config.output().file());
        run.advance(MergeStage.SERIALIZE);
        try {
            long bytes = writers.apply(destination).write(result.document(), destination);
            log.info("Wrote assembled document to {} ({} bytes)", destination, bytes);
        } catch (RuntimeException e) {
            run.abort(e);
            throw e;
        }
        run.advance(MergeStage.DONE);
        return result;
    }

    /**
     * Returns the stage the last {@link #assemble(AssemblyConfig)} call reached, null before the
     * first call. A load failure ends before any stage is entered.
     *
     * @return stage of the last run
     */
    public MergeStage stage() {
        return progress.stage();
    }

    /**
     * Picks the merger for the configured mode. A flat merge request wins over hierarchical.
     *
     * @param config assembly configuration
     * @param run progress of the current run
     * @return merger
     */
    DocumentMerger mergerFor(AssemblyConfig config, MergeProgress run) {
        if (config.assemble().flatMerge()) {
            return new FlatMerger();
        }
        return new HierarchicalMerger(config.app(), tool, clock, run);
    }

    private List<Document> loadInputs(List<String> files) {
        if (files.isEmpty()) {
            log.warn("No input documents configured; the output will only contain the root component");
        }
        List<Document> inputs = new ArrayList<>();
        for (String file : files) {
            Path path = Paths.get(file);
            log.debug("Loading input document: {}", path);
            inputs.add(loader.load(path));
        }
        log.info("Loaded {} input documents", inputs.size());
        return inputs;
    }
}
