package com.bomassembler.core.merge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stage of one assembly run, shared by the merger and the code that serializes its result.
 *
 * <p>Once a terminal stage is reached the run is over: further transitions are rejected until
 * {@link #begin()} starts a new run.
 */
public class MergeProgress {

    private static final Logger log = LoggerFactory.getLogger(MergeProgress.class);

    private MergeStage stage;

    /**
     * Returns the current stage, null before the first run.
     *
     * @return current stage
     */
    public MergeStage stage() {
        return stage;
    }

    /**
     * Starts a run at {@link MergeStage#INIT}, whatever the previous run ended with.
     */
    public void begin() {
        log.debug("Merge stage: {} -> {}", stage, MergeStage.INIT);
        stage = MergeStage.INIT;
    }

    /**
     * Moves to the next stage.
     *
     * @param next stage to enter
     * @throws IllegalStateException if no run was started or the run already ended
     */
    public void advance(MergeStage next) {
        if (stage == null || stage.isTerminal()) {
            throw new IllegalStateException("Cannot enter " + next + " from " + stage);
        }
        log.debug("Merge stage: {} -> {}", stage, next);
        stage = next;
    }

    /**
     * Ends the run as {@link MergeStage#ABORTED}. A run that already ended keeps its stage.
     *
     * @param cause failure that ended the run
     */
    public void abort(Exception cause) {
        if (stage != null && stage.isTerminal()) {
            return;
        }
        log.error("Merge aborted during {}: {}", stage, cause.getMessage());
        stage = MergeStage.ABORTED;
    }
}
