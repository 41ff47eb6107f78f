package com.bomassembler.core.merge;

/**
 * Stages of an assembly run. {@link #DONE} and {@link #ABORTED} are terminal.
 */
public enum MergeStage {
    INIT,
    SYNTHESIZE_ROOT,
    INGEST,
    FINALIZE,
    SERIALIZE,
    DONE,
    ABORTED;

    public boolean isTerminal() {
        return this == DONE || this == ABORTED;
    }
}
