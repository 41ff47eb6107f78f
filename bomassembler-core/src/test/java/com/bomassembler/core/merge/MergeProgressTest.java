package com.bomassembler.core.merge;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link MergeProgress}.
 */
class MergeProgressTest {

    private final MergeProgress progress = new MergeProgress();

    @Test
    void advance_beforeBegin_throws() {
        assertThatThrownBy(() -> progress.advance(MergeStage.SYNTHESIZE_ROOT))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void advance_fullRun_endsDone() {
        progress.begin();
        progress.advance(MergeStage.SYNTHESIZE_ROOT);
        progress.advance(MergeStage.INGEST);
        progress.advance(MergeStage.FINALIZE);
        progress.advance(MergeStage.SERIALIZE);
        progress.advance(MergeStage.DONE);

        assertThat(progress.stage()).isEqualTo(MergeStage.DONE);
        assertThat(progress.stage().isTerminal()).isTrue();
    }

    @Test
    void advance_afterTerminalStage_throws() {
        progress.begin();
        progress.abort(new IllegalStateException("boom"));

        assertThatThrownBy(() -> progress.advance(MergeStage.SERIALIZE))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("ABORTED");
    }

    @Test
    void abort_afterDone_keepsDone() {
        progress.begin();
        progress.advance(MergeStage.DONE);

        progress.abort(new IllegalStateException("late"));

        assertThat(progress.stage()).isEqualTo(MergeStage.DONE);
    }

    @Test
    void begin_afterAbortedRun_startsOver() {
        progress.begin();
        progress.abort(new IllegalStateException("boom"));

        progress.begin();

        assertThat(progress.stage()).isEqualTo(MergeStage.INIT);
    }
}
