package com.lbg.markets.surveillance.pipeline.orchestration;

/**
 * Shutdown progress of one stage.
 */
public enum StageState {
    /** Accepting and processing tasks. */
    RUNNING,
    /** Upstream has finished; waiting for this stage's workers to drain and exit. */
    DRAINING,
    /** Every worker of the stage has terminated. */
    CLOSED;

    public boolean canTransitionTo(StageState next) {
        return next.ordinal() == ordinal() + 1;
    }
}
