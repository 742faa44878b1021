package com.lbg.markets.surveillance.pipeline.orchestration;

import com.lbg.markets.surveillance.pipeline.domain.FileTask;
import com.lbg.markets.surveillance.pipeline.domain.PipelineStage;

/**
 * Per-task work of one worker stage.
 */
public interface StageHandler {

    PipelineStage stage();

    /**
     * Process one task and return the instance to hand downstream.
     * Any exception marks the task as failed at this stage.
     */
    FileTask process(FileTask task) throws Exception;
}
