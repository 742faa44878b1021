package com.lbg.markets.surveillance.pipeline.domain;

/**
 * Processing phases a task passes through, in order.
 */
public enum PipelineStage {
    DISPATCH,
    TRANSFER,
    METADATA,
    VERIFY
}
