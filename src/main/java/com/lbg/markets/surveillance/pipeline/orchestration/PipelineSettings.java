package com.lbg.markets.surveillance.pipeline.orchestration;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Sizing and timing of a pipeline.
 *
 * @param transferWorkers size of the replication pool
 * @param metadataWorkers size of the registration pool
 * @param queueCapacity   bound of each stage queue; zero or less means unbounded
 * @param awaitTimeout    longest wait for any single stage to finish
 * @param dispatchDelay   pause before each task is dispatched
 * @param clock           source of destination key timestamps
 */
public record PipelineSettings(
        int transferWorkers,
        int metadataWorkers,
        int queueCapacity,
        Duration awaitTimeout,
        Duration dispatchDelay,
        Clock clock
) {
    public static final Duration DEFAULT_AWAIT_TIMEOUT = Duration.ofMinutes(30);

    public PipelineSettings {
        if (transferWorkers < 1) {
            throw new IllegalArgumentException("transferWorkers must be at least 1");
        }
        if (metadataWorkers < 1) {
            throw new IllegalArgumentException("metadataWorkers must be at least 1");
        }
        awaitTimeout = awaitTimeout != null ? awaitTimeout : DEFAULT_AWAIT_TIMEOUT;
        if (awaitTimeout.isNegative() || awaitTimeout.isZero()) {
            throw new IllegalArgumentException("awaitTimeout must be positive");
        }
        dispatchDelay = dispatchDelay != null ? dispatchDelay : Duration.ZERO;
        if (dispatchDelay.isNegative()) {
            throw new IllegalArgumentException("dispatchDelay cannot be negative");
        }
        clock = Objects.requireNonNullElseGet(clock, Clock::systemDefaultZone);
    }

    /**
     * Unbounded queues, no dispatch delay, system clock.
     */
    public static PipelineSettings of(int transferWorkers, int metadataWorkers) {
        return new PipelineSettings(transferWorkers, metadataWorkers, 0, DEFAULT_AWAIT_TIMEOUT, Duration.ZERO, null);
    }

    public PipelineSettings withQueueCapacity(int capacity) {
        return new PipelineSettings(transferWorkers, metadataWorkers, capacity, awaitTimeout, dispatchDelay, clock);
    }

    public PipelineSettings withAwaitTimeout(Duration timeout) {
        return new PipelineSettings(transferWorkers, metadataWorkers, queueCapacity, timeout, dispatchDelay, clock);
    }

    public PipelineSettings withClock(Clock newClock) {
        return new PipelineSettings(transferWorkers, metadataWorkers, queueCapacity, awaitTimeout, dispatchDelay, newClock);
    }
}
