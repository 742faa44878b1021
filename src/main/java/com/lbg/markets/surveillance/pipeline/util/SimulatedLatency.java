package com.lbg.markets.surveillance.pipeline.util;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * A random pause within a fixed range, used by the simulated collaborators.
 */
public record SimulatedLatency(
        Duration min,
        Duration max
) {
    public static final SimulatedLatency NONE = new SimulatedLatency(Duration.ZERO, Duration.ZERO);

    public SimulatedLatency {
        min = min != null ? min : Duration.ZERO;
        max = max != null ? max : min;
        if (min.isNegative() || max.compareTo(min) < 0) {
            throw new IllegalArgumentException("latency range must satisfy 0 <= min <= max");
        }
    }

    public void pause() throws InterruptedException {
        long minMs = min.toMillis();
        long maxMs = max.toMillis();
        long sleepMs = maxMs > minMs ? ThreadLocalRandom.current().nextLong(minMs, maxMs + 1) : minMs;
        if (sleepMs > 0) {
            Thread.sleep(sleepMs);
        }
    }
}
