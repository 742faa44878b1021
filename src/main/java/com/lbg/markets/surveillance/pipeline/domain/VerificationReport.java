package com.lbg.markets.surveillance.pipeline.domain;

import java.util.Collection;
import java.util.List;

/**
 * Outcome of a pipeline run as observed by the verifier.
 */
public record VerificationReport(
        int expected,
        int processed,
        int succeeded,
        int failed,
        List<FileTask> failures
) {
    public VerificationReport {
        if (expected < 0 || processed < 0 || succeeded < 0 || failed < 0) {
            throw new IllegalArgumentException("counts cannot be negative");
        }
        if (succeeded + failed != processed) {
            throw new IllegalArgumentException("succeeded + failed must equal processed");
        }
        failures = failures != null ? List.copyOf(failures) : List.of();
    }

    /**
     * Build a report from every task the verifier received.
     */
    public static VerificationReport of(int expected, Collection<FileTask> received) {
        List<FileTask> failedTasks = received.stream()
                .filter(task -> !task.isSuccessful())
                .toList();
        int succeeded = received.size() - failedTasks.size();
        return new VerificationReport(expected, received.size(), succeeded, failedTasks.size(), failedTasks);
    }

    /**
     * Tasks that were expected but never reached the verifier.
     */
    public int missing() {
        return expected - processed;
    }

    public boolean isComplete() {
        return missing() == 0;
    }

    public boolean isClean() {
        return isComplete() && failed == 0;
    }
}
