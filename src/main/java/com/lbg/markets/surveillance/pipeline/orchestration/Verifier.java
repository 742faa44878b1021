package com.lbg.markets.surveillance.pipeline.orchestration;

import com.lbg.markets.surveillance.pipeline.domain.FileTask;
import com.lbg.markets.surveillance.pipeline.domain.VerificationReport;
import com.lbg.markets.surveillance.pipeline.queue.StageQueue;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Single consumer of the verify queue. Collects every task until end-of-stream,
 * then checks the batch as a whole.
 */
public class Verifier implements Callable<VerificationReport> {

    private static final Logger LOG = Logger.getLogger(Verifier.class);

    private final int expected;
    private final StageQueue verifyQueue;

    public Verifier(int expected, StageQueue verifyQueue) {
        this.expected = expected;
        this.verifyQueue = verifyQueue;
    }

    @Override
    public VerificationReport call() throws InterruptedException {
        List<FileTask> received = new ArrayList<>();

        while (true) {
            Optional<FileTask> next = verifyQueue.take();
            if (next.isEmpty()) {
                break;
            }
            FileTask task = next.get();
            received.add(task);
            LOG.debugf("Verified %s - %s", task.name(), task.status());
        }

        VerificationReport report = VerificationReport.of(expected, received);
        logReport(report);
        return report;
    }

    private void logReport(VerificationReport report) {
        LOG.infof("Verification report - Expected: %d, Processed: %d, Success: %d, Failed: %d",
                report.expected(), report.processed(), report.succeeded(), report.failed());

        for (FileTask failure : report.failures()) {
            LOG.warnf("Failed: %s at %s - %s",
                    failure.name(), failure.failure().stage(), failure.failure().cause());
        }
        if (!report.isComplete()) {
            LOG.warnf("Missing files: %d", report.missing());
        }
    }
}
