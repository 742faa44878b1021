package com.lbg.markets.surveillance.pipeline.orchestration;

import com.lbg.markets.surveillance.pipeline.domain.FileTask;
import com.lbg.markets.surveillance.pipeline.domain.PipelineStage;
import com.lbg.markets.surveillance.pipeline.queue.StageQueue;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.BooleanSupplier;

/**
 * Feeds the initial tasks into the transfer queue, each exactly once.
 * Does not signal end-of-stream; that is left to the coordinator, which knows the pool sizes.
 */
public class Dispatcher implements Callable<Integer> {

    private static final Logger LOG = Logger.getLogger(Dispatcher.class);

    private final List<FileTask> tasks;
    private final StageQueue transferQueue;
    private final StageQueue verifyQueue;
    private final Duration delay;
    private final BooleanSupplier cancelled;

    public Dispatcher(List<FileTask> tasks, StageQueue transferQueue, StageQueue verifyQueue,
                      Duration delay, BooleanSupplier cancelled) {
        this.tasks = List.copyOf(tasks);
        this.transferQueue = transferQueue;
        this.verifyQueue = verifyQueue;
        this.delay = delay;
        this.cancelled = cancelled;
    }

    /**
     * @return number of tasks handed to the transfer queue
     */
    @Override
    public Integer call() throws InterruptedException {
        int dispatched = 0;
        for (FileTask task : tasks) {
            if (cancelled.getAsBoolean()) {
                // cancelled tasks still reach the verifier so the report accounts for them
                verifyQueue.put(task.failed(PipelineStage.DISPATCH, "cancelled"));
                continue;
            }
            if (!delay.isZero()) {
                Thread.sleep(delay.toMillis());
            }
            LOG.debugf("Dispatching %s", task.name());
            transferQueue.put(task);
            dispatched++;
        }
        LOG.infof("Dispatcher finished: %d of %d tasks dispatched", dispatched, tasks.size());
        return dispatched;
    }
}
