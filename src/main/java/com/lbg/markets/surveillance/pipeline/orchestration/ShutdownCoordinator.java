package com.lbg.markets.surveillance.pipeline.orchestration;

import com.lbg.markets.surveillance.pipeline.domain.PipelineStage;
import com.lbg.markets.surveillance.pipeline.queue.StageQueue;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Sequences end-of-stream signals between stages.
 * <p>
 * A stage's downstream queue is signalled only once every worker of the stage has
 * terminated, and stages close strictly in pipeline order.
 */
public class ShutdownCoordinator {

    private static final Logger LOG = Logger.getLogger(ShutdownCoordinator.class);

    private final Map<PipelineStage, StageState> states = new EnumMap<>(PipelineStage.class);
    private final Duration awaitTimeout;

    public ShutdownCoordinator(Duration awaitTimeout) {
        this.awaitTimeout = awaitTimeout;
        for (PipelineStage stage : PipelineStage.values()) {
            states.put(stage, StageState.RUNNING);
        }
    }

    /**
     * Completion of every thread of one stage.
     */
    @FunctionalInterface
    public interface StageCompletion {

        /**
         * @return {@code false} if the timeout elapsed before the stage finished
         */
        boolean await(Duration timeout) throws InterruptedException;
    }

    /**
     * Wait for {@code stage} to finish, then send {@code consumers} end-of-stream signals to
     * the queue feeding the next stage.
     */
    public void closeStage(PipelineStage stage, StageCompletion completion,
                           StageQueue downstream, int consumers) throws InterruptedException {
        awaitStage(stage, completion);
        downstream.signalEnd(consumers);
        LOG.debugf("Stage %s closed; sent %d end-of-stream signals to %s", stage, consumers, downstream.name());
    }

    /**
     * Wait for {@code stage} to finish without signalling anyone. Used for the last stage.
     */
    public void awaitStage(PipelineStage stage, StageCompletion completion) throws InterruptedException {
        requireUpstreamClosed(stage);
        transition(stage, StageState.DRAINING);

        if (!completion.await(awaitTimeout)) {
            throw new PipelineException(String.format("Stage %s did not finish within %s", stage, awaitTimeout));
        }

        transition(stage, StageState.CLOSED);
    }

    public synchronized StageState state(PipelineStage stage) {
        return states.get(stage);
    }

    private synchronized void requireUpstreamClosed(PipelineStage stage) {
        if (stage.ordinal() == 0) {
            return;
        }
        PipelineStage upstream = PipelineStage.values()[stage.ordinal() - 1];
        if (states.get(upstream) != StageState.CLOSED) {
            throw new ShutdownProtocolViolationException(String.format(
                    "Stage %s cannot drain while upstream stage %s is %s", stage, upstream, states.get(upstream)));
        }
    }

    private synchronized void transition(PipelineStage stage, StageState next) {
        StageState current = states.get(stage);
        if (!current.canTransitionTo(next)) {
            throw new ShutdownProtocolViolationException(String.format(
                    "Stage %s cannot move from %s to %s", stage, current, next));
        }
        states.put(stage, next);
    }
}
