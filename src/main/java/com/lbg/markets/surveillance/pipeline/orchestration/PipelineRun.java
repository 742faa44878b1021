package com.lbg.markets.surveillance.pipeline.orchestration;

import com.lbg.markets.surveillance.pipeline.domain.FileTask;
import com.lbg.markets.surveillance.pipeline.domain.PipelineStage;
import com.lbg.markets.surveillance.pipeline.domain.VerificationReport;
import com.lbg.markets.surveillance.pipeline.queue.StageQueue;
import com.lbg.markets.surveillance.pipeline.util.NamedThreadFactory;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One pass of a batch through dispatch, transfer, metadata and verify.
 * <p>
 * Owns its queues and threads; nothing is shared with other runs. A run can be executed once.
 */
public class PipelineRun {

    private static final Logger LOG = Logger.getLogger(PipelineRun.class);

    private final List<FileTask> tasks;
    private final PipelineSettings settings;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final AtomicBoolean started = new AtomicBoolean();

    private final StageQueue transferQueue;
    private final StageQueue metadataQueue;
    private final StageQueue verifyQueue;
    private final StageWorkerPool transferPool;
    private final StageWorkerPool metadataPool;
    private final ShutdownCoordinator coordinator;

    PipelineRun(List<FileTask> tasks, PipelineSettings settings, StageHandler transfer, StageHandler metadata) {
        this.tasks = List.copyOf(tasks);
        this.settings = settings;

        this.transferQueue = new StageQueue("transfer", settings.queueCapacity());
        this.metadataQueue = new StageQueue("metadata", settings.queueCapacity());
        this.verifyQueue = new StageQueue("verify", settings.queueCapacity());

        this.transferPool = new StageWorkerPool("transfer-worker", settings.transferWorkers(),
                transferQueue, metadataQueue, verifyQueue, transfer, cancelled::get);
        this.metadataPool = new StageWorkerPool("metadata-worker", settings.metadataWorkers(),
                metadataQueue, verifyQueue, verifyQueue, metadata, cancelled::get);
        this.coordinator = new ShutdownCoordinator(settings.awaitTimeout());
    }

    /**
     * Run the batch to completion and return the verifier's report.
     *
     * @throws PipelineException if a stage times out, the caller is interrupted, or the
     *                           shutdown protocol is violated
     */
    public VerificationReport execute() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("A pipeline run can only be executed once");
        }
        LOG.infof("Starting pipeline run: %d tasks, %d transfer workers, %d metadata workers",
                tasks.size(), transferPool.size(), metadataPool.size());

        ExecutorService verifierExecutor = Executors.newSingleThreadExecutor(new NamedThreadFactory("verifier-"));
        ExecutorService dispatcherExecutor = Executors.newSingleThreadExecutor(new NamedThreadFactory("dispatcher-"));
        try {
            Future<VerificationReport> verification = verifierExecutor.submit(new Verifier(tasks.size(), verifyQueue));
            transferPool.start();
            metadataPool.start();
            Future<Integer> dispatch = dispatcherExecutor.submit(new Dispatcher(
                    tasks, transferQueue, verifyQueue, settings.dispatchDelay(), cancelled::get));

            coordinator.closeStage(PipelineStage.DISPATCH, timeout -> awaitFuture(dispatch, timeout),
                    transferQueue, transferPool.size());
            coordinator.closeStage(PipelineStage.TRANSFER, timeout -> awaitPool(transferPool, timeout),
                    metadataQueue, metadataPool.size());
            coordinator.closeStage(PipelineStage.METADATA, timeout -> awaitPool(metadataPool, timeout),
                    verifyQueue, 1);
            coordinator.awaitStage(PipelineStage.VERIFY, timeout -> awaitFuture(verification, timeout));

            VerificationReport report = verification.get();
            LOG.infof("Pipeline run complete");
            return report;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abandon();
            throw new PipelineException("Interrupted while waiting for pipeline stages", e);
        } catch (ExecutionException e) {
            abandon();
            throw new PipelineException("Verifier failed", e.getCause());
        } catch (PipelineException e) {
            abandon();
            throw e;
        } finally {
            dispatcherExecutor.shutdownNow();
            verifierExecutor.shutdownNow();
        }
    }

    /**
     * Ask the run to stop early. Tasks not yet processed are routed to the verifier as
     * cancelled failures; the run still ends through the normal shutdown sequence.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            LOG.warn("Pipeline run cancelled");
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public StageState stageState(PipelineStage stage) {
        return coordinator.state(stage);
    }

    /**
     * Queue feeding {@code stage}; dispatch has none.
     */
    StageQueue inputQueue(PipelineStage stage) {
        return switch (stage) {
            case DISPATCH -> throw new IllegalArgumentException("Dispatch stage has no input queue");
            case TRANSFER -> transferQueue;
            case METADATA -> metadataQueue;
            case VERIFY -> verifyQueue;
        };
    }

    private void abandon() {
        cancel();
        transferPool.abort();
        metadataPool.abort();
    }

    private boolean awaitFuture(Future<?> future, Duration timeout) throws InterruptedException {
        try {
            future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            if (e.getCause() instanceof PipelineException pipelineException) {
                throw pipelineException;
            }
            throw new PipelineException("Pipeline stage failed", e.getCause());
        }
    }

    private boolean awaitPool(StageWorkerPool pool, Duration timeout) throws InterruptedException {
        if (!pool.awaitTermination(timeout)) {
            return false;
        }
        if (pool.fatalError().isPresent()) {
            RuntimeException fatal = pool.fatalError().get();
            if (fatal instanceof ShutdownProtocolViolationException violation) {
                throw violation;
            }
            throw new PipelineException("Worker pool " + pool.name() + " stopped abnormally", fatal);
        }
        if (pool.input().size() > 0) {
            throw new ShutdownProtocolViolationException(String.format(
                    "Worker pool %s terminated with %d items left in queue %s",
                    pool.name(), pool.input().size(), pool.input().name()));
        }
        LOG.debugf("Worker pool %s finished: %d processed, %d failed",
                pool.name(), pool.processedCount(), pool.failedCount());
        return true;
    }
}
