package com.lbg.markets.surveillance.pipeline.orchestration;

import com.lbg.markets.surveillance.pipeline.domain.FileTask;
import com.lbg.markets.surveillance.pipeline.domain.PipelineStage;
import com.lbg.markets.surveillance.pipeline.domain.TaskFailure;
import com.lbg.markets.surveillance.pipeline.queue.StageQueue;
import com.lbg.markets.surveillance.pipeline.util.NamedThreadFactory;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

/**
 * Fixed-size set of workers consuming one queue.
 * <p>
 * Successful results go to {@code output}; failed tasks skip the remaining stages and go
 * straight to {@code failures}. Each worker exits after taking exactly one end-of-stream
 * marker from its input.
 */
public class StageWorkerPool {

    private static final Logger LOG = Logger.getLogger(StageWorkerPool.class);

    private final String name;
    private final int size;
    private final StageQueue input;
    private final StageQueue output;
    private final StageQueue failures;
    private final StageHandler handler;
    private final BooleanSupplier cancelled;

    private final AtomicInteger processed = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private final AtomicInteger exited = new AtomicInteger();
    private final AtomicReference<RuntimeException> fatal = new AtomicReference<>();

    private ExecutorService executor;

    public StageWorkerPool(String name, int size, StageQueue input, StageQueue output, StageQueue failures,
                           StageHandler handler, BooleanSupplier cancelled) {
        if (size < 1) {
            throw new IllegalArgumentException("Pool " + name + " needs at least one worker");
        }
        this.name = name;
        this.size = size;
        this.input = input;
        this.output = output;
        this.failures = failures;
        this.handler = handler;
        this.cancelled = cancelled;
    }

    public synchronized void start() {
        if (executor != null) {
            throw new IllegalStateException("Pool " + name + " already started");
        }
        executor = Executors.newFixedThreadPool(size, new NamedThreadFactory(name + "-"));
        for (int i = 0; i < size; i++) {
            executor.execute(this::runWorker);
        }
        executor.shutdown();
        LOG.debugf("Started %d %s workers", size, name);
    }

    /**
     * Wait until every worker has exited.
     *
     * @return {@code false} if the timeout elapsed first
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        if (executor == null) {
            throw new IllegalStateException("Pool " + name + " was never started");
        }
        return executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Interrupt workers that are still running. Only used when a run is abandoned.
     */
    public void abort() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    private void runWorker() {
        String worker = Thread.currentThread().getName();
        try {
            while (true) {
                Optional<FileTask> next = input.take();
                if (next.isEmpty()) {
                    LOG.debugf("Worker %s received end-of-stream, finishing", worker);
                    break;
                }
                handle(next.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warnf("Worker %s interrupted", worker);
        } catch (RuntimeException e) {
            // protocol violations and broken invariants end the run, not just this worker
            LOG.errorf(e, "Worker %s stopped unexpectedly", worker);
            fatal.compareAndSet(null, e);
        } finally {
            exited.incrementAndGet();
        }
    }

    private void handle(FileTask task) throws InterruptedException {
        PipelineStage stage = handler.stage();
        FileTask result;

        if (cancelled.getAsBoolean()) {
            result = task.failed(stage, "cancelled");
        } else {
            try {
                result = handler.process(task);
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                LOG.errorf(e, "%s failed for %s", stage, task.name());
                result = task.failed(TaskFailure.of(stage, e));
            }
        }

        processed.incrementAndGet();
        if (result.status() == FileTask.TaskStatus.FAILED) {
            failed.incrementAndGet();
            failures.put(result);
        } else {
            output.put(result);
        }
    }

    public String name() {
        return name;
    }

    public int size() {
        return size;
    }

    public StageQueue input() {
        return input;
    }

    public int processedCount() {
        return processed.get();
    }

    public int failedCount() {
        return failed.get();
    }

    public int exitedCount() {
        return exited.get();
    }

    /**
     * First error that stopped a worker, if any.
     */
    public Optional<RuntimeException> fatalError() {
        return Optional.ofNullable(fatal.get());
    }
}
