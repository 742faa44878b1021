package com.lbg.markets.surveillance.pipeline.orchestration;

import com.lbg.markets.surveillance.pipeline.domain.FileTask;
import com.lbg.markets.surveillance.pipeline.domain.PipelineStage;
import com.lbg.markets.surveillance.pipeline.queue.StageQueue;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class StageWorkerPoolTest {

    private static final String KEY = "2025/01/15/14/30/45/550e8400-e29b-41d4-a716-446655440000";

    /**
     * Transfers every task except the ones whose id is listed, which throw.
     */
    private static StageHandler transferHandler(String... failingIds) {
        List<String> failing = List.of(failingIds);
        return new StageHandler() {
            @Override
            public PipelineStage stage() {
                return PipelineStage.TRANSFER;
            }

            @Override
            public FileTask process(FileTask task) {
                if (failing.contains(task.id())) {
                    throw new IllegalStateException("cannot copy " + task.id());
                }
                return task.transferred(KEY);
            }
        };
    }

    private static List<FileTask> drain(StageQueue queue) throws InterruptedException {
        List<FileTask> drained = new ArrayList<>();
        while (queue.size() > 0) {
            Optional<FileTask> next = queue.take();
            next.ifPresent(drained::add);
        }
        return drained;
    }

    @Test
    void shouldRouteResultsByOutcome() throws InterruptedException {
        StageQueue input = new StageQueue("in");
        StageQueue output = new StageQueue("out");
        StageQueue failures = new StageQueue("failures");
        StageWorkerPool pool = new StageWorkerPool("test-worker", 3, input, output, failures,
                transferHandler("2", "4"), () -> false);

        for (FileTask task : TestCollaborators.tasks(5)) {
            input.put(task);
        }
        pool.start();
        input.signalEnd(pool.size());

        assertTrue(pool.awaitTermination(Duration.ofSeconds(10)));
        assertEquals(3, pool.exitedCount());
        assertEquals(5, pool.processedCount());
        assertEquals(2, pool.failedCount());
        assertEquals(0, input.pendingEndSignals());
        assertTrue(pool.fatalError().isEmpty());

        List<FileTask> transferred = drain(output);
        List<FileTask> failed = drain(failures);
        assertEquals(3, transferred.size());
        assertEquals(2, failed.size());
        failed.forEach(task -> {
            assertEquals(PipelineStage.TRANSFER, task.failure().stage());
            assertTrue(task.failure().cause().startsWith("cannot copy"));
        });
    }

    @Test
    void shouldFailTasksWithoutProcessingOnceCancelled() throws InterruptedException {
        StageQueue input = new StageQueue("in");
        StageQueue output = new StageQueue("out");
        StageQueue failures = new StageQueue("failures");
        StageWorkerPool pool = new StageWorkerPool("test-worker", 1, input, output, failures,
                transferHandler(), () -> true);

        input.put(TestCollaborators.tasks(1).get(0));
        input.signalEnd(1);
        pool.start();

        assertTrue(pool.awaitTermination(Duration.ofSeconds(10)));
        assertEquals(0, output.size());
        FileTask cancelled = failures.take().orElseThrow();
        assertEquals("cancelled", cancelled.failure().cause());
    }

    @Test
    void shouldRecordViolationWhenOutputClosedEarly() throws InterruptedException {
        StageQueue input = new StageQueue("in");
        StageQueue output = new StageQueue("out");
        StageQueue failures = new StageQueue("failures");
        output.signalEnd(1);
        StageWorkerPool pool = new StageWorkerPool("test-worker", 1, input, output, failures,
                transferHandler(), () -> false);

        input.put(TestCollaborators.tasks(1).get(0));
        input.signalEnd(1);
        pool.start();

        assertTrue(pool.awaitTermination(Duration.ofSeconds(10)));
        assertTrue(pool.fatalError().isPresent());
        assertInstanceOf(ShutdownProtocolViolationException.class, pool.fatalError().get());
        // the worker died before reaching its end-of-stream marker
        assertEquals(1, input.pendingEndSignals());
    }

    @Test
    void shouldRejectInvalidLifecycleUse() {
        StageQueue queue = new StageQueue("q");
        StageWorkerPool pool = new StageWorkerPool("test-worker", 1, queue, queue, queue, transferHandler(), () -> false);

        assertThrows(IllegalStateException.class, () -> pool.awaitTermination(Duration.ofMillis(10)));
        assertThrows(IllegalArgumentException.class,
                () -> new StageWorkerPool("empty", 0, queue, queue, queue, transferHandler(), () -> false));
    }
}
