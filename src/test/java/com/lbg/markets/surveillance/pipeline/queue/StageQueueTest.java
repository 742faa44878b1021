package com.lbg.markets.surveillance.pipeline.queue;

import com.lbg.markets.surveillance.pipeline.domain.FileTask;
import com.lbg.markets.surveillance.pipeline.domain.ObjectLocation;
import com.lbg.markets.surveillance.pipeline.orchestration.ShutdownProtocolViolationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class StageQueueTest {

    private FileTask task(String id) {
        return FileTask.ready(id, "file_" + id + ".pdf", new ObjectLocation("src", "k" + id), "dest", Map.of());
    }

    @Test
    void shouldDeliverTasksInInsertionOrder() throws InterruptedException {
        StageQueue queue = new StageQueue("test");

        queue.put(task("1"));
        queue.put(task("2"));
        queue.put(task("3"));

        assertEquals("1", queue.take().orElseThrow().id());
        assertEquals("2", queue.take().orElseThrow().id());
        assertEquals("3", queue.take().orElseThrow().id());
    }

    @Test
    void shouldSignalEndOfStreamAfterQueuedTasks() throws InterruptedException {
        StageQueue queue = new StageQueue("test");
        queue.put(task("1"));

        queue.signalEnd(2);

        assertTrue(queue.isClosed());
        assertEquals(2, queue.pendingEndSignals());
        assertTrue(queue.take().isPresent());
        assertEquals(Optional.empty(), queue.take());
        assertEquals(Optional.empty(), queue.take());
        assertEquals(0, queue.pendingEndSignals());
        assertEquals(0, queue.size());
    }

    @Test
    void shouldRejectTasksAfterEndOfStream() throws InterruptedException {
        StageQueue queue = new StageQueue("test");
        queue.signalEnd(1);

        ShutdownProtocolViolationException e = assertThrows(ShutdownProtocolViolationException.class,
                () -> queue.put(task("1")));
        assertTrue(e.getMessage().contains("test"));
    }

    @Test
    void shouldRejectSecondEndOfStream() throws InterruptedException {
        StageQueue queue = new StageQueue("test");
        queue.signalEnd(1);

        assertThrows(ShutdownProtocolViolationException.class, () -> queue.signalEnd(1));
        assertThrows(IllegalArgumentException.class, () -> new StageQueue("other").signalEnd(0));
    }

    @Test
    void shouldBlockProducerWhenBoundedQueueIsFull() throws InterruptedException {
        StageQueue queue = new StageQueue("bounded", 1);
        queue.put(task("1"));

        CountDownLatch secondPut = new CountDownLatch(1);
        Thread producer = new Thread(() -> {
            try {
                queue.put(task("2"));
                secondPut.countDown();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        producer.start();

        // still full, so the producer cannot have finished
        assertFalse(secondPut.await(200, TimeUnit.MILLISECONDS));

        assertEquals("1", queue.take().orElseThrow().id());
        assertTrue(secondPut.await(5, TimeUnit.SECONDS));
        assertEquals("2", queue.take().orElseThrow().id());
        producer.join(Duration.ofSeconds(5).toMillis());
    }

    @Test
    void shouldRejectBlockedProducerWhenQueueClosesWhileFull() throws InterruptedException {
        StageQueue queue = new StageQueue("bounded", 1);
        queue.put(task("1"));

        AtomicReference<Exception> outcome = new AtomicReference<>();
        Thread producer = new Thread(() -> {
            try {
                queue.put(task("2"));
            } catch (Exception e) {
                outcome.set(e);
            }
        });
        producer.start();

        queue.signalEnd(1);
        assertEquals("1", queue.take().orElseThrow().id());
        producer.join(Duration.ofSeconds(5).toMillis());

        assertInstanceOf(ShutdownProtocolViolationException.class, outcome.get());
        assertEquals(Optional.empty(), queue.take());
        assertEquals(0, queue.size());
    }

    @Test
    void shouldNotCountEndOfStreamAgainstCapacity() throws InterruptedException {
        StageQueue queue = new StageQueue("bounded", 1);
        queue.put(task("1"));

        queue.signalEnd(3);

        assertEquals(4, queue.size());
        assertEquals(3, queue.pendingEndSignals());
    }
}
