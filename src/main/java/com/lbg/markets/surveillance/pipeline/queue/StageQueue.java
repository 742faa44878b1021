package com.lbg.markets.surveillance.pipeline.queue;

import com.lbg.markets.surveillance.pipeline.domain.FileTask;
import com.lbg.markets.surveillance.pipeline.orchestration.ShutdownProtocolViolationException;
import org.jboss.logging.Logger;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * FIFO handoff between two adjacent stages.
 * <p>
 * Carries tasks and end-of-stream markers in one queue. Consumers never see a marker as data:
 * {@link #take()} returns an empty {@code Optional} for it. Once {@link #signalEnd(int)} has
 * been called the queue is closed to producers.
 * <p>
 * Capacity bounds tasks only. End-of-stream markers never wait for space, and the closed check
 * and the enqueue of a task happen under the same lock as {@link #signalEnd(int)}, so no task
 * can land behind the markers.
 */
public class StageQueue {

    private static final Logger LOG = Logger.getLogger(StageQueue.class);

    private static final Slot END_OF_STREAM = new Slot(null);

    private final String name;
    private final BlockingQueue<Slot> slots = new LinkedBlockingQueue<>();
    private final Semaphore space;
    private final AtomicInteger endSignalsSent = new AtomicInteger();
    private final AtomicInteger endSignalsTaken = new AtomicInteger();
    private volatile boolean closed;

    /**
     * Unbounded queue; producers never block.
     */
    public StageQueue(String name) {
        this(name, 0);
    }

    /**
     * Queue holding at most {@code capacity} tasks; zero or less means unbounded.
     */
    public StageQueue(String name, int capacity) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.space = capacity > 0 ? new Semaphore(capacity) : null;
    }

    /**
     * Hand a task to the next stage. Blocks while a bounded queue is full.
     *
     * @throws ShutdownProtocolViolationException if end-of-stream was already signalled
     */
    public void put(FileTask task) throws InterruptedException {
        Objects.requireNonNull(task, "task cannot be null");
        if (space != null) {
            space.acquire();
        }
        synchronized (this) {
            if (closed) {
                if (space != null) {
                    space.release();
                }
                throw new ShutdownProtocolViolationException(String.format(
                        "Task %s offered to queue %s after end-of-stream was signalled", task.id(), name));
            }
            slots.add(new Slot(task));
        }
    }

    /**
     * Take the next task, blocking while the queue is empty.
     *
     * @return the task, or empty once this consumer has reached end-of-stream
     */
    public Optional<FileTask> take() throws InterruptedException {
        Slot slot = slots.take();
        if (slot.isEndOfStream()) {
            endSignalsTaken.incrementAndGet();
            return Optional.empty();
        }
        if (space != null) {
            space.release();
        }
        return Optional.of(slot.task());
    }

    /**
     * Close the queue and enqueue one end-of-stream marker per consumer.
     * Must only be called once every producer of this queue has terminated.
     */
    public void signalEnd(int consumers) {
        if (consumers < 1) {
            throw new IllegalArgumentException("consumers must be at least 1");
        }
        synchronized (this) {
            if (closed) {
                throw new ShutdownProtocolViolationException("End-of-stream signalled twice on queue " + name);
            }
            closed = true;
            for (int i = 0; i < consumers; i++) {
                slots.add(END_OF_STREAM);
                endSignalsSent.incrementAndGet();
            }
        }
        LOG.debugf("Queue %s closed with %d end-of-stream signals", name, consumers);
    }

    public String name() {
        return name;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Items currently waiting, end-of-stream markers included.
     */
    public int size() {
        return slots.size();
    }

    /**
     * End-of-stream markers sent but not yet taken by a consumer.
     */
    public int pendingEndSignals() {
        return endSignalsSent.get() - endSignalsTaken.get();
    }

    private record Slot(FileTask task) {
        boolean isEndOfStream() {
            return task == null;
        }
    }
}
