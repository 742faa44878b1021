package com.lbg.markets.surveillance.pipeline.domain;

import com.lbg.markets.surveillance.pipeline.domain.FileTask.TaskStatus;

import java.io.Serial;

/**
 * Exception thrown when an invalid status transition is attempted.
 */
public class IllegalStateTransitionException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = -2817462055190127781L;

    private final String taskId;
    private final TaskStatus fromStatus;
    private final TaskStatus toStatus;

    public IllegalStateTransitionException(String taskId, TaskStatus from, TaskStatus to) {
        super(String.format("Invalid status transition for task %s from %s to %s", taskId, from, to));
        this.taskId = taskId;
        this.fromStatus = from;
        this.toStatus = to;
    }

    public String getTaskId() {
        return taskId;
    }

    public TaskStatus getFromStatus() {
        return fromStatus;
    }

    public TaskStatus getToStatus() {
        return toStatus;
    }
}
