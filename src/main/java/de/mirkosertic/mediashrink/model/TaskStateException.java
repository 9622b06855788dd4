package de.mirkosertic.mediashrink.model;

import java.util.Set;

/**
 * A requested operation does not fit the task's current status.
 */
public class TaskStateException extends Exception {

    private final long taskId;
    private final TaskStatus actual;

    public TaskStateException(final long taskId, final TaskStatus actual, final String message) {
        super(message);
        this.taskId = taskId;
        this.actual = actual;
    }

    public static TaskStateException unexpected(final long taskId, final TaskStatus actual,
                                                final Set<TaskStatus> expected) {
        return new TaskStateException(taskId, actual,
                "Task " + taskId + " is " + actual + ", expected one of " + expected);
    }

    public long getTaskId() {
        return taskId;
    }

    public TaskStatus getActual() {
        return actual;
    }
}
