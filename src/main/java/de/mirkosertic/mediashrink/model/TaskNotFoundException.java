package de.mirkosertic.mediashrink.model;

public class TaskNotFoundException extends Exception {

    private final long taskId;

    public TaskNotFoundException(final long taskId) {
        super("Task not found: " + taskId);
        this.taskId = taskId;
    }

    public long getTaskId() {
        return taskId;
    }
}
