package com.purchasingpower.specflow.exception;

/**
 * No resolution strategy matched the given task id.
 */
public class TaskNotFoundException extends TaskStatusException {

    public TaskNotFoundException(String taskId) {
        super("Task not found: " + taskId, taskId);
    }

}
