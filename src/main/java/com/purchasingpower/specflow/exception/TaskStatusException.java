package com.purchasingpower.specflow.exception;

import lombok.Getter;

/**
 * Base type for failures while rewriting a checkbox in tasks.md or plan.md text.
 */
@Getter
public class TaskStatusException extends RuntimeException {

    private final String taskId;

    public TaskStatusException(String message, String taskId) {
        super(message);
        this.taskId = taskId;
    }

}
