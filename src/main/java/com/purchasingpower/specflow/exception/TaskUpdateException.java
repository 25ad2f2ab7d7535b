package com.purchasingpower.specflow.exception;

import lombok.Getter;

/**
 * The task was resolved but its source line could not be rewritten.
 */
@Getter
public class TaskUpdateException extends TaskStatusException {

    private final int lineNumber;

    public TaskUpdateException(String message, String taskId, int lineNumber) {
        super(message, taskId);
        this.lineNumber = lineNumber;
    }

}
