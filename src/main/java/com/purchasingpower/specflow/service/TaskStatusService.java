package com.purchasingpower.specflow.service;

import com.purchasingpower.specflow.model.tasks.BatchUpdateResult;
import com.purchasingpower.specflow.model.tasks.UpdateResult;

import java.util.List;

/**
 * Rewrites task checkboxes in tasks.md text.
 *
 * <p>Every call re-parses the given content, resolves the id with the full
 * fallback chain and changes exactly one line; all other bytes are preserved.
 * Nothing is read from or written to disk.
 *
 * @since 1.0.0
 */
public interface TaskStatusService {

    /**
     * Set one task's checkbox.
     *
     * @throws com.purchasingpower.specflow.exception.TaskNotFoundException if no task matches the id
     * @throws com.purchasingpower.specflow.exception.TaskUpdateException   if the task's line has no checkbox
     */
    UpdateResult setTaskStatus(String content, String taskId, boolean completed);

    /**
     * Flip one task's checkbox.
     */
    UpdateResult toggleTaskStatus(String content, String taskId);

    /**
     * Check every listed task. Unknown ids are skipped with a warning.
     */
    BatchUpdateResult markTasksComplete(String content, List<String> taskIds);

    /**
     * Uncheck every listed task. Unknown ids are skipped with a warning.
     */
    BatchUpdateResult markTasksIncomplete(String content, List<String> taskIds);
}
