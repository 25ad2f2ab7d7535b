package com.purchasingpower.specflow.model.tasks;

import lombok.Builder;
import lombok.Value;

/**
 * Flat task row handed to the database sync job.
 *
 * <p>All order fields are 1-based and contiguous within their scope:
 * {@code groupOrder} across the document, {@code taskOrder} inside a group,
 * {@code majorOrder} across phases and {@code subOrder} inside a phase.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class SyncTask {
    String displayId;
    String title;
    boolean completed;
    int lineNumber;

    String groupTitle;
    int groupOrder;
    int taskOrder;
    String majorTitle;
    int majorOrder;
    int subOrder;
}
