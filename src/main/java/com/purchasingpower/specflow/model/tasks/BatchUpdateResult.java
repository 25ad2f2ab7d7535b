package com.purchasingpower.specflow.model.tasks;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a bulk status change. {@code updated} counts the ids that were applied;
 * ids that could not be resolved are skipped.
 */
@Value
@Builder
public class BatchUpdateResult {
    String newContent;
    int updated;
}
