package com.purchasingpower.specflow.model.tasks;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a single status change. {@code task} reflects the new status.
 */
@Value
@Builder
public class UpdateResult {
    String newContent;
    LegacyTask task;
}
