package com.purchasingpower.specflow.model.tasks;

import lombok.Builder;
import lombok.Value;

/**
 * Task shape used by older callers of the parser.
 */
@Value
@Builder
public class LegacyTask {
    String id;
    String title;
    boolean completed;
    String groupId;
    int lineNumber;
    int indent;
    String displayId;
}
