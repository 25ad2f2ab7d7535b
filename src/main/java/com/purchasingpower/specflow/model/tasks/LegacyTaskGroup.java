package com.purchasingpower.specflow.model.tasks;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Group shape used by older callers. Orders are 1-based, indices 0-based.
 */
@Value
@Builder
public class LegacyTaskGroup {
    String id;
    String title;
    List<LegacyTask> tasks;
    String displayId;
    int phaseIndex;
    int groupIndex;
    int majorOrder;
    String majorTitle;
    int subOrder;
    String groupTitle;
    int groupOrder;
}
