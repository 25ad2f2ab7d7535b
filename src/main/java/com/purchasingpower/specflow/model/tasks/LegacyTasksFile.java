package com.purchasingpower.specflow.model.tasks;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Flat projection of a {@link ParseResult} kept for backward compatibility.
 */
@Value
@Builder
public class LegacyTasksFile {
    String changeId;
    List<LegacyTaskGroup> groups;
}
