package com.purchasingpower.specflow.model.tasks;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Top-level {@code ##} grouping. Phases without any non-empty group are dropped.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class ParsedPhase {
    int index;
    String title;
    int lineNumber;
    List<ParsedGroup> groups;
}
