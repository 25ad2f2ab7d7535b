package com.purchasingpower.specflow.model.tasks;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Typed tree produced from one tasks.md document.
 *
 * <p>{@code groups} is the flat, document-ordered list of every emitted group;
 * {@code phases} holds the same group instances nested under their phase.
 * Immutable; re-parse after any text edit.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class ParseResult {
    String changeId;
    List<ParsedPhase> phases;
    List<ParsedGroup> groups;
    ParseMetadata metadata;

    /**
     * Tasks still unchecked, in document order.
     */
    public List<ParsedTask> pendingTasks() {
        return groups.stream()
                .flatMap(group -> group.getTasks().stream())
                .filter(task -> !task.isCompleted())
                .toList();
    }
}
