package com.purchasingpower.specflow.model.tasks;

/**
 * A task together with the group and phase that own it.
 */
public record ResolvedTask(ParsedTask task, ParsedGroup group, ParsedPhase phase) {
}
