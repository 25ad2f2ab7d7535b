package com.purchasingpower.specflow.model.tasks;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Header level a task group was created from.
 *
 * <p>{@link #PHASE} only occurs for a group synthesized implicitly when tasks
 * appear directly under a {@code ##} phase header with no {@code ###} section.
 */
public enum GroupLevel {

    /** Implicit group named after its phase. */
    PHASE("phase"),

    /** Explicit {@code ###} section. */
    SECTION("section");

    private final String value;

    GroupLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
