package com.purchasingpower.specflow.model.tasks;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of non-fatal problems reported while parsing tasks.md.
 */
public enum WarningType {
    DUPLICATE_ID("duplicate-id"),
    ORPHAN_SUBTASK("orphan-subtask"),
    INVALID_INDENT("invalid-indent"),
    UNKNOWN_FORMAT("unknown-format");

    private final String value;

    WarningType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
