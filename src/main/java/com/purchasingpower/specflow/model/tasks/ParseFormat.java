package com.purchasingpower.specflow.model.tasks;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Document format reported in {@link ParseMetadata}.
 */
public enum ParseFormat {
    OPENSPEC_1_0("openspec-1.0"),
    LEGACY("legacy");

    private final String value;

    ParseFormat(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
