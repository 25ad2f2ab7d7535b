package com.purchasingpower.specflow.model.moai;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Modal verb of an EARS requirement.
 */
public enum RequirementType {
    SHALL("shall"),
    SHOULD("should"),
    MAY("may"),
    WILL("will");

    private final String value;

    RequirementType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
