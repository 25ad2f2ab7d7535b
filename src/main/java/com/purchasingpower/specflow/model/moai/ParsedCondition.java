package com.purchasingpower.specflow.model.moai;

/**
 * A checkbox item from plan.md or acceptance.md.
 */
public record ParsedCondition(String text, boolean checked) {
}
