package com.purchasingpower.specflow.model.moai;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Gherkin-style criterion from acceptance.md.
 *
 * <p>{@code then} keeps bullet continuation lines newline-joined.
 * {@code verified} follows the same rule as {@link ParsedTag#isCompleted()}:
 * at least one success metric and all of them checked.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class ParsedAcceptanceCriteria {
    /** e.g. "AC-1" */
    String id;
    String title;
    String given;
    String when;
    String then;
    List<ParsedCondition> successMetrics;
    boolean verified;
}
