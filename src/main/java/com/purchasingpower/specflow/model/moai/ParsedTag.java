package com.purchasingpower.specflow.model.moai;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One unit of work from the TAG chain of a plan.md.
 *
 * <p>{@code completed} is true only when there is at least one completion
 * condition and every condition is checked.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class ParsedTag {
    /** e.g. "TAG-001" */
    String id;
    String title;
    String scope;
    String purpose;
    /** Ids of TAGs this one depends on; empty for "None". */
    List<String> dependencies;
    List<ParsedCondition> conditions;
    boolean completed;
}
