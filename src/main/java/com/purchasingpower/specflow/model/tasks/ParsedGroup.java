package com.purchasingpower.specflow.model.tasks;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A task group: an explicit {@code ###} section or an implicit group under a bare phase.
 *
 * <p>Only groups holding at least one task are ever emitted.
 *
 * @since 1.0.0
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ParsedGroup {

    /** "group-{n}", n = globalIndex + 1. */
    String id;

    /** "{phaseIndex + 1}.{sectionIndex + 1}", e.g. "2.1". */
    String displayId;

    String title;

    GroupLevel level;

    /** 0-based index of the owning phase. */
    int phaseIndex;

    /** 0-based position inside the owning phase. */
    int sectionIndex;

    /** 0-based position in the flat group list. */
    int globalIndex;

    String phaseTitle;

    List<ParsedTask> tasks;
}
