package com.purchasingpower.specflow.model.tasks;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * A single checkbox line from tasks.md.
 *
 * <p>Identity:
 * <ul>
 *   <li>{@code id} - internal id {@code task-{groupNumber}-{ordinal}}</li>
 *   <li>{@code displayId} - positional id {@code {phase}.{section}.{ordinal}}, e.g. "1.2.3"</li>
 *   <li>{@code contentHash} - 8 hex chars derived from group title and task title;
 *       survives reordering but collides for duplicate titles</li>
 * </ul>
 *
 * <p>All identity values are recomputed on every parse.
 *
 * @since 1.0.0
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ParsedTask {

    String id;
    String displayId;
    String contentHash;

    String title;
    boolean completed;

    /**
     * Raw count of leading whitespace characters (0, 2, 4, ...).
     */
    int indent;

    /**
     * Index (0-based, within the owning group) of the nearest preceding task with
     * a smaller indent. Null for top-level tasks and orphan subtasks.
     */
    Integer parentTaskIndex;

    /**
     * 1-based line number in the source text.
     */
    int lineNumber;

    String rawLine;

    String groupId;

    @JsonIgnore
    public boolean isSubtask() {
        return parentTaskIndex != null;
    }
}
